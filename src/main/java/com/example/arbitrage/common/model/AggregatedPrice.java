package com.example.arbitrage.common.model;

import com.example.arbitrage.common.utils.BigDecimalUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static com.example.arbitrage.common.utils.BigDecimalUtil.MC;

/**
 * Лучшие цены по паре среди всех площадок.
 * bestBuy - минимальный ask, bestSell - максимальный bid.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregatedPrice {
    private String base;
    private String quote;
    private Instant timestamp;
    private PriceQuote bestBuy;
    private PriceQuote bestSell;
    @Builder.Default
    private List<PriceQuote> allQuotes = List.of();

    public String getProductId() {
        return base + "-" + quote;
    }

    public boolean hasBothSides() {
        return bestBuy != null && bestSell != null;
    }

    /**
     * bestSell.bid - bestBuy.ask, null если одной из сторон нет
     */
    public BigDecimal getSpread() {
        if (!hasBothSides()) {
            return null;
        }
        return bestSell.getBid().subtract(bestBuy.getAsk());
    }

    /**
     * Спред в процентах от цены покупки
     */
    public BigDecimal getSpreadPct() {
        BigDecimal spread = getSpread();
        if (spread == null || !BigDecimalUtil.isPositive(bestBuy.getAsk())) {
            return null;
        }
        return BigDecimalUtil.toPercent(spread, bestBuy.getAsk());
    }

    /**
     * Чистая прибыль покупки на bestBuy и продажи на bestSell с учетом taker комиссий и газа DEX
     */
    public ProfitCalculation calculateProfit(BigDecimal quantity, boolean includeFees, boolean includeGas) {
        if (!hasBothSides()) {
            return null;
        }

        BigDecimal buyPrice = bestBuy.getAsk();
        if (includeFees) {
            buyPrice = buyPrice.multiply(BigDecimal.ONE.add(feeFraction(bestBuy)), MC);
        }
        BigDecimal buyCost = quantity.multiply(buyPrice, MC);
        if (includeGas && bestBuy.isDex()) {
            buyCost = buyCost.add(gasOf(bestBuy), MC);
        }

        BigDecimal sellPrice = bestSell.getBid();
        if (includeFees) {
            sellPrice = sellPrice.multiply(BigDecimal.ONE.subtract(feeFraction(bestSell)), MC);
        }
        BigDecimal sellRevenue = quantity.multiply(sellPrice, MC);
        if (includeGas && bestSell.isDex()) {
            sellRevenue = sellRevenue.subtract(gasOf(bestSell), MC);
        }

        BigDecimal netProfit = sellRevenue.subtract(buyCost, MC);

        return ProfitCalculation.builder()
                .quantity(quantity)
                .buyExchange(bestBuy.getExchange())
                .buyPrice(buyPrice)
                .buyCost(buyCost)
                .sellExchange(bestSell.getExchange())
                .sellPrice(sellPrice)
                .sellRevenue(sellRevenue)
                .grossProfit(getSpread().multiply(quantity, MC))
                .netProfit(netProfit)
                .netProfitPct(BigDecimalUtil.toPercent(netProfit, buyCost))
                .profitable(netProfit.signum() > 0)
                .build();
    }

    private static BigDecimal feeFraction(PriceQuote quote) {
        BigDecimal fee = quote.getTakerFeePct() != null ? quote.getTakerFeePct() : BigDecimal.ZERO;
        return fee.divide(BigDecimalUtil.HUNDRED, MC);
    }

    private static BigDecimal gasOf(PriceQuote quote) {
        return quote.getGasEstimate() != null ? quote.getGasEstimate() : BigDecimal.ZERO;
    }
}
