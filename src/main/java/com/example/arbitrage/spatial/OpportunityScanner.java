package com.example.arbitrage.spatial;

import com.example.arbitrage.common.model.AggregatedPrice;
import com.example.arbitrage.common.model.ArbitrageOpportunity;
import com.example.arbitrage.common.model.CurrencyPair;
import com.example.arbitrage.common.model.ProfitCalculation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Сканирует набор пар через агрегатор и возвращает межбиржевые возможности
 */
@Slf4j
@RequiredArgsConstructor
public class OpportunityScanner {

    // без стакана реальную ликвидность не оценить
    static final BigDecimal DEFAULT_MAX_QUANTITY = new BigDecimal("100");
    static final BigDecimal BASE_CONFIDENCE = new BigDecimal("80");

    private final PriceAggregator aggregator;
    private final Clock clock;

    /**
     * Возможности с прибылью не ниже minProfitPct при объеме minQuantity, по убыванию прибыли.
     * Котировки устаревают сразу: expiresAt равен моменту обнаружения.
     */
    public List<ArbitrageOpportunity> findOpportunities(List<CurrencyPair> pairs,
                                                        BigDecimal minProfitPct,
                                                        BigDecimal minQuantity,
                                                        Duration timeout) {
        List<CompletableFuture<ArbitrageOpportunity>> futures = pairs.stream()
                .map(pair -> aggregator.getBestPricesAsync(pair.base(), pair.quote(), timeout)
                        .thenApply(prices -> toOpportunity(prices, minProfitPct, minQuantity))
                        .exceptionally(ex -> {
                            log.error("❌ Ошибка проверки пары {}: {}", pair.productId(), ex.getMessage());
                            return null;
                        }))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<ArbitrageOpportunity> opportunities = futures.stream()
                .map(CompletableFuture::join)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(ArbitrageOpportunity::getEstimatedProfitPct).reversed())
                .toList();

        log.info("📊 Проверено {} пар, найдено {} возможностей", pairs.size(), opportunities.size());
        return opportunities;
    }

    private ArbitrageOpportunity toOpportunity(AggregatedPrice prices, BigDecimal minProfitPct, BigDecimal minQuantity) {
        if (!prices.hasBothSides()) {
            return null;
        }

        ProfitCalculation profit = prices.calculateProfit(minQuantity, true, true);
        if (profit == null || !profit.isProfitable()) {
            return null;
        }
        if (profit.getNetProfitPct().compareTo(minProfitPct) < 0) {
            return null;
        }

        Instant now = clock.instant();
        return ArbitrageOpportunity.builder()
                .id(prices.getProductId() + "-" + now.toEpochMilli())
                .timestamp(now)
                .productId(prices.getProductId())
                .base(prices.getBase())
                .quote(prices.getQuote())
                .buyExchange(prices.getBestBuy().getExchange())
                .buyExchangeType(prices.getBestBuy().getExchangeType())
                .buyPrice(prices.getBestBuy().getAsk())
                .sellExchange(prices.getBestSell().getExchange())
                .sellExchangeType(prices.getBestSell().getExchangeType())
                .sellPrice(prices.getBestSell().getBid())
                .spread(orZero(prices.getSpread()))
                .spreadPct(orZero(prices.getSpreadPct()))
                .estimatedProfit(profit.getNetProfit())
                .estimatedProfitPct(profit.getNetProfitPct())
                .maxQuantity(DEFAULT_MAX_QUANTITY)
                .minQuantity(minQuantity)
                .expiresAt(now)
                .confidence(BASE_CONFIDENCE)
                .build();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
