package com.example.arbitrage.feeds;

import com.example.arbitrage.common.model.ExchangeType;
import com.example.arbitrage.common.model.PriceQuote;
import com.example.arbitrage.common.utils.BigDecimalUtil;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;

/**
 * Котировки децентрализованной биржи.
 * Ask получаем свопом 1000 единиц quote в base, bid - свопом 1 единицы base в quote.
 */
@Slf4j
public class DexPriceFeed implements PriceFeed {

    static final BigDecimal ASK_PROBE_AMOUNT = new BigDecimal("1000");
    static final BigDecimal BID_PROBE_AMOUNT = BigDecimal.ONE;

    static final Map<Integer, BigDecimal> FEE_TIERS = Map.of(
            100, new BigDecimal("0.01"),
            500, new BigDecimal("0.05"),
            3000, new BigDecimal("0.30"),
            10000, new BigDecimal("1.00")
    );
    static final BigDecimal DEFAULT_FEE_PCT = new BigDecimal("0.30");

    // Газ в валюте котировки, зависит от сети
    static final Map<Integer, BigDecimal> GAS_ESTIMATES = Map.of(
            1, new BigDecimal("15.00"),
            56, new BigDecimal("0.30"),
            137, new BigDecimal("0.05"),
            42161, new BigDecimal("0.50")
    );
    static final BigDecimal DEFAULT_GAS_ESTIMATE = new BigDecimal("10.00");

    private final String name;
    private final DexQuoteClient dexQuoteClient;
    private final int chainId;
    private final Clock clock;

    public DexPriceFeed(String name, DexQuoteClient dexQuoteClient, int chainId, Clock clock) {
        this.name = name;
        this.dexQuoteClient = dexQuoteClient;
        this.chainId = chainId;
        this.clock = clock;
    }

    @Override
    public PriceQuote getPrice(String base, String quote) {
        try {
            DexQuote askQuote = dexQuoteClient.getQuote(quote, base, ASK_PROBE_AMOUNT);
            DexQuote bidQuote = dexQuoteClient.getQuote(base, quote, BID_PROBE_AMOUNT);

            if (askQuote == null || bidQuote == null) {
                log.warn("⚠️ {}: нет котировки DEX для {}-{}", name, base, quote);
                return null;
            }

            if (!BigDecimalUtil.isPositive(askQuote.amountOut()) || !BigDecimalUtil.isPositive(bidQuote.amountOut())) {
                log.warn("⚠️ {}: пустой своп для {}-{}, пул без ликвидности", name, base, quote);
                return null;
            }

            BigDecimal ask = ASK_PROBE_AMOUNT.divide(askQuote.amountOut(), BigDecimalUtil.MC);
            BigDecimal bid = bidQuote.amountOut();
            BigDecimal feePct = FEE_TIERS.getOrDefault(askQuote.feeTier(), DEFAULT_FEE_PCT);

            return PriceQuote.builder()
                    .exchange(name)
                    .exchangeType(ExchangeType.DEX)
                    .base(base)
                    .quote(quote)
                    .bid(bid)
                    .ask(ask)
                    .takerFeePct(feePct)
                    .makerFeePct(feePct)
                    .gasEstimate(GAS_ESTIMATES.getOrDefault(chainId, DEFAULT_GAS_ESTIMATE))
                    .chainId(chainId)
                    .timestamp(clock.instant())
                    .build();
        } catch (Exception e) {
            log.error("❌ {}: ошибка получения цены DEX для {}-{}: {}", name, base, quote, e.getMessage());
            return null;
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ExchangeType getExchangeType() {
        return ExchangeType.DEX;
    }

    @Override
    public boolean isAvailable() {
        return dexQuoteClient.isConnected();
    }
}
