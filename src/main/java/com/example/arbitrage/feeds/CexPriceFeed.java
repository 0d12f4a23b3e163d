package com.example.arbitrage.feeds;

import com.example.arbitrage.common.model.ExchangeType;
import com.example.arbitrage.common.model.PriceQuote;
import com.example.arbitrage.common.model.Ticker;
import com.example.arbitrage.common.utils.BigDecimalUtil;
import com.example.arbitrage.market.MarketDataProvider;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Котировки централизованной биржи поверх {@link MarketDataProvider}
 */
@Slf4j
public class CexPriceFeed implements PriceFeed {

    private final String name;
    private final MarketDataProvider marketDataProvider;
    private final BigDecimal takerFeePct;
    private final BigDecimal makerFeePct;
    private final String healthCheckPair;
    private final Clock clock;

    public CexPriceFeed(String name,
                        MarketDataProvider marketDataProvider,
                        BigDecimal takerFeePct,
                        BigDecimal makerFeePct,
                        String healthCheckPair,
                        Clock clock) {
        this.name = name;
        this.marketDataProvider = marketDataProvider;
        this.takerFeePct = takerFeePct;
        this.makerFeePct = makerFeePct;
        this.healthCheckPair = healthCheckPair;
        this.clock = clock;
    }

    @Override
    public PriceQuote getPrice(String base, String quote) {
        String pairId = base + "-" + quote;
        Ticker ticker = marketDataProvider.getTicker(pairId);
        if (ticker == null || !BigDecimalUtil.isPositive(ticker.getBid()) || !BigDecimalUtil.isPositive(ticker.getAsk())) {
            log.debug("{}: нет валидной котировки для {}", name, pairId);
            return null;
        }
        return PriceQuote.builder()
                .exchange(name)
                .exchangeType(ExchangeType.CEX)
                .base(base)
                .quote(quote)
                .bid(ticker.getBid())
                .ask(ticker.getAsk())
                .takerFeePct(takerFeePct)
                .makerFeePct(makerFeePct)
                .timestamp(clock.instant())
                .build();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ExchangeType getExchangeType() {
        return ExchangeType.CEX;
    }

    @Override
    public boolean isAvailable() {
        try {
            return marketDataProvider.getTicker(healthCheckPair) != null;
        } catch (Exception e) {
            log.warn("⚠️ {} недоступен: {}", name, e.getMessage());
            return false;
        }
    }
}
