package com.example.arbitrage.spatial;

import com.example.arbitrage.common.model.ExchangeType;
import com.example.arbitrage.common.model.PriceQuote;
import com.example.arbitrage.feeds.PriceFeed;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Площадка с фиксированной котировкой, задержкой или ошибкой
 */
public class StubPriceFeed implements PriceFeed {

    private final String name;
    private final ExchangeType type;
    private volatile BigDecimal bid;
    private volatile BigDecimal ask;
    private BigDecimal feePct = BigDecimal.ZERO;
    private BigDecimal gas;
    private Duration delay = Duration.ZERO;
    private boolean failing;
    private boolean available = true;
    private final AtomicInteger calls = new AtomicInteger();

    public StubPriceFeed(String name, ExchangeType type, String bid, String ask) {
        this.name = name;
        this.type = type;
        this.bid = bid != null ? new BigDecimal(bid) : null;
        this.ask = ask != null ? new BigDecimal(ask) : null;
    }

    public static StubPriceFeed cex(String name, String bid, String ask) {
        return new StubPriceFeed(name, ExchangeType.CEX, bid, ask);
    }

    public StubPriceFeed fee(String pct) {
        this.feePct = new BigDecimal(pct);
        return this;
    }

    public StubPriceFeed gas(String gas) {
        this.gas = new BigDecimal(gas);
        return this;
    }

    public StubPriceFeed delay(Duration delay) {
        this.delay = delay;
        return this;
    }

    public StubPriceFeed failing() {
        this.failing = true;
        return this;
    }

    public StubPriceFeed unavailable() {
        this.available = false;
        return this;
    }

    public int getCalls() {
        return calls.get();
    }

    @Override
    public PriceQuote getPrice(String base, String quote) {
        calls.incrementAndGet();
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }
        if (failing) {
            throw new IllegalStateException(name + " не отвечает");
        }
        return PriceQuote.builder()
                .exchange(name)
                .exchangeType(type)
                .base(base)
                .quote(quote)
                .bid(bid)
                .ask(ask)
                .takerFeePct(feePct)
                .makerFeePct(feePct)
                .gasEstimate(gas)
                .timestamp(Instant.now())
                .build();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ExchangeType getExchangeType() {
        return type;
    }

    @Override
    public boolean isAvailable() {
        if (failing) {
            throw new IllegalStateException(name + " не отвечает");
        }
        return available;
    }
}
