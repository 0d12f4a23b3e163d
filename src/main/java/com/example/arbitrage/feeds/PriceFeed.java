package com.example.arbitrage.feeds;

import com.example.arbitrage.common.model.ExchangeType;
import com.example.arbitrage.common.model.PriceQuote;

/**
 * Источник котировок одной площадки.
 * Агрегатор работает со всеми реализациями одинаково и не знает о конкретных биржах.
 */
public interface PriceFeed {

    /**
     * Котировка по паре или null, если площадка ее не дает
     */
    PriceQuote getPrice(String base, String quote);

    String getName();

    ExchangeType getExchangeType();

    boolean isAvailable();
}
