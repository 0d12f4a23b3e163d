package com.example.arbitrage.market;

import com.example.arbitrage.common.model.Product;
import com.example.arbitrage.common.model.Ticker;

import java.math.BigDecimal;
import java.util.List;

/**
 * Источник рыночных данных одной биржи.
 * Реализации могут бросать {@link MarketDataException}; вызывающий код обрабатывает ее на уровне одной ноги/пары.
 */
public interface MarketDataProvider {

    /**
     * Лучшие bid/ask по паре или null, если котировки нет
     */
    Ticker getTicker(String pairId);

    /**
     * Последняя цена сделки или null
     */
    BigDecimal getPrice(String pairId);

    /**
     * Все инструменты биржи
     */
    List<Product> getProducts();
}
