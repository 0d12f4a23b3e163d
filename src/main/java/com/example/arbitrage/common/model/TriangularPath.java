package com.example.arbitrage.common.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;

/**
 * Треугольный путь через три валюты с возвратом в стартовую.
 * Пример: ETH → BTC → USDT → ETH по парам ETH-BTC, BTC-USDT, ETH-USDT.
 */
@Getter
@EqualsAndHashCode
public class TriangularPath {

    private final List<String> currencies;
    private final List<String> pairs;
    private final List<LegDirection> directions;

    public TriangularPath(List<String> currencies, List<String> pairs, List<LegDirection> directions) {
        this.currencies = List.copyOf(currencies);
        this.pairs = List.copyOf(pairs);
        this.directions = List.copyOf(directions);
    }

    public String getStartCurrency() {
        return currencies.get(0);
    }

    /**
     * 4 валюты с совпадающими концами, 3 пары и 3 направления
     */
    public boolean isValid() {
        return currencies.size() == 4
                && pairs.size() == 3
                && directions.size() == 3
                && currencies.get(0).equals(currencies.get(3));
    }

    @Override
    public String toString() {
        return String.join(" → ", currencies);
    }
}
