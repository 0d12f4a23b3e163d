package com.example.arbitrage.common.model;

import lombok.Getter;

/**
 * Направление сделки на одном шаге цикла
 */
@Getter
public enum LegDirection {
    BUY("buy"),
    SELL("sell"),
    UNKNOWN("unknown");

    private final String value;

    LegDirection(String value) {
        this.value = value;
    }
}
