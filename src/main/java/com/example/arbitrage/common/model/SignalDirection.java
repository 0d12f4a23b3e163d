package com.example.arbitrage.common.model;

import lombok.Getter;

@Getter
public enum SignalDirection {
    LONG_SPREAD("long_spread"),
    SHORT_SPREAD("short_spread"),
    EXIT("exit");

    private final String value;

    SignalDirection(String value) {
        this.value = value;
    }

    public boolean isEntry() {
        return this != EXIT;
    }
}
