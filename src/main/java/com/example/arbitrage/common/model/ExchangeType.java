package com.example.arbitrage.common.model;

import lombok.Getter;

@Getter
public enum ExchangeType {
    CEX("cex"),
    DEX("dex");

    private final String value;

    ExchangeType(String value) {
        this.value = value;
    }
}
