package com.example.arbitrage.common.model;

public enum TradeAction {
    BUY,
    SELL
}
