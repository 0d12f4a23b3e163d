package com.example.arbitrage.market;

/**
 * Ошибка получения рыночных данных от внешнего источника
 */
public class MarketDataException extends RuntimeException {

    public MarketDataException(String message) {
        super(message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
