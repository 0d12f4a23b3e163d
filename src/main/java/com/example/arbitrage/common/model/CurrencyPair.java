package com.example.arbitrage.common.model;

/**
 * Пара base/quote для межбиржевого сканирования
 */
public record CurrencyPair(String base, String quote) {

    /**
     * Разбирает строку вида ETH-USDT
     */
    public static CurrencyPair parse(String pairId) {
        String[] parts = pairId.trim().split("-");
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new IllegalArgumentException("Некорректная пара: " + pairId);
        }
        return new CurrencyPair(parts[0], parts[1]);
    }

    public String productId() {
        return base + "-" + quote;
    }
}
