package com.example.arbitrage.feeds;

import java.math.BigDecimal;

/**
 * Результат симуляции свопа на DEX
 *
 * @param amountOut получаемое количество токена
 * @param feeTier   уровень комиссии пула (100, 500, 3000, 10000)
 */
public record DexQuote(BigDecimal amountOut, int feeTier) {
}
