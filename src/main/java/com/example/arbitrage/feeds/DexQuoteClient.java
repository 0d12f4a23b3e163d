package com.example.arbitrage.feeds;

import java.math.BigDecimal;

/**
 * Клиент quoter-контракта DEX
 */
public interface DexQuoteClient {

    /**
     * Симулирует своп amountIn токена tokenIn в tokenOut, null если пула нет
     */
    DexQuote getQuote(String tokenIn, String tokenOut, BigDecimal amountIn);

    boolean isConnected();
}
