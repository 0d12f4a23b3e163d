package com.example.arbitrage.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Найденная межбиржевая возможность.
 * expiresAt совпадает с моментом обнаружения: перед исполнением котировки нужно перепроверить.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArbitrageOpportunity {
    private String id;
    private Instant timestamp;
    private String productId;
    private String base;
    private String quote;

    private String buyExchange;
    private ExchangeType buyExchangeType;
    private BigDecimal buyPrice;
    private String sellExchange;
    private ExchangeType sellExchangeType;
    private BigDecimal sellPrice;

    private BigDecimal spread;
    private BigDecimal spreadPct;
    private BigDecimal estimatedProfit;
    private BigDecimal estimatedProfitPct;

    private BigDecimal maxQuantity;
    private BigDecimal minQuantity;

    private Instant expiresAt;
    private BigDecimal confidence;
}
