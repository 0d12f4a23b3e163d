package com.example.arbitrage.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Котировка одной площадки по паре
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceQuote {
    private String exchange;
    private ExchangeType exchangeType;
    private String base;
    private String quote;
    private BigDecimal bid;
    private BigDecimal ask;
    private BigDecimal takerFeePct;
    private BigDecimal makerFeePct;

    /**
     * Оценка газа в валюте котировки, только для DEX
     */
    private BigDecimal gasEstimate;

    private Integer chainId;
    private Instant timestamp;

    public boolean isDex() {
        return exchangeType == ExchangeType.DEX;
    }
}
