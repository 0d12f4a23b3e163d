package com.example.arbitrage.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Ticker {
    private String pairId;
    private BigDecimal bid;
    private BigDecimal ask;
    private BigDecimal last;
    private Instant timestamp;
}
