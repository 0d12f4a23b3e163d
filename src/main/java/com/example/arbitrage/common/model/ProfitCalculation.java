package com.example.arbitrage.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfitCalculation {
    private BigDecimal quantity;
    private String buyExchange;
    private BigDecimal buyPrice;
    private BigDecimal buyCost;
    private String sellExchange;
    private BigDecimal sellPrice;
    private BigDecimal sellRevenue;
    private BigDecimal grossProfit;
    private BigDecimal netProfit;
    private BigDecimal netProfitPct;
    private boolean profitable;
}
