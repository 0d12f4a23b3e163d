package com.example.arbitrage.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Торговый инструмент биржи в формате BASE-QUOTE
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {
    private String pairId;
    private String base;
    private String quote;
    private boolean tradingDisabled;
}
