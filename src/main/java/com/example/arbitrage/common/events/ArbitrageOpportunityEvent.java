package com.example.arbitrage.common.events;

import com.example.arbitrage.common.model.ArbitrageOpportunity;
import lombok.*;

@Data
@Builder
@ToString
@AllArgsConstructor
@NoArgsConstructor
public class ArbitrageOpportunityEvent {
    private ArbitrageOpportunity opportunity;
}
