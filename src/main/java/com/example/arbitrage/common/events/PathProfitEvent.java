package com.example.arbitrage.common.events;

import com.example.arbitrage.common.model.PathProfit;
import lombok.*;

@Data
@Builder
@ToString
@AllArgsConstructor
@NoArgsConstructor
public class PathProfitEvent {
    private PathProfit pathProfit;
}
