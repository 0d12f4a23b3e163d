package com.example.arbitrage.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpreadStatistics {
    private String pair1;
    private String pair2;
    private double correlation;
    private double hedgeRatio;
    private boolean cointegrated;
    private double currentSpread;
    private double meanSpread;
    private double stdSpread;
    private double zScore;
    private double minSpread;
    private double maxSpread;
    private int sampleSize;
}
