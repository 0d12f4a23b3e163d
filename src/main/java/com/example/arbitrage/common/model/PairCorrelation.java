package com.example.arbitrage.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Результат анализа связи двух пар: корреляция Пирсона, хедж-коэффициент (наклон OLS)
 * и псевдо p-value теста коинтеграции по пересечениям среднего.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PairCorrelation {

    public static final double COINTEGRATION_PVALUE_THRESHOLD = 0.05;
    public static final double STAT_ARB_MIN_CORRELATION = 0.7;
    public static final int MIN_SAMPLE_SIZE = 100;

    private String pair1;
    private String pair2;
    private double correlation;
    private double cointegrationPvalue;
    private double hedgeRatio;
    private int lookbackDays;
    private int sampleSize;
    private boolean cointegrated;

    public boolean isSuitableForStatArb() {
        return Math.abs(correlation) > STAT_ARB_MIN_CORRELATION
                && cointegrated
                && sampleSize >= MIN_SAMPLE_SIZE;
    }
}
