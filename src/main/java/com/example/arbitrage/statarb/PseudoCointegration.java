package com.example.arbitrage.statarb;

/**
 * Эвристика вместо настоящего теста коинтеграции (ADF не делаем).
 * Считаем пересечения спредом своего среднего: чем чаще пересекает, тем сильнее возврат к среднему.
 */
public final class PseudoCointegration {

    private PseudoCointegration() {
    }

    /**
     * Псевдо p-value: 0.01, 0.05, 0.10 или 0.50. Для постоянного спреда 1.0.
     */
    public static double pValue(double[] spread) {
        if (spread.length == 0) {
            return 1.0;
        }
        double mean = SpreadMath.mean(spread);
        double std = SpreadMath.populationStd(spread);
        if (std == 0) {
            return 1.0;
        }

        double ratio = countMeanCrossings(spread, mean) / (spread.length / 2.0);

        if (ratio > 0.8) {
            return 0.01;
        } else if (ratio > 0.6) {
            return 0.05;
        } else if (ratio > 0.4) {
            return 0.10;
        }
        return 0.50;
    }

    static int countMeanCrossings(double[] series, double mean) {
        int crossings = 0;
        for (int i = 1; i < series.length; i++) {
            if ((series[i] > mean) != (series[i - 1] > mean)) {
                crossings++;
            }
        }
        return crossings;
    }
}
