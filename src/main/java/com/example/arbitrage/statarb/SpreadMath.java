package com.example.arbitrage.statarb;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

final class SpreadMath {

    private SpreadMath() {
    }

    static double mean(double[] values) {
        return StatUtils.mean(values);
    }

    /**
     * Стандартное отклонение генеральной совокупности (делим на n)
     */
    static double populationStd(double[] values) {
        return new StandardDeviation(false).evaluate(values);
    }

    static double[] spread(double[] prices1, double[] prices2, double hedgeRatio) {
        double[] spread = new double[prices1.length];
        for (int i = 0; i < prices1.length; i++) {
            spread[i] = prices1[i] - hedgeRatio * prices2[i];
        }
        return spread;
    }

    /**
     * Последние n точек ряда
     */
    static double[] tail(double[] values, int n) {
        double[] result = new double[n];
        System.arraycopy(values, values.length - n, result, 0, n);
        return result;
    }

    static double zScore(double[] spread) {
        double std = populationStd(spread);
        if (std == 0) {
            return 0.0;
        }
        return (spread[spread.length - 1] - mean(spread)) / std;
    }
}
