package com.example.arbitrage.statarb;

import com.example.arbitrage.common.model.PairCorrelation;
import com.example.arbitrage.common.model.SpreadStatistics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Корреляция Пирсона, хедж-коэффициент OLS и псевдо-коинтеграция между двумя парами.
 * Результаты кэшируются в {@link CorrelationCache}; кэш не меняет результат, только экономит расчет.
 */
@Slf4j
public class CorrelationEstimator {

    private final PriceHistoryStore historyStore;
    private final CorrelationCache cache;
    private final Duration defaultCacheTtl;

    public CorrelationEstimator(PriceHistoryStore historyStore, CorrelationCache cache, Duration defaultCacheTtl) {
        this.historyStore = historyStore;
        this.cache = cache;
        this.defaultCacheTtl = defaultCacheTtl;
    }

    public Optional<PairCorrelation> calculateCorrelation(String pair1, String pair2) {
        return calculateCorrelation(pair1, pair2, true, defaultCacheTtl);
    }

    /**
     * Пустой результат, если у любой из пар меньше 100 точек
     */
    public Optional<PairCorrelation> calculateCorrelation(String pair1, String pair2, boolean useCache, Duration cacheTtl) {
        if (useCache) {
            Optional<PairCorrelation> cached = cache.get(pair1, pair2);
            if (cached.isPresent()) {
                return cached;
            }
        }

        double[] prices1 = historyStore.getPrices(pair1);
        double[] prices2 = historyStore.getPrices(pair2);

        if (prices1.length < PairCorrelation.MIN_SAMPLE_SIZE || prices2.length < PairCorrelation.MIN_SAMPLE_SIZE) {
            log.warn("⚠️ Недостаточно данных для корреляции: {}={}, {}={}",
                    pair1, prices1.length, pair2, prices2.length);
            return Optional.empty();
        }

        int n = Math.min(prices1.length, prices2.length);
        double[] aligned1 = SpreadMath.tail(prices1, n);
        double[] aligned2 = SpreadMath.tail(prices2, n);

        double correlation = pearson(aligned1, aligned2);
        double hedgeRatio = hedgeRatio(aligned1, aligned2);
        double pValue = PseudoCointegration.pValue(SpreadMath.spread(aligned1, aligned2, hedgeRatio));

        PairCorrelation result = PairCorrelation.builder()
                .pair1(pair1)
                .pair2(pair2)
                .correlation(correlation)
                .cointegrationPvalue(pValue)
                .hedgeRatio(hedgeRatio)
                .lookbackDays(historyStore.getLookbackDays())
                .sampleSize(n)
                .cointegrated(pValue < PairCorrelation.COINTEGRATION_PVALUE_THRESHOLD)
                .build();

        cache.put(result, cacheTtl);
        log.debug("📊 {} / {}: r={}, hedge={}, p={}, n={}", pair1, pair2, correlation, hedgeRatio, pValue, n);
        return Optional.of(result);
    }

    /**
     * Все неупорядоченные пары отслеживаемых символов с |r| >= minCorrelation, коинтеграцией и n >= 100,
     * по убыванию |r|
     */
    public List<PairCorrelation> getSuitablePairs(double minCorrelation) {
        List<String> pairs = historyStore.getTrackedPairs();
        List<PairCorrelation> suitable = new ArrayList<>();

        for (int i = 0; i < pairs.size(); i++) {
            for (int j = i + 1; j < pairs.size(); j++) {
                calculateCorrelation(pairs.get(i), pairs.get(j))
                        .filter(c -> Math.abs(c.getCorrelation()) >= minCorrelation)
                        .filter(PairCorrelation::isCointegrated)
                        .filter(c -> c.getSampleSize() >= PairCorrelation.MIN_SAMPLE_SIZE)
                        .ifPresent(suitable::add);
            }
        }

        suitable.sort(Comparator.comparingDouble((PairCorrelation c) -> Math.abs(c.getCorrelation())).reversed());
        log.info("🔍 Подходящих для стат. арбитража пар: {} из {} символов", suitable.size(), pairs.size());
        return suitable;
    }

    /**
     * Выровненный по длине спред price1 - hedge * price2 на текущей истории
     */
    public Optional<double[]> currentSpread(String pair1, String pair2) {
        Optional<PairCorrelation> correlation = calculateCorrelation(pair1, pair2);
        if (correlation.isEmpty()) {
            return Optional.empty();
        }

        double[] prices1 = historyStore.getPrices(pair1);
        double[] prices2 = historyStore.getPrices(pair2);
        int n = Math.min(prices1.length, prices2.length);
        if (n < 2) {
            return Optional.empty();
        }

        return Optional.of(SpreadMath.spread(
                SpreadMath.tail(prices1, n),
                SpreadMath.tail(prices2, n),
                correlation.get().getHedgeRatio()));
    }

    public Optional<SpreadStatistics> getSpreadStatistics(String pair1, String pair2) {
        Optional<PairCorrelation> correlation = calculateCorrelation(pair1, pair2);
        Optional<double[]> spread = currentSpread(pair1, pair2);
        if (correlation.isEmpty() || spread.isEmpty()) {
            return Optional.empty();
        }

        double[] s = spread.get();
        PairCorrelation c = correlation.get();
        return Optional.of(SpreadStatistics.builder()
                .pair1(pair1)
                .pair2(pair2)
                .correlation(c.getCorrelation())
                .hedgeRatio(c.getHedgeRatio())
                .cointegrated(c.isCointegrated())
                .currentSpread(s[s.length - 1])
                .meanSpread(SpreadMath.mean(s))
                .stdSpread(SpreadMath.populationStd(s))
                .zScore(SpreadMath.zScore(s))
                .minSpread(StatUtils.min(s))
                .maxSpread(StatUtils.max(s))
                .sampleSize(s.length)
                .build());
    }

    /**
     * Пирсон; при нулевой дисперсии 1.0 для совпадающих рядов и 0.0 иначе
     */
    static double pearson(double[] x, double[] y) {
        if (SpreadMath.populationStd(x) == 0 || SpreadMath.populationStd(y) == 0) {
            return Arrays.equals(x, y) ? 1.0 : 0.0;
        }
        double r = new PearsonsCorrelation().correlation(x, y);
        return Math.max(-1.0, Math.min(1.0, r));
    }

    /**
     * Наклон регрессии price1 на price2; при постоянном price2 наклон не определен, берем 1.0
     */
    static double hedgeRatio(double[] prices1, double[] prices2) {
        if (SpreadMath.populationStd(prices2) == 0) {
            return 1.0;
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < prices1.length; i++) {
            regression.addData(prices2[i], prices1[i]);
        }
        return regression.getSlope();
    }
}
