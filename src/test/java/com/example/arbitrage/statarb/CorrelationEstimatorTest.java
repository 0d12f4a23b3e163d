package com.example.arbitrage.statarb;

import com.example.arbitrage.common.model.PairCorrelation;
import com.example.arbitrage.common.model.SpreadStatistics;
import com.example.arbitrage.common.utils.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Корреляция, хедж-коэффициент и отбор пар для стат. арбитража
 */
class CorrelationEstimatorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
    private final PriceHistoryStore store = new PriceHistoryStore(30, 10_000, clock);
    private final CorrelationCache cache = new CorrelationCache(clock);
    private final CorrelationEstimator estimator = new CorrelationEstimator(store, cache, Duration.ofMinutes(5));

    @Test
    void testIdenticalConstantHistories() {
        for (int i = 0; i < 150; i++) {
            store.updatePrice("A-USDT", 100.0);
            store.updatePrice("B-USDT", 100.0);
        }

        PairCorrelation correlation = estimator.calculateCorrelation("A-USDT", "B-USDT").orElseThrow();

        assertEquals(1.0, correlation.getCorrelation());
        assertEquals(1.0, correlation.getHedgeRatio());
        assertEquals(1.0, correlation.getCointegrationPvalue());
        assertFalse(correlation.isCointegrated());
        assertEquals(150, correlation.getSampleSize());
        assertEquals(30, correlation.getLookbackDays());
    }

    @Test
    void testLinearlyRelatedPairs() {
        fillLinearPair("A-USDT", "B-USDT", 150);

        PairCorrelation correlation = estimator.calculateCorrelation("A-USDT", "B-USDT").orElseThrow();

        assertEquals(0.998, correlation.getCorrelation(), 1e-3);
        assertEquals(2.0, correlation.getHedgeRatio(), 0.01);
        assertEquals(0.01, correlation.getCointegrationPvalue());
        assertTrue(correlation.isCointegrated());
        assertTrue(correlation.isSuitableForStatArb());
    }

    @Test
    void testNotEnoughHistory() {
        fillLinearPair("A-USDT", "B-USDT", 99);

        assertTrue(estimator.calculateCorrelation("A-USDT", "B-USDT").isEmpty());
        assertTrue(estimator.calculateCorrelation("A-USDT", "UNKNOWN").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void testHistoriesAreAlignedToShorterTail() {
        for (int i = 0; i < 200; i++) {
            store.updatePrice("A-USDT", 100 + i);
        }
        for (int i = 0; i < 120; i++) {
            store.updatePrice("B-USDT", 50 + i * 0.5);
        }

        PairCorrelation correlation = estimator.calculateCorrelation("A-USDT", "B-USDT").orElseThrow();

        assertEquals(120, correlation.getSampleSize());
        assertEquals(1.0, correlation.getCorrelation(), 1e-9);
        assertEquals(2.0, correlation.getHedgeRatio(), 1e-9);
    }

    @Test
    void testCacheDoesNotChangeResult() {
        fillLinearPair("A-USDT", "B-USDT", 150);

        PairCorrelation first = estimator.calculateCorrelation("A-USDT", "B-USDT").orElseThrow();
        PairCorrelation cached = estimator.calculateCorrelation("A-USDT", "B-USDT").orElseThrow();
        PairCorrelation recomputed = estimator.calculateCorrelation("A-USDT", "B-USDT", false, Duration.ofMinutes(5)).orElseThrow();

        assertSame(first, cached);
        assertEquals(first.getCorrelation(), recomputed.getCorrelation());
        assertEquals(first.getHedgeRatio(), recomputed.getHedgeRatio());
        assertEquals(first.getCointegrationPvalue(), recomputed.getCointegrationPvalue());
        assertEquals(first, recomputed);
    }

    @Test
    void testCachedValueIsServedUntilExpiry() {
        fillLinearPair("A-USDT", "B-USDT", 150);
        estimator.calculateCorrelation("A-USDT", "B-USDT");

        store.updatePrice("A-USDT", 400);
        store.updatePrice("B-USDT", 150);

        assertEquals(150, estimator.calculateCorrelation("A-USDT", "B-USDT").orElseThrow().getSampleSize());

        clock.advance(Duration.ofMinutes(5));
        assertEquals(151, estimator.calculateCorrelation("A-USDT", "B-USDT").orElseThrow().getSampleSize());
    }

    @Test
    void testSuitablePairs() {
        fillLinearPair("A-USDT", "B-USDT", 150);
        for (int i = 0; i < 150; i++) {
            store.updatePrice("C-USDT", 1000 + 0.5 * i * i);
        }

        List<PairCorrelation> suitable = estimator.getSuitablePairs(0.7);

        assertEquals(1, suitable.size());
        assertEquals("A-USDT", suitable.get(0).getPair1());
        assertEquals("B-USDT", suitable.get(0).getPair2());

        assertTrue(estimator.getSuitablePairs(0.999).isEmpty());
    }

    @Test
    void testSuitablePairsSortedByAbsoluteCorrelation() {
        fillLinearPair("A-USDT", "B-USDT", 150);
        // зеркальная пара с отрицательной корреляцией
        for (int i = 0; i < 150; i++) {
            double noise = i % 2 == 0 ? 3 : -3;
            store.updatePrice("D-USDT", 500 - 0.1 * i + noise);
        }

        List<PairCorrelation> suitable = estimator.getSuitablePairs(0.5);

        assertEquals(3, suitable.size());
        assertEquals("B-USDT", suitable.get(0).getPair2());
        assertEquals("D-USDT", suitable.get(1).getPair2());
        assertTrue(suitable.get(1).getCorrelation() < 0);
        for (int i = 1; i < suitable.size(); i++) {
            assertTrue(Math.abs(suitable.get(i - 1).getCorrelation()) >= Math.abs(suitable.get(i).getCorrelation()));
        }
        assertTrue(suitable.stream().allMatch(PairCorrelation::isCointegrated));
    }

    @Test
    void testSpreadStatistics() {
        fillLinearPair("A-USDT", "B-USDT", 150);

        SpreadStatistics stats = estimator.getSpreadStatistics("A-USDT", "B-USDT").orElseThrow();

        assertEquals(150, stats.getSampleSize());
        assertTrue(stats.getMinSpread() <= stats.getMeanSpread());
        assertTrue(stats.getMeanSpread() <= stats.getMaxSpread());
        assertTrue(stats.getStdSpread() > 0);
        assertEquals((stats.getCurrentSpread() - stats.getMeanSpread()) / stats.getStdSpread(), stats.getZScore(), 1e-9);
        assertTrue(stats.isCointegrated());
        assertEquals(2.0, stats.getHedgeRatio(), 0.01);

        assertTrue(estimator.getSpreadStatistics("A-USDT", "UNKNOWN").isEmpty());
    }

    @Test
    void testPearsonWithZeroVariance() {
        assertEquals(1.0, CorrelationEstimator.pearson(new double[]{5, 5, 5}, new double[]{5, 5, 5}));
        assertEquals(0.0, CorrelationEstimator.pearson(new double[]{5, 5, 5}, new double[]{1, 2, 3}));
        assertEquals(1.0, CorrelationEstimator.hedgeRatio(new double[]{1, 2, 3}, new double[]{7, 7, 7}));
    }

    /**
     * pair1 = 2 * pair2 + 5 с чередующимся шумом ±0.5
     */
    private void fillLinearPair(String pair1, String pair2, int n) {
        for (int i = 0; i < n; i++) {
            double p2 = 100 + 0.1 * i;
            store.updatePrice(pair1, 2 * p2 + 5 + (i % 2 == 0 ? 0.5 : -0.5));
            store.updatePrice(pair2, p2);
        }
    }
}
