package com.example.arbitrage.statarb;

import com.example.arbitrage.common.model.PairCorrelation;
import com.example.arbitrage.common.utils.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Время жизни записей кэша корреляций
 */
class CorrelationCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
    private final CorrelationCache cache = new CorrelationCache(clock);

    @Test
    void testEntryExpiresAfterTtl() {
        PairCorrelation correlation = correlation("ETH-USDT", "BTC-USDT");
        cache.put(correlation, Duration.ofMinutes(5));

        assertSame(correlation, cache.get("ETH-USDT", "BTC-USDT").orElseThrow());

        clock.advance(Duration.ofMinutes(5).minusSeconds(1));
        assertTrue(cache.get("ETH-USDT", "BTC-USDT").isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get("ETH-USDT", "BTC-USDT").isEmpty());
    }

    @Test
    void testKeyIsOrdered() {
        cache.put(correlation("ETH-USDT", "BTC-USDT"), Duration.ofMinutes(5));

        assertTrue(cache.get("BTC-USDT", "ETH-USDT").isEmpty());
    }

    @Test
    void testPutReplacesAndRestartsTtl() {
        cache.put(correlation("ETH-USDT", "BTC-USDT"), Duration.ofMinutes(1));
        clock.advance(Duration.ofSeconds(50));

        PairCorrelation fresh = correlation("ETH-USDT", "BTC-USDT");
        fresh.setSampleSize(500);
        cache.put(fresh, Duration.ofMinutes(1));
        clock.advance(Duration.ofSeconds(50));

        assertEquals(500, cache.get("ETH-USDT", "BTC-USDT").orElseThrow().getSampleSize());
        assertEquals(1, cache.size());
    }

    @Test
    void testClear() {
        cache.put(correlation("ETH-USDT", "BTC-USDT"), Duration.ofMinutes(5));
        cache.put(correlation("SOL-USDT", "BTC-USDT"), Duration.ofMinutes(5));
        assertEquals(2, cache.size());

        cache.clear();

        assertEquals(0, cache.size());
        assertTrue(cache.get("ETH-USDT", "BTC-USDT").isEmpty());
    }

    private static PairCorrelation correlation(String pair1, String pair2) {
        return PairCorrelation.builder()
                .pair1(pair1)
                .pair2(pair2)
                .correlation(0.9)
                .hedgeRatio(1.5)
                .cointegrationPvalue(0.01)
                .cointegrated(true)
                .sampleSize(200)
                .build();
    }
}
