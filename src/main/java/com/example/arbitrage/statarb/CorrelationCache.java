package com.example.arbitrage.statarb;

import com.example.arbitrage.common.model.PairCorrelation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Кэш корреляций по упорядоченной паре (pair1, pair2) с временем жизни.
 * При гонке за протухшую запись побеждает последняя запись.
 */
public class CorrelationCache {

    private record Key(String pair1, String pair2) {
    }

    private record Entry(PairCorrelation value, Instant expiresAt) {
    }

    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public CorrelationCache(Clock clock) {
        this.clock = clock;
    }

    public Optional<PairCorrelation> get(String pair1, String pair2) {
        Entry entry = entries.get(new Key(pair1, pair2));
        if (entry == null || !clock.instant().isBefore(entry.expiresAt())) {
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void put(PairCorrelation correlation, Duration ttl) {
        entries.put(new Key(correlation.getPair1(), correlation.getPair2()),
                new Entry(correlation, clock.instant().plus(ttl)));
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
