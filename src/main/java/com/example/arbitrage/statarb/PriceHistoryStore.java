package com.example.arbitrage.statarb;

import com.example.arbitrage.common.model.PriceHistory;
import com.example.arbitrage.common.model.PricePoint;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Истории цен по парам.
 * Хранит не больше maxHistoryPoints точек на пару и не старше lookbackDays + 1 дней.
 */
@Slf4j
public class PriceHistoryStore {

    private static final double[] EMPTY = new double[0];

    @Getter
    private final int lookbackDays;
    @Getter
    private final int maxHistoryPoints;
    private final Clock clock;

    private final Map<String, PriceHistory> histories = new ConcurrentHashMap<>();
    private final List<String> trackedPairs = new CopyOnWriteArrayList<>();

    public PriceHistoryStore(int lookbackDays, int maxHistoryPoints, Clock clock) {
        if (lookbackDays <= 0) {
            throw new IllegalArgumentException("lookbackDays должен быть > 0: " + lookbackDays);
        }
        if (maxHistoryPoints <= 0) {
            throw new IllegalArgumentException("maxHistoryPoints должен быть > 0: " + maxHistoryPoints);
        }
        this.lookbackDays = lookbackDays;
        this.maxHistoryPoints = maxHistoryPoints;
        this.clock = clock;
    }

    /**
     * Добавляет наблюдение и обрезает историю пары по времени.
     *
     * @param timestamp время цены, null - текущее время
     */
    public void updatePrice(String pair, double price, Instant timestamp) {
        PriceHistory history = histories.computeIfAbsent(pair, p -> {
            trackedPairs.add(p);
            log.debug("Начали отслеживать {}", p);
            return new PriceHistory(maxHistoryPoints);
        });

        Instant now = clock.instant();
        Instant ts = timestamp != null ? timestamp : now;
        Instant cutoff = now.minus(Duration.ofDays(lookbackDays + 1L));
        history.appendAndTrim(new PricePoint(ts, price), cutoff);
    }

    public void updatePrice(String pair, double price) {
        updatePrice(pair, price, null);
    }

    public double[] getPrices(String pair) {
        PriceHistory history = histories.get(pair);
        return history == null ? EMPTY : history.prices();
    }

    public int size(String pair) {
        PriceHistory history = histories.get(pair);
        return history == null ? 0 : history.size();
    }

    /**
     * Пары в порядке начала отслеживания
     */
    public List<String> getTrackedPairs() {
        return List.copyOf(trackedPairs);
    }

    public void clear() {
        histories.clear();
        trackedPairs.clear();
    }
}
