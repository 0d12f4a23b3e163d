package com.example.arbitrage.common.model;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Ограниченная история цен одной пары.
 * Старые точки вытесняются при переполнении и обрезаются по времени.
 * Ожидается неубывающий по времени порядок добавления.
 */
public class PriceHistory {

    private final int capacity;
    private final Deque<PricePoint> points;

    public PriceHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Емкость истории должна быть > 0: " + capacity);
        }
        this.capacity = capacity;
        this.points = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Добавляет точку и удаляет с головы все точки старше cutoff
     */
    public synchronized void appendAndTrim(PricePoint point, Instant cutoff) {
        if (points.size() == capacity) {
            points.pollFirst();
        }
        points.addLast(point);
        while (!points.isEmpty() && points.peekFirst().timestamp().isBefore(cutoff)) {
            points.pollFirst();
        }
    }

    public synchronized double[] prices() {
        return points.stream().mapToDouble(PricePoint::price).toArray();
    }

    public synchronized PricePoint oldest() {
        return points.peekFirst();
    }

    public synchronized PricePoint latest() {
        return points.peekLast();
    }

    public synchronized int size() {
        return points.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
