package com.example.arbitrage.spatial;

import com.example.arbitrage.common.model.AggregatedPrice;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Цикл: получить лучшие цены, отдать в callback, подождать интервал.
 * Ошибка одной итерации логируется и цикл продолжается. Остановка через {@link #stop()}.
 */
@Slf4j
public class SpreadMonitor implements Runnable {

    private final PriceAggregator aggregator;
    private final String base;
    private final String quote;
    private final Consumer<AggregatedPrice> callback;
    private final Duration interval;
    private final Duration timeout;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong iterations = new AtomicLong();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);

    SpreadMonitor(PriceAggregator aggregator, String base, String quote, Consumer<AggregatedPrice> callback,
                  Duration interval, Duration timeout) {
        this.aggregator = aggregator;
        this.base = base;
        this.quote = quote;
        this.callback = callback;
        this.interval = interval;
        this.timeout = timeout;
    }

    @Override
    public void run() {
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                try {
                    AggregatedPrice prices = aggregator.getBestPrices(base, quote, timeout);
                    callback.accept(prices);
                } catch (Exception e) {
                    log.error("❌ Ошибка в мониторинге спреда {}-{}: {}", base, quote, e.getMessage());
                }
                iterations.incrementAndGet();

                // ожидание прерывается сразу при stop()
                if (stopSignal.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running.set(false);
            finished.countDown();
            log.info("⏹️ Мониторинг спреда {}-{} остановлен после {} итераций", base, quote, iterations.get());
        }
    }

    public void stop() {
        running.set(false);
        stopSignal.countDown();
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getIterations() {
        return iterations.get();
    }

    /**
     * Ждет завершения цикла после {@link #stop()}
     */
    public boolean awaitTermination(Duration wait) throws InterruptedException {
        return finished.await(wait.toMillis(), TimeUnit.MILLISECONDS);
    }
}
