package com.example.arbitrage.spatial;

import com.example.arbitrage.common.model.AggregatedPrice;
import com.example.arbitrage.common.model.PriceQuote;
import com.example.arbitrage.common.utils.BigDecimalUtil;
import com.example.arbitrage.feeds.PriceFeed;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Собирает котировки со всех площадок и выбирает лучшие цены покупки и продажи.
 * Площадка, которая упала или не ответила за таймаут, просто исключается из результата.
 */
@Slf4j
public class PriceAggregator {

    private final List<PriceFeed> feeds;
    private final Executor executor;
    private final Executor monitorExecutor;
    private final Clock clock;

    public PriceAggregator(List<PriceFeed> feeds, Executor executor, Executor monitorExecutor, Clock clock) {
        this.feeds = new CopyOnWriteArrayList<>(feeds);
        this.executor = executor;
        this.monitorExecutor = monitorExecutor;
        this.clock = clock;
    }

    public AggregatedPrice getBestPrices(String base, String quote, Duration timeout) {
        return getBestPricesAsync(base, quote, timeout).join();
    }

    /**
     * Опрашивает все площадки параллельно, каждую со своим таймаутом
     */
    public CompletableFuture<AggregatedPrice> getBestPricesAsync(String base, String quote, Duration timeout) {
        List<CompletableFuture<PriceQuote>> futures = feeds.stream()
                .map(feed -> fetchWithTimeout(feed, base, quote, timeout))
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> aggregate(base, quote, futures.stream()
                        .map(CompletableFuture::join)
                        .filter(Objects::nonNull)
                        .toList()));
    }

    private CompletableFuture<PriceQuote> fetchWithTimeout(PriceFeed feed, String base, String quote, Duration timeout) {
        return CompletableFuture
                .supplyAsync(() -> feed.getPrice(base, quote), executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    if (cause instanceof TimeoutException) {
                        log.warn("⚠️ Таймаут получения цены {}-{} от {}", base, quote, feed.getName());
                    } else {
                        log.error("❌ Ошибка получения цены {}-{} от {}: {}", base, quote, feed.getName(), cause.getMessage());
                    }
                    return null;
                });
    }

    private AggregatedPrice aggregate(String base, String quote, List<PriceQuote> quotes) {
        List<PriceQuote> valid = quotes.stream()
                // нулевая цена означает отсутствие котировки
                .filter(q -> BigDecimalUtil.isPositive(q.getBid()) && BigDecimalUtil.isPositive(q.getAsk()))
                .toList();

        if (valid.isEmpty()) {
            log.debug("Нет ни одной котировки для {}-{}", base, quote);
            return AggregatedPrice.builder()
                    .base(base)
                    .quote(quote)
                    .timestamp(clock.instant())
                    .allQuotes(List.of())
                    .build();
        }

        return AggregatedPrice.builder()
                .base(base)
                .quote(quote)
                .timestamp(clock.instant())
                .bestBuy(valid.stream().min(Comparator.comparing(PriceQuote::getAsk)).orElseThrow())
                .bestSell(valid.stream().max(Comparator.comparing(PriceQuote::getBid)).orElseThrow())
                .allQuotes(valid)
                .build();
    }

    /**
     * Запускает фоновое отслеживание спреда. Цикл живет до {@link SpreadMonitor#stop()}.
     */
    public SpreadMonitor monitorSpread(String base, String quote, Consumer<AggregatedPrice> callback,
                                       Duration interval, Duration timeout) {
        SpreadMonitor monitor = new SpreadMonitor(this, base, quote, callback, interval, timeout);
        monitorExecutor.execute(monitor);
        log.info("▶️ Запущен мониторинг спреда {}-{} с интервалом {}", base, quote, interval);
        return monitor;
    }

    public void addFeed(PriceFeed feed) {
        feeds.add(feed);
    }

    public void removeFeed(String feedName) {
        feeds.removeIf(feed -> feed.getName().equals(feedName));
    }

    public List<PriceFeed> getFeeds() {
        return List.copyOf(feeds);
    }

    /**
     * Доступность каждой площадки по имени. Упавшая проверка считается недоступностью.
     */
    public Map<String, Boolean> checkFeedHealth() {
        Map<String, Boolean> result = new LinkedHashMap<>();
        for (PriceFeed feed : feeds) {
            try {
                result.put(feed.getName(), feed.isAvailable());
            } catch (Exception e) {
                log.warn("⚠️ Проверка {} завершилась ошибкой: {}", feed.getName(), e.getMessage());
                result.put(feed.getName(), false);
            }
        }
        return result;
    }
}
