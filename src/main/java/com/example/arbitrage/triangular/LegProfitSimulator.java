package com.example.arbitrage.triangular;

import com.example.arbitrage.common.model.LegDirection;
import com.example.arbitrage.common.model.PathProfit;
import com.example.arbitrage.common.model.Ticker;
import com.example.arbitrage.common.model.TriangularPath;
import com.example.arbitrage.common.utils.BigDecimalUtil;
import com.example.arbitrage.market.MarketDataProvider;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static com.example.arbitrage.common.utils.BigDecimalUtil.MC;

/**
 * Симуляция прохода по ногам пути: цены ask для покупки и bid для продажи, комиссия с каждой ноги.
 * Пути оцениваются пачками: внутри пачки параллельно, между пачками пауза под лимиты биржи.
 */
@Slf4j
public class LegProfitSimulator {

    private final MarketDataProvider marketDataProvider;
    private final BigDecimal feePct;
    private final Executor executor;
    private final int batchSize;
    private final Duration batchDelay;
    private final Duration pathTimeout;
    private final Clock clock;

    public LegProfitSimulator(MarketDataProvider marketDataProvider,
                              BigDecimal feePct,
                              Executor executor,
                              int batchSize,
                              Duration batchDelay,
                              Duration pathTimeout,
                              Clock clock) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Размер пачки должен быть > 0: " + batchSize);
        }
        this.marketDataProvider = marketDataProvider;
        this.feePct = feePct;
        this.executor = executor;
        this.batchSize = batchSize;
        this.batchDelay = batchDelay;
        this.pathTimeout = pathTimeout;
        this.clock = clock;
    }

    public PathProfit calculatePathProfit(TriangularPath path, BigDecimal startAmount, boolean includeFees) {
        BigDecimal currentAmount = startAmount;
        List<BigDecimal> rates = new ArrayList<>(3);
        List<BigDecimal> fees = new ArrayList<>(3);

        for (int i = 0; i < path.getPairs().size(); i++) {
            String pair = path.getPairs().get(i);
            LegDirection direction = path.getDirections().get(i);

            BigDecimal price;
            try {
                price = getExecutionPrice(pair, direction);
            } catch (Exception e) {
                log.error("❌ Ошибка получения цены {} для пути {}: {}", pair, path, e.getMessage());
                return PathProfit.notPriceable(path, startAmount, clock.instant());
            }

            if (!BigDecimalUtil.isPositive(price)) {
                log.debug("Нет цены для {} ({}), путь {} не оценить", pair, direction.getValue(), path);
                return PathProfit.notPriceable(path, startAmount, clock.instant());
            }
            rates.add(price);

            BigDecimal output = direction == LegDirection.SELL
                    ? currentAmount.multiply(price, MC)
                    : currentAmount.divide(price, MC);

            BigDecimal fee = BigDecimal.ZERO;
            if (includeFees) {
                fee = BigDecimalUtil.percentOf(output, feePct);
                output = output.subtract(fee, MC);
            }
            fees.add(fee);

            currentAmount = output;
        }

        BigDecimal profit = currentAmount.subtract(startAmount, MC);

        return PathProfit.builder()
                .path(path)
                .startAmount(startAmount)
                .endAmount(currentAmount)
                .profit(profit)
                .profitPct(BigDecimalUtil.toPercent(profit, startAmount))
                .rates(List.copyOf(rates))
                .fees(List.copyOf(fees))
                .profitable(profit.signum() > 0)
                .timestamp(clock.instant())
                .build();
    }

    /**
     * Оценивает все пути пачками по batchSize. Ошибка или таймаут одного пути не прерывает перебор.
     * При прерывании потока возвращает то, что успели посчитать.
     */
    public List<PathProfit> evaluatePaths(List<TriangularPath> paths, BigDecimal startAmount) {
        List<PathProfit> results = new ArrayList<>(paths.size());

        for (int from = 0; from < paths.size(); from += batchSize) {
            List<TriangularPath> batch = paths.subList(from, Math.min(from + batchSize, paths.size()));

            List<CompletableFuture<PathProfit>> futures = batch.stream()
                    .map(path -> CompletableFuture
                            .supplyAsync(() -> calculatePathProfit(path, startAmount, true), executor)
                            .orTimeout(pathTimeout.toMillis(), TimeUnit.MILLISECONDS)
                            .exceptionally(ex -> {
                                log.error("❌ Ошибка оценки пути {}: {}", path, ex.getMessage());
                                return null;
                            }))
                    .toList();

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            futures.stream()
                    .map(CompletableFuture::join)
                    .filter(Objects::nonNull)
                    .forEach(results::add);

            if (!pause()) {
                log.warn("⚠️ Оценка путей прервана после {} из {}", results.size(), paths.size());
                break;
            }
        }

        return results;
    }

    private BigDecimal getExecutionPrice(String pair, LegDirection direction) {
        Ticker ticker = marketDataProvider.getTicker(pair);
        if (ticker == null) {
            return null;
        }
        return direction == LegDirection.BUY ? ticker.getAsk() : ticker.getBid();
    }

    private boolean pause() {
        if (batchDelay.isZero() || batchDelay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(batchDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
