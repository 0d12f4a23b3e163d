package com.example.arbitrage.core.schedulers;

import com.example.arbitrage.common.events.ArbitrageOpportunityEvent;
import com.example.arbitrage.common.events.PathProfitEvent;
import com.example.arbitrage.common.events.ZScoreSignalEvent;
import com.example.arbitrage.common.model.ArbitrageOpportunity;
import com.example.arbitrage.common.model.CurrencyPair;
import com.example.arbitrage.common.model.PairCorrelation;
import com.example.arbitrage.common.model.PathProfit;
import com.example.arbitrage.common.model.SignalDirection;
import com.example.arbitrage.common.model.ZScoreSignal;
import com.example.arbitrage.core.services.ArbitrageEventPublisher;
import com.example.arbitrage.market.MarketDataProvider;
import com.example.arbitrage.spatial.OpportunityScanner;
import com.example.arbitrage.statarb.CorrelationEstimator;
import com.example.arbitrage.statarb.PriceHistoryStore;
import com.example.arbitrage.statarb.ZScoreSignalGenerator;
import com.example.arbitrage.triangular.TriangularArbitrageDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
@ConditionalOnProperty(value = "arbitrage.scanner.enabled", havingValue = "true", matchIfMissing = false)
public class ArbitrageScanScheduler {

    // Флаги для пропуска пересекающихся запусков
    private final AtomicBoolean triangularRunning = new AtomicBoolean(false);
    private final AtomicBoolean spatialRunning = new AtomicBoolean(false);
    private final AtomicBoolean statArbRunning = new AtomicBoolean(false);

    // Открытые позиции по парам "pair1|pair2"
    private final Map<String, SignalDirection> positions = new ConcurrentHashMap<>();

    private final TriangularArbitrageDetector triangularDetector;
    private final OpportunityScanner opportunityScanner;
    private final MarketDataProvider marketDataProvider;
    private final PriceHistoryStore priceHistoryStore;
    private final CorrelationEstimator correlationEstimator;
    private final ZScoreSignalGenerator signalGenerator;
    private final ArbitrageEventPublisher eventPublisher;

    private final List<String> startCurrencies;
    private final BigDecimal triangularMinProfitPct;
    private final BigDecimal startAmount;
    private final int maxPathsPerCurrency;
    private final List<CurrencyPair> spatialPairs;
    private final BigDecimal spatialMinProfitPct;
    private final BigDecimal minQuantity;
    private final Duration spatialTimeout;
    private final List<String> statArbPairs;
    private final double minCorrelation;
    private final double entryThreshold;
    private final double exitThreshold;

    public ArbitrageScanScheduler(TriangularArbitrageDetector triangularDetector,
                                  OpportunityScanner opportunityScanner,
                                  MarketDataProvider marketDataProvider,
                                  PriceHistoryStore priceHistoryStore,
                                  CorrelationEstimator correlationEstimator,
                                  ZScoreSignalGenerator signalGenerator,
                                  ArbitrageEventPublisher eventPublisher,
                                  @Value("${arbitrage.triangular.start-currencies:ETH,BTC,USDT}") List<String> startCurrencies,
                                  @Value("${arbitrage.triangular.min-profit-pct:0.1}") BigDecimal triangularMinProfitPct,
                                  @Value("${arbitrage.triangular.start-amount:1000}") BigDecimal startAmount,
                                  @Value("${arbitrage.triangular.max-paths-per-currency:50}") int maxPathsPerCurrency,
                                  @Value("${arbitrage.spatial.pairs:ETH-USDT,BTC-USDT}") List<String> spatialPairs,
                                  @Value("${arbitrage.spatial.min-profit-pct:0.3}") BigDecimal spatialMinProfitPct,
                                  @Value("${arbitrage.spatial.min-quantity:0.01}") BigDecimal minQuantity,
                                  @Value("${arbitrage.spatial.timeout-ms:10000}") long spatialTimeoutMs,
                                  @Value("${arbitrage.statarb.pairs:BTC-USDT,ETH-USDT,SOL-USDT,BNB-USDT}") List<String> statArbPairs,
                                  @Value("${arbitrage.statarb.min-correlation:0.7}") double minCorrelation,
                                  @Value("${arbitrage.statarb.entry-threshold:2.0}") double entryThreshold,
                                  @Value("${arbitrage.statarb.exit-threshold:0.5}") double exitThreshold) {
        this.triangularDetector = triangularDetector;
        this.opportunityScanner = opportunityScanner;
        this.marketDataProvider = marketDataProvider;
        this.priceHistoryStore = priceHistoryStore;
        this.correlationEstimator = correlationEstimator;
        this.signalGenerator = signalGenerator;
        this.eventPublisher = eventPublisher;
        this.startCurrencies = List.copyOf(startCurrencies);
        this.triangularMinProfitPct = triangularMinProfitPct;
        this.startAmount = startAmount;
        this.maxPathsPerCurrency = maxPathsPerCurrency;
        this.spatialPairs = spatialPairs.stream().map(CurrencyPair::parse).toList();
        this.spatialMinProfitPct = spatialMinProfitPct;
        this.minQuantity = minQuantity;
        this.spatialTimeout = Duration.ofMillis(spatialTimeoutMs);
        this.statArbPairs = List.copyOf(statArbPairs);
        this.minCorrelation = minCorrelation;
        this.entryThreshold = entryThreshold;
        this.exitThreshold = exitThreshold;
    }

    @Scheduled(cron = "${arbitrage.scanner.triangular-cron:0 */5 * * * *}") // Каждые 5 минут
    public void scanTriangular() {
        if (!triangularRunning.compareAndSet(false, true)) {
            log.warn("⚠️ Треугольный скан уже выполняется");
            return;
        }

        long start = System.currentTimeMillis();
        try {
            int published = executeTriangularScan();
            log.info("⏱️ Треугольный скан завершен за {} сек, прибыльных путей: {}",
                    (System.currentTimeMillis() - start) / 1000.0, published);
        } finally {
            triangularRunning.set(false);
        }
    }

    @Scheduled(cron = "${arbitrage.scanner.spatial-cron:*/30 * * * * *}") // Каждые 30 секунд
    public void scanSpatial() {
        if (!spatialRunning.compareAndSet(false, true)) {
            log.warn("⚠️ Межбиржевой скан уже выполняется");
            return;
        }

        try {
            executeSpatialScan();
        } finally {
            spatialRunning.set(false);
        }
    }

    @Scheduled(cron = "${arbitrage.scanner.statarb-cron:0 * * * * *}") // Каждую минуту
    public void scanStatArb() {
        if (!statArbRunning.compareAndSet(false, true)) {
            log.warn("⚠️ Стат. арбитраж уже выполняется");
            return;
        }

        try {
            samplePrices();
            executeSignalCheck();
        } finally {
            statArbRunning.set(false);
        }
    }

    /**
     * Перестраивает граф и публикует прибыльные пути
     */
    int executeTriangularScan() {
        try {
            triangularDetector.buildCurrencyGraph();
        } catch (Exception e) {
            log.error("❌ Ошибка построения графа валют: {}", e.getMessage());
            return 0;
        }

        List<PathProfit> profitable = triangularDetector.findProfitablePaths(
                startCurrencies, triangularMinProfitPct, startAmount, maxPathsPerCurrency);
        profitable.forEach(p -> {
            log.info("💰 {}: {}%", p.getPath(), p.getProfitPct());
            eventPublisher.publishPathProfit(PathProfitEvent.builder().pathProfit(p).build());
        });
        return profitable.size();
    }

    int executeSpatialScan() {
        List<ArbitrageOpportunity> opportunities;
        try {
            opportunities = opportunityScanner.findOpportunities(spatialPairs, spatialMinProfitPct, minQuantity, spatialTimeout);
        } catch (Exception e) {
            log.error("❌ Ошибка межбиржевого скана: {}", e.getMessage());
            return 0;
        }

        opportunities.forEach(o -> {
            log.info("💰 {}: купить на {} по {}, продать на {} по {} ({}%)", o.getProductId(),
                    o.getBuyExchange(), o.getBuyPrice(), o.getSellExchange(), o.getSellPrice(), o.getEstimatedProfitPct());
            eventPublisher.publishOpportunity(ArbitrageOpportunityEvent.builder().opportunity(o).build());
        });
        return opportunities.size();
    }

    /**
     * Добавляет последнюю цену каждой отслеживаемой пары в историю
     */
    int samplePrices() {
        int sampled = 0;
        for (String pair : statArbPairs) {
            try {
                BigDecimal price = marketDataProvider.getPrice(pair);
                if (price == null) {
                    log.debug("Нет цены для {}", pair);
                    continue;
                }
                priceHistoryStore.updatePrice(pair, price.doubleValue());
                sampled++;
            } catch (Exception e) {
                log.error("❌ Ошибка получения цены {}: {}", pair, e.getMessage());
            }
        }
        return sampled;
    }

    /**
     * Проверяет сигналы по подходящим парам и по всем открытым позициям.
     * Позиция по паре, которая перестала быть подходящей, все равно должна дождаться выхода.
     */
    int executeSignalCheck() {
        int published = 0;
        Set<String> checked = new HashSet<>();
        for (PairCorrelation correlation : correlationEstimator.getSuitablePairs(minCorrelation)) {
            checked.add(positionKey(correlation.getPair1(), correlation.getPair2()));
            if (checkSignal(correlation.getPair1(), correlation.getPair2(), correlation)) {
                published++;
            }
        }

        for (String key : List.copyOf(positions.keySet())) {
            if (checked.contains(key)) {
                continue;
            }
            String[] pairs = key.split("\\|", 2);
            log.debug("Пара {} / {} больше не подходит, ждем выхода из позиции", pairs[0], pairs[1]);
            PairCorrelation correlation = correlationEstimator.calculateCorrelation(pairs[0], pairs[1]).orElse(null);
            if (checkSignal(pairs[0], pairs[1], correlation)) {
                published++;
            }
        }
        return published;
    }

    private boolean checkSignal(String pair1, String pair2, PairCorrelation correlation) {
        String key = positionKey(pair1, pair2);
        Optional<ZScoreSignal> signal = signalGenerator.getSignal(pair1, pair2,
                entryThreshold, exitThreshold, Optional.ofNullable(positions.get(key)));
        if (signal.isEmpty()) {
            return false;
        }

        ZScoreSignal s = signal.get();
        if (s.getDirection().isEntry()) {
            positions.put(key, s.getDirection());
        } else {
            positions.remove(key);
        }
        eventPublisher.publishSignal(ZScoreSignalEvent.builder().signal(s).correlation(correlation).build());
        return true;
    }

    Map<String, SignalDirection> getPositions() {
        return Map.copyOf(positions);
    }

    private static String positionKey(String pair1, String pair2) {
        return pair1 + "|" + pair2;
    }
}
