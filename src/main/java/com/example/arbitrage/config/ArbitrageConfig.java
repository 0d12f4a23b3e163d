package com.example.arbitrage.config;

import com.example.arbitrage.api.OkxClient;
import com.example.arbitrage.feeds.CexPriceFeed;
import com.example.arbitrage.feeds.DexPriceFeed;
import com.example.arbitrage.feeds.DexQuoteClient;
import com.example.arbitrage.feeds.PriceFeed;
import com.example.arbitrage.market.MarketDataProvider;
import com.example.arbitrage.market.OkxMarketDataProvider;
import com.example.arbitrage.spatial.OpportunityScanner;
import com.example.arbitrage.spatial.PriceAggregator;
import com.example.arbitrage.statarb.CorrelationCache;
import com.example.arbitrage.statarb.CorrelationEstimator;
import com.example.arbitrage.statarb.PriceHistoryStore;
import com.example.arbitrage.statarb.ZScoreSignalGenerator;
import com.example.arbitrage.triangular.CurrencyGraphBuilder;
import com.example.arbitrage.triangular.LegProfitSimulator;
import com.example.arbitrage.triangular.TriangularArbitrageDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Сборка детекторов арбитража и их зависимостей
 */
@Slf4j
@Configuration
public class ArbitrageConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService arbitrageExecutor(@Value("${arbitrage.executor.threads:8}") int threads) {
        log.info("🔧 Пул расчета треугольных путей: {} потоков", threads);
        return Executors.newFixedThreadPool(threads);
    }

    // Опрос площадок не должен стоять в очереди за медленными треугольными путями
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService priceFeedExecutor(@Value("${arbitrage.executor.feed-threads:4}") int threads) {
        log.info("🔧 Пул запросов котировок площадок: {} потоков", threads);
        return Executors.newFixedThreadPool(threads);
    }

    // Мониторы спреда живут долго, держим их отдельно от пула запросов
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService spreadMonitorExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public OkxClient okxClient(@Value("${arbitrage.okx.base-url:https://www.okx.com}") String baseUrl,
                               @Value("${arbitrage.okx.timeout-ms:5000}") long timeoutMs) {
        log.info("🔧 Создание OkxClient: {}", baseUrl);
        return new OkxClient(baseUrl, Duration.ofMillis(timeoutMs));
    }

    @Bean
    public MarketDataProvider marketDataProvider(OkxClient okxClient) {
        return new OkxMarketDataProvider(okxClient);
    }

    @Bean
    public CexPriceFeed okxPriceFeed(MarketDataProvider marketDataProvider,
                                     @Value("${arbitrage.okx.taker-fee-pct:0.1}") BigDecimal takerFeePct,
                                     @Value("${arbitrage.okx.maker-fee-pct:0.08}") BigDecimal makerFeePct,
                                     Clock clock) {
        return new CexPriceFeed("okx", marketDataProvider, takerFeePct, makerFeePct, "BTC-USDT", clock);
    }

    @Bean
    public PriceAggregator priceAggregator(CexPriceFeed okxPriceFeed,
                                           ObjectProvider<DexQuoteClient> dexQuoteClient,
                                           @Value("${arbitrage.dex.name:uniswap_v3}") String dexName,
                                           @Value("${arbitrage.dex.chain-id:1}") int dexChainId,
                                           @Qualifier("priceFeedExecutor") ExecutorService executor,
                                           @Qualifier("spreadMonitorExecutor") ExecutorService monitorExecutor,
                                           Clock clock) {
        List<PriceFeed> feeds = new ArrayList<>();
        feeds.add(okxPriceFeed);
        dexQuoteClient.ifAvailable(client -> {
            log.info("🔧 Подключен DEX фид {} (chain {})", dexName, dexChainId);
            feeds.add(new DexPriceFeed(dexName, client, dexChainId, clock));
        });
        return new PriceAggregator(feeds, executor, monitorExecutor, clock);
    }

    @Bean
    public OpportunityScanner opportunityScanner(PriceAggregator priceAggregator, Clock clock) {
        return new OpportunityScanner(priceAggregator, clock);
    }

    @Bean
    public CurrencyGraphBuilder currencyGraphBuilder(Clock clock) {
        return new CurrencyGraphBuilder(clock);
    }

    @Bean
    public LegProfitSimulator legProfitSimulator(MarketDataProvider marketDataProvider,
                                                 @Value("${arbitrage.triangular.fee-pct:0.1}") BigDecimal feePct,
                                                 @Value("${arbitrage.triangular.batch-size:10}") int batchSize,
                                                 @Value("${arbitrage.triangular.batch-delay-ms:100}") long batchDelayMs,
                                                 @Value("${arbitrage.triangular.path-timeout-ms:15000}") long pathTimeoutMs,
                                                 @Qualifier("arbitrageExecutor") ExecutorService executor,
                                                 Clock clock) {
        return new LegProfitSimulator(marketDataProvider, feePct, executor, batchSize,
                Duration.ofMillis(batchDelayMs), Duration.ofMillis(pathTimeoutMs), clock);
    }

    @Bean
    public TriangularArbitrageDetector triangularArbitrageDetector(MarketDataProvider marketDataProvider,
                                                                   CurrencyGraphBuilder currencyGraphBuilder,
                                                                   LegProfitSimulator legProfitSimulator) {
        return new TriangularArbitrageDetector(marketDataProvider, currencyGraphBuilder, legProfitSimulator);
    }

    @Bean
    public PriceHistoryStore priceHistoryStore(@Value("${arbitrage.statarb.lookback-days:30}") int lookbackDays,
                                               @Value("${arbitrage.statarb.max-history-points:10000}") int maxHistoryPoints,
                                               Clock clock) {
        return new PriceHistoryStore(lookbackDays, maxHistoryPoints, clock);
    }

    @Bean
    public CorrelationCache correlationCache(Clock clock) {
        return new CorrelationCache(clock);
    }

    @Bean
    public CorrelationEstimator correlationEstimator(PriceHistoryStore priceHistoryStore,
                                                     CorrelationCache correlationCache,
                                                     @Value("${arbitrage.statarb.cache-minutes:5}") long cacheMinutes) {
        return new CorrelationEstimator(priceHistoryStore, correlationCache, Duration.ofMinutes(cacheMinutes));
    }

    @Bean
    public ZScoreSignalGenerator zScoreSignalGenerator(CorrelationEstimator correlationEstimator, Clock clock) {
        return new ZScoreSignalGenerator(correlationEstimator, clock);
    }
}
