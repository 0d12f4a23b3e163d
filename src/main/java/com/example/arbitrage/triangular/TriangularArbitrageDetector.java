package com.example.arbitrage.triangular;

import com.example.arbitrage.common.model.PathProfit;
import com.example.arbitrage.common.model.TriangularPath;
import com.example.arbitrage.market.MarketDataProvider;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Поиск прибыльных треугольных циклов внутри одной биржи.
 * <p>
 * Граф строится заново при каждом вызове {@link #buildCurrencyGraph()}, до первого построения пути не ищутся.
 */
@Slf4j
public class TriangularArbitrageDetector {

    private final MarketDataProvider marketDataProvider;
    private final CurrencyGraphBuilder graphBuilder;
    private final LegProfitSimulator simulator;

    private volatile CurrencyGraph graph;

    public TriangularArbitrageDetector(MarketDataProvider marketDataProvider,
                                       CurrencyGraphBuilder graphBuilder,
                                       LegProfitSimulator simulator) {
        this.marketDataProvider = marketDataProvider;
        this.graphBuilder = graphBuilder;
        this.simulator = simulator;
    }

    /**
     * @return количество пар в графе
     */
    public int buildCurrencyGraph() {
        CurrencyGraph built = graphBuilder.build(marketDataProvider.getProducts());
        this.graph = built;
        return built.getPairCount();
    }

    public List<TriangularPath> findTriangularPaths(String startCurrency, int maxPaths) {
        CurrencyGraph current = graph;
        if (current == null) {
            log.warn("⚠️ Граф валют еще не построен");
            return List.of();
        }
        return new TriangularCycleFinder(current).findTriangularPaths(startCurrency, maxPaths);
    }

    public PathProfit calculatePathProfit(TriangularPath path, BigDecimal startAmount, boolean includeFees) {
        return simulator.calculatePathProfit(path, startAmount, includeFees);
    }

    /**
     * Прибыльные пути по всем стартовым валютам, отсортированные по profitPct по убыванию
     */
    public List<PathProfit> findProfitablePaths(List<String> startCurrencies,
                                                BigDecimal minProfitPct,
                                                BigDecimal startAmount,
                                                int maxPathsPerCurrency) {
        List<PathProfit> profitable = new ArrayList<>();

        for (String currency : startCurrencies) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("⚠️ Поиск треугольных путей прерван на {}", currency);
                break;
            }
            List<TriangularPath> paths = findTriangularPaths(currency, maxPathsPerCurrency);
            if (paths.isEmpty()) {
                continue;
            }

            List<PathProfit> found = simulator.evaluatePaths(paths, startAmount).stream()
                    .filter(p -> p.isProfitable() && p.getProfitPct().compareTo(minProfitPct) >= 0)
                    .toList();

            log.info("🔍 {}: проверено {} путей, прибыльных {}", currency, paths.size(), found.size());
            profitable.addAll(found);
        }

        profitable.sort(Comparator.comparing(PathProfit::getProfitPct).reversed());
        return profitable;
    }

    public List<String> getAllCurrencies() {
        CurrencyGraph current = graph;
        return current == null ? List.of() : current.getCurrencies();
    }

    public int getPairCount() {
        CurrencyGraph current = graph;
        return current == null ? 0 : current.getPairCount();
    }

    public Instant getLastBuild() {
        CurrencyGraph current = graph;
        return current == null ? null : current.getBuiltAt();
    }
}
