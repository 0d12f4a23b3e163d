package com.example.arbitrage.triangular;

import com.example.arbitrage.common.model.LegDirection;
import com.example.arbitrage.common.model.TriangularPath;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Перебор циклов start → mid1 → mid2 → start по графу валют
 */
@Slf4j
public class TriangularCycleFinder {

    private final CurrencyGraph graph;

    public TriangularCycleFinder(CurrencyGraph graph) {
        this.graph = graph;
    }

    /**
     * Находит до maxPaths треугольных путей из startCurrency. Перебор останавливается, как только набран лимит.
     */
    public List<TriangularPath> findTriangularPaths(String startCurrency, int maxPaths) {
        int start = graph.currencyIndex(startCurrency);
        if (start < 0 || graph.edges(start).isEmpty()) {
            log.warn("⚠️ Валюта {} отсутствует в графе", startCurrency);
            return List.of();
        }

        List<TriangularPath> paths = new ArrayList<>();
        if (maxPaths <= 0) {
            return paths;
        }

        for (CurrencyGraph.Edge first : graph.edges(start)) {
            int mid1 = first.neighbor();
            if (mid1 == start) {
                continue;
            }
            LegDirection dir1 = legDirection(graph.pair(first.pair()), startCurrency, graph.currency(mid1));

            for (CurrencyGraph.Edge second : graph.edges(mid1)) {
                int mid2 = second.neighbor();
                if (mid2 == start || mid2 == mid1) {
                    continue;
                }

                int closing = graph.pairBetween(mid2, start);
                if (closing < 0) {
                    continue;
                }

                String mid1Currency = graph.currency(mid1);
                String mid2Currency = graph.currency(mid2);
                CurrencyGraph.GraphPair pair1 = graph.pair(first.pair());
                CurrencyGraph.GraphPair pair2 = graph.pair(second.pair());
                CurrencyGraph.GraphPair pair3 = graph.pair(closing);

                paths.add(new TriangularPath(
                        List.of(startCurrency, mid1Currency, mid2Currency, startCurrency),
                        List.of(pair1.pairId(), pair2.pairId(), pair3.pairId()),
                        List.of(dir1,
                                legDirection(pair2, mid1Currency, mid2Currency),
                                legDirection(pair3, mid2Currency, startCurrency))));

                if (paths.size() >= maxPaths) {
                    return paths;
                }
            }
        }

        log.debug("Найдено {} треугольных путей из {}", paths.size(), startCurrency);
        return paths;
    }

    /**
     * Есть base, хотим quote - продаем; есть quote, хотим base - покупаем.
     */
    public static LegDirection legDirection(CurrencyGraph.GraphPair pair, String from, String to) {
        if (from.equals(pair.base()) && to.equals(pair.quote())) {
            return LegDirection.SELL;
        }
        if (from.equals(pair.quote()) && to.equals(pair.base())) {
            return LegDirection.BUY;
        }
        log.warn("⚠️ Некорректный шаг: {} -> {} через {}", from, to, pair.pairId());
        return LegDirection.UNKNOWN;
    }
}
