package com.example.arbitrage.triangular;

import com.example.arbitrage.common.model.Product;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Строит граф валют из плоского списка инструментов. Каждый вызов строит граф заново.
 */
@Slf4j
public class CurrencyGraphBuilder {

    private static final String SEPARATOR = "-";

    private final Clock clock;

    public CurrencyGraphBuilder(Clock clock) {
        this.clock = clock;
    }

    public CurrencyGraph build(List<Product> products) {
        if (products == null || products.isEmpty()) {
            throw new IllegalArgumentException("Пустой список инструментов для построения графа");
        }

        CurrencyGraph graph = new CurrencyGraph(clock.instant());
        int skipped = 0;

        for (Product product : products) {
            if (product == null || product.isTradingDisabled()) {
                skipped++;
                log.debug("Пропускаем отключенный инструмент {}", product != null ? product.getPairId() : null);
                continue;
            }

            String[] parts = splitPairId(product.getPairId());
            if (parts == null) {
                skipped++;
                log.debug("Пропускаем инструмент без разделителя base-quote: {}", product.getPairId());
                continue;
            }

            graph.addPair(product.getPairId(), parts[0], parts[1]);
        }

        if (graph.getPairCount() == 0) {
            throw new IllegalStateException("Ни одного торгуемого инструмента из " + products.size());
        }

        log.info("✅ Построен граф валют: {} пар, {} валют, пропущено {}",
                graph.getPairCount(), graph.getCurrencies().size(), skipped);
        return graph;
    }

    /**
     * base и quote из BASE-QUOTE или null для некорректного идентификатора
     */
    static String[] splitPairId(String pairId) {
        if (pairId == null) {
            return null;
        }
        String[] parts = pairId.split(SEPARATOR, -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty() || parts[0].equals(parts[1])) {
            return null;
        }
        return parts;
    }
}
