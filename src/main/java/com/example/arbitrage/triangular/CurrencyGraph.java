package com.example.arbitrage.triangular;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Граф валют биржи.
 * Пары хранятся в плоской таблице, списки смежности ссылаются на индексы валют и пар.
 */
public class CurrencyGraph {

    /**
     * Пара из таблицы графа
     */
    public record GraphPair(String pairId, String base, String quote) {
    }

    /**
     * Ребро: соседняя валюта и пара, через которую в нее попадаем
     */
    public record Edge(int neighbor, int pair) {
    }

    private final List<String> currencies = new ArrayList<>();
    private final Map<String, Integer> currencyIndex = new HashMap<>();
    private final List<GraphPair> pairTable = new ArrayList<>();
    private final Map<String, Integer> pairIndex = new HashMap<>();
    private final List<List<Edge>> adjacency = new ArrayList<>();
    private final Map<Long, Integer> edgePositions = new HashMap<>();
    private final Set<String> pairIds = new LinkedHashSet<>();
    private final Instant builtAt;

    CurrencyGraph(Instant builtAt) {
        this.builtAt = builtAt;
    }

    /**
     * Добавляет пару в обе стороны: base→quote и quote→base.
     * Повторная пара для тех же валют перезаписывает ребро.
     */
    void addPair(String pairId, String base, String quote) {
        int pair = pairIndex.computeIfAbsent(pairId, id -> {
            pairTable.add(new GraphPair(id, base, quote));
            return pairTable.size() - 1;
        });
        int b = indexOf(base);
        int q = indexOf(quote);
        putEdge(b, q, pair);
        putEdge(q, b, pair);
        pairIds.add(pairId);
    }

    private int indexOf(String currency) {
        return currencyIndex.computeIfAbsent(currency, c -> {
            currencies.add(c);
            adjacency.add(new ArrayList<>());
            return currencies.size() - 1;
        });
    }

    private void putEdge(int from, int to, int pair) {
        long key = edgeKey(from, to);
        Integer position = edgePositions.get(key);
        List<Edge> edges = adjacency.get(from);
        if (position != null) {
            edges.set(position, new Edge(to, pair));
        } else {
            edges.add(new Edge(to, pair));
            edgePositions.put(key, edges.size() - 1);
        }
    }

    private static long edgeKey(int from, int to) {
        return ((long) from << 32) | (to & 0xffffffffL);
    }

    public boolean contains(String currency) {
        return currencyIndex.containsKey(currency);
    }

    /**
     * Индекс валюты или -1
     */
    public int currencyIndex(String currency) {
        return currencyIndex.getOrDefault(currency, -1);
    }

    public String currency(int index) {
        return currencies.get(index);
    }

    public GraphPair pair(int index) {
        return pairTable.get(index);
    }

    public List<Edge> edges(int currency) {
        return Collections.unmodifiableList(adjacency.get(currency));
    }

    /**
     * Индекс пары, соединяющей from и to, или -1
     */
    public int pairBetween(int from, int to) {
        Integer position = edgePositions.get(edgeKey(from, to));
        return position == null ? -1 : adjacency.get(from).get(position).pair();
    }

    public List<String> getCurrencies() {
        return Collections.unmodifiableList(currencies);
    }

    public Set<String> getPairIds() {
        return Collections.unmodifiableSet(pairIds);
    }

    public int getPairCount() {
        return pairIds.size();
    }

    public Instant getBuiltAt() {
        return builtAt;
    }
}
