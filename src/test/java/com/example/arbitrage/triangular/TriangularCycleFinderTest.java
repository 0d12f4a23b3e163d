package com.example.arbitrage.triangular;

import com.example.arbitrage.common.model.LegDirection;
import com.example.arbitrage.common.model.Product;
import com.example.arbitrage.common.model.TriangularPath;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Перебор треугольных циклов и направления ног
 */
class TriangularCycleFinderTest {

    private final CurrencyGraphBuilder builder = new CurrencyGraphBuilder(Clock.systemUTC());

    @Test
    void testFindsBothRotationsOfTriangle() {
        TriangularCycleFinder finder = new TriangularCycleFinder(graph("ETH-BTC", "BTC-USDT", "ETH-USDT"));

        List<TriangularPath> paths = finder.findTriangularPaths("ETH", 10);

        assertEquals(2, paths.size());
        TriangularPath path = paths.stream()
                .filter(p -> p.getCurrencies().get(1).equals("BTC"))
                .findFirst()
                .orElseThrow();
        assertEquals(List.of("ETH", "BTC", "USDT", "ETH"), path.getCurrencies());
        assertEquals(List.of("ETH-BTC", "BTC-USDT", "ETH-USDT"), path.getPairs());
        assertEquals(List.of(LegDirection.SELL, LegDirection.SELL, LegDirection.BUY), path.getDirections());
        assertEquals("ETH → BTC → USDT → ETH", path.toString());
    }

    @Test
    void testEveryPathIsWellFormed() {
        TriangularCycleFinder finder = new TriangularCycleFinder(graph(
                "ETH-BTC", "BTC-USDT", "ETH-USDT", "SOL-USDT", "SOL-BTC", "SOL-ETH", "BNB-USDT", "BNB-BTC"));

        for (String start : List.of("ETH", "BTC", "USDT", "SOL", "BNB")) {
            List<TriangularPath> paths = finder.findTriangularPaths(start, 100);
            assertFalse(paths.isEmpty(), "Нет путей из " + start);

            for (TriangularPath path : paths) {
                assertTrue(path.isValid());
                assertEquals(start, path.getStartCurrency());
                // три разные валюты внутри цикла
                assertEquals(3, new HashSet<>(path.getCurrencies().subList(0, 3)).size());

                for (int i = 0; i < 3; i++) {
                    String[] parts = path.getPairs().get(i).split("-");
                    String from = path.getCurrencies().get(i);
                    String to = path.getCurrencies().get(i + 1);
                    LegDirection expected = from.equals(parts[0]) && to.equals(parts[1])
                            ? LegDirection.SELL
                            : LegDirection.BUY;
                    assertEquals(expected, path.getDirections().get(i), path + " нога " + i);
                    assertTrue(Stream.of(parts).anyMatch(from::equals));
                    assertTrue(Stream.of(parts).anyMatch(to::equals));
                }
            }
            assertEquals(paths.size(), new HashSet<>(paths).size());
        }
    }

    @Test
    void testStopsAtMaxPaths() {
        TriangularCycleFinder finder = new TriangularCycleFinder(graph(
                "ETH-BTC", "BTC-USDT", "ETH-USDT", "SOL-USDT", "SOL-BTC", "SOL-ETH"));

        assertEquals(1, finder.findTriangularPaths("ETH", 1).size());
        assertEquals(3, finder.findTriangularPaths("ETH", 3).size());
        assertTrue(finder.findTriangularPaths("ETH", 0).isEmpty());
    }

    @Test
    void testUnknownCurrencyGivesNoPaths() {
        TriangularCycleFinder finder = new TriangularCycleFinder(graph("ETH-BTC", "BTC-USDT", "ETH-USDT"));

        assertTrue(finder.findTriangularPaths("DOGE", 10).isEmpty());
    }

    @Test
    void testNoCycleWithoutClosingPair() {
        TriangularCycleFinder finder = new TriangularCycleFinder(graph("ETH-BTC", "BTC-USDT"));

        assertTrue(finder.findTriangularPaths("ETH", 10).isEmpty());
    }

    @Test
    void testLegDirection() {
        CurrencyGraph.GraphPair pair = new CurrencyGraph.GraphPair("ETH-BTC", "ETH", "BTC");

        assertEquals(LegDirection.SELL, TriangularCycleFinder.legDirection(pair, "ETH", "BTC"));
        assertEquals(LegDirection.BUY, TriangularCycleFinder.legDirection(pair, "BTC", "ETH"));
        assertEquals(LegDirection.UNKNOWN, TriangularCycleFinder.legDirection(pair, "SOL", "BTC"));
    }

    private CurrencyGraph graph(String... pairIds) {
        return builder.build(Stream.of(pairIds)
                .map(id -> Product.builder().pairId(id).build())
                .toList());
    }
}
