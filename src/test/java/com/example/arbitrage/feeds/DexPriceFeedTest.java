package com.example.arbitrage.feeds;

import com.example.arbitrage.common.model.ExchangeType;
import com.example.arbitrage.common.model.PriceQuote;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Котировки DEX через симуляцию свопов
 */
class DexPriceFeedTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void testAskAndBidFromSwaps() {
        DexPriceFeed feed = new DexPriceFeed("uniswap_v3", new FakeQuoteClient("0.5", "1995", 500), 1, CLOCK);

        PriceQuote quote = feed.getPrice("ETH", "USDT");

        // 1000 USDT -> 0.5 ETH, значит ask = 2000
        assertEquals(0, new BigDecimal("2000").compareTo(quote.getAsk()));
        assertEquals(0, new BigDecimal("1995").compareTo(quote.getBid()));
        assertEquals(0, new BigDecimal("0.05").compareTo(quote.getTakerFeePct()));
        assertEquals(0, new BigDecimal("15.00").compareTo(quote.getGasEstimate()));
        assertEquals(1, quote.getChainId());
        assertEquals(ExchangeType.DEX, quote.getExchangeType());
        assertTrue(quote.isDex());
        assertEquals("uniswap_v3", quote.getExchange());
        assertEquals(CLOCK.instant(), quote.getTimestamp());
    }

    @Test
    void testGasDependsOnChain() {
        assertEquals(0, new BigDecimal("0.30").compareTo(
                new DexPriceFeed("pancakeswap", new FakeQuoteClient("0.5", "1995", 3000), 56, CLOCK)
                        .getPrice("ETH", "USDT").getGasEstimate()));
        assertEquals(0, new BigDecimal("10.00").compareTo(
                new DexPriceFeed("other", new FakeQuoteClient("0.5", "1995", 3000), 999, CLOCK)
                        .getPrice("ETH", "USDT").getGasEstimate()));
    }

    @Test
    void testUnknownFeeTierFallsBackToDefault() {
        DexPriceFeed feed = new DexPriceFeed("uniswap_v3", new FakeQuoteClient("0.5", "1995", 42), 1, CLOCK);

        assertEquals(0, new BigDecimal("0.30").compareTo(feed.getPrice("ETH", "USDT").getTakerFeePct()));
        assertEquals(0, new BigDecimal("1.00").compareTo(DexPriceFeed.FEE_TIERS.get(10000)));
    }

    @Test
    void testMissingPoolGivesNull() {
        FakeQuoteClient client = new FakeQuoteClient("0.5", "1995", 500);
        client.missing = true;

        assertNull(new DexPriceFeed("uniswap_v3", client, 1, CLOCK).getPrice("ETH", "USDT"));
    }

    @Test
    void testEmptySwapGivesNull() {
        // пул без ликвидности: за 1000 USDT ничего не получить
        assertNull(new DexPriceFeed("uniswap_v3", new FakeQuoteClient("0", "3000", 500), 1, CLOCK)
                .getPrice("ETH", "USDT"));
        assertNull(new DexPriceFeed("uniswap_v3", new FakeQuoteClient("0.5", "0", 500), 1, CLOCK)
                .getPrice("ETH", "USDT"));
    }

    @Test
    void testClientErrorGivesNull() {
        FakeQuoteClient client = new FakeQuoteClient("0.5", "1995", 500);
        client.failing = true;

        assertNull(new DexPriceFeed("uniswap_v3", client, 1, CLOCK).getPrice("ETH", "USDT"));
    }

    @Test
    void testAvailabilityFollowsConnection() {
        FakeQuoteClient client = new FakeQuoteClient("0.5", "1995", 500);
        DexPriceFeed feed = new DexPriceFeed("uniswap_v3", client, 1, CLOCK);

        assertTrue(feed.isAvailable());
        client.connected = false;
        assertFalse(feed.isAvailable());
        assertEquals(ExchangeType.DEX, feed.getExchangeType());
    }

    private static class FakeQuoteClient implements DexQuoteClient {
        private final BigDecimal baseOutFor1000Quote;
        private final BigDecimal quoteOutFor1Base;
        private final int feeTier;
        boolean missing;
        boolean failing;
        boolean connected = true;

        FakeQuoteClient(String baseOutFor1000Quote, String quoteOutFor1Base, int feeTier) {
            this.baseOutFor1000Quote = new BigDecimal(baseOutFor1000Quote);
            this.quoteOutFor1Base = new BigDecimal(quoteOutFor1Base);
            this.feeTier = feeTier;
        }

        @Override
        public DexQuote getQuote(String tokenIn, String tokenOut, BigDecimal amountIn) {
            if (failing) {
                throw new IllegalStateException("RPC недоступен");
            }
            if (missing) {
                return null;
            }
            // котируемая валюта в базовую: USDT -> ETH
            if (tokenIn.equals("USDT")) {
                return new DexQuote(baseOutFor1000Quote, feeTier);
            }
            return new DexQuote(quoteOutFor1Base.multiply(amountIn), feeTier);
        }

        @Override
        public boolean isConnected() {
            return connected;
        }
    }
}
