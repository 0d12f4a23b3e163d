package com.example.arbitrage.market;

import com.example.arbitrage.api.OkxClient;
import com.example.arbitrage.common.model.Product;
import com.example.arbitrage.common.model.Ticker;
import com.example.arbitrage.common.utils.BigDecimalUtil;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
public class OkxMarketDataProvider implements MarketDataProvider {

    private static final String LIVE_STATE = "live";

    private final OkxClient okxClient;

    @Override
    public Ticker getTicker(String pairId) {
        JsonObject data = okxClient.getTicker(pairId);
        if (data == null) {
            log.warn("⚠️ OKX: нет тикера для {}", pairId);
            return null;
        }
        return Ticker.builder()
                .pairId(pairId)
                .bid(BigDecimalUtil.safeParse(getString(data, "bidPx")))
                .ask(BigDecimalUtil.safeParse(getString(data, "askPx")))
                .last(BigDecimalUtil.safeParse(getString(data, "last")))
                .timestamp(parseTimestamp(getString(data, "ts")))
                .build();
    }

    @Override
    public BigDecimal getPrice(String pairId) {
        Ticker ticker = getTicker(pairId);
        return ticker != null ? ticker.getLast() : null;
    }

    @Override
    public List<Product> getProducts() {
        List<JsonObject> instruments = okxClient.getSpotInstruments();
        List<Product> products = new ArrayList<>(instruments.size());
        for (JsonObject instrument : instruments) {
            products.add(Product.builder()
                    .pairId(getString(instrument, "instId"))
                    .base(getString(instrument, "baseCcy"))
                    .quote(getString(instrument, "quoteCcy"))
                    .tradingDisabled(!LIVE_STATE.equals(getString(instrument, "state")))
                    .build());
        }
        return products;
    }

    private static String getString(JsonObject obj, String field) {
        JsonElement el = obj.get(field);
        return el == null || el.isJsonNull() ? null : el.getAsString();
    }

    private static Instant parseTimestamp(String ts) {
        if (ts == null || ts.isEmpty()) {
            return Instant.now();
        }
        try {
            return Instant.ofEpochMilli(Long.parseLong(ts));
        } catch (NumberFormatException e) {
            log.debug("Некорректный ts тикера OKX: {}", ts);
            return Instant.now();
        }
    }
}
