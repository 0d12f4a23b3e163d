package com.example.arbitrage.api;

import com.example.arbitrage.market.MarketDataException;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Клиент публичного REST API OKX (инструменты и тикеры спота)
 */
@Slf4j
public class OkxClient {

    private static final String INSTRUMENTS_ENDPOINT = "/api/v5/public/instruments?instType=SPOT";
    private static final String TICKER_ENDPOINT = "/api/v5/market/ticker?instId=";

    private final OkHttpClient client;
    private final String baseUrl;

    public OkxClient(String baseUrl, Duration timeout) {
        this(baseUrl, new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout)
                .build());
    }

    public OkxClient(String baseUrl, OkHttpClient client) {
        this.baseUrl = baseUrl;
        this.client = client;
    }

    public List<JsonObject> getSpotInstruments() {
        JsonArray data = getData(baseUrl + INSTRUMENTS_ENDPOINT);
        List<JsonObject> result = new ArrayList<>(data.size());
        for (JsonElement el : data) {
            result.add(el.getAsJsonObject());
        }
        log.debug("📊 OKX вернул {} спот инструментов", result.size());
        return result;
    }

    /**
     * Тикер инструмента или null, если биржа вернула пустой ответ
     */
    public JsonObject getTicker(String instId) {
        JsonArray data = getData(baseUrl + TICKER_ENDPOINT + instId);
        if (data.isEmpty()) {
            return null;
        }
        return data.get(0).getAsJsonObject();
    }

    private JsonArray getData(String url) {
        Request request = new Request.Builder()
                .url(url)
                .build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new MarketDataException("OKX HTTP " + response.code() + " для " + url);
            }
            JsonObject obj = JsonParser.parseString(body.string()).getAsJsonObject();
            String code = obj.has("code") ? obj.get("code").getAsString() : "0";
            if (!"0".equals(code)) {
                String msg = obj.has("msg") ? obj.get("msg").getAsString() : "";
                throw new MarketDataException("OKX ошибка " + code + ": " + msg);
            }
            JsonArray data = obj.getAsJsonArray("data");
            return data != null ? data : new JsonArray();
        } catch (IOException e) {
            throw new MarketDataException("Ошибка запроса к OKX: " + url, e);
        }
    }
}
