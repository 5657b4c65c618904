package com.pumpscreener.exchange.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pumpscreener.config.PumpScreenerProperties;
import com.pumpscreener.exception.MarketDataException;
import com.pumpscreener.exchange.MarketDataClient;
import com.pumpscreener.model.domain.Quote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;

/**
 * Binance USDT-M futures 24h rolling ticker.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BinanceTickerClient implements MarketDataClient {

    private static final String TICKER_PATH = "/fapi/v1/ticker/24hr";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final PumpScreenerProperties properties;

    @Override
    public String getSourceName() {
        return "Binance Futures";
    }

    @Override
    public Quote fetchQuote(String symbol) throws MarketDataException {
        HttpUrl baseUrl = HttpUrl.parse(properties.getBinance().getBaseUrl() + TICKER_PATH);
        if (baseUrl == null) {
            throw new IllegalStateException("Invalid Binance base URL: " + properties.getBinance().getBaseUrl());
        }
        HttpUrl url = baseUrl.newBuilder()
                .addQueryParameter("symbol", symbol)
                .build();

        Request request = new Request.Builder().url(url).get().build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String payload = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new MarketDataException(String.format("[%s] HTTP %d: %s",
                        symbol, response.code(), preview(payload)));
            }
            return parseTicker(symbol, payload);
        } catch (IOException e) {
            throw new MarketDataException(String.format("[%s] Request failed: %s", symbol, e.getMessage()), e);
        }
    }

    Quote parseTicker(String symbol, String payload) throws MarketDataException {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new MarketDataException(String.format("[%s] Malformed ticker payload: %s", symbol, preview(payload)), e);
        }
        if (root == null || !root.isObject()) {
            throw new MarketDataException(String.format("[%s] Unexpected ticker payload: %s", symbol, preview(payload)));
        }

        BigDecimal price = readDecimal(root, "lastPrice", symbol);
        BigDecimal changePercent = readDecimal(root, "priceChangePercent", symbol);
        BigDecimal quoteVolume = readDecimal(root, "quoteVolume", symbol);

        if (price.signum() <= 0) {
            throw new MarketDataException(String.format("[%s] Non-positive price %s", symbol, price.toPlainString()));
        }
        if (quoteVolume.signum() < 0) {
            throw new MarketDataException(String.format("[%s] Negative volume %s", symbol, quoteVolume.toPlainString()));
        }

        return new Quote(symbol, price, changePercent, quoteVolume);
    }

    private BigDecimal readDecimal(JsonNode root, String field, String symbol) throws MarketDataException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new MarketDataException(String.format("[%s] Missing field '%s'", symbol, field));
        }
        try {
            return new BigDecimal(node.asText());
        } catch (NumberFormatException e) {
            throw new MarketDataException(String.format("[%s] Field '%s' is not a number: %s",
                    symbol, field, node.asText()), e);
        }
    }

    private String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
