package io.predterm.infrastructure.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.predterm.domain.market.OrderBook;
import io.predterm.domain.market.Platform;
import io.predterm.domain.market.PriceHistory;
import io.predterm.domain.market.PriceInterval;
import io.predterm.domain.market.TradeHistory;
import io.predterm.infrastructure.metrics.SyncMetrics;
import io.predterm.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link MarketApiClient} against the terminal REST API.
 *
 * Endpoints:
 * <pre>
 * GET {base}/api/markets/{platform}/{id}/orderbook?depth=
 * GET {base}/api/markets/{platform}/{id}/trades?limit=&amp;cursor=
 * GET {base}/api/markets/{platform}/{id}/history?interval=&amp;timeframe=
 * </pre>
 * Non-2xx responses carry {@code {"error": "..."}}.
 */
public class HttpMarketApiClient implements MarketApiClient {
    private static final Logger log = LoggerFactory.getLogger(HttpMarketApiClient.class);

    private static final Duration TIMEOUT = Duration.ofSeconds(15);

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final SyncMetrics metrics;

    public HttpMarketApiClient(String baseUrl, SyncMetrics metrics) {
        this(baseUrl, HttpClient.newBuilder().connectTimeout(TIMEOUT).build(), metrics);
    }

    public HttpMarketApiClient(String baseUrl, HttpClient httpClient, SyncMetrics metrics) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.mapper = Json.newMapper();
        this.metrics = metrics != null ? metrics : SyncMetrics.noop();
    }

    @Override
    public CompletableFuture<OrderBook> getOrderBook(Platform platform, String marketId, Integer depth) {
        Map<String, String> query = new LinkedHashMap<>();
        if (depth != null && depth > 0) {
            query.put("depth", depth.toString());
        }
        return get("orderbook", platform, marketId, query, OrderBook.class);
    }

    @Override
    public CompletableFuture<TradeHistory> getTrades(Platform platform, String marketId, Integer limit, String cursor) {
        Map<String, String> query = new LinkedHashMap<>();
        if (limit != null && limit > 0) {
            query.put("limit", limit.toString());
        }
        if (cursor != null && !cursor.isEmpty()) {
            query.put("cursor", cursor);
        }
        return get("trades", platform, marketId, query, TradeHistory.class);
    }

    @Override
    public CompletableFuture<PriceHistory> getPriceHistory(Platform platform, String marketId,
                                                           PriceInterval interval, String timeframe) {
        Map<String, String> query = new LinkedHashMap<>();
        if (interval != null) {
            query.put("interval", interval.code());
        }
        if (timeframe != null && !timeframe.isEmpty()) {
            query.put("timeframe", timeframe);
        }
        return get("history", platform, marketId, query, PriceHistory.class);
    }

    URI uri(String resource, Platform platform, String marketId, Map<String, String> query) {
        StringBuilder url = new StringBuilder(baseUrl)
            .append("/api/markets/")
            .append(platform.wireName())
            .append('/')
            .append(encode(marketId))
            .append('/')
            .append(resource);
        if (!query.isEmpty()) {
            StringJoiner params = new StringJoiner("&", "?", "");
            query.forEach((k, v) -> params.add(k + "=" + encode(v)));
            url.append(params);
        }
        return URI.create(url.toString());
    }

    private <T> CompletableFuture<T> get(String resource, Platform platform, String marketId,
                                         Map<String, String> query, Class<T> type) {
        URI uri = uri(resource, platform, marketId, query);
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(TIMEOUT)
            .header("Accept", "application/json")
            .GET()
            .build();
        long startTime = System.currentTimeMillis();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .thenApply(response -> parse(resource, uri, response, type))
            .handle((body, error) -> {
                long elapsed = System.currentTimeMillis() - startTime;
                metrics.recordSnapshotFetch(resource, error == null, Duration.ofMillis(elapsed));
                if (error == null) {
                    log.debug("[API] GET {} in {}ms", uri, elapsed);
                    return body;
                }
                throw failure(resource, uri, error);
            });
    }

    private <T> T parse(String resource, URI uri, HttpResponse<String> response, Class<T> type) {
        if (response.statusCode() / 100 != 2) {
            String reason = errorMessage(response.body());
            log.warn("[API] GET {} -> HTTP {} {}", uri.getPath(), response.statusCode(), reason);
            throw new MarketApiException(
                "Failed to fetch " + resource + ": HTTP " + response.statusCode() + " " + reason,
                response.statusCode());
        }
        try {
            return mapper.readValue(response.body(), type);
        } catch (IOException e) {
            log.warn("[API] GET {} returned an unreadable body: {}", uri.getPath(), e.getMessage());
            throw new MarketApiException("Failed to fetch " + resource + ": " + e.getMessage(), e);
        }
    }

    private static MarketApiException failure(String resource, URI uri, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
            ? error.getCause()
            : error;
        if (cause instanceof MarketApiException) {
            return (MarketApiException) cause;
        }
        log.warn("[API] GET {} failed: {}", uri.getPath(), cause.toString());
        return new MarketApiException("Failed to fetch " + resource + ": " + cause.getMessage(), cause);
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode node = mapper.readTree(body);
            JsonNode error = node.get("error");
            return error != null ? error.asText() : body;
        } catch (IOException e) {
            // Not JSON: report the start of the raw body.
            return body.length() > 200 ? body.substring(0, 200) : body;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
