package io.predterm.config;

import io.predterm.util.Env;

import java.time.Duration;
import java.util.Objects;

/**
 * Client configuration.
 *
 * Every option can be set through an environment variable or system property
 * of the same name (see {@link #fromEnv()}).
 */
public record SyncConfig(
    String wsUrl,
    String apiBaseUrl,
    boolean autoConnect,
    boolean autoReconnect,
    int maxReconnectAttempts,
    long reconnectBaseDelayMs,
    long pingIntervalMs,
    int maxTrades,
    int maxNewsItems,
    int tradeWindowSeconds,
    double whaleThresholdMultiplier,
    long snapshotPollIntervalMs,
    long connectTimeoutMs,
    int monitoringPort
) {
    public static final String DEFAULT_WS_URL = "ws://localhost:3001/ws";
    public static final String DEFAULT_API_BASE = "http://localhost:3001";

    public SyncConfig {
        Objects.requireNonNull(wsUrl, "wsUrl");
        Objects.requireNonNull(apiBaseUrl, "apiBaseUrl");
    }

    public static SyncConfig defaults() {
        return new SyncConfig(
            DEFAULT_WS_URL,
            DEFAULT_API_BASE,
            true,
            true,
            5,
            1000,
            30_000,
            50,
            50,
            60,
            2.0,
            10_000,
            10_000,
            0
        );
    }

    public static SyncConfig fromEnv() {
        SyncConfig d = defaults();
        return new SyncConfig(
            Env.get("PREDTERM_WS_URL", d.wsUrl()),
            Env.get("PREDTERM_API_BASE", d.apiBaseUrl()),
            Env.getBool("PREDTERM_AUTO_CONNECT", d.autoConnect()),
            Env.getBool("PREDTERM_AUTO_RECONNECT", d.autoReconnect()),
            Env.getInt("PREDTERM_MAX_RECONNECT_ATTEMPTS", d.maxReconnectAttempts()),
            Env.getLong("PREDTERM_RECONNECT_BASE_DELAY_MS", d.reconnectBaseDelayMs()),
            Env.getLong("PREDTERM_PING_INTERVAL_MS", d.pingIntervalMs()),
            Env.getInt("PREDTERM_MAX_TRADES", d.maxTrades()),
            Env.getInt("PREDTERM_MAX_NEWS_ITEMS", d.maxNewsItems()),
            Env.getInt("PREDTERM_TRADE_WINDOW_SECONDS", d.tradeWindowSeconds()),
            Env.getDouble("PREDTERM_WHALE_THRESHOLD_MULTIPLIER", d.whaleThresholdMultiplier()),
            Env.getLong("PREDTERM_SNAPSHOT_POLL_INTERVAL_MS", d.snapshotPollIntervalMs()),
            Env.getLong("PREDTERM_CONNECT_TIMEOUT_MS", d.connectTimeoutMs()),
            Env.getInt("PREDTERM_MONITORING_PORT", d.monitoringPort())
        ).validate();
    }

    /**
     * @return this, for chaining
     * @throws IllegalArgumentException if a count or interval is not positive
     */
    public SyncConfig validate() {
        requirePositive("maxReconnectAttempts", maxReconnectAttempts);
        requirePositive("reconnectBaseDelayMs", reconnectBaseDelayMs);
        requirePositive("pingIntervalMs", pingIntervalMs);
        requirePositive("maxTrades", maxTrades);
        requirePositive("maxNewsItems", maxNewsItems);
        requirePositive("tradeWindowSeconds", tradeWindowSeconds);
        requirePositive("snapshotPollIntervalMs", snapshotPollIntervalMs);
        requirePositive("connectTimeoutMs", connectTimeoutMs);
        if (!(whaleThresholdMultiplier > 0)) {
            throw new IllegalArgumentException("whaleThresholdMultiplier must be positive");
        }
        if (monitoringPort < 0 || monitoringPort > 65535) {
            throw new IllegalArgumentException("monitoringPort out of range: " + monitoringPort);
        }
        if (!wsUrl.startsWith("ws://") && !wsUrl.startsWith("wss://")) {
            throw new IllegalArgumentException("wsUrl must be a ws:// or wss:// URL: " + wsUrl);
        }
        return this;
    }

    public Duration reconnectBaseDelay() {
        return Duration.ofMillis(reconnectBaseDelayMs);
    }

    public Duration pingInterval() {
        return Duration.ofMillis(pingIntervalMs);
    }

    public Duration snapshotPollInterval() {
        return Duration.ofMillis(snapshotPollIntervalMs);
    }

    public Duration connectTimeout() {
        return Duration.ofMillis(connectTimeoutMs);
    }

    public Duration tradeWindow() {
        return Duration.ofSeconds(tradeWindowSeconds);
    }

    public SyncConfig withWsUrl(String url) {
        return new SyncConfig(url, apiBaseUrl, autoConnect, autoReconnect, maxReconnectAttempts,
            reconnectBaseDelayMs, pingIntervalMs, maxTrades, maxNewsItems, tradeWindowSeconds,
            whaleThresholdMultiplier, snapshotPollIntervalMs, connectTimeoutMs, monitoringPort);
    }

    public SyncConfig withReconnect(boolean autoReconnect, int maxAttempts, long baseDelayMs) {
        return new SyncConfig(wsUrl, apiBaseUrl, autoConnect, autoReconnect, maxAttempts,
            baseDelayMs, pingIntervalMs, maxTrades, maxNewsItems, tradeWindowSeconds,
            whaleThresholdMultiplier, snapshotPollIntervalMs, connectTimeoutMs, monitoringPort);
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
