package io.predterm.infrastructure.metrics;

import io.predterm.domain.stream.ConnectionState;
import io.predterm.domain.stream.ErrorCode;
import io.predterm.domain.stream.MessageType;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of {@link SyncMetrics}.
 *
 * Key Metrics:
 * - predterm_stream_messages_total{type} - decoded inbound messages
 * - predterm_stream_malformed_frames_total - frames dropped by the codec
 * - predterm_stream_handler_failures_total{type} - handler exceptions
 * - predterm_stream_connection_state{state} - 1 for the current state, 0 otherwise
 * - predterm_stream_reconnect_attempts_total / predterm_stream_reconnect_exhausted_total
 * - predterm_stream_latency_seconds - heartbeat round trip
 * - predterm_snapshot_fetch_seconds{resource, status} - pulled snapshot latency
 *
 * Usage:
 * <pre>
 * PrometheusSyncMetrics metrics = new PrometheusSyncMetrics(new CollectorRegistry());
 * ConnectionManager connection = new ConnectionManager(config, transport, loop, metrics);
 * handlers.addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusSyncMetrics implements SyncMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusSyncMetrics.class);

    private final CollectorRegistry registry;

    // Dispatch metrics
    private final Counter messageCounter;
    private final Counter malformedFrameCounter;
    private final Counter handlerFailureCounter;
    private final Counter serverErrorCounter;

    // Connection metrics
    private final Gauge connectionState;
    private final Counter reconnectAttemptCounter;
    private final Counter reconnectExhaustedCounter;
    private final Histogram latency;
    private final Gauge latestLatency;
    private final Gauge heartbeatHealthy;
    private final Gauge subscriptionCount;

    // Pull metrics
    private final Histogram snapshotFetchLatency;
    private final Counter staleSnapshotCounter;

    public PrometheusSyncMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusSyncMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.messageCounter = Counter.build()
            .name("predterm_stream_messages_total")
            .help("Total number of decoded inbound stream messages")
            .labelNames("type")
            .register(registry);

        this.malformedFrameCounter = Counter.build()
            .name("predterm_stream_malformed_frames_total")
            .help("Total number of inbound frames dropped as malformed")
            .register(registry);

        this.handlerFailureCounter = Counter.build()
            .name("predterm_stream_handler_failures_total")
            .help("Total number of message handler exceptions")
            .labelNames("type")
            .register(registry);

        this.serverErrorCounter = Counter.build()
            .name("predterm_stream_server_errors_total")
            .help("Total number of error frames sent by the server")
            .labelNames("code")
            .register(registry);

        this.connectionState = Gauge.build()
            .name("predterm_stream_connection_state")
            .help("Current connection state (1 for the active state)")
            .labelNames("state")
            .register(registry);

        this.reconnectAttemptCounter = Counter.build()
            .name("predterm_stream_reconnect_attempts_total")
            .help("Total number of reconnect attempts")
            .register(registry);

        this.reconnectExhaustedCounter = Counter.build()
            .name("predterm_stream_reconnect_exhausted_total")
            .help("Number of times reconnection gave up")
            .register(registry);

        this.latency = Histogram.build()
            .name("predterm_stream_latency_seconds")
            .help("Heartbeat round trip in seconds")
            .buckets(0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0)
            .register(registry);

        this.latestLatency = Gauge.build()
            .name("predterm_stream_latency_last_ms")
            .help("Most recent heartbeat round trip in milliseconds")
            .register(registry);

        this.heartbeatHealthy = Gauge.build()
            .name("predterm_stream_heartbeat_healthy")
            .help("Heartbeat health (1=pongs arriving, 0=timed out)")
            .register(registry);

        this.subscriptionCount = Gauge.build()
            .name("predterm_stream_subscriptions")
            .help("Number of channels in the subscription registry")
            .register(registry);

        this.snapshotFetchLatency = Histogram.build()
            .name("predterm_snapshot_fetch_seconds")
            .help("Pulled snapshot request latency in seconds")
            .labelNames("resource", "status")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0, 10.0)
            .register(registry);

        this.staleSnapshotCounter = Counter.build()
            .name("predterm_snapshot_stale_discarded_total")
            .help("Pulled snapshot responses discarded because a newer request was issued")
            .register(registry);

        heartbeatHealthy.set(1);
        log.info("[PrometheusSyncMetrics] Initialized");
    }

    @Override
    public void recordMessage(MessageType type) {
        messageCounter.labels(type.wireName()).inc();
    }

    @Override
    public void recordMalformedFrame() {
        malformedFrameCounter.inc();
    }

    @Override
    public void recordHandlerFailure(MessageType type) {
        handlerFailureCounter.labels(type.wireName()).inc();
    }

    @Override
    public void recordServerError(ErrorCode code) {
        serverErrorCounter.labels(code.wireName()).inc();
    }

    @Override
    public void recordConnectionState(ConnectionState state) {
        for (ConnectionState s : ConnectionState.values()) {
            connectionState.labels(s.name()).set(s == state ? 1 : 0);
        }
    }

    @Override
    public void recordReconnectAttempt(int attemptNumber) {
        reconnectAttemptCounter.inc();
    }

    @Override
    public void recordReconnectExhausted() {
        reconnectExhaustedCounter.inc();
    }

    @Override
    public void recordLatency(long latencyMillis) {
        latency.observe(latencyMillis / 1000.0);
        latestLatency.set(latencyMillis);
    }

    @Override
    public void recordHeartbeatHealth(boolean healthy) {
        heartbeatHealthy.set(healthy ? 1 : 0);
    }

    @Override
    public void updateSubscriptionCount(int count) {
        subscriptionCount.set(count);
    }

    @Override
    public void recordSnapshotFetch(String resource, boolean success, Duration fetchLatency) {
        snapshotFetchLatency.labels(resource, success ? "success" : "failure")
            .observe(fetchLatency.toMillis() / 1000.0);
    }

    @Override
    public void recordStaleSnapshotDiscarded() {
        staleSnapshotCounter.inc();
    }

    /**
     * Get Prometheus CollectorRegistry for /metrics endpoint.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
