package io.predterm.infrastructure.metrics;

import io.predterm.domain.stream.ConnectionState;
import io.predterm.domain.stream.ErrorCode;
import io.predterm.domain.stream.MessageType;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusSyncMetricsTest {

    private CollectorRegistry registry;
    private PrometheusSyncMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusSyncMetrics(registry);
    }

    private double sample(String name, String[] labels, String[] values) {
        Double value = registry.getSampleValue(name, labels, values);
        return value == null ? 0.0 : value;
    }

    @Test
    void testMessageCountersByType() {
        metrics.recordMessage(MessageType.PRICE_UPDATE);
        metrics.recordMessage(MessageType.PRICE_UPDATE);
        metrics.recordMessage(MessageType.TRADE_UPDATE);
        metrics.recordHandlerFailure(MessageType.TRADE_UPDATE);
        metrics.recordMalformedFrame();

        String[] type = {"type"};
        assertEquals(2.0, sample("predterm_stream_messages_total", type, new String[]{"price_update"}));
        assertEquals(1.0, sample("predterm_stream_messages_total", type, new String[]{"trade_update"}));
        assertEquals(1.0, sample("predterm_stream_handler_failures_total", type, new String[]{"trade_update"}));
        assertEquals(1.0, registry.getSampleValue("predterm_stream_malformed_frames_total"));
    }

    @Test
    void testConnectionStateIsOneHot() {
        metrics.recordConnectionState(ConnectionState.CONNECTING);
        metrics.recordConnectionState(ConnectionState.CONNECTED);

        String[] state = {"state"};
        assertEquals(1.0, sample("predterm_stream_connection_state", state, new String[]{"CONNECTED"}));
        assertEquals(0.0, sample("predterm_stream_connection_state", state, new String[]{"CONNECTING"}));
        assertEquals(0.0, sample("predterm_stream_connection_state", state, new String[]{"RECONNECTING"}));
    }

    @Test
    void testLatencyAndHealth() {
        assertEquals(1.0, registry.getSampleValue("predterm_stream_heartbeat_healthy"));

        metrics.recordLatency(42);
        metrics.recordHeartbeatHealth(false);

        assertEquals(42.0, registry.getSampleValue("predterm_stream_latency_last_ms"));
        assertEquals(1.0, registry.getSampleValue("predterm_stream_latency_seconds_count"));
        assertEquals(0.042, registry.getSampleValue("predterm_stream_latency_seconds_sum"), 1e-9);
        assertEquals(0.0, registry.getSampleValue("predterm_stream_heartbeat_healthy"));
    }

    @Test
    void testReconnectAndServerErrors() {
        metrics.recordReconnectAttempt(1);
        metrics.recordReconnectAttempt(2);
        metrics.recordReconnectExhausted();
        metrics.recordServerError(ErrorCode.RATE_LIMITED);

        assertEquals(2.0, registry.getSampleValue("predterm_stream_reconnect_attempts_total"));
        assertEquals(1.0, registry.getSampleValue("predterm_stream_reconnect_exhausted_total"));
        assertEquals(1.0, sample("predterm_stream_server_errors_total", new String[]{"code"}, new String[]{"rate_limited"}));
    }

    @Test
    void testSnapshotMetrics() {
        metrics.recordSnapshotFetch("orderbook", true, Duration.ofMillis(80));
        metrics.recordSnapshotFetch("trades", false, Duration.ofMillis(300));
        metrics.recordStaleSnapshotDiscarded();
        metrics.updateSubscriptionCount(3);

        String[] labels = {"resource", "status"};
        assertEquals(1.0, sample("predterm_snapshot_fetch_seconds_count", labels, new String[]{"orderbook", "success"}));
        assertEquals(1.0, sample("predterm_snapshot_fetch_seconds_count", labels, new String[]{"trades", "failure"}));
        assertEquals(1.0, registry.getSampleValue("predterm_snapshot_stale_discarded_total"));
        assertEquals(3.0, registry.getSampleValue("predterm_stream_subscriptions"));
    }
}
