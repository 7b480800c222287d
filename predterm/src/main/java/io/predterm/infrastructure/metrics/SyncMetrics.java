package io.predterm.infrastructure.metrics;

import io.predterm.domain.stream.ConnectionState;
import io.predterm.domain.stream.ErrorCode;
import io.predterm.domain.stream.MessageType;

import java.time.Duration;

/**
 * Metrics for the stream synchronization layer.
 *
 * Key metrics:
 * - Inbound messages by type, dropped frames, failing handlers
 * - Connection state, reconnect attempts, exhaustion
 * - Heartbeat latency and health
 * - Snapshot pulls and stale responses discarded
 */
public interface SyncMetrics {

    /**
     * Record a successfully decoded inbound message.
     */
    void recordMessage(MessageType type);

    /**
     * Record a frame that could not be decoded and was dropped.
     */
    void recordMalformedFrame();

    /**
     * Record a handler that threw while processing a message.
     */
    void recordHandlerFailure(MessageType type);

    /**
     * Record server-sent {@code error} frames.
     */
    void recordServerError(ErrorCode code);

    void recordConnectionState(ConnectionState state);

    /**
     * @param attemptNumber 1-based reconnect attempt number
     */
    void recordReconnectAttempt(int attemptNumber);

    void recordReconnectExhausted();

    void recordLatency(long latencyMillis);

    void recordHeartbeatHealth(boolean healthy);

    void updateSubscriptionCount(int count);

    /**
     * Record a pulled snapshot request.
     *
     * @param resource "orderbook", "trades" or "history"
     * @param success whether the request succeeded
     * @param latency request duration
     */
    void recordSnapshotFetch(String resource, boolean success, Duration latency);

    void recordStaleSnapshotDiscarded();

    /**
     * Metrics sink that records nothing.
     */
    static SyncMetrics noop() {
        return NoOpSyncMetrics.INSTANCE;
    }
}
