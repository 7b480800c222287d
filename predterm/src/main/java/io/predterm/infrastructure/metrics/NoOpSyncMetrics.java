package io.predterm.infrastructure.metrics;

import io.predterm.domain.stream.ConnectionState;
import io.predterm.domain.stream.ErrorCode;
import io.predterm.domain.stream.MessageType;

import java.time.Duration;

final class NoOpSyncMetrics implements SyncMetrics {
    static final NoOpSyncMetrics INSTANCE = new NoOpSyncMetrics();

    private NoOpSyncMetrics() {}

    @Override public void recordMessage(MessageType type) {}
    @Override public void recordMalformedFrame() {}
    @Override public void recordHandlerFailure(MessageType type) {}
    @Override public void recordServerError(ErrorCode code) {}
    @Override public void recordConnectionState(ConnectionState state) {}
    @Override public void recordReconnectAttempt(int attemptNumber) {}
    @Override public void recordReconnectExhausted() {}
    @Override public void recordLatency(long latencyMillis) {}
    @Override public void recordHeartbeatHealth(boolean healthy) {}
    @Override public void updateSubscriptionCount(int count) {}
    @Override public void recordSnapshotFetch(String resource, boolean success, Duration latency) {}
    @Override public void recordStaleSnapshotDiscarded() {}
}
