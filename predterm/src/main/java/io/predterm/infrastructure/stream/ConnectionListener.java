package io.predterm.infrastructure.stream;

import io.predterm.domain.stream.ConnectionState;

/**
 * Connection observer. Callbacks run on the event loop; keep them short.
 */
public interface ConnectionListener {

    default void onStateChange(ConnectionState state) {}

    default void onError(StreamError error) {}

    /**
     * Latest heartbeat round trip.
     */
    default void onLatency(long latencyMillis) {}
}
