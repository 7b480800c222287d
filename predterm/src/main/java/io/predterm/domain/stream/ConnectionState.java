package io.predterm.domain.stream;

/**
 * Lifecycle state of the shared stream connection.
 */
public enum ConnectionState {
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    RECONNECTING;

    public boolean isConnected() {
        return this == CONNECTED;
    }
}
