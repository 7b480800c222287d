package io.predterm.infrastructure.stream;

/**
 * Error surfaced to connection listeners.
 *
 * @param fatal true when the connection will not recover without a manual retry
 */
public record StreamError(Kind kind, String message, boolean fatal) {

    public enum Kind {
        /** Transport reported an error; the close event that follows decides what happens. */
        TRANSPORT,
        /** Handshake did not complete. */
        CONNECT_FAILED,
        /** Reconnect attempts used up. */
        RECONNECT_EXHAUSTED
    }

    public static StreamError transport() {
        return new StreamError(Kind.TRANSPORT, "WebSocket error occurred", false);
    }

    public static StreamError connectFailed(String detail) {
        return new StreamError(Kind.CONNECT_FAILED, "Connection failed: " + detail, false);
    }

    public static StreamError reconnectExhausted() {
        return new StreamError(Kind.RECONNECT_EXHAUSTED, "Max reconnection attempts reached", true);
    }
}
