package io.predterm.infrastructure.stream.transport;

/**
 * One open connection.
 */
public interface TransportSession {

    /**
     * Queue a text frame.
     *
     * @return false if the session is no longer open
     */
    boolean send(String text);

    /**
     * Start the closing handshake. The listener's {@code onClose} follows.
     */
    void close(int code, String reason);

    boolean isOpen();
}
