package io.predterm.infrastructure.stream;

/**
 * Outbound side of the live session, as seen by the subscription registry.
 */
public interface FrameSender {

    boolean isConnected();

    /**
     * @return false if nothing was sent because the session is not open
     */
    boolean send(String frame);
}
