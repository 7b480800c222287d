package io.predterm.infrastructure.stream.transport;

/**
 * Raw session events, called on transport threads.
 */
public interface TransportListener {

    int NORMAL_CLOSURE = 1000;
    int ABNORMAL_CLOSURE = 1006;

    /**
     * Handshake complete; the session may be used from now on.
     */
    void onOpen(TransportSession session);

    /**
     * A complete text message.
     */
    void onText(String frame);

    void onClose(int code, String reason);

    /**
     * A transport failure. Always followed by {@link #onClose}.
     */
    void onError(Throwable error);
}
