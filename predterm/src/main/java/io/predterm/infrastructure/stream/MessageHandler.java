package io.predterm.infrastructure.stream;

import io.predterm.domain.stream.ServerMessage;

/**
 * Receives every decoded inbound message. Called on the dispatch thread.
 */
@FunctionalInterface
public interface MessageHandler {
    void onMessage(ServerMessage message);
}
