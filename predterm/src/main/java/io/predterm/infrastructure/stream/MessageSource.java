package io.predterm.infrastructure.stream;

/**
 * Anything consumers can register message handlers with.
 */
public interface MessageSource {

    Registration onMessage(MessageHandler handler);
}
