package io.predterm.infrastructure.stream.codec;

/**
 * Inbound frame that is not valid JSON, lacks a known {@code type}, or misses a required field.
 */
public class MalformedFrameException extends RuntimeException {

    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
