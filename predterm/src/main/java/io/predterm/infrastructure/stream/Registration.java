package io.predterm.infrastructure.stream;

/**
 * Handle returned by a registration call. Removing is idempotent.
 */
@FunctionalInterface
public interface Registration extends AutoCloseable {

    void remove();

    @Override
    default void close() {
        remove();
    }
}
