package io.predterm.infrastructure.stream;

import io.predterm.domain.stream.Subscription;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One consumer's interest in a channel. Releasing twice is a no-op.
 */
public final class SubscriptionLease implements AutoCloseable {

    private final Subscription subscription;
    private final Runnable onRelease;
    private final AtomicBoolean released = new AtomicBoolean(false);

    SubscriptionLease(Subscription subscription, Runnable onRelease) {
        this.subscription = subscription;
        this.onRelease = onRelease;
    }

    public Subscription subscription() {
        return subscription;
    }

    public boolean isReleased() {
        return released.get();
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            onRelease.run();
        }
    }

    @Override
    public void close() {
        release();
    }
}
