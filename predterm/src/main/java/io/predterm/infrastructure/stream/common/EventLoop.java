package io.predterm.infrastructure.stream.common;

import java.time.Duration;

/**
 * Single-threaded task queue with timers.
 *
 * All connection state, subscription bookkeeping and message dispatch run as
 * tasks on one loop, so none of it needs locking.
 */
public interface EventLoop extends AutoCloseable {

    /**
     * Queue a task. Tasks run in submission order.
     */
    void execute(Runnable task);

    Cancellable schedule(Runnable task, Duration delay);

    Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    /**
     * Wall-clock millis as seen by this loop.
     */
    long currentTimeMillis();

    /**
     * Stop running tasks. Pending timers are dropped.
     */
    @Override
    void close();

    /**
     * Handle for a scheduled task.
     */
    interface Cancellable {
        void cancel();
    }
}
