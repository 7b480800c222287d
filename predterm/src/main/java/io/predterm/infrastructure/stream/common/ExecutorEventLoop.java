package io.predterm.infrastructure.stream.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link EventLoop} backed by a single daemon thread.
 */
public final class ExecutorEventLoop implements EventLoop {
    private static final Logger log = LoggerFactory.getLogger(ExecutorEventLoop.class);

    private final String name;
    private final ScheduledThreadPoolExecutor scheduler;

    public ExecutorEventLoop(String name) {
        this.name = name;
        this.scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
        // Pending reconnect or timeout timers must not hold up shutdown.
        this.scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.scheduler.setRemoveOnCancelPolicy(true);
    }

    @Override
    public void execute(Runnable task) {
        try {
            scheduler.execute(guard(task));
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Loop closed, dropping task", name);
        }
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        try {
            ScheduledFuture<?> f = scheduler.schedule(guard(task), delay.toMillis(), TimeUnit.MILLISECONDS);
            return () -> f.cancel(false);
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Loop closed, dropping timer", name);
            return () -> {};
        }
    }

    @Override
    public Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        try {
            ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(guard(task),
                initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
            return () -> f.cancel(false);
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Loop closed, dropping periodic timer", name);
            return () -> {};
        }
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // A throwing periodic task would otherwise be silently descheduled.
    private Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("[{}] Task failed", name, e);
            }
        };
    }
}
