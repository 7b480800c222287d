package io.predterm.infrastructure.stream.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.LongConsumer;

/**
 * Application-level ping/pong over the stream connection.
 *
 * Every {@code pingInterval} the ping sender is handed the loop's current
 * time, which the server echoes back in its pong. Latency is the single most
 * recent round trip; no averaging. If no pong arrives within {@code timeout}
 * of a ping the health callback is told the link is unhealthy.
 *
 * Runs entirely on the owning {@link EventLoop}; not thread-safe on its own.
 */
public class HeartbeatManager {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatManager.class);

    private final String name;
    private final EventLoop loop;
    private final Duration pingInterval;
    private final Duration timeout;
    private final LongConsumer pingSender;
    private final LongConsumer latencyCallback;
    private final Consumer<Boolean> healthCallback;

    private EventLoop.Cancellable pingTask;
    private EventLoop.Cancellable timeoutTask;
    private long lastPongAt = -1;
    private long lastLatencyMillis = -1;
    private boolean running = false;
    private boolean healthy = true;

    public HeartbeatManager(String name, EventLoop loop, Duration pingInterval, Duration timeout,
                            LongConsumer pingSender, LongConsumer latencyCallback,
                            Consumer<Boolean> healthCallback) {
        if (pingInterval.isNegative() || pingInterval.isZero()) {
            throw new IllegalArgumentException("Ping interval must be positive");
        }
        this.name = name;
        this.loop = loop;
        this.pingInterval = pingInterval;
        this.timeout = timeout;
        this.pingSender = pingSender;
        this.latencyCallback = latencyCallback;
        this.healthCallback = healthCallback;
    }

    /**
     * Start pinging. The first ping goes out one interval after start.
     */
    public void start() {
        if (running) {
            log.debug("[HEARTBEAT:{}] Already running", name);
            return;
        }
        log.debug("[HEARTBEAT:{}] Starting (interval: {}ms, timeout: {}ms)",
            name, pingInterval.toMillis(), timeout.toMillis());
        running = true;
        healthy = true;
        pingTask = loop.scheduleAtFixedRate(this::sendPing, pingInterval, pingInterval);
    }

    public void stop() {
        if (!running) {
            return;
        }
        log.debug("[HEARTBEAT:{}] Stopping", name);
        running = false;
        if (pingTask != null) {
            pingTask.cancel();
            pingTask = null;
        }
        cancelTimeout();
    }

    /**
     * Record a pong echoing the given client timestamp.
     */
    public void recordPong(long clientTimestamp) {
        long now = loop.currentTimeMillis();
        lastPongAt = now;
        lastLatencyMillis = Math.max(0, now - clientTimestamp);
        cancelTimeout();

        if (latencyCallback != null) {
            try {
                latencyCallback.accept(lastLatencyMillis);
            } catch (Exception e) {
                log.error("[HEARTBEAT:{}] Latency callback threw exception", name, e);
            }
        }
        if (!healthy) {
            log.info("[HEARTBEAT:{}] Pong received, link healthy again", name);
            setHealthy(true);
        }
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isHealthy() {
        return healthy;
    }

    /**
     * @return last round trip in millis, or -1 before the first pong
     */
    public long getLastLatencyMillis() {
        return lastLatencyMillis;
    }

    public long getLastPongAt() {
        return lastPongAt;
    }

    private void sendPing() {
        if (!running) {
            return;
        }
        long ts = loop.currentTimeMillis();
        log.trace("[HEARTBEAT:{}] ping {}", name, ts);
        try {
            pingSender.accept(ts);
        } catch (Exception e) {
            log.error("[HEARTBEAT:{}] Ping sender threw exception", name, e);
            setHealthy(false);
            return;
        }
        if (timeoutTask == null) {
            timeoutTask = loop.schedule(this::onTimeout, timeout);
        }
    }

    private void onTimeout() {
        timeoutTask = null;
        if (!running) {
            return;
        }
        log.warn("[HEARTBEAT:{}] No pong for {}ms", name, timeout.toMillis());
        setHealthy(false);
    }

    private void cancelTimeout() {
        if (timeoutTask != null) {
            timeoutTask.cancel();
            timeoutTask = null;
        }
    }

    private void setHealthy(boolean value) {
        if (healthy == value) {
            return;
        }
        healthy = value;
        if (healthCallback != null) {
            try {
                healthCallback.accept(value);
            } catch (Exception e) {
                log.error("[HEARTBEAT:{}] Health callback threw exception", name, e);
            }
        }
    }
}
