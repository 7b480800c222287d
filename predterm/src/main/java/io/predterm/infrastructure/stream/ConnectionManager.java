package io.predterm.infrastructure.stream;

import io.predterm.config.SyncConfig;
import io.predterm.domain.stream.ConnectionState;
import io.predterm.domain.stream.ServerMessage;
import io.predterm.domain.stream.Subscription;
import io.predterm.infrastructure.metrics.SyncMetrics;
import io.predterm.infrastructure.stream.codec.MessageCodec;
import io.predterm.infrastructure.stream.common.EventLoop;
import io.predterm.infrastructure.stream.common.HeartbeatManager;
import io.predterm.infrastructure.stream.common.ReconnectionPolicy;
import io.predterm.infrastructure.stream.transport.Transport;
import io.predterm.infrastructure.stream.transport.TransportListener;
import io.predterm.infrastructure.stream.transport.TransportSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The single shared connection to the market stream.
 *
 * States: CONNECTING -> CONNECTED -> DISCONNECTED on a clean close, or
 * DISCONNECTED -> RECONNECTING -> CONNECTING on an abnormal one. Reconnect
 * attempt {@code n} waits {@code base * 2^n}; after the configured number of
 * attempts without an open the connection stays DISCONNECTED and reports
 * "Max reconnection attempts reached" until {@link #retry()} is called.
 *
 * On every open the subscription registry is replayed and the heartbeat
 * started. All state lives on the event loop; the public methods may be
 * called from any thread and take effect asynchronously.
 */
public class ConnectionManager implements MessageSource, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final SyncConfig config;
    private final URI uri;
    private final Transport transport;
    private final EventLoop loop;
    private final SyncMetrics metrics;
    private final MessageCodec codec;
    private final MessageBus bus;
    private final SubscriptionRegistry registry;
    private final ReconnectionPolicy policy;
    private final HeartbeatManager heartbeat;
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    // Loop-confined
    private TransportSession session;
    private int epoch = 0;
    private boolean connectInFlight = false;
    private boolean manualDisconnect = false;
    private EventLoop.Cancellable reconnectTimer;

    // Published for readers on other threads
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile StreamError lastError;
    private volatile long latencyMillis = -1;

    public ConnectionManager(SyncConfig config, Transport transport, EventLoop loop, SyncMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.uri = URI.create(config.wsUrl());
        this.transport = Objects.requireNonNull(transport, "transport");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.metrics = metrics != null ? metrics : SyncMetrics.noop();
        this.codec = new MessageCodec();
        this.bus = new MessageBus(codec, this.metrics);
        this.registry = new SubscriptionRegistry(codec, new SessionSender(), this.metrics);
        this.policy = ReconnectionPolicy.builder()
            .baseDelay(config.reconnectBaseDelay())
            .multiplier(2.0)
            .maxAttempts(config.maxReconnectAttempts())
            .build();
        this.heartbeat = new HeartbeatManager(
            "stream",
            loop,
            config.pingInterval(),
            config.pingInterval().multipliedBy(2),
            ts -> sendFrame(codec.encodePing(ts)),
            this::onLatency,
            this::onHeartbeatHealth
        );

        // Control messages are handled ahead of any consumer.
        bus.onMessage(this::handleControlMessage);
        this.metrics.recordConnectionState(state);
    }

    /**
     * Connect now if the configuration asks for it.
     */
    public void start() {
        if (config.autoConnect()) {
            connect();
        }
    }

    /**
     * Open the connection. No-op while open or while an attempt is in flight.
     */
    public void connect() {
        loop.execute(() -> {
            manualDisconnect = false;
            doConnect();
        });
    }

    /**
     * Clean close (1000). Cancels heartbeat and pending reconnects; no reconnect follows.
     */
    public void disconnect() {
        loop.execute(this::doDisconnect);
    }

    /**
     * Recover after reconnects were exhausted: reset the attempt counter and connect.
     */
    public void retry() {
        loop.execute(() -> {
            log.info("[SYNC] Manual retry");
            policy.reset();
            lastError = null;
            manualDisconnect = false;
            doConnect();
        });
    }

    public void subscribe(Subscription subscription) {
        loop.execute(() -> registry.subscribe(subscription));
    }

    public void unsubscribe(Subscription subscription) {
        loop.execute(() -> registry.unsubscribe(subscription));
    }

    /**
     * Take a counted lease on a channel. The returned lease may be released from any thread.
     */
    public SubscriptionLease acquire(Subscription subscription) {
        Objects.requireNonNull(subscription, "subscription");
        AtomicReference<SubscriptionLease> inner = new AtomicReference<>();
        loop.execute(() -> inner.set(registry.acquire(subscription)));
        // Loop is FIFO: the acquire above always runs before this release.
        return new SubscriptionLease(subscription, () -> loop.execute(() -> {
            SubscriptionLease lease = inner.get();
            if (lease != null) {
                lease.release();
            }
        }));
    }

    @Override
    public Registration onMessage(MessageHandler handler) {
        return bus.onMessage(handler);
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    public ConnectionState state() {
        return state;
    }

    public Optional<StreamError> lastError() {
        return Optional.ofNullable(lastError);
    }

    /**
     * @return last heartbeat round trip, or -1 before the first pong
     */
    public long latencyMillis() {
        return latencyMillis;
    }

    public List<Subscription> subscriptions() {
        return registry.subscriptions();
    }

    public StreamStatus status() {
        StreamError error = lastError;
        return new StreamStatus(
            state,
            latencyMillis,
            error == null ? null : error.message(),
            policy.getAttemptCount(),
            registry.subscriptions().stream().map(Subscription::key).toList()
        );
    }

    public EventLoop eventLoop() {
        return loop;
    }

    public SyncConfig config() {
        return config;
    }

    /**
     * Disconnect and stop the event loop.
     */
    @Override
    public void close() {
        loop.execute(this::doDisconnect);
        loop.close();
    }

    // ---- loop-side ----

    private void doConnect() {
        if (connectInFlight || (session != null && session.isOpen())) {
            log.debug("[SYNC] connect() ignored, state={}", state);
            return;
        }
        cancelReconnectTimer();
        connectInFlight = true;
        int attemptEpoch = ++epoch;
        setState(ConnectionState.CONNECTING);
        log.info("[SYNC] Connecting to {}", uri);

        transport.connect(uri, new SessionListener(attemptEpoch)).whenComplete((s, e) -> {
            if (e != null) {
                loop.execute(() -> onHandshakeFailed(attemptEpoch, e));
            }
        });
    }

    private void doDisconnect() {
        manualDisconnect = true;
        cancelReconnectTimer();
        heartbeat.stop();
        epoch++;
        connectInFlight = false;
        TransportSession current = session;
        session = null;
        if (current != null) {
            current.close(TransportListener.NORMAL_CLOSURE, "Client disconnect");
        }
        registry.onDisconnect();
        if (state != ConnectionState.DISCONNECTED) {
            log.info("[SYNC] Disconnected by client");
        }
        setState(ConnectionState.DISCONNECTED);
    }

    private void onOpen(int attemptEpoch, TransportSession opened) {
        if (attemptEpoch != epoch) {
            log.debug("[SYNC] Closing superseded session");
            opened.close(TransportListener.NORMAL_CLOSURE, "Superseded");
            return;
        }
        session = opened;
        connectInFlight = false;
        policy.recordSuccess();
        lastError = null;
        log.info("[SYNC] Connected");
        setState(ConnectionState.CONNECTED);
        heartbeat.start();
        registry.replay();
    }

    private void onHandshakeFailed(int attemptEpoch, Throwable error) {
        if (attemptEpoch != epoch || session != null) {
            return;
        }
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        log.warn("[SYNC] Handshake failed: {}", cause.toString());
        publishError(StreamError.connectFailed(String.valueOf(cause.getMessage())));
        onClose(attemptEpoch, TransportListener.ABNORMAL_CLOSURE, "Handshake failed");
    }

    private void onClose(int attemptEpoch, int code, String reason) {
        if (attemptEpoch != epoch) {
            return;
        }
        epoch++;
        session = null;
        connectInFlight = false;
        heartbeat.stop();
        registry.onDisconnect();
        setState(ConnectionState.DISCONNECTED);

        if (manualDisconnect || code == TransportListener.NORMAL_CLOSURE) {
            log.info("[SYNC] Connection closed cleanly ({} {})", code, reason);
            return;
        }
        log.warn("[SYNC] Connection lost: {} {}", code, reason);
        if (!config.autoReconnect()) {
            return;
        }
        if (policy.isExhausted()) {
            log.error("[SYNC] Giving up after {} reconnect attempts", policy.getAttemptCount());
            metrics.recordReconnectExhausted();
            publishError(StreamError.reconnectExhausted());
            return;
        }

        var delay = policy.nextDelay();
        log.info("[SYNC] Reconnecting in {}ms (attempt {}/{})",
            delay.toMillis(), policy.getAttemptCount() + 1, policy.getMaxAttempts());
        setState(ConnectionState.RECONNECTING);
        reconnectTimer = loop.schedule(() -> {
            reconnectTimer = null;
            policy.recordAttempt();
            metrics.recordReconnectAttempt(policy.getAttemptCount());
            doConnect();
        }, delay);
    }

    private void onTransportError(int attemptEpoch, Throwable error) {
        if (attemptEpoch != epoch) {
            return;
        }
        log.warn("[SYNC] Transport error: {}", error.toString());
        publishError(StreamError.transport());
    }

    private void handleControlMessage(ServerMessage message) {
        switch (message.type()) {
            case PONG -> heartbeat.recordPong(((ServerMessage.Pong) message).clientTimestamp());
            case SUBSCRIBED -> registry.onSubscribed(((ServerMessage.Subscribed) message).subscription());
            case UNSUBSCRIBED -> registry.onUnsubscribed(((ServerMessage.Unsubscribed) message).subscription());
            case ERROR -> {
                ServerMessage.ErrorMessage error = (ServerMessage.ErrorMessage) message;
                metrics.recordServerError(error.code());
                log.warn("[SYNC] Server error {}: {}", error.code().wireName(), error.message());
            }
            case CONNECTION_STATUS -> {
                ServerMessage.ConnectionStatus status = (ServerMessage.ConnectionStatus) message;
                log.info("[SYNC] Upstream {} feed is {}", status.platform(), status.status().wireName());
            }
            default -> {
                // market data is for consumers
            }
        }
    }

    private boolean sendFrame(String frame) {
        TransportSession current = session;
        if (current == null || !current.isOpen()) {
            log.debug("[SYNC] Not connected, dropping outbound frame");
            return false;
        }
        return current.send(frame);
    }

    private void cancelReconnectTimer() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
    }

    private void onLatency(long millis) {
        latencyMillis = millis;
        metrics.recordLatency(millis);
        for (ConnectionListener listener : listeners) {
            try {
                listener.onLatency(millis);
            } catch (Exception e) {
                log.warn("[SYNC] Listener error on latency: {}", e.getMessage(), e);
            }
        }
    }

    private void onHeartbeatHealth(boolean healthy) {
        metrics.recordHeartbeatHealth(healthy);
        if (!healthy) {
            log.warn("[SYNC] Heartbeat unanswered, connection may be stale");
        }
    }

    private void setState(ConnectionState next) {
        if (state == next) {
            return;
        }
        state = next;
        metrics.recordConnectionState(next);
        for (ConnectionListener listener : listeners) {
            try {
                listener.onStateChange(next);
            } catch (Exception e) {
                log.warn("[SYNC] Listener error on state change: {}", e.getMessage(), e);
            }
        }
    }

    private void publishError(StreamError error) {
        lastError = error;
        for (ConnectionListener listener : listeners) {
            try {
                listener.onError(error);
            } catch (Exception e) {
                log.warn("[SYNC] Listener error on error: {}", e.getMessage(), e);
            }
        }
    }

    private final class SessionSender implements FrameSender {
        @Override
        public boolean isConnected() {
            return session != null && session.isOpen();
        }

        @Override
        public boolean send(String frame) {
            return sendFrame(frame);
        }
    }

    // Events from a superseded session are ignored by epoch.
    private final class SessionListener implements TransportListener {
        private final int attemptEpoch;

        private SessionListener(int attemptEpoch) {
            this.attemptEpoch = attemptEpoch;
        }

        @Override
        public void onOpen(TransportSession opened) {
            loop.execute(() -> ConnectionManager.this.onOpen(attemptEpoch, opened));
        }

        @Override
        public void onText(String frame) {
            loop.execute(() -> {
                if (attemptEpoch == epoch) {
                    bus.dispatchFrame(frame);
                }
            });
        }

        @Override
        public void onClose(int code, String reason) {
            loop.execute(() -> ConnectionManager.this.onClose(attemptEpoch, code, reason));
        }

        @Override
        public void onError(Throwable error) {
            loop.execute(() -> onTransportError(attemptEpoch, error));
        }
    }
}
