package io.predterm.service.reconcile;

import io.predterm.domain.market.OrderBook;
import io.predterm.domain.market.Platform;
import io.predterm.domain.market.TradeHistory;
import io.predterm.infrastructure.api.MarketApiClient;
import io.predterm.infrastructure.metrics.SyncMetrics;
import io.predterm.infrastructure.stream.Registration;
import io.predterm.infrastructure.stream.common.EventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Periodically pulls the order book and recent trades of one market.
 *
 * Each poll is numbered; results are delivered on the event loop and a
 * response older than one already accepted (or issued before a
 * {@link #refresh()}) is dropped. Failures go to the failure callback only
 * and leave the last accepted snapshot in place.
 */
public final class SnapshotPoller implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SnapshotPoller.class);

    private final MarketApiClient api;
    private final EventLoop loop;
    private final Platform platform;
    private final String marketId;
    private final Duration interval;
    private final int tradeLimit;
    private final SyncMetrics metrics;
    private final RequestGeneration generation = new RequestGeneration();
    private final List<Consumer<PulledSnapshot>> listeners = new CopyOnWriteArrayList<>();
    private final Consumer<Throwable> onFailure;

    private volatile PulledSnapshot latest;
    private volatile boolean closed = false;
    private EventLoop.Cancellable timer;

    public SnapshotPoller(MarketApiClient api, EventLoop loop, Platform platform, String marketId,
                          Duration interval, int tradeLimit, SyncMetrics metrics,
                          Consumer<Throwable> onFailure) {
        this.api = api;
        this.loop = loop;
        this.platform = platform;
        this.marketId = marketId;
        this.interval = interval;
        this.tradeLimit = tradeLimit;
        this.metrics = metrics != null ? metrics : SyncMetrics.noop();
        this.onFailure = onFailure;
    }

    /**
     * Poll now and then every interval.
     */
    public synchronized void start() {
        if (timer != null || closed) {
            return;
        }
        log.info("[POLLER] {}:{} every {}ms", platform, marketId, interval.toMillis());
        timer = loop.scheduleAtFixedRate(() -> poll(generation.next()), Duration.ZERO, interval);
    }

    /**
     * Poll immediately; responses to earlier polls still in flight will be dropped.
     */
    public void refresh() {
        poll(generation.supersede());
    }

    /**
     * @return last accepted snapshot, or null before the first one
     */
    public PulledSnapshot latest() {
        return latest;
    }

    public Registration addListener(Consumer<PulledSnapshot> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
    }

    private void poll(long gen) {
        if (closed) {
            return;
        }
        log.debug("[POLLER] {}:{} request #{}", platform, marketId, gen);
        CompletableFuture<OrderBook> book = api.getOrderBook(platform, marketId, null);
        CompletableFuture<TradeHistory> trades = api.getTrades(platform, marketId, tradeLimit, null);
        book.thenCombine(trades, (b, t) -> new PulledSnapshot(b, t.trades(), gen, Instant.ofEpochMilli(loop.currentTimeMillis())))
            .whenComplete((snapshot, error) -> loop.execute(() -> complete(gen, snapshot, error)));
    }

    private void complete(long gen, PulledSnapshot snapshot, Throwable error) {
        if (closed) {
            return;
        }
        if (!generation.tryAccept(gen)) {
            metrics.recordStaleSnapshotDiscarded();
            log.debug("[POLLER] {}:{} dropping stale response #{} (accepted #{})",
                platform, marketId, gen, generation.latestAccepted());
            return;
        }
        if (error != null) {
            Throwable cause = unwrap(error);
            log.warn("[POLLER] {}:{} snapshot #{} failed: {}", platform, marketId, gen, cause.getMessage());
            if (onFailure != null) {
                try {
                    onFailure.accept(cause);
                } catch (Exception e) {
                    log.warn("[POLLER] Failure callback threw: {}", e.getMessage(), e);
                }
            }
            return;
        }
        latest = snapshot;
        for (Consumer<PulledSnapshot> listener : listeners) {
            try {
                listener.accept(snapshot);
            } catch (Exception e) {
                log.warn("[POLLER] Listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
