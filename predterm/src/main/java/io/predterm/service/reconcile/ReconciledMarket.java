package io.predterm.service.reconcile;

import io.predterm.infrastructure.stream.Registration;
import io.predterm.service.reducer.MarketStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Keeps a {@link ReconciledMarketView} current for one market by rebuilding it
 * whenever the stream or the poller changes.
 */
public final class ReconciledMarket implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReconciledMarket.class);

    private final MarketStream stream;
    private final SnapshotPoller poller;
    private final int maxTrades;
    private final List<Consumer<ReconciledMarketView>> listeners = new CopyOnWriteArrayList<>();
    private final Registration streamRegistration;
    private final Registration pollerRegistration;
    private volatile ReconciledMarketView view;

    public ReconciledMarket(MarketStream stream, SnapshotPoller poller, int maxTrades) {
        this.stream = stream;
        this.poller = poller;
        this.maxTrades = maxTrades;
        this.view = build();
        this.streamRegistration = stream.addChangeListener(this::recompute);
        this.pollerRegistration = poller.addListener(s -> recompute());
    }

    public ReconciledMarketView view() {
        return view;
    }

    public MarketStream stream() {
        return stream;
    }

    public SnapshotPoller poller() {
        return poller;
    }

    public Registration addListener(Consumer<ReconciledMarketView> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Stop listening; the stream and poller stay open.
     */
    @Override
    public void close() {
        streamRegistration.remove();
        pollerRegistration.remove();
    }

    private synchronized void recompute() {
        ReconciledMarketView next = build();
        view = next;
        for (Consumer<ReconciledMarketView> listener : listeners) {
            try {
                listener.accept(next);
            } catch (Exception e) {
                log.warn("[RECONCILE] Listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private ReconciledMarketView build() {
        return SnapshotReconciler.reconcile(
            stream.platform(),
            stream.marketId(),
            stream.prices(),
            stream.orderBook(),
            stream.trades(),
            poller.latest(),
            maxTrades);
    }
}
