package io.predterm.service.reconcile;

import io.predterm.domain.market.OrderBook;
import io.predterm.domain.market.Platform;
import io.predterm.domain.market.TradeHistory;
import io.predterm.infrastructure.api.MarketApiClient;
import io.predterm.infrastructure.api.MarketApiException;
import io.predterm.infrastructure.metrics.SyncMetrics;
import io.predterm.infrastructure.stream.common.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static io.predterm.MarketFixtures.T0;
import static io.predterm.MarketFixtures.book;
import static io.predterm.MarketFixtures.level;
import static io.predterm.MarketFixtures.trade;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SnapshotPollerTest {

    private static final String MARKET = "KXBTC-25";
    private static final Duration INTERVAL = Duration.ofSeconds(5);

    @Mock
    private MarketApiClient api;

    @Mock
    private SyncMetrics metrics;

    private ManualEventLoop loop;
    private final List<CompletableFuture<OrderBook>> books = new ArrayList<>();
    private final List<CompletableFuture<TradeHistory>> trades = new ArrayList<>();
    private final List<Throwable> failures = new ArrayList<>();
    private SnapshotPoller poller;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        when(api.getOrderBook(eq(Platform.KALSHI), eq(MARKET), any())).thenAnswer(inv -> {
            CompletableFuture<OrderBook> future = new CompletableFuture<>();
            books.add(future);
            return future;
        });
        when(api.getTrades(eq(Platform.KALSHI), eq(MARKET), any(), any())).thenAnswer(inv -> {
            CompletableFuture<TradeHistory> future = new CompletableFuture<>();
            trades.add(future);
            return future;
        });
        poller = new SnapshotPoller(api, loop, Platform.KALSHI, MARKET, INTERVAL, 100, metrics, failures::add);
    }

    @Test
    void testFirstPollIsImmediateThenPeriodic() {
        poller.start();
        loop.advance(Duration.ZERO);
        assertEquals(1, books.size(), "Start should poll immediately");

        loop.advance(INTERVAL);
        assertEquals(2, books.size(), "Second poll after one interval");
        verify(api, times(2)).getTrades(eq(Platform.KALSHI), eq(MARKET), eq(100), any());
    }

    @Test
    void testAcceptedSnapshotNotifiesListeners() {
        List<PulledSnapshot> seen = new ArrayList<>();
        poller.addListener(seen::add);
        poller.start();
        loop.advance(Duration.ZERO);

        OrderBook book = pulledBook("0.40");
        respond(0, book);
        loop.runPending();

        assertEquals(1, seen.size());
        PulledSnapshot snapshot = poller.latest();
        assertSame(book, snapshot.orderBook());
        assertEquals(1, snapshot.trades().size());
        assertEquals(1, snapshot.generation());
    }

    @Test
    void testRefreshDropsEarlierResponse() {
        poller.start();
        loop.advance(Duration.ZERO);
        poller.refresh();
        assertEquals(2, books.size());

        respond(0, pulledBook("0.30"));
        loop.runPending();
        assertNull(poller.latest(), "Response issued before refresh must be dropped");

        OrderBook fresh = pulledBook("0.45");
        respond(1, fresh);
        loop.runPending();

        assertSame(fresh, poller.latest().orderBook());
        verify(metrics).recordStaleSnapshotDiscarded();
    }

    @Test
    void testOutOfOrderResponseIsDropped() {
        poller.start();
        loop.advance(Duration.ZERO);
        loop.advance(INTERVAL);
        assertEquals(2, books.size());

        OrderBook newer = pulledBook("0.50");
        respond(1, newer);
        loop.runPending();
        respond(0, pulledBook("0.20"));
        loop.runPending();

        assertSame(newer, poller.latest().orderBook(), "Older response must not overwrite a newer one");
        assertEquals(2, poller.latest().generation());
        verify(metrics).recordStaleSnapshotDiscarded();
    }

    @Test
    void testFailureReportedAndLatestKept() {
        poller.start();
        loop.advance(Duration.ZERO);
        OrderBook first = pulledBook("0.40");
        respond(0, first);
        loop.runPending();

        loop.advance(INTERVAL);
        books.get(1).completeExceptionally(new MarketApiException("Market not found", 404));
        trades.get(1).complete(new TradeHistory(MARKET, Platform.KALSHI, List.of(), null));
        loop.runPending();

        assertEquals(1, failures.size());
        assertTrue(failures.get(0) instanceof MarketApiException);
        assertTrue(((MarketApiException) failures.get(0)).isNotFound());
        assertSame(first, poller.latest().orderBook(), "A failed poll keeps the last good snapshot");
    }

    @Test
    void testCloseStopsPollingAndIgnoresInFlight() {
        poller.start();
        loop.advance(Duration.ZERO);
        poller.close();

        respond(0, pulledBook("0.40"));
        loop.runPending();
        loop.advance(INTERVAL.multipliedBy(3));

        assertNull(poller.latest());
        assertEquals(1, books.size());
        assertEquals(0, loop.pendingTimers());
    }

    private void respond(int index, OrderBook book) {
        books.get(index).complete(book);
        trades.get(index).complete(new TradeHistory(MARKET, Platform.KALSHI,
            List.of(trade("t" + index, "buy", "10", T0)), null));
    }

    private static OrderBook pulledBook(String bid) {
        return book(Platform.KALSHI, MARKET, List.of(level(bid, "10")), List.of(level("0.90", "10")));
    }
}
