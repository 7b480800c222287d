package io.predterm.infrastructure.stream;

import io.predterm.config.SyncConfig;
import io.predterm.domain.market.Platform;
import io.predterm.domain.stream.ConnectionState;
import io.predterm.domain.stream.ServerMessage;
import io.predterm.domain.stream.Subscription;
import io.predterm.infrastructure.metrics.SyncMetrics;
import io.predterm.infrastructure.stream.codec.MessageCodec;
import io.predterm.infrastructure.stream.common.ManualEventLoop;
import io.predterm.infrastructure.stream.transport.FakeTransport;
import io.predterm.infrastructure.stream.transport.FakeTransport.FakeSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionManagerTest {

    private static final Subscription PRICE = Subscription.price(Platform.KALSHI, "KXBTC-25");
    private static final Subscription TRADES = Subscription.trades(Platform.POLYMARKET, "0xabc");
    private static final Subscription NEWS = Subscription.globalNews();

    private final MessageCodec codec = new MessageCodec();
    private ManualEventLoop loop;
    private FakeTransport transport;
    private ConnectionManager manager;
    private List<StreamError> errors;
    private List<ConnectionState> states;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        transport = new FakeTransport();
        manager = newManager(SyncConfig.defaults());
    }

    private ConnectionManager newManager(SyncConfig config) {
        ConnectionManager m = new ConnectionManager(config, transport, loop, SyncMetrics.noop());
        errors = new ArrayList<>();
        states = new ArrayList<>();
        m.addListener(new ConnectionListener() {
            @Override
            public void onStateChange(ConnectionState state) {
                states.add(state);
            }

            @Override
            public void onError(StreamError error) {
                errors.add(error);
            }
        });
        return m;
    }

    private FakeSession connectAndOpen() {
        manager.start();
        loop.runPending();
        FakeSession session = transport.last().open();
        loop.runPending();
        return session;
    }

    @Test
    void testConnectOpensAndReportsConnected() {
        connectAndOpen();

        assertEquals(ConnectionState.CONNECTED, manager.state());
        assertEquals(List.of(ConnectionState.CONNECTING, ConnectionState.CONNECTED), states);
        assertEquals("ws://localhost:3001/ws", transport.last().uri().toString());
        assertTrue(manager.lastError().isEmpty());
    }

    @Test
    void testBackoffDoublesUntilExhausted() {
        manager.start();
        loop.runPending();
        transport.last().failHandshake(new ConnectException("Connection refused"));
        loop.runPending();

        assertEquals(ConnectionState.RECONNECTING, manager.state());

        long[] delays = {1000, 2000, 4000, 8000, 16000};
        for (int i = 0; i < delays.length; i++) {
            loop.advance(Duration.ofMillis(delays[i] - 1));
            assertEquals(i + 1, transport.connectCount(), "No attempt before " + delays[i] + "ms");

            loop.advance(Duration.ofMillis(1));
            assertEquals(i + 2, transport.connectCount(), "Attempt " + (i + 1) + " after " + delays[i] + "ms");

            transport.last().failHandshake(new ConnectException("Connection refused"));
            loop.runPending();
        }

        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        StreamError last = manager.lastError().orElseThrow();
        assertEquals(StreamError.Kind.RECONNECT_EXHAUSTED, last.kind());
        assertEquals("Max reconnection attempts reached", last.message());
        assertTrue(last.fatal());

        loop.advance(Duration.ofMinutes(10));
        assertEquals(6, transport.connectCount(), "No attempts after exhaustion");
    }

    @Test
    void testMinuteScaleBackoffKeepsDoubling() {
        manager = newManager(SyncConfig.defaults().withReconnect(true, 5, 300_000));
        manager.start();
        loop.runPending();
        transport.last().failHandshake(new ConnectException("Connection refused"));
        loop.runPending();

        long[] delays = {300_000, 600_000, 1_200_000, 2_400_000, 4_800_000};
        for (int i = 0; i < delays.length; i++) {
            loop.advance(Duration.ofMillis(delays[i] - 1));
            assertEquals(i + 1, transport.connectCount(), "No attempt before " + delays[i] + "ms");

            loop.advance(Duration.ofMillis(1));
            assertEquals(i + 2, transport.connectCount(), "Attempt " + (i + 1) + " after " + delays[i] + "ms");

            transport.last().failHandshake(new ConnectException("Connection refused"));
            loop.runPending();
        }

        assertEquals(StreamError.Kind.RECONNECT_EXHAUSTED, manager.lastError().orElseThrow().kind());
    }

    @Test
    void testBaseDelayLongerThanHalfHourIsAccepted() {
        manager = newManager(SyncConfig.defaults().withReconnect(true, 2, 3_600_000));
        manager.start();
        loop.runPending();
        transport.last().failHandshake(new ConnectException("Connection refused"));
        loop.runPending();

        assertEquals(ConnectionState.RECONNECTING, manager.state());
        loop.advance(Duration.ofMinutes(59));
        assertEquals(1, transport.connectCount());
        loop.advance(Duration.ofMinutes(1));
        assertEquals(2, transport.connectCount(), "Reconnect after one hour");
    }

    @Test
    void testRetryAfterExhaustion() {
        manager = newManager(SyncConfig.defaults().withReconnect(true, 1, 1000));
        manager.start();
        loop.runPending();
        transport.last().failHandshake(new ConnectException("refused"));
        loop.runPending();
        loop.advance(Duration.ofSeconds(1));
        transport.last().failHandshake(new ConnectException("refused"));
        loop.runPending();
        assertTrue(manager.lastError().orElseThrow().fatal());

        manager.retry();
        loop.runPending();
        assertEquals(3, transport.connectCount());
        transport.last().open();
        loop.runPending();

        assertEquals(ConnectionState.CONNECTED, manager.state());
        assertTrue(manager.lastError().isEmpty(), "Error cleared on successful open");
    }

    @Test
    void testHandshakeFailureReportsConnectFailed() {
        manager.start();
        loop.runPending();
        transport.last().failHandshake(new ConnectException("Connection refused"));
        loop.runPending();

        assertEquals(1, errors.size());
        assertEquals(StreamError.Kind.CONNECT_FAILED, errors.get(0).kind());
        assertFalse(errors.get(0).fatal());
    }

    @Test
    void testCleanDisconnectDoesNotReconnect() {
        FakeSession session = connectAndOpen();

        manager.disconnect();
        loop.runPending();

        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        assertEquals(1000, session.clientCloseCode());
        assertEquals(0, loop.pendingTimers(), "Heartbeat and reconnect timers cancelled");

        loop.advance(Duration.ofMinutes(5));
        assertEquals(1, transport.connectCount());
    }

    @Test
    void testServerNormalCloseDoesNotReconnect() {
        FakeSession session = connectAndOpen();

        session.serverClose(1000, "bye");
        loop.runPending();
        loop.advance(Duration.ofMinutes(1));

        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        assertEquals(1, transport.connectCount());
        assertTrue(errors.isEmpty());
    }

    @Test
    void testAbnormalCloseReconnectsAfterBaseDelay() {
        FakeSession session = connectAndOpen();

        session.fail(new IOException("Connection reset"));
        loop.runPending();

        assertEquals(ConnectionState.RECONNECTING, manager.state());
        assertEquals(StreamError.Kind.TRANSPORT, errors.get(0).kind());
        assertEquals("WebSocket error occurred", errors.get(0).message());

        loop.advance(Duration.ofMillis(1000));
        assertEquals(2, transport.connectCount());
        transport.last().open();
        loop.runPending();
        assertEquals(ConnectionState.CONNECTED, manager.state());
    }

    @Test
    void testAutoReconnectDisabled() {
        manager = newManager(SyncConfig.defaults().withReconnect(false, 5, 1000));
        FakeSession session = connectAndOpen();

        session.serverClose(1006, "gone");
        loop.runPending();
        loop.advance(Duration.ofMinutes(1));

        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        assertEquals(1, transport.connectCount());
    }

    @Test
    void testReplayAfterReconnectMatchesRegistry() {
        manager.subscribe(PRICE);
        manager.acquire(TRADES);
        manager.subscribe(NEWS);
        FakeSession first = connectAndOpen();

        assertEquals(List.of(
            codec.encodeSubscribe(PRICE),
            codec.encodeSubscribe(TRADES),
            codec.encodeSubscribe(NEWS)), first.sent());

        manager.unsubscribe(NEWS);
        loop.runPending();
        assertEquals(codec.encodeUnsubscribe(NEWS), first.sent().get(3));

        first.fail(new IOException("reset"));
        loop.runPending();
        loop.advance(Duration.ofSeconds(1));
        FakeSession second = transport.last().open();
        loop.runPending();

        assertEquals(List.of(codec.encodeSubscribe(PRICE), codec.encodeSubscribe(TRADES)), second.sent());
        assertEquals(List.of(PRICE, TRADES), manager.subscriptions());
    }

    @Test
    void testTwoLeasesShareOneWireSubscription() {
        FakeSession session = connectAndOpen();

        SubscriptionLease a = manager.acquire(TRADES);
        SubscriptionLease b = manager.acquire(TRADES);
        loop.runPending();
        assertEquals(List.of(codec.encodeSubscribe(TRADES)), session.sent());

        a.release();
        loop.runPending();
        assertEquals(1, session.sent().size(), "Still leased by b");

        b.release();
        b.release();
        loop.runPending();
        assertEquals(List.of(codec.encodeSubscribe(TRADES), codec.encodeUnsubscribe(TRADES)), session.sent());
        assertTrue(manager.subscriptions().isEmpty());
    }

    @Test
    void testLatencyFromPong() {
        List<Long> latencies = new ArrayList<>();
        manager.addListener(new ConnectionListener() {
            @Override
            public void onLatency(long latencyMillis) {
                latencies.add(latencyMillis);
            }
        });
        FakeSession session = connectAndOpen();
        assertEquals(-1, manager.latencyMillis());

        loop.advance(Duration.ofSeconds(30));
        long pingTs = loop.currentTimeMillis();
        assertEquals(codec.encodePing(pingTs), session.sent().get(session.sent().size() - 1));

        loop.advance(Duration.ofMillis(42));
        session.receive("{\"type\":\"pong\",\"client_timestamp\":" + pingTs + ",\"server_timestamp\":" + (pingTs + 20) + "}");
        loop.runPending();

        assertEquals(42, manager.latencyMillis());
        assertEquals(List.of(42L), latencies);
        assertEquals(42, manager.status().latencyMs());
    }

    @Test
    void testFramesFromSupersededSessionAreIgnored() {
        List<ServerMessage> received = new ArrayList<>();
        manager.onMessage(received::add);
        FakeSession first = connectAndOpen();

        first.fail(new IOException("reset"));
        loop.runPending();
        loop.advance(Duration.ofSeconds(1));
        transport.last().open();
        loop.runPending();

        first.receive("{\"type\":\"price_update\",\"platform\":\"kalshi\",\"market_id\":\"KXBTC-25\","
            + "\"yes_price\":\"0.52\",\"no_price\":\"0.48\",\"timestamp\":\"2026-01-01T00:00:00Z\"}");
        loop.runPending();
        assertTrue(received.isEmpty());

        transport.last().receive("{\"type\":\"price_update\",\"platform\":\"kalshi\",\"market_id\":\"KXBTC-25\","
            + "\"yes_price\":\"0.53\",\"no_price\":\"0.47\",\"timestamp\":\"2026-01-01T00:00:01Z\"}");
        loop.runPending();
        assertEquals(1, received.size());
    }

    @Test
    void testStatusListsSubscriptionKeys() {
        manager.subscribe(PRICE);
        FakeSession session = connectAndOpen();

        session.receive("{\"type\":\"subscribed\",\"subscription\":{\"type\":\"price\",\"platform\":\"kalshi\",\"market_id\":\"KXBTC-25\"}}");
        loop.runPending();

        assertEquals(List.of("price:kalshi:KXBTC-25"), manager.status().subscriptions());
    }

    @Test
    void testCloseStopsLoop() {
        FakeSession session = connectAndOpen();

        manager.close();

        assertTrue(loop.isClosed());
        assertEquals(1000, session.clientCloseCode());
        assertEquals(ConnectionState.DISCONNECTED, manager.state());
    }
}
