package io.predterm.infrastructure.stream;

import io.predterm.domain.market.Platform;
import io.predterm.domain.stream.MessageType;
import io.predterm.domain.stream.ServerMessage;
import io.predterm.infrastructure.metrics.SyncMetrics;
import io.predterm.infrastructure.stream.codec.MessageCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MessageBusTest {

    @Mock
    private SyncMetrics metrics;

    private MessageBus bus;

    @BeforeEach
    void setUp() {
        bus = new MessageBus(new MessageCodec(), metrics);
    }

    private static ServerMessage price(String yes) {
        return new ServerMessage.PriceUpdate(Platform.KALSHI, "KXBTC-25",
            new BigDecimal(yes), BigDecimal.ONE.subtract(new BigDecimal(yes)), Instant.parse("2026-01-01T00:00:00Z"));
    }

    @Test
    void testThrowingHandlerDoesNotStarveOthers() {
        int[] received = new int[10];
        for (int i = 0; i < 10; i++) {
            int idx = i;
            bus.onMessage(msg -> {
                if (idx == 4) {
                    throw new IllegalStateException("handler #5 broke");
                }
                received[idx]++;
            });
        }

        for (int n = 0; n < 6; n++) {
            bus.dispatch(price("0.5" + n));
        }

        for (int i = 0; i < 10; i++) {
            assertEquals(i == 4 ? 0 : 6, received[i], "Handler #" + (i + 1));
        }
        verify(metrics, times(6)).recordHandlerFailure(MessageType.PRICE_UPDATE);
        verify(metrics, times(6)).recordMessage(MessageType.PRICE_UPDATE);
    }

    @Test
    void testHandlersCalledInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        bus.onMessage(msg -> calls.add("a"));
        bus.onMessage(msg -> calls.add("b"));
        bus.onMessage(msg -> calls.add("c"));

        bus.dispatch(price("0.5"));

        assertEquals(List.of("a", "b", "c"), calls);
    }

    @Test
    void testRemovedHandlerStopsReceiving() {
        List<ServerMessage> received = new ArrayList<>();
        Registration registration = bus.onMessage(received::add);

        bus.dispatch(price("0.5"));
        registration.remove();
        registration.remove();
        bus.dispatch(price("0.6"));

        assertEquals(1, received.size());
        assertEquals(0, bus.handlerCount());
    }

    @Test
    void testRegistrationDuringDispatchSeesOnlyLaterMessages() {
        List<ServerMessage> late = new ArrayList<>();
        bus.onMessage(msg -> {
            if (bus.handlerCount() == 1) {
                bus.onMessage(late::add);
            }
        });

        bus.dispatch(price("0.5"));
        assertTrue(late.isEmpty());

        bus.dispatch(price("0.6"));
        assertEquals(1, late.size());
    }

    @Test
    void testMalformedFramesAreDropped() {
        List<ServerMessage> received = new ArrayList<>();
        bus.onMessage(received::add);

        bus.dispatchFrame("not json");
        bus.dispatchFrame("[1,2,3]");
        bus.dispatchFrame("{\"type\":\"weather_update\"}");
        bus.dispatchFrame("{\"type\":\"price_update\",\"platform\":\"kalshi\"}");
        bus.dispatchFrame("{\"type\":\"pong\",\"client_timestamp\":1,\"server_timestamp\":2}");

        assertEquals(1, received.size());
        assertEquals(MessageType.PONG, received.get(0).type());
        verify(metrics, times(4)).recordMalformedFrame();
    }
}
