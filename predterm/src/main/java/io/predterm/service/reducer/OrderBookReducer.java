package io.predterm.service.reducer;

import io.predterm.domain.market.OrderBook;
import io.predterm.domain.market.Platform;
import io.predterm.domain.stream.OrderBookUpdateType;
import io.predterm.domain.stream.ServerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Four-sided order book of one market.
 *
 * Snapshots replace the whole book. Deltas are applied the same way: the
 * server sends full sides in both cases, so each update is authoritative.
 */
public class OrderBookReducer extends ChannelReducer<OrderBook> {
    private static final Logger log = LoggerFactory.getLogger(OrderBookReducer.class);

    private final Platform platform;
    private final String marketId;
    private volatile int deltasSinceSnapshot = 0;

    public OrderBookReducer(Platform platform, String marketId) {
        super(null);
        this.platform = platform;
        this.marketId = marketId;
    }

    @Override
    protected OrderBook reduce(OrderBook current, ServerMessage message) {
        if (!(message instanceof ServerMessage.OrderBookUpdate)) {
            return current;
        }
        ServerMessage.OrderBookUpdate update = (ServerMessage.OrderBookUpdate) message;
        if (!update.isFor(platform, marketId)) {
            return current;
        }
        if (update.updateType() == OrderBookUpdateType.SNAPSHOT) {
            deltasSinceSnapshot = 0;
        } else {
            deltasSinceSnapshot++;
            if (current == null) {
                log.debug("[REDUCER] Delta before first snapshot for {}:{}", platform, marketId);
            }
        }
        return update.toOrderBook();
    }

    /**
     * Deltas applied since the last snapshot.
     */
    public int deltasSinceSnapshot() {
        return deltasSinceSnapshot;
    }
}
