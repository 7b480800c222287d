package io.predterm.service.reducer;

import io.predterm.domain.market.MarketOption;
import io.predterm.domain.market.Platform;
import io.predterm.domain.market.Trade;
import io.predterm.domain.stream.Subscription;
import io.predterm.infrastructure.stream.ConnectionManager;
import io.predterm.infrastructure.stream.Registration;
import io.predterm.infrastructure.stream.SubscriptionLease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Combined trade tape of every outcome of a multi-outcome event.
 */
public final class EventTradesStream implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventTradesStream.class);

    public static final int DEFAULT_MAX_TRADES = 100;

    private final EventTradeReducer reducer;
    private final List<SubscriptionLease> leases = new ArrayList<>();

    private EventTradesStream(EventTradeReducer reducer) {
        this.reducer = reducer;
    }

    public static EventTradesStream open(ConnectionManager connection, Platform platform,
                                         String eventId, List<MarketOption> options, int maxTrades) {
        EventTradesStream stream = new EventTradesStream(new EventTradeReducer(platform, options, maxTrades));
        stream.reducer.attach(connection);

        Set<String> ids = new LinkedHashSet<>();
        for (MarketOption option : options) {
            if (option.streamId() != null) {
                ids.add(option.streamId());
            }
        }
        for (String id : ids) {
            stream.leases.add(connection.acquire(Subscription.trades(platform, id)));
        }
        log.info("[STREAM] Opened event {} trades over {} outcome markets", eventId, ids.size());
        return stream;
    }

    /**
     * Newest first, labelled with outcome names.
     */
    public List<Trade> trades() {
        return reducer.state();
    }

    public int subscriptionCount() {
        return leases.size();
    }

    public Registration addListener(Consumer<List<Trade>> listener) {
        return reducer.addListener(listener);
    }

    @Override
    public void close() {
        leases.forEach(SubscriptionLease::release);
        reducer.close();
    }
}
