package io.predterm.service.reducer;

import io.predterm.domain.market.MarketPrices;
import io.predterm.domain.market.OrderBook;
import io.predterm.domain.market.Platform;
import io.predterm.domain.market.Trade;
import io.predterm.domain.stream.Subscription;
import io.predterm.infrastructure.stream.ConnectionManager;
import io.predterm.infrastructure.stream.Registration;
import io.predterm.infrastructure.stream.SubscriptionLease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Live price, order book and trades of one market over the shared connection.
 *
 * Usage:
 * <pre>
 * try (MarketStream stream = MarketStream.open(connection, Platform.KALSHI, "KXBTC-25", MarketStream.Options.defaults())) {
 *     stream.addChangeListener(() -> render(stream.orderBook()));
 * }
 * </pre>
 */
public final class MarketStream implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MarketStream.class);

    /**
     * Which channels to open.
     */
    public record Options(boolean prices, boolean orderBook, boolean trades, int maxTrades) {
        public static Options defaults() {
            return new Options(true, true, true, 50);
        }

        public Options withMaxTrades(int maxTrades) {
            return new Options(prices, orderBook, trades, maxTrades);
        }
    }

    private final Platform platform;
    private final String marketId;
    private final PriceReducer priceReducer;
    private final OrderBookReducer orderBookReducer;
    private final TradeReducer tradeReducer;
    private final List<ChannelReducer<?>> attached = new ArrayList<>();
    private final List<SubscriptionLease> leases = new ArrayList<>();
    private volatile boolean closed = false;

    private MarketStream(Platform platform, String marketId, int maxTrades) {
        this.platform = platform;
        this.marketId = marketId;
        this.priceReducer = new PriceReducer(platform, marketId);
        this.orderBookReducer = new OrderBookReducer(platform, marketId);
        this.tradeReducer = new TradeReducer(platform, marketId, maxTrades);
    }

    public static MarketStream open(ConnectionManager connection, Platform platform, String marketId, Options options) {
        MarketStream stream = new MarketStream(platform, marketId, options.maxTrades());
        // Reducers go on the bus before the lease so nothing sent after the subscribe is missed.
        if (options.prices()) {
            stream.open(connection, stream.priceReducer, Subscription.price(platform, marketId));
        }
        if (options.orderBook()) {
            stream.open(connection, stream.orderBookReducer, Subscription.orderBook(platform, marketId));
        }
        if (options.trades()) {
            stream.open(connection, stream.tradeReducer, Subscription.trades(platform, marketId));
        }
        log.info("[STREAM] Opened {}:{} ({} channels)", platform, marketId, stream.leases.size());
        return stream;
    }

    private void open(ConnectionManager connection, ChannelReducer<?> reducer, Subscription subscription) {
        reducer.attach(connection);
        attached.add(reducer);
        leases.add(connection.acquire(subscription));
    }

    public Platform platform() {
        return platform;
    }

    public String marketId() {
        return marketId;
    }

    /**
     * @return latest pushed prices, or null before the first price update
     */
    public MarketPrices prices() {
        return priceReducer.state();
    }

    /**
     * @return latest pushed book, or null before the first order book update
     */
    public OrderBook orderBook() {
        return orderBookReducer.state();
    }

    public List<Trade> trades() {
        return tradeReducer.state();
    }

    public PriceReducer priceReducer() {
        return priceReducer;
    }

    public OrderBookReducer orderBookReducer() {
        return orderBookReducer;
    }

    public TradeReducer tradeReducer() {
        return tradeReducer;
    }

    /**
     * Run the callback whenever any of the opened channels changes.
     */
    public Registration addChangeListener(Runnable callback) {
        List<Registration> registrations = new ArrayList<>();
        for (ChannelReducer<?> reducer : attached) {
            registrations.add(reducer.addListener(s -> callback.run()));
        }
        return () -> registrations.forEach(Registration::remove);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        leases.forEach(SubscriptionLease::release);
        attached.forEach(ChannelReducer::close);
        log.info("[STREAM] Closed {}:{}", platform, marketId);
    }
}
