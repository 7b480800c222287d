package io.predterm.service.reducer;

import io.predterm.domain.market.NewsItem;
import io.predterm.domain.market.Platform;
import io.predterm.domain.stream.Subscription;
import io.predterm.infrastructure.stream.ConnectionManager;
import io.predterm.infrastructure.stream.Registration;
import io.predterm.infrastructure.stream.SubscriptionLease;

import java.util.List;
import java.util.function.Consumer;

/**
 * Global or per-market news over the shared connection.
 */
public final class NewsStream implements AutoCloseable {

    private final NewsReducer reducer;
    private final SubscriptionLease lease;

    private NewsStream(ConnectionManager connection, NewsReducer reducer, Subscription subscription) {
        this.reducer = reducer;
        reducer.attach(connection);
        this.lease = connection.acquire(subscription);
    }

    public static NewsStream global(ConnectionManager connection, int maxItems) {
        return new NewsStream(connection, NewsReducer.global(maxItems), Subscription.globalNews());
    }

    public static NewsStream forMarket(ConnectionManager connection, Platform platform, String marketId, int maxItems) {
        return new NewsStream(connection, NewsReducer.forMarket(platform, marketId, maxItems),
            Subscription.marketNews(platform, marketId));
    }

    /**
     * Newest first.
     */
    public List<NewsItem> news() {
        return reducer.state();
    }

    public Registration addListener(Consumer<List<NewsItem>> listener) {
        return reducer.addListener(listener);
    }

    @Override
    public void close() {
        lease.release();
        reducer.close();
    }
}
