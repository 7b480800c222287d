package io.predterm.service.reducer;

import io.predterm.domain.market.MarketNewsContext;
import io.predterm.domain.market.NewsItem;
import io.predterm.domain.market.Platform;
import io.predterm.domain.stream.ServerMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * News feed, newest first, unique by id, capped.
 *
 * The global feed takes every news update; a market feed only takes updates
 * whose market context names that market.
 */
public class NewsReducer extends ChannelReducer<List<NewsItem>> {

    private final MarketNewsContext market;   // null for the global feed
    private final int maxItems;

    private NewsReducer(MarketNewsContext market, int maxItems) {
        super(List.of());
        if (maxItems <= 0) {
            throw new IllegalArgumentException("maxItems must be positive");
        }
        this.market = market;
        this.maxItems = maxItems;
    }

    public static NewsReducer global(int maxItems) {
        return new NewsReducer(null, maxItems);
    }

    public static NewsReducer forMarket(Platform platform, String marketId, int maxItems) {
        return new NewsReducer(new MarketNewsContext(platform, marketId), maxItems);
    }

    public boolean isGlobal() {
        return market == null;
    }

    @Override
    protected List<NewsItem> reduce(List<NewsItem> current, ServerMessage message) {
        if (!(message instanceof ServerMessage.NewsUpdate)) {
            return current;
        }
        ServerMessage.NewsUpdate update = (ServerMessage.NewsUpdate) message;
        if (market != null) {
            MarketNewsContext context = update.marketContext();
            if (context == null || !context.matches(market.platform(), market.marketId())) {
                return current;
            }
        }
        NewsItem item = update.item();
        for (NewsItem existing : current) {
            if (existing.id().equals(item.id())) {
                return current;
            }
        }
        List<NewsItem> next = new ArrayList<>(Math.min(current.size() + 1, maxItems));
        next.add(item);
        for (int i = 0; i < current.size() && next.size() < maxItems; i++) {
            next.add(current.get(i));
        }
        return List.copyOf(next);
    }
}
