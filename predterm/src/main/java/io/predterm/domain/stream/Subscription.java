package io.predterm.domain.stream;

import io.predterm.domain.market.Platform;

import java.util.Objects;

/**
 * A channel of interest: kind plus, for market-scoped kinds, platform and market id.
 *
 * Two subscriptions are the same channel iff their {@link #key()} is equal.
 */
public record Subscription(SubscriptionKind kind, Platform platform, String marketId) {

    public static final String GLOBAL_NEWS_KEY = "global_news";

    public Subscription {
        Objects.requireNonNull(kind, "kind");
        if (kind.isMarketScoped()) {
            Objects.requireNonNull(platform, "platform");
            if (marketId == null || marketId.isBlank()) {
                throw new IllegalArgumentException("marketId required for " + kind.wireName());
            }
        } else {
            platform = null;
            marketId = null;
        }
    }

    public static Subscription price(Platform platform, String marketId) {
        return new Subscription(SubscriptionKind.PRICE, platform, marketId);
    }

    public static Subscription orderBook(Platform platform, String marketId) {
        return new Subscription(SubscriptionKind.ORDER_BOOK, platform, marketId);
    }

    public static Subscription trades(Platform platform, String marketId) {
        return new Subscription(SubscriptionKind.TRADES, platform, marketId);
    }

    public static Subscription globalNews() {
        return new Subscription(SubscriptionKind.GLOBAL_NEWS, null, null);
    }

    public static Subscription marketNews(Platform platform, String marketId) {
        return new Subscription(SubscriptionKind.MARKET_NEWS, platform, marketId);
    }

    /**
     * Registry key, e.g. {@code "order_book:kalshi:KXBTC-25"} or {@code "global_news"}.
     */
    public String key() {
        if (!kind.isMarketScoped()) {
            return GLOBAL_NEWS_KEY;
        }
        return kind.wireName() + ":" + platform.wireName() + ":" + marketId;
    }

    @Override
    public String toString() {
        return key();
    }
}
