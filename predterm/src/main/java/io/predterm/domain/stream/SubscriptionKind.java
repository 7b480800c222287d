package io.predterm.domain.stream;

/**
 * Channel kinds the stream server accepts.
 */
public enum SubscriptionKind {
    PRICE("price"),
    ORDER_BOOK("order_book"),
    TRADES("trades"),
    GLOBAL_NEWS("global_news"),
    MARKET_NEWS("market_news");

    private final String wireName;

    SubscriptionKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isMarketScoped() {
        return this != GLOBAL_NEWS;
    }

    public static SubscriptionKind fromWire(String value) {
        for (SubscriptionKind kind : values()) {
            if (kind.wireName.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown subscription type: " + value);
    }
}
