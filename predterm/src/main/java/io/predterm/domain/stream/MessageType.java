package io.predterm.domain.stream;

import java.util.Optional;

/**
 * Value of the {@code type} tag on inbound frames.
 */
public enum MessageType {
    SUBSCRIBED("subscribed"),
    UNSUBSCRIBED("unsubscribed"),
    PRICE_UPDATE("price_update"),
    ORDER_BOOK_UPDATE("order_book_update"),
    TRADE_UPDATE("trade_update"),
    NEWS_UPDATE("news_update"),
    ERROR("error"),
    PONG("pong"),
    CONNECTION_STATUS("connection_status");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<MessageType> fromWire(String value) {
        for (MessageType type : values()) {
            if (type.wireName.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
