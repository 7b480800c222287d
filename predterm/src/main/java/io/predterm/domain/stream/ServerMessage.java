package io.predterm.domain.stream;

import io.predterm.domain.market.MarketNewsContext;
import io.predterm.domain.market.NewsItem;
import io.predterm.domain.market.OrderBook;
import io.predterm.domain.market.OrderBookLevel;
import io.predterm.domain.market.Platform;
import io.predterm.domain.market.Trade;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Parsed inbound frame. Exactly one record per {@link MessageType}.
 *
 * Instances live only for the duration of dispatch; handlers must copy what they keep.
 */
public interface ServerMessage {

    MessageType type();

    /**
     * Market-scoped updates carry the market they apply to.
     */
    interface MarketScoped extends ServerMessage {
        Platform platform();

        String marketId();

        default boolean isFor(Platform platform, String marketId) {
            return platform() == platform && marketId().equals(marketId);
        }
    }

    record PriceUpdate(Platform platform, String marketId, BigDecimal yesPrice, BigDecimal noPrice,
                       Instant timestamp) implements MarketScoped {
        @Override
        public MessageType type() {
            return MessageType.PRICE_UPDATE;
        }
    }

    record OrderBookUpdate(Platform platform, String marketId, OrderBookUpdateType updateType,
                           List<OrderBookLevel> yesBids, List<OrderBookLevel> yesAsks,
                           List<OrderBookLevel> noBids, List<OrderBookLevel> noAsks,
                           Instant timestamp) implements MarketScoped {
        @Override
        public MessageType type() {
            return MessageType.ORDER_BOOK_UPDATE;
        }

        public OrderBook toOrderBook() {
            return new OrderBook(marketId, platform, timestamp, yesBids, yesAsks, noBids, noAsks, null);
        }
    }

    record TradeUpdate(Platform platform, String marketId, Trade trade) implements MarketScoped {
        @Override
        public MessageType type() {
            return MessageType.TRADE_UPDATE;
        }
    }

    record NewsUpdate(NewsItem item, MarketNewsContext marketContext) implements ServerMessage {
        @Override
        public MessageType type() {
            return MessageType.NEWS_UPDATE;
        }

        public boolean isGlobal() {
            return marketContext == null;
        }
    }

    record Subscribed(Subscription subscription) implements ServerMessage {
        @Override
        public MessageType type() {
            return MessageType.SUBSCRIBED;
        }
    }

    record Unsubscribed(Subscription subscription) implements ServerMessage {
        @Override
        public MessageType type() {
            return MessageType.UNSUBSCRIBED;
        }
    }

    record ErrorMessage(ErrorCode code, String message) implements ServerMessage {
        @Override
        public MessageType type() {
            return MessageType.ERROR;
        }
    }

    record Pong(long clientTimestamp, long serverTimestamp) implements ServerMessage {
        @Override
        public MessageType type() {
            return MessageType.PONG;
        }
    }

    record ConnectionStatus(Platform platform, FeedStatus status) implements ServerMessage {
        @Override
        public MessageType type() {
            return MessageType.CONNECTION_STATUS;
        }
    }
}
