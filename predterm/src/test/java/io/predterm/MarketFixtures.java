package io.predterm;

import io.predterm.domain.market.MarketNewsContext;
import io.predterm.domain.market.NewsItem;
import io.predterm.domain.market.OrderBook;
import io.predterm.domain.market.OrderBookLevel;
import io.predterm.domain.market.Platform;
import io.predterm.domain.market.Trade;
import io.predterm.domain.stream.OrderBookUpdateType;
import io.predterm.domain.stream.ServerMessage;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Builders for domain values used across tests.
 */
public final class MarketFixtures {

    public static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    public static OrderBookLevel level(String price, String quantity) {
        return OrderBookLevel.of(price, quantity);
    }

    public static Trade trade(String id, String marketId, String side, String quantity, Instant at) {
        return new Trade(id, marketId, Platform.KALSHI, at, new BigDecimal("0.50"),
            new BigDecimal(quantity), "yes", side);
    }

    public static Trade trade(String id, String side, String quantity, Instant at) {
        return trade(id, "KXBTC-25", side, quantity, at);
    }

    public static ServerMessage.TradeUpdate tradeUpdate(Platform platform, String marketId, Trade trade) {
        return new ServerMessage.TradeUpdate(platform, marketId, trade);
    }

    public static ServerMessage.PriceUpdate priceUpdate(Platform platform, String marketId, String yes, String no, Instant at) {
        return new ServerMessage.PriceUpdate(platform, marketId, new BigDecimal(yes), new BigDecimal(no), at);
    }

    public static ServerMessage.OrderBookUpdate bookUpdate(Platform platform, String marketId, OrderBookUpdateType type,
                                                           List<OrderBookLevel> bids, List<OrderBookLevel> asks) {
        return new ServerMessage.OrderBookUpdate(platform, marketId, type, bids, asks, List.of(), List.of(), T0);
    }

    public static OrderBook book(Platform platform, String marketId, List<OrderBookLevel> bids, List<OrderBookLevel> asks) {
        return new OrderBook(marketId, platform, T0, bids, asks, List.of(), List.of(), null);
    }

    public static NewsItem news(String id, String title) {
        return new NewsItem(id, title, "https://news.example.com/" + id, T0, null, null, null, null,
            0.5, List.of(), null);
    }

    public static ServerMessage.NewsUpdate newsUpdate(NewsItem item, Platform platform, String marketId) {
        return new ServerMessage.NewsUpdate(item, platform == null ? null : new MarketNewsContext(platform, marketId));
    }

    private MarketFixtures() {}
}
