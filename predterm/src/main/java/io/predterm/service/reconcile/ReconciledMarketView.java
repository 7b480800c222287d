package io.predterm.service.reconcile;

import io.predterm.domain.market.MarketPrices;
import io.predterm.domain.market.OrderBook;
import io.predterm.domain.market.Platform;
import io.predterm.domain.market.Trade;

import java.util.List;

/**
 * Single authoritative view of a market, rebuilt from push and pull state on every change.
 */
public record ReconciledMarketView(
    Platform platform,
    String marketId,
    MarketPrices prices,
    DataSource pricesSource,
    OrderBook orderBook,
    DataSource orderBookSource,
    List<Trade> trades,
    DataSource tradesSource
) {
    public ReconciledMarketView {
        trades = trades == null ? List.of() : List.copyOf(trades);
    }

    public boolean hasOrderBook() {
        return orderBook != null;
    }
}
