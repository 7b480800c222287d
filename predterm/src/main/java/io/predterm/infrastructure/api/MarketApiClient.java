package io.predterm.infrastructure.api;

import io.predterm.domain.market.OrderBook;
import io.predterm.domain.market.Platform;
import io.predterm.domain.market.PriceHistory;
import io.predterm.domain.market.PriceInterval;
import io.predterm.domain.market.TradeHistory;

import java.util.concurrent.CompletableFuture;

/**
 * Request/response access to market snapshots.
 *
 * Futures complete exceptionally with {@link MarketApiException} on failure.
 */
public interface MarketApiClient {

    /**
     * @param depth max levels per side, or null for the server default
     */
    CompletableFuture<OrderBook> getOrderBook(Platform platform, String marketId, Integer depth);

    /**
     * @param limit max trades, or null for the server default
     * @param cursor pagination cursor from a previous page, or null
     */
    CompletableFuture<TradeHistory> getTrades(Platform platform, String marketId, Integer limit, String cursor);

    /**
     * @param interval candle interval, or null for the server default
     * @param timeframe preset such as "24H" or "7D", or null
     */
    CompletableFuture<PriceHistory> getPriceHistory(Platform platform, String marketId,
                                                    PriceInterval interval, String timeframe);
}
