package io.predterm.service.reconcile;

import io.predterm.domain.market.MarketPrices;
import io.predterm.domain.market.OrderBook;
import io.predterm.domain.market.OrderBookLevel;
import io.predterm.domain.market.Platform;
import io.predterm.domain.market.Trade;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merge rules between pushed and pulled market state.
 *
 * <ul>
 *   <li>Order book and prices: pushed state wins whenever present; pulled
 *       state only fills the gap before the first push.</li>
 *   <li>Trades: pushed trades first, then pulled trades whose id was not
 *       pushed, truncated to the cap. No id appears twice.</li>
 * </ul>
 */
public final class SnapshotReconciler {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public static ReconciledMarketView reconcile(Platform platform, String marketId,
                                                 MarketPrices pushPrices, OrderBook pushBook,
                                                 List<Trade> pushTrades, PulledSnapshot pulled, int maxTrades) {
        OrderBook pulledBook = pulled == null ? null : pulled.orderBook();
        List<Trade> pulledTrades = pulled == null ? List.of() : pulled.trades();
        List<Trade> pushed = pushTrades == null ? List.of() : pushTrades;

        OrderBook book = pushBook != null ? pushBook : pulledBook;
        DataSource bookSource = source(pushBook, pulledBook);

        MarketPrices pulledPrices = pricesFromBook(pulledBook);
        MarketPrices prices = pushPrices != null ? pushPrices : pulledPrices;
        DataSource pricesSource = source(pushPrices, pulledPrices);

        List<Trade> trades = mergeTrades(pushed, pulledTrades, maxTrades);
        DataSource tradesSource = !pushed.isEmpty() ? DataSource.PUSH
            : !trades.isEmpty() ? DataSource.PULL
            : DataSource.NONE;

        return new ReconciledMarketView(platform, marketId, prices, pricesSource, book, bookSource,
            trades, tradesSource);
    }

    /**
     * {@code [...push, ...pulled not in push]}, first occurrence of an id wins, capped.
     */
    public static List<Trade> mergeTrades(List<Trade> push, List<Trade> pulled, int maxTrades) {
        if (maxTrades <= 0) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<Trade> merged = new ArrayList<>(Math.min(maxTrades, push.size() + pulled.size()));
        for (Trade trade : push) {
            if (merged.size() >= maxTrades) break;
            if (seen.add(trade.id())) {
                merged.add(trade);
            }
        }
        for (Trade trade : pulled) {
            if (merged.size() >= maxTrades) break;
            if (seen.add(trade.id())) {
                merged.add(trade);
            }
        }
        return List.copyOf(merged);
    }

    /**
     * Prices implied by a pulled book: yes is the mid of the yes side, no is its complement.
     *
     * @return null when the book lacks a two-sided yes market
     */
    public static MarketPrices pricesFromBook(OrderBook book) {
        if (book == null || book.yesBids().isEmpty() || book.yesAsks().isEmpty()) {
            return null;
        }
        OrderBookLevel bid = book.yesBids().get(0);
        OrderBookLevel ask = book.yesAsks().get(0);
        BigDecimal yes = bid.price().add(ask.price()).divide(TWO, 6, RoundingMode.HALF_UP).stripTrailingZeros();
        return new MarketPrices(yes, BigDecimal.ONE.subtract(yes), book.timestamp());
    }

    private static DataSource source(Object push, Object pulled) {
        if (push != null) return DataSource.PUSH;
        if (pulled != null) return DataSource.PULL;
        return DataSource.NONE;
    }

    private SnapshotReconciler() {}
}
