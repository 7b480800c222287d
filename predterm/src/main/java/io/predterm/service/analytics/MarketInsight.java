package io.predterm.service.analytics;

/**
 * Analytics derived from one reconciled view.
 *
 * @param bookMetrics null while no order book is known
 */
public record MarketInsight(
    OrderBookMetrics bookMetrics,
    double marketHeat,
    TradeMomentum momentum,
    MarketSentiment sentiment
) {
}
