package io.predterm.service.analytics;

/**
 * Summary numbers of one side pair (bids vs asks) of a book.
 *
 * @param imbalanceRatio (bid - ask) / (bid + ask) in [-1, 1]; positive is bid heavy
 * @param wallThreshold quantity above which a level counts as a wall
 */
public record OrderBookMetrics(
    double bestBid,
    double bestAsk,
    double midPrice,
    double spread,
    double spreadPercent,
    double totalBidQty,
    double totalAskQty,
    double imbalanceRatio,
    double bidAskRatio,
    double wallThreshold,
    double maxQuantity
) {
}
