package io.predterm.service.analytics;

import java.util.List;

/**
 * Composite sentiment.
 *
 * @param score -100 (bearish) to 100 (bullish)
 * @param confidence 0 to 1, from data coverage and signal agreement
 */
public record MarketSentiment(
    double score,
    SentimentLabel label,
    double confidence,
    Components components,
    List<SentimentSignal> signals
) {
    public MarketSentiment {
        signals = List.copyOf(signals);
    }

    /** Each component is on the same -100..100 scale as the score. */
    public record Components(double orderBook, double tradeFlow, double priceTrend, double volumeAnomaly) {
    }
}
