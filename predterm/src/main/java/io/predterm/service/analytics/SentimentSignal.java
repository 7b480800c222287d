package io.predterm.service.analytics;

/**
 * One contributing observation, e.g. ("Order Book", "Strong bid-side liquidity").
 */
public record SentimentSignal(SignalType type, String source, String description, double weight) {
}
