package io.predterm.service.analytics;

/**
 * Inputs to {@link SentimentCalculator}. Zero (or null momentum) means "not available".
 */
public record SentimentInputs(
    double orderBookImbalance,
    TradeMomentum tradeMomentum,
    double currentPrice,
    double previousPrice,
    double volume24h,
    double averageVolume
) {
    public static SentimentInputs defaults() {
        return new SentimentInputs(0, null, 0, 0, 0, 0);
    }

    public SentimentInputs withOrderBookImbalance(double imbalance) {
        return new SentimentInputs(imbalance, tradeMomentum, currentPrice, previousPrice, volume24h, averageVolume);
    }

    public SentimentInputs withTradeMomentum(TradeMomentum momentum) {
        return new SentimentInputs(orderBookImbalance, momentum, currentPrice, previousPrice, volume24h, averageVolume);
    }

    public SentimentInputs withPrices(double current, double previous) {
        return new SentimentInputs(orderBookImbalance, tradeMomentum, current, previous, volume24h, averageVolume);
    }

    public SentimentInputs withVolume(double volume, double average) {
        return new SentimentInputs(orderBookImbalance, tradeMomentum, currentPrice, previousPrice, volume, average);
    }
}
