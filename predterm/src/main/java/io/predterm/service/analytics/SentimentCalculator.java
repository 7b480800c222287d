package io.predterm.service.analytics;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static io.predterm.service.analytics.OrderBookAnalytics.clamp;

/**
 * Blends book imbalance, trade flow, price trend and volume into one score.
 */
public final class SentimentCalculator {

    private static final double W_ORDER_BOOK = 0.30;
    private static final double W_TRADE_FLOW = 0.35;
    private static final double W_PRICE_TREND = 0.20;
    private static final double W_VOLUME = 0.15;

    private static final int MAX_DATA_POINTS = 4;

    public static MarketSentiment calculate(SentimentInputs in) {
        List<SentimentSignal> signals = new ArrayList<>();

        double orderBook = in.orderBookImbalance() * 100;
        if (in.orderBookImbalance() > 0.3) {
            signals.add(new SentimentSignal(SignalType.BULLISH, "Order Book", "Strong bid-side liquidity", 0.3));
        } else if (in.orderBookImbalance() < -0.3) {
            signals.add(new SentimentSignal(SignalType.BEARISH, "Order Book", "Strong ask-side liquidity", 0.3));
        }

        TradeMomentum momentum = in.tradeMomentum();
        double tradeFlow = 0;
        if (momentum != null) {
            tradeFlow = momentum.momentumRatio() * 100;
            double weight = momentum.accelerating() ? 0.4 : 0.3;
            if (momentum.direction() == TradeDirection.BUY) {
                signals.add(new SentimentSignal(SignalType.BULLISH, "Trade Flow",
                    momentum.accelerating() ? "Accelerating buy pressure" : "Net buying activity", weight));
            } else if (momentum.direction() == TradeDirection.SELL) {
                signals.add(new SentimentSignal(SignalType.BEARISH, "Trade Flow",
                    momentum.accelerating() ? "Accelerating sell pressure" : "Net selling activity", weight));
            }
            if (momentum.hasWhale()) {
                boolean whaleBuy = momentum.largestTrade() != null && momentum.largestTrade().isBuy();
                signals.add(new SentimentSignal(whaleBuy ? SignalType.BULLISH : SignalType.BEARISH, "Whale Activity",
                    whaleBuy ? "Large buy order detected" : "Large sell order detected", 0.2));
            }
        }

        double priceTrend = 0;
        boolean hasPrices = in.currentPrice() > 0 && in.previousPrice() > 0;
        if (hasPrices) {
            double changePercent = (in.currentPrice() - in.previousPrice()) / in.previousPrice() * 100;
            priceTrend = clamp(changePercent * 10, -100, 100);
            if (changePercent > 2) {
                signals.add(new SentimentSignal(SignalType.BULLISH, "Price Trend",
                    String.format(Locale.ROOT, "Price up %.1f%%", changePercent), 0.2));
            } else if (changePercent < -2) {
                signals.add(new SentimentSignal(SignalType.BEARISH, "Price Trend",
                    String.format(Locale.ROOT, "Price down %.1f%%", Math.abs(changePercent)), 0.2));
            }
        }

        double volumeAnomaly = 0;
        boolean hasVolume = in.volume24h() > 0 && in.averageVolume() > 0;
        if (hasVolume) {
            double ratio = in.volume24h() / in.averageVolume();
            volumeAnomaly = clamp((ratio - 1) * 50, -100, 100);
            if (ratio > 1.5) {
                // Heavy volume amplifies whatever the trade flow says.
                SignalType type = tradeFlow > 0 ? SignalType.BULLISH
                    : tradeFlow < 0 ? SignalType.BEARISH
                    : SignalType.NEUTRAL;
                signals.add(new SentimentSignal(type, "Volume",
                    String.format(Locale.ROOT, "%.0f%% of average volume", ratio * 100), 0.15));
            }
        }

        double score = clamp(orderBook * W_ORDER_BOOK + tradeFlow * W_TRADE_FLOW
            + priceTrend * W_PRICE_TREND + volumeAnomaly * W_VOLUME, -100, 100);

        int dataPoints = 0;
        if (in.orderBookImbalance() != 0) dataPoints++;
        if (momentum != null) dataPoints++;
        if (hasPrices) dataPoints++;
        if (hasVolume) dataPoints++;

        long bullish = signals.stream().filter(s -> s.type() == SignalType.BULLISH).count();
        long bearish = signals.stream().filter(s -> s.type() == SignalType.BEARISH).count();
        double agreement = bullish + bearish > 0
            ? Math.max(bullish, bearish) / (double) (bullish + bearish)
            : 0.5;
        double confidence = (double) dataPoints / MAX_DATA_POINTS * 0.6 + agreement * 0.4;

        return new MarketSentiment(score, SentimentLabel.forScore(score), confidence,
            new MarketSentiment.Components(orderBook, tradeFlow, priceTrend, volumeAnomaly), signals);
    }

    private SentimentCalculator() {}
}
