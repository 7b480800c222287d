package io.predterm.service.analytics;

import io.predterm.domain.market.Trade;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Trade-flow momentum over a trailing window.
 *
 * Stateful only in one respect: it remembers the previous sample's ratio so it
 * can tell whether momentum is accelerating. Use one calculator per market.
 */
public class TradeMomentumCalculator {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);
    public static final double DEFAULT_WHALE_THRESHOLD = 2.0;

    private static final double DIRECTION_THRESHOLD = 0.2;

    private final Duration window;
    private final double whaleThreshold;

    private double previousRatio = 0;
    private boolean previousAccelerating = false;

    public TradeMomentumCalculator() {
        this(DEFAULT_WINDOW, DEFAULT_WHALE_THRESHOLD);
    }

    public TradeMomentumCalculator(Duration window, double whaleThreshold) {
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Window must be positive");
        }
        this.window = window;
        this.whaleThreshold = whaleThreshold;
    }

    /**
     * Momentum of the trades inside {@code [now - window, now]}.
     */
    public synchronized TradeMomentum calculate(List<Trade> trades, Instant now) {
        Instant cutoff = now.minus(window);
        List<Trade> recent = new ArrayList<>();
        for (Trade trade : trades) {
            if (trade.timestamp() != null && !trade.timestamp().isBefore(cutoff)) {
                recent.add(trade);
            }
        }

        if (recent.isEmpty()) {
            // An empty window is not a sample: keep the acceleration baseline.
            return new TradeMomentum(0, 0, 0, 0, 0, 0, previousAccelerating, TradeDirection.NEUTRAL,
                0, null, false);
        }

        double avgSize = recent.stream().mapToDouble(Trade::quantityValue).sum() / recent.size();
        double buyVolume = 0;
        double sellVolume = 0;
        int buyCount = 0;
        int sellCount = 0;
        Trade largest = null;
        double largestSize = 0;
        boolean hasWhale = false;

        for (Trade trade : recent) {
            double qty = trade.quantityValue();
            if (trade.isBuy()) {
                buyVolume += qty;
                buyCount++;
            } else {
                sellVolume += qty;
                sellCount++;
            }
            if (qty > largestSize) {
                largestSize = qty;
                largest = trade;
            }
            if (qty > avgSize * whaleThreshold) {
                hasWhale = true;
            }
        }

        double net = buyVolume - sellVolume;
        double total = buyVolume + sellVolume;
        double ratio = total > 0 ? net / total : 0;

        TradeDirection direction = ratio > DIRECTION_THRESHOLD ? TradeDirection.BUY
            : ratio < -DIRECTION_THRESHOLD ? TradeDirection.SELL
            : TradeDirection.NEUTRAL;

        boolean accelerating = Math.abs(ratio) > Math.abs(previousRatio);
        previousRatio = ratio;
        previousAccelerating = accelerating;

        double velocity = recent.size() / (double) window.toSeconds() * 60;

        return new TradeMomentum(net, buyVolume, sellVolume, buyCount, sellCount, ratio, accelerating,
            direction, velocity, largest, hasWhale);
    }

    /**
     * Annotate the first {@code maxTrades} trades with size relative to the mean of all trades.
     */
    public static List<ProcessedTrade> processTrades(List<Trade> trades, int maxTrades, double whaleThreshold, Instant now) {
        double avgSize = trades.isEmpty() ? 0
            : trades.stream().mapToDouble(Trade::quantityValue).sum() / trades.size();
        List<ProcessedTrade> processed = new ArrayList<>();
        for (int i = 0; i < trades.size() && i < maxTrades; i++) {
            Trade trade = trades.get(i);
            double relative = avgSize > 0 ? trade.quantityValue() / avgSize : 1;
            long age = trade.timestamp() == null ? 0 : Duration.between(trade.timestamp(), now).toMillis();
            processed.add(new ProcessedTrade(trade, relative, relative > whaleThreshold, age));
        }
        return List.copyOf(processed);
    }

    /**
     * Buy/sell ratio per bucket, oldest bucket first, ending at {@code now}.
     *
     * @return empty when there are no trades at all
     */
    public static List<PressurePoint> pressureHistory(List<Trade> trades, Duration bucket, int maxBuckets, Instant now) {
        if (trades.isEmpty()) {
            return List.of();
        }
        long bucketMs = bucket.toMillis();
        long nowMs = now.toEpochMilli();
        PressurePoint[] points = new PressurePoint[maxBuckets];

        for (int i = 0; i < maxBuckets; i++) {
            long end = nowMs - i * bucketMs;
            long start = end - bucketMs;
            double buy = 0;
            double sell = 0;
            for (Trade trade : trades) {
                if (trade.timestamp() == null) continue;
                long t = trade.timestamp().toEpochMilli();
                if (t >= start && t < end) {
                    if (trade.isBuy()) buy += trade.quantityValue();
                    else sell += trade.quantityValue();
                }
            }
            double total = buy + sell;
            points[maxBuckets - 1 - i] = new PressurePoint(start, total > 0 ? (buy - sell) / total : 0, buy, sell);
        }
        return List.of(points);
    }
}
