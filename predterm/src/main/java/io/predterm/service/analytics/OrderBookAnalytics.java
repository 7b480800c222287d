package io.predterm.service.analytics;

import io.predterm.domain.market.OrderBookLevel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Order book metrics: spread, imbalance, walls, heatmap intensity, depth.
 *
 * Prices are probabilities in [0, 1]; an empty bid side counts as a best bid
 * of 0 and an empty ask side as a best ask of 1.
 */
public final class OrderBookAnalytics {

    public static final List<Double> DEFAULT_DEPTH_STEPS = List.of(0.01, 0.02, 0.05, 0.1);

    // Distance from mid at which proximity heat reaches zero.
    private static final double MAX_HEAT_DISTANCE = 0.1;

    public static OrderBookMetrics calculateMetrics(List<OrderBookLevel> bids, List<OrderBookLevel> asks) {
        double totalBid = 0;
        double totalAsk = 0;
        double bestBid = 0;
        double bestAsk = 1;
        double maxQuantity = 1;
        int levels = 0;

        for (OrderBookLevel level : bids) {
            double price = level.price().doubleValue();
            double qty = level.quantity().doubleValue();
            totalBid += qty;
            bestBid = Math.max(bestBid, price);
            maxQuantity = Math.max(maxQuantity, qty);
            levels++;
        }
        for (OrderBookLevel level : asks) {
            double price = level.price().doubleValue();
            double qty = level.quantity().doubleValue();
            totalAsk += qty;
            bestAsk = Math.min(bestAsk, price);
            maxQuantity = Math.max(maxQuantity, qty);
            levels++;
        }

        double mid = (bestBid + bestAsk) / 2;
        double spread = bestAsk - bestBid;
        double spreadPercent = mid > 0 ? spread / mid * 100 : 0;
        double total = totalBid + totalAsk;
        double imbalance = total > 0 ? clamp((totalBid - totalAsk) / total, -1, 1) : 0;
        double bidAskRatio = totalAsk > 0 ? totalBid / totalAsk : 1;
        double avgQuantity = levels > 0 ? total / levels : 0;

        return new OrderBookMetrics(bestBid, bestAsk, mid, spread, spreadPercent, totalBid, totalAsk,
            imbalance, bidAskRatio, avgQuantity * 2, maxQuantity);
    }

    /**
     * Sort a side (bids descending, asks ascending) and annotate each level.
     */
    public static List<ProcessedLevel> processLevels(List<OrderBookLevel> levels, OrderBookMetrics metrics, boolean isBid) {
        Comparator<OrderBookLevel> byPrice = Comparator.comparing(OrderBookLevel::price);
        List<OrderBookLevel> sorted = new ArrayList<>(levels);
        sorted.sort(isBid ? byPrice.reversed() : byPrice);

        List<ProcessedLevel> processed = new ArrayList<>(sorted.size());
        double cumulative = 0;
        for (OrderBookLevel level : sorted) {
            double price = level.price().doubleValue();
            double qty = level.quantity().doubleValue();
            cumulative += qty;

            double distance = Math.abs(price - metrics.midPrice());
            double qtyHeat = metrics.maxQuantity() > 0 ? qty / metrics.maxQuantity() : 0;
            double proximityHeat = Math.max(0, 1 - distance / MAX_HEAT_DISTANCE);
            double intensity = clamp(qtyHeat * 0.6 + proximityHeat * 0.4, 0, 1);

            processed.add(new ProcessedLevel(level, price, qty, cumulative, distance, intensity,
                qty > metrics.wallThreshold()));
        }
        return List.copyOf(processed);
    }

    public static List<ProcessedLevel> detectWalls(List<ProcessedLevel> levels) {
        return levels.stream().filter(ProcessedLevel::wall).toList();
    }

    public static DepthProfile depthProfile(List<ProcessedLevel> bids, List<ProcessedLevel> asks, double midPrice) {
        return depthProfile(bids, asks, midPrice, DEFAULT_DEPTH_STEPS);
    }

    /**
     * For each step, total bid quantity priced at or above {@code mid * (1 - step)}
     * and total ask quantity at or below {@code mid * (1 + step)}.
     */
    public static DepthProfile depthProfile(List<ProcessedLevel> bids, List<ProcessedLevel> asks,
                                            double midPrice, List<Double> steps) {
        List<Double> bidDepth = new ArrayList<>(steps.size());
        List<Double> askDepth = new ArrayList<>(steps.size());
        for (double step : steps) {
            double bidFloor = midPrice * (1 - step);
            double askCeiling = midPrice * (1 + step);
            bidDepth.add(bids.stream().filter(b -> b.price() >= bidFloor).mapToDouble(ProcessedLevel::quantity).sum());
            askDepth.add(asks.stream().filter(a -> a.price() <= askCeiling).mapToDouble(ProcessedLevel::quantity).sum());
        }
        return new DepthProfile(steps, bidDepth, askDepth);
    }

    /**
     * How agitated the book looks, 0 to 100 (50 is unremarkable).
     *
     * @param previous metrics from the prior update, or null
     */
    public static double marketHeat(OrderBookMetrics metrics, OrderBookMetrics previous) {
        double heat = 50;
        heat += Math.abs(metrics.imbalanceRatio()) * 20;

        if (metrics.spreadPercent() > 2) heat += 15;
        else if (metrics.spreadPercent() > 1) heat += 5;
        else heat -= 10;

        double liquidity = metrics.totalBidQty() + metrics.totalAskQty();
        if (liquidity < 10_000) heat += 15;
        else if (liquidity > 100_000) heat -= 10;

        if (previous != null) {
            heat += Math.abs(metrics.imbalanceRatio() - previous.imbalanceRatio()) * 30;
        }
        return clamp(heat, 0, 100);
    }

    /**
     * "40% bid", "15% ask" or "balanced".
     */
    public static String formatImbalance(double ratio) {
        String percent = String.format(Locale.ROOT, "%.0f", Math.abs(ratio * 100));
        if (ratio > 0) return percent + "% bid";
        if (ratio < 0) return percent + "% ask";
        return "balanced";
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private OrderBookAnalytics() {}
}
