package io.predterm.service.analytics;

import io.predterm.domain.market.OrderBookLevel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.predterm.MarketFixtures.level;
import static org.junit.jupiter.api.Assertions.*;

class OrderBookAnalyticsTest {

    private static final double EPS = 1e-9;

    private final List<OrderBookLevel> bids = List.of(level("0.69", "100"), level("0.70", "600"));
    private final List<OrderBookLevel> asks = List.of(level("0.75", "100"), level("0.74", "200"));

    @Test
    void testCalculateMetrics() {
        OrderBookMetrics metrics = OrderBookAnalytics.calculateMetrics(bids, asks);

        assertEquals(0.70, metrics.bestBid(), EPS);
        assertEquals(0.74, metrics.bestAsk(), EPS);
        assertEquals(0.72, metrics.midPrice(), EPS);
        assertEquals(0.04, metrics.spread(), EPS);
        assertEquals(0.04 / 0.72 * 100, metrics.spreadPercent(), 1e-6);
        assertEquals(700, metrics.totalBidQty(), EPS);
        assertEquals(300, metrics.totalAskQty(), EPS);
        assertEquals(0.4, metrics.imbalanceRatio(), EPS, "700 bid vs 300 ask");
        assertEquals(700.0 / 300.0, metrics.bidAskRatio(), EPS);
        assertEquals(500, metrics.wallThreshold(), EPS, "Twice the mean level size");
        assertEquals(600, metrics.maxQuantity(), EPS);
    }

    @Test
    void testEmptyBookDefaults() {
        OrderBookMetrics metrics = OrderBookAnalytics.calculateMetrics(List.of(), List.of());

        assertEquals(0, metrics.bestBid(), EPS);
        assertEquals(1, metrics.bestAsk(), EPS);
        assertEquals(0.5, metrics.midPrice(), EPS);
        assertEquals(0, metrics.imbalanceRatio(), EPS);
        assertEquals(1, metrics.bidAskRatio(), EPS);
        assertEquals(1, metrics.maxQuantity(), EPS);
    }

    @Test
    void testProcessLevelsSortsAndAccumulates() {
        OrderBookMetrics metrics = OrderBookAnalytics.calculateMetrics(bids, asks);

        List<ProcessedLevel> processedBids = OrderBookAnalytics.processLevels(bids, metrics, true);
        assertEquals(0.70, processedBids.get(0).price(), EPS, "Bids descending");
        assertEquals(600, processedBids.get(0).cumulativeQuantity(), EPS);
        assertEquals(700, processedBids.get(1).cumulativeQuantity(), EPS);
        assertEquals(0.02, processedBids.get(0).distanceFromMid(), EPS);
        assertEquals(0.92, processedBids.get(0).intensity(), 1e-6);

        List<ProcessedLevel> processedAsks = OrderBookAnalytics.processLevels(asks, metrics, false);
        assertEquals(0.74, processedAsks.get(0).price(), EPS, "Asks ascending");

        for (ProcessedLevel level : processedAsks) {
            assertTrue(level.intensity() >= 0 && level.intensity() <= 1, "Intensity out of range: " + level);
        }
    }

    @Test
    void testDetectWalls() {
        OrderBookMetrics metrics = OrderBookAnalytics.calculateMetrics(bids, asks);
        List<ProcessedLevel> walls = OrderBookAnalytics.detectWalls(
            OrderBookAnalytics.processLevels(bids, metrics, true));

        assertEquals(1, walls.size());
        assertEquals(600, walls.get(0).quantity(), EPS);
    }

    @Test
    void testDepthProfile() {
        OrderBookMetrics metrics = OrderBookAnalytics.calculateMetrics(bids, asks);
        DepthProfile depth = OrderBookAnalytics.depthProfile(
            OrderBookAnalytics.processLevels(bids, metrics, true),
            OrderBookAnalytics.processLevels(asks, metrics, false),
            metrics.midPrice());

        assertEquals(OrderBookAnalytics.DEFAULT_DEPTH_STEPS, depth.steps());
        assertEquals(0, depth.bidDepth().get(1), EPS, "Nothing within 2% of mid");
        assertEquals(0, depth.askDepth().get(1), EPS);
        assertEquals(700, depth.bidDepth().get(2), EPS, "Whole bid side within 5%");
        assertEquals(300, depth.askDepth().get(2), EPS);
    }

    @Test
    void testMarketHeat() {
        OrderBookMetrics metrics = OrderBookAnalytics.calculateMetrics(bids, asks);
        OrderBookMetrics balanced = OrderBookAnalytics.calculateMetrics(
            List.of(level("0.70", "500")), List.of(level("0.74", "500")));

        // 50 + imbalance 8 + wide spread 15 + thin book 15
        assertEquals(88, OrderBookAnalytics.marketHeat(metrics, null), 1e-6);
        assertEquals(100, OrderBookAnalytics.marketHeat(metrics, balanced), EPS, "Clamped at 100");
    }

    @Test
    void testFormatImbalance() {
        assertEquals("40% bid", OrderBookAnalytics.formatImbalance(0.4));
        assertEquals("15% ask", OrderBookAnalytics.formatImbalance(-0.15));
        assertEquals("balanced", OrderBookAnalytics.formatImbalance(0));
    }
}
