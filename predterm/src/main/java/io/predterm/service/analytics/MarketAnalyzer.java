package io.predterm.service.analytics;

import io.predterm.domain.market.MarketPrices;
import io.predterm.domain.market.OrderBook;
import io.predterm.service.reconcile.ReconciledMarketView;

import java.time.Duration;
import java.time.Instant;

/**
 * Runs the analytics over successive views of one market.
 *
 * Book metrics are recomputed only when the book instance changes. The
 * previous distinct yes price is kept as the baseline for the price trend,
 * and the previous distinct book metrics as the baseline for market heat.
 */
public class MarketAnalyzer {

    private final TradeMomentumCalculator momentumCalculator;
    private final Memoizer<OrderBook, OrderBookMetrics> bookMetrics =
        new Memoizer<>(book -> OrderBookAnalytics.calculateMetrics(book.yesBids(), book.yesAsks()));

    private OrderBookMetrics lastMetrics;
    private OrderBookMetrics previousMetrics;
    private double lastPrice;
    private double previousPrice;

    public MarketAnalyzer(Duration tradeWindow, double whaleThreshold) {
        this.momentumCalculator = new TradeMomentumCalculator(tradeWindow, whaleThreshold);
    }

    public synchronized MarketInsight analyze(ReconciledMarketView view, Instant now) {
        OrderBookMetrics metrics = null;
        double heat = 0;
        if (view.hasOrderBook()) {
            metrics = bookMetrics.apply(view.orderBook());
            if (metrics != lastMetrics) {
                previousMetrics = lastMetrics;
                lastMetrics = metrics;
            }
            heat = OrderBookAnalytics.marketHeat(metrics, previousMetrics);
        }

        MarketPrices prices = view.prices();
        if (prices != null && prices.yesPrice() != null) {
            double price = prices.yesPrice().doubleValue();
            if (price != lastPrice) {
                previousPrice = lastPrice;
                lastPrice = price;
            }
        }

        TradeMomentum momentum = momentumCalculator.calculate(view.trades(), now);
        SentimentInputs inputs = SentimentInputs.defaults()
            .withOrderBookImbalance(metrics == null ? 0 : metrics.imbalanceRatio())
            .withTradeMomentum(view.trades().isEmpty() ? null : momentum)
            .withPrices(lastPrice, previousPrice);

        return new MarketInsight(metrics, heat, momentum, SentimentCalculator.calculate(inputs));
    }
}
