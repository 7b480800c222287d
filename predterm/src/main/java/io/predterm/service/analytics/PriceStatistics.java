package io.predterm.service.analytics;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Range and volatility over a price series (e.g. {@code PriceHistory.closes()}).
 */
public final class PriceStatistics {

    public static Optional<PriceRange> range(List<Double> prices) {
        if (prices.isEmpty()) {
            return Optional.empty();
        }
        double high = prices.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
        double low = prices.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
        double range = high - low;
        double mid = (high + low) / 2;
        return Optional.of(new PriceRange(high, low, range, mid, mid > 0 ? range / mid * 100 : 0));
    }

    /**
     * Empty when fewer than two prices, or when no step starts from a positive price.
     */
    public static Optional<VolatilityMetrics> volatility(List<Double> prices) {
        if (prices.size() < 2) {
            return Optional.empty();
        }
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < prices.size(); i++) {
            double prev = prices.get(i - 1);
            if (prev > 0) {
                returns.add((prices.get(i) - prev) / prev);
            }
        }
        if (returns.isEmpty()) {
            return Optional.empty();
        }

        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double variance = returns.stream().mapToDouble(r -> (r - mean) * (r - mean)).sum() / returns.size();
        double avgChange = returns.stream().mapToDouble(Math::abs).average().orElse(0);
        return Optional.of(new VolatilityMetrics(Math.sqrt(variance) * 100, avgChange * 100));
    }

    private PriceStatistics() {}
}
