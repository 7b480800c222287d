package io.predterm.service.analytics;

/**
 * @param volatility population standard deviation of step returns, in percent
 * @param averageChange mean absolute step return, in percent
 */
public record VolatilityMetrics(double volatility, double averageChange) {
}
