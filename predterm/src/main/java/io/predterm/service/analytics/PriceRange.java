package io.predterm.service.analytics;

public record PriceRange(double high, double low, double range, double mid, double rangePercent) {
}
