package io.predterm.service.analytics;

import io.predterm.domain.market.OrderBookLevel;

/**
 * A book level annotated for depth and heatmap display.
 *
 * @param intensity heat in [0, 1]
 */
public record ProcessedLevel(
    OrderBookLevel level,
    double price,
    double quantity,
    double cumulativeQuantity,
    double distanceFromMid,
    double intensity,
    boolean wall
) {
}
