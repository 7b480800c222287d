package io.predterm.service.analytics;

import io.predterm.domain.market.Trade;

/**
 * @param relativeSize quantity divided by the mean quantity (1 = average)
 * @param ageMillis time since the trade
 */
public record ProcessedTrade(Trade trade, double relativeSize, boolean whale, long ageMillis) {
}
