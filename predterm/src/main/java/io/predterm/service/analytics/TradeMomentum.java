package io.predterm.service.analytics;

import io.predterm.domain.market.Trade;

/**
 * Buy/sell pressure over a trailing window.
 *
 * @param momentumRatio net / total volume in [-1, 1]; 1 is all buys
 * @param velocity trades per minute
 * @param largestTrade biggest trade in the window, or null
 * @param hasWhale whether any trade exceeded the whale multiple of the window mean
 */
public record TradeMomentum(
    double netVolume,
    double buyVolume,
    double sellVolume,
    int buyCount,
    int sellCount,
    double momentumRatio,
    boolean accelerating,
    TradeDirection direction,
    double velocity,
    Trade largestTrade,
    boolean hasWhale
) {
    public static TradeMomentum empty() {
        return new TradeMomentum(0, 0, 0, 0, 0, 0, false, TradeDirection.NEUTRAL, 0, null, false);
    }
}
