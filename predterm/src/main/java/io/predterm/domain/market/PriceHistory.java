package io.predterm.domain.market;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Pulled candle series for one market.
 */
public record PriceHistory(
    @JsonProperty("market_id")
    String marketId,

    @JsonProperty("platform")
    Platform platform,

    @JsonProperty("interval")
    PriceInterval interval,

    @JsonProperty("candles")
    List<PriceCandle> candles
) {
    public PriceHistory {
        candles = candles == null ? List.of() : List.copyOf(candles);
    }

    /**
     * Close prices in series order, for price statistics.
     */
    public List<Double> closes() {
        return candles.stream()
            .filter(c -> c.close() != null)
            .map(c -> c.close().doubleValue())
            .toList();
    }
}
