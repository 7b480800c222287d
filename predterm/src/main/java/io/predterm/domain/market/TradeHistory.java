package io.predterm.domain.market;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Pulled page of recent trades.
 */
public record TradeHistory(
    @JsonProperty("market_id")
    String marketId,

    @JsonProperty("platform")
    Platform platform,

    @JsonProperty("trades")
    List<Trade> trades,

    @JsonProperty("next_cursor")
    String nextCursor
) {
    public TradeHistory {
        trades = trades == null ? List.of() : List.copyOf(trades);
    }
}
