package io.predterm.domain.market;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One outcome of a multi-outcome event.
 *
 * Trades may reference any of the three ids, so lookups index all of them.
 */
public record MarketOption(
    @JsonProperty("name")
    String name,

    @JsonProperty("market_id")
    String marketId,

    @JsonProperty("clob_token_id")
    String clobTokenId,     // id used for stream subscriptions

    @JsonProperty("condition_id")
    String conditionId
) {
    /**
     * Id to subscribe the trades channel with.
     */
    public String streamId() {
        return clobTokenId != null ? clobTokenId : marketId;
    }
}
