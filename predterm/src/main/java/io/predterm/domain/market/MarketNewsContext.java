package io.predterm.domain.market;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Market a news update was published for.
 */
public record MarketNewsContext(
    @JsonProperty("platform")
    Platform platform,

    @JsonProperty("market_id")
    String marketId
) {
    public boolean matches(Platform platform, String marketId) {
        return this.platform == platform && this.marketId != null && this.marketId.equals(marketId);
    }
}
