package io.predterm.domain.market;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Executed trade. Identity is {@link #id()}.
 *
 * Outcome and side are kept as the venue sends them ("Yes"/"yes", "Buy"/"buy");
 * use {@link #isBuy()} rather than comparing strings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Trade(
    @JsonProperty("id")
    String id,

    @JsonProperty("market_id")
    String marketId,

    @JsonProperty("platform")
    Platform platform,

    @JsonProperty("timestamp")
    Instant timestamp,

    @JsonProperty("price")
    BigDecimal price,

    @JsonProperty("quantity")
    BigDecimal quantity,

    @JsonProperty("outcome")
    String outcome,

    @JsonProperty("side")
    String side,

    @JsonProperty("outcome_name")
    String outcomeName,      // multi-outcome events only

    @JsonProperty("transaction_hash")
    String transactionHash   // on-chain venues only
) {
    public Trade {
        Objects.requireNonNull(id, "id");
    }

    public Trade(String id, String marketId, Platform platform, Instant timestamp,
                 BigDecimal price, BigDecimal quantity, String outcome, String side) {
        this(id, marketId, platform, timestamp, price, quantity, outcome, side, null, null);
    }

    public boolean isBuy() {
        return side != null && side.equalsIgnoreCase("buy");
    }

    public double quantityValue() {
        return quantity == null ? 0.0 : quantity.doubleValue();
    }

    public Trade withOutcomeName(String name) {
        return new Trade(id, marketId, platform, timestamp, price, quantity, outcome, side, name, transactionHash);
    }
}
