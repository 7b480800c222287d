package io.predterm.domain.market;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

public record PriceCandle(
    @JsonProperty("timestamp")
    Instant timestamp,

    @JsonProperty("open")
    BigDecimal open,

    @JsonProperty("high")
    BigDecimal high,

    @JsonProperty("low")
    BigDecimal low,

    @JsonProperty("close")
    BigDecimal close,

    @JsonProperty("volume")
    BigDecimal volume,

    @JsonProperty("buy_volume")
    BigDecimal buyVolume,    // taker buys

    @JsonProperty("sell_volume")
    BigDecimal sellVolume    // taker sells
) {
}
