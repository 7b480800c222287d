package io.predterm.domain.market;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One price level of an order book side.
 */
public record OrderBookLevel(
    @JsonProperty("price")
    BigDecimal price,

    @JsonProperty("quantity")
    BigDecimal quantity,

    @JsonProperty("order_count")
    Integer orderCount     // null when the venue does not report it
) {
    public OrderBookLevel {
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(quantity, "quantity");
    }

    public static OrderBookLevel of(String price, String quantity) {
        return new OrderBookLevel(new BigDecimal(price), new BigDecimal(quantity), null);
    }
}
