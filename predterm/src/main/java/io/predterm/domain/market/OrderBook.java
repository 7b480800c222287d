package io.predterm.domain.market;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Full four-sided order book of a binary market.
 *
 * Sides are always kept sorted: bids price-descending, asks price-ascending.
 * The canonical constructor re-sorts its inputs so every construction path
 * (snapshot, delta replace, pulled REST book) yields ordered sides.
 */
public record OrderBook(
    @JsonProperty("market_id")
    String marketId,

    @JsonProperty("platform")
    Platform platform,

    @JsonProperty("timestamp")
    Instant timestamp,

    @JsonProperty("yes_bids")
    List<OrderBookLevel> yesBids,

    @JsonProperty("yes_asks")
    List<OrderBookLevel> yesAsks,

    @JsonProperty("no_bids")
    List<OrderBookLevel> noBids,

    @JsonProperty("no_asks")
    List<OrderBookLevel> noAsks,

    @JsonProperty("sequence")
    Long sequence
) {
    private static final Comparator<OrderBookLevel> BIDS = Comparator.comparing(OrderBookLevel::price).reversed();
    private static final Comparator<OrderBookLevel> ASKS = Comparator.comparing(OrderBookLevel::price);

    public OrderBook {
        yesBids = sorted(yesBids, BIDS);
        yesAsks = sorted(yesAsks, ASKS);
        noBids = sorted(noBids, BIDS);
        noAsks = sorted(noAsks, ASKS);
    }

    public static OrderBook empty(Platform platform, String marketId) {
        return new OrderBook(marketId, platform, null, List.of(), List.of(), List.of(), List.of(), null);
    }

    public boolean isEmpty() {
        return yesBids.isEmpty() && yesAsks.isEmpty() && noBids.isEmpty() && noAsks.isEmpty();
    }

    private static List<OrderBookLevel> sorted(List<OrderBookLevel> levels, Comparator<OrderBookLevel> order) {
        if (levels == null || levels.isEmpty()) {
            return List.of();
        }
        List<OrderBookLevel> copy = new ArrayList<>(levels);
        copy.sort(order);
        return List.copyOf(copy);
    }
}
