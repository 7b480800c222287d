package io.predterm.service.reconcile;

import io.predterm.domain.market.OrderBook;
import io.predterm.domain.market.Trade;

import java.time.Instant;
import java.util.List;

/**
 * One accepted result of the snapshot poller.
 *
 * @param generation request generation that produced it
 */
public record PulledSnapshot(OrderBook orderBook, List<Trade> trades, long generation, Instant fetchedAt) {

    public PulledSnapshot {
        trades = trades == null ? List.of() : List.copyOf(trades);
    }
}
