package io.predterm.service.reducer;

import io.predterm.domain.market.MarketOption;
import io.predterm.domain.market.Platform;
import io.predterm.domain.market.Trade;
import io.predterm.domain.stream.ServerMessage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Trades across all outcome markets of a multi-outcome event.
 *
 * Each trade is labelled with its outcome name, looked up by market id,
 * CLOB token id or condition id. The list is unique by id, newest first by
 * trade timestamp and capped.
 */
public class EventTradeReducer extends ChannelReducer<List<Trade>> {

    static final String UNKNOWN_OUTCOME = "Unknown";

    private static final Comparator<Trade> NEWEST_FIRST = Comparator.comparing(
        (Trade t) -> t.timestamp() == null ? Instant.EPOCH : t.timestamp()).reversed();

    private final Platform platform;
    private final Map<String, MarketOption> outcomes = new HashMap<>();
    private final int maxTrades;

    public EventTradeReducer(Platform platform, List<MarketOption> options, int maxTrades) {
        super(List.of());
        if (maxTrades <= 0) {
            throw new IllegalArgumentException("maxTrades must be positive");
        }
        this.platform = platform;
        this.maxTrades = maxTrades;
        for (MarketOption option : options) {
            index(option.marketId(), option);
            index(option.clobTokenId(), option);
            index(option.conditionId(), option);
        }
    }

    @Override
    protected List<Trade> reduce(List<Trade> current, ServerMessage message) {
        if (!(message instanceof ServerMessage.TradeUpdate)) {
            return current;
        }
        ServerMessage.TradeUpdate update = (ServerMessage.TradeUpdate) message;
        if (update.platform() != platform) {
            return current;
        }
        MarketOption option = outcomes.get(update.marketId());
        if (option == null) {
            option = outcomes.get(update.trade().marketId());
        }
        if (option == null) {
            return current;
        }
        Trade trade = update.trade();
        for (Trade existing : current) {
            if (existing.id().equals(trade.id())) {
                return current;
            }
        }
        String name = option.name() != null ? option.name() : UNKNOWN_OUTCOME;
        List<Trade> next = new ArrayList<>(current.size() + 1);
        next.add(trade.withOutcomeName(name));
        next.addAll(current);
        next.sort(NEWEST_FIRST);
        return List.copyOf(next.size() > maxTrades ? next.subList(0, maxTrades) : next);
    }

    private void index(String id, MarketOption option) {
        if (id != null && !id.isEmpty()) {
            outcomes.put(id, option);
        }
    }
}
