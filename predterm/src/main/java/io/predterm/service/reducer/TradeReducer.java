package io.predterm.service.reducer;

import io.predterm.domain.market.Platform;
import io.predterm.domain.market.Trade;
import io.predterm.domain.stream.ServerMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Recent trades of one market, newest first, unique by id, capped.
 */
public class TradeReducer extends ChannelReducer<List<Trade>> {

    private final Platform platform;
    private final String marketId;
    private final int maxTrades;

    public TradeReducer(Platform platform, String marketId, int maxTrades) {
        super(List.of());
        if (maxTrades <= 0) {
            throw new IllegalArgumentException("maxTrades must be positive");
        }
        this.platform = platform;
        this.marketId = marketId;
        this.maxTrades = maxTrades;
    }

    @Override
    protected List<Trade> reduce(List<Trade> current, ServerMessage message) {
        if (!(message instanceof ServerMessage.TradeUpdate)) {
            return current;
        }
        ServerMessage.TradeUpdate update = (ServerMessage.TradeUpdate) message;
        if (!update.isFor(platform, marketId)) {
            return current;
        }
        Trade trade = update.trade();
        for (Trade existing : current) {
            if (existing.id().equals(trade.id())) {
                return current;
            }
        }
        List<Trade> next = new ArrayList<>(Math.min(current.size() + 1, maxTrades));
        next.add(trade);
        for (int i = 0; i < current.size() && next.size() < maxTrades; i++) {
            next.add(current.get(i));
        }
        return List.copyOf(next);
    }
}
