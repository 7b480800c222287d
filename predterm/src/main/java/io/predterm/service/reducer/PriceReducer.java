package io.predterm.service.reducer;

import io.predterm.domain.market.MarketPrices;
import io.predterm.domain.market.Platform;
import io.predterm.domain.stream.ServerMessage;

/**
 * Latest yes/no price of one market. Last write wins.
 */
public class PriceReducer extends ChannelReducer<MarketPrices> {

    private final Platform platform;
    private final String marketId;

    public PriceReducer(Platform platform, String marketId) {
        super(null);
        this.platform = platform;
        this.marketId = marketId;
    }

    @Override
    protected MarketPrices reduce(MarketPrices current, ServerMessage message) {
        if (!(message instanceof ServerMessage.PriceUpdate)) {
            return current;
        }
        ServerMessage.PriceUpdate update = (ServerMessage.PriceUpdate) message;
        if (!update.isFor(platform, marketId)) {
            return current;
        }
        return new MarketPrices(update.yesPrice(), update.noPrice(), update.timestamp());
    }
}
