package io.predterm.service.reducer;

import io.predterm.domain.market.Platform;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static io.predterm.MarketFixtures.T0;
import static io.predterm.MarketFixtures.priceUpdate;
import static org.junit.jupiter.api.Assertions.*;

class PriceReducerTest {

    @Test
    void testLastWriteWins() {
        PriceReducer reducer = new PriceReducer(Platform.POLYMARKET, "0xabc");
        assertNull(reducer.state());

        reducer.apply(priceUpdate(Platform.POLYMARKET, "0xabc", "0.61", "0.39", T0));
        reducer.apply(priceUpdate(Platform.POLYMARKET, "0xabc", "0.58", "0.42", T0.minusSeconds(5)));

        assertEquals(new BigDecimal("0.58"), reducer.state().yesPrice());
        assertEquals(new BigDecimal("0.42"), reducer.state().noPrice());
    }

    @Test
    void testIgnoresOtherMarket() {
        PriceReducer reducer = new PriceReducer(Platform.POLYMARKET, "0xabc");

        reducer.apply(priceUpdate(Platform.POLYMARKET, "0xdef", "0.61", "0.39", T0));

        assertNull(reducer.state());
    }
}
