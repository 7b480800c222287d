package io.predterm.domain.market;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Latest yes/no prices of a market.
 */
public record MarketPrices(BigDecimal yesPrice, BigDecimal noPrice, Instant timestamp) {
}
