package io.predterm.service.analytics;

public enum TradeDirection {
    BUY,
    SELL,
    NEUTRAL
}
