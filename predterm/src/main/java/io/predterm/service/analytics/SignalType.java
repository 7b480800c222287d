package io.predterm.service.analytics;

public enum SignalType {
    BULLISH,
    BEARISH,
    NEUTRAL
}
