package io.predterm.domain.market;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Prediction-market venue a market lives on.
 */
public enum Platform {
    KALSHI("kalshi"),
    POLYMARKET("polymarket");

    private final String wireName;

    Platform(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parse wire form (case-insensitive).
     *
     * @throws IllegalArgumentException for an unknown platform
     */
    @JsonCreator
    public static Platform fromWire(String value) {
        if (value != null) {
            for (Platform p : values()) {
                if (p.wireName.equalsIgnoreCase(value.trim())) {
                    return p;
                }
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
