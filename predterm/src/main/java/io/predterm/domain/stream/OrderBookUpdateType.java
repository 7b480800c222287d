package io.predterm.domain.stream;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OrderBookUpdateType {
    SNAPSHOT("snapshot"),
    DELTA("delta");

    private final String wireName;

    OrderBookUpdateType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static OrderBookUpdateType fromWire(String value) {
        for (OrderBookUpdateType t : values()) {
            if (t.wireName.equals(value)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown order book update type: " + value);
    }
}
