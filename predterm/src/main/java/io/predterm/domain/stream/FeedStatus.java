package io.predterm.domain.stream;

/**
 * Server-side status of an upstream venue feed, as reported by {@code connection_status}.
 */
public enum FeedStatus {
    CONNECTED("connected"),
    CONNECTING("connecting"),
    DISCONNECTED("disconnected"),
    FAILED("failed");

    private final String wireName;

    FeedStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static FeedStatus fromWire(String value) {
        for (FeedStatus status : values()) {
            if (status.wireName.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown feed status: " + value);
    }
}
