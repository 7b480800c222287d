package io.predterm.domain.stream;

/**
 * Error codes carried by server {@code error} frames.
 */
public enum ErrorCode {
    INVALID_MESSAGE("invalid_message"),
    UNKNOWN_SUBSCRIPTION("unknown_subscription"),
    MARKET_NOT_FOUND("market_not_found"),
    PLATFORM_ERROR("platform_error"),
    RATE_LIMITED("rate_limited"),
    INTERNAL_ERROR("internal_error"),
    UNKNOWN("unknown");    // newer server codes

    private final String wireName;

    ErrorCode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ErrorCode fromWire(String value) {
        for (ErrorCode code : values()) {
            if (code.wireName.equals(value)) {
                return code;
            }
        }
        return UNKNOWN;
    }
}
