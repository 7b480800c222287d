package io.predterm.infrastructure.api;

/**
 * A pulled-snapshot request failed.
 */
public class MarketApiException extends RuntimeException {

    private final int statusCode;

    public MarketApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public MarketApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * @return HTTP status, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
