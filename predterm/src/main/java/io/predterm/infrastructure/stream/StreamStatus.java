package io.predterm.infrastructure.stream;

import io.predterm.domain.stream.ConnectionState;

import java.util.List;

/**
 * Point-in-time view of the connection for status endpoints.
 */
public record StreamStatus(
    ConnectionState state,
    long latencyMs,
    String lastError,
    int reconnectAttempts,
    List<String> subscriptions
) {
}
