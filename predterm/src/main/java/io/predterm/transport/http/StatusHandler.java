package io.predterm.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.predterm.infrastructure.stream.StreamStatus;
import io.predterm.util.Json;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * GET /status: connection state, latency, last error and active subscription keys.
 */
public class StatusHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(StatusHandler.class);
    private static final ObjectMapper MAPPER = Json.newMapper();

    private final Supplier<StreamStatus> status;

    public StatusHandler(Supplier<StreamStatus> status) {
        this.status = status;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        try {
            exchange.setStatusCode(200);
            exchange.getResponseSender().send(MAPPER.writeValueAsString(toJson(status.get())));
        } catch (JsonProcessingException e) {
            log.error("[MONITOR] Failed to render status: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("{\"error\":\"status unavailable\"}");
        }
    }

    static ObjectNode toJson(StreamStatus s) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("state", s.state().name().toLowerCase(java.util.Locale.ROOT));
        if (s.latencyMs() >= 0) {
            node.put("latencyMs", s.latencyMs());
        } else {
            node.putNull("latencyMs");
        }
        if (s.lastError() != null) {
            node.put("lastError", s.lastError());
        } else {
            node.putNull("lastError");
        }
        node.put("reconnectAttempts", s.reconnectAttempts());
        ArrayNode subs = node.putArray("subscriptions");
        s.subscriptions().forEach(subs::add);
        return node;
    }
}
