package io.predterm.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Serves a {@link CollectorRegistry} in Prometheus text format.
 *
 * Repeated {@code name[]} query parameters restrict the output to those
 * metric families, as the standard exporters do.
 *
 * <pre>
 * # HELP predterm_stream_messages_total Inbound stream messages by type
 * # TYPE predterm_stream_messages_total counter
 * predterm_stream_messages_total{type="price_update",} 412.0
 * predterm_stream_messages_total{type="trade_update",} 57.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Deque<String> names = exchange.getQueryParameters().get("name[]");
        Set<String> include = names == null ? Set.of() : new HashSet<>(names);

        StringWriter body = new StringWriter();
        try {
            TextFormat.write004(body, include.isEmpty()
                ? registry.metricFamilySamples()
                : registry.filteredMetricFamilySamples(include));
        } catch (IOException e) {
            log.error("[MONITOR] Metrics export failed: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
            return;
        }

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        exchange.getResponseSender().send(body.toString());
        log.debug("[MONITOR] /metrics {} families requested, {} chars",
            include.isEmpty() ? "all" : include.size(), body.getBuffer().length());
    }
}
