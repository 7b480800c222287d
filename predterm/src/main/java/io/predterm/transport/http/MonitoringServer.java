package io.predterm.transport.http;

import io.predterm.infrastructure.metrics.PrometheusMetricsHandler;
import io.predterm.infrastructure.stream.StreamStatus;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Small Undertow server exposing {@code /metrics} and {@code /status}.
 */
public class MonitoringServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MonitoringServer.class);

    private final String host;
    private final int port;
    private final Undertow server;
    private boolean started = false;

    public MonitoringServer(String host, int port, CollectorRegistry registry, Supplier<StreamStatus> status) {
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid monitoring port: " + port);
        }
        this.host = host;
        this.port = port;

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(registry))
            .get("/status", new StatusHandler(status))
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send("predterm monitoring\n\nGET /metrics, /status\n");
            });

        this.server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(routes)
            .build();
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        server.start();
        started = true;
        log.info("[MONITOR] Listening on http://{}:{}/ (metrics, status)", host, port);
    }

    public int port() {
        return port;
    }

    @Override
    public synchronized void close() {
        if (!started) {
            return;
        }
        server.stop();
        started = false;
        log.info("[MONITOR] Stopped");
    }
}
