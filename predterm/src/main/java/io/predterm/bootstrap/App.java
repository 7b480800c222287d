package io.predterm.bootstrap;

import io.predterm.config.SyncConfig;
import io.predterm.domain.market.Platform;
import io.predterm.infrastructure.api.HttpMarketApiClient;
import io.predterm.infrastructure.api.MarketApiClient;
import io.predterm.infrastructure.metrics.PrometheusSyncMetrics;
import io.predterm.infrastructure.metrics.SyncMetrics;
import io.predterm.infrastructure.stream.ConnectionListener;
import io.predterm.infrastructure.stream.ConnectionManager;
import io.predterm.infrastructure.stream.StreamError;
import io.predterm.infrastructure.stream.common.EventLoop;
import io.predterm.infrastructure.stream.common.ExecutorEventLoop;
import io.predterm.infrastructure.stream.transport.JdkWebSocketTransport;
import io.predterm.service.analytics.MarketAnalyzer;
import io.predterm.service.analytics.MarketInsight;
import io.predterm.service.analytics.OrderBookAnalytics;
import io.predterm.service.reconcile.ReconciledMarket;
import io.predterm.service.reconcile.ReconciledMarketView;
import io.predterm.service.reconcile.SnapshotPoller;
import io.predterm.service.reducer.MarketStream;
import io.predterm.service.reducer.NewsStream;
import io.predterm.transport.http.MonitoringServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command line entry point.
 *
 * <pre>
 * App polymarket:0xabc... kalshi:KXBTC-25
 * </pre>
 *
 * Connects the shared stream, follows each market (push plus pulled
 * snapshots) and logs a line of analytics on every reconciled update.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        List<MarketRef> markets;
        try {
            markets = parseMarkets(args);
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            log.error("Usage: App <platform>:<marketId> [<platform>:<marketId> ...]");
            System.exit(2);
            return;
        }

        SyncConfig config = SyncConfig.fromEnv().validate();
        log.info("=== predterm sync starting ({} market(s), stream {}) ===", markets.size(), config.wsUrl());

        PrometheusSyncMetrics metrics = new PrometheusSyncMetrics();
        ExecutorEventLoop loop = new ExecutorEventLoop("predterm-sync");
        ConnectionManager connection = new ConnectionManager(
            config, new JdkWebSocketTransport(config.connectTimeout()), loop, metrics);
        connection.addListener(new ConnectionListener() {
            @Override
            public void onError(StreamError error) {
                if (error.fatal()) {
                    log.error("[APP] {} (call retry to resume)", error.message());
                }
            }
        });

        MarketApiClient api = new HttpMarketApiClient(config.apiBaseUrl(), metrics);
        List<AutoCloseable> resources = new ArrayList<>();

        NewsStream news = NewsStream.global(connection, config.maxNewsItems());
        news.addListener(items -> {
            if (!items.isEmpty()) {
                log.info("[NEWS] {}", items.get(0).title());
            }
        });
        resources.add(news);

        for (MarketRef market : markets) {
            resources.addAll(followMarket(market, config, connection, api, loop, metrics));
        }

        MonitoringServer monitoring = null;
        if (config.monitoringPort() > 0) {
            monitoring = new MonitoringServer("0.0.0.0", config.monitoringPort(), metrics.getRegistry(), connection::status);
            monitoring.start();
        }
        MonitoringServer finalMonitoring = monitoring;

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("=== predterm sync shutting down ===");
            closeAll(resources);
            if (finalMonitoring != null) {
                finalMonitoring.close();
            }
            connection.close();
        }, "predterm-shutdown"));

        connection.start();
    }

    /**
     * Wires push stream, pulled snapshots and analytics for one market.
     *
     * @return what to close on shutdown, in closing order
     */
    static List<AutoCloseable> followMarket(MarketRef market, SyncConfig config, ConnectionManager connection,
                                            MarketApiClient api, EventLoop loop, SyncMetrics metrics) {
        MarketStream stream = MarketStream.open(connection, market.platform(), market.marketId(),
            MarketStream.Options.defaults().withMaxTrades(config.maxTrades()));
        SnapshotPoller poller = new SnapshotPoller(api, loop, market.platform(), market.marketId(),
            config.snapshotPollInterval(), config.maxTrades(), metrics,
            e -> log.warn("[APP] Snapshot fetch for {} failed: {}", market, e.getMessage()));
        ReconciledMarket reconciled = new ReconciledMarket(stream, poller, config.maxTrades());
        MarketAnalyzer analyzer = new MarketAnalyzer(config.tradeWindow(), config.whaleThresholdMultiplier());
        reconciled.addListener(view -> logInsight(view, analyzer.analyze(view, Instant.now())));
        poller.start();
        // The view detaches first, then its sources stop.
        return List.of(reconciled, poller, stream);
    }

    static void closeAll(List<AutoCloseable> resources) {
        for (AutoCloseable resource : resources) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("[APP] Error closing {}: {}", resource, e.getMessage());
            }
        }
    }

    static List<MarketRef> parseMarkets(String[] args) {
        if (args.length == 0) {
            throw new IllegalArgumentException("No markets given");
        }
        List<MarketRef> markets = new ArrayList<>();
        for (String arg : args) {
            int sep = arg.indexOf(':');
            if (sep <= 0 || sep == arg.length() - 1) {
                throw new IllegalArgumentException("Expected <platform>:<marketId>, got '" + arg + "'");
            }
            markets.add(new MarketRef(Platform.fromWire(arg.substring(0, sep)), arg.substring(sep + 1)));
        }
        return markets;
    }

    private static void logInsight(ReconciledMarketView view, MarketInsight insight) {
        String book = insight.bookMetrics() == null ? "no book"
            : String.format(Locale.ROOT, "mid %.3f spread %.3f %s heat %.0f",
                insight.bookMetrics().midPrice(),
                insight.bookMetrics().spread(),
                OrderBookAnalytics.formatImbalance(insight.bookMetrics().imbalanceRatio()),
                insight.marketHeat());
        log.info("[APP] {}:{} [{}/{}/{}] {} | flow {} ({} trades/min) | {} ({}, conf {})",
            view.platform(), view.marketId(),
            view.pricesSource(), view.orderBookSource(), view.tradesSource(),
            book,
            insight.momentum().direction(),
            String.format(Locale.ROOT, "%.1f", insight.momentum().velocity()),
            insight.sentiment().label().displayName(),
            String.format(Locale.ROOT, "%.0f", insight.sentiment().score()),
            String.format(Locale.ROOT, "%.2f", insight.sentiment().confidence()));
    }

    record MarketRef(Platform platform, String marketId) {
        @Override
        public String toString() {
            return platform.wireName() + ":" + marketId;
        }
    }

    private App() {}
}
