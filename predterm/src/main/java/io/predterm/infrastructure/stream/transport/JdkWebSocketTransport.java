package io.predterm.infrastructure.stream.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Transport} over {@code java.net.http.WebSocket}.
 *
 * The JDK client reports a failure through {@code onError} with no close
 * afterwards, so a synthetic close with code 1006 is raised after every error.
 */
public final class JdkWebSocketTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketTransport.class);

    private final HttpClient httpClient;
    private final Duration connectTimeout;

    public JdkWebSocketTransport(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();
    }

    @Override
    public CompletableFuture<TransportSession> connect(URI uri, TransportListener listener) {
        log.debug("[TRANSPORT] Connecting to {}", uri);
        FrameListener frames = new FrameListener(listener);
        return httpClient.newWebSocketBuilder()
            .connectTimeout(connectTimeout)
            .buildAsync(uri, frames)
            .thenApply(ws -> frames.session);
    }

    private static final class FrameListener implements WebSocket.Listener {
        private final TransportListener listener;
        private final StringBuilder buf = new StringBuilder();
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private volatile JdkSession session;

        FrameListener(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            session = new JdkSession(webSocket, closed);
            webSocket.request(1);
            listener.onOpen(session);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buf.append(data);
            if (last) {
                String msg = buf.toString();
                buf.setLength(0);
                listener.onText(msg);
            }
            webSocket.request(1);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            if (closed.compareAndSet(false, true)) {
                listener.onClose(statusCode, reason);
            }
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.warn("[TRANSPORT] WebSocket error: {}", error.toString());
            listener.onError(error);
            if (closed.compareAndSet(false, true)) {
                listener.onClose(TransportListener.ABNORMAL_CLOSURE, String.valueOf(error.getMessage()));
            }
        }
    }

    private static final class JdkSession implements TransportSession {
        private final WebSocket webSocket;
        private final AtomicBoolean closed;
        // The JDK rejects a send while the previous one is pending.
        private CompletableFuture<WebSocket> sendChain = CompletableFuture.completedFuture(null);

        JdkSession(WebSocket webSocket, AtomicBoolean closed) {
            this.webSocket = webSocket;
            this.closed = closed;
        }

        @Override
        public synchronized boolean send(String text) {
            if (!isOpen()) {
                return false;
            }
            sendChain = sendChain
                .thenCompose(ws -> webSocket.sendText(text, true))
                .exceptionally(e -> {
                    log.warn("[TRANSPORT] Send failed: {}", e.toString());
                    return webSocket;
                });
            return true;
        }

        @Override
        public void close(int code, String reason) {
            if (webSocket.isOutputClosed()) {
                return;
            }
            webSocket.sendClose(code, reason).whenComplete((ws, e) -> {
                if (e != null) {
                    log.debug("[TRANSPORT] Close handshake failed, aborting: {}", e.toString());
                    webSocket.abort();
                }
            });
        }

        @Override
        public boolean isOpen() {
            return !closed.get() && !webSocket.isOutputClosed();
        }
    }
}
