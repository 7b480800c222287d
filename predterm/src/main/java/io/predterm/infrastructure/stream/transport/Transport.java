package io.predterm.infrastructure.stream.transport;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens text-frame sessions to the stream server.
 *
 * Each call to {@link #connect} yields an independent session. The returned
 * future completes exceptionally when the handshake fails; in that case no
 * listener callbacks are made.
 */
public interface Transport {

    CompletableFuture<TransportSession> connect(URI uri, TransportListener listener);
}
