package io.predterm.infrastructure.stream;

import io.predterm.domain.stream.ServerMessage;
import io.predterm.infrastructure.metrics.SyncMetrics;
import io.predterm.infrastructure.stream.codec.MalformedFrameException;
import io.predterm.infrastructure.stream.codec.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans decoded stream messages out to every registered handler.
 *
 * Handlers run synchronously in registration order. A handler that throws is
 * logged and counted, and the remaining handlers still get the message. The
 * handler list is copy-on-write, so a delivery in progress keeps the list it
 * started with while (un)registrations apply from the next message on.
 */
public final class MessageBus implements MessageSource {
    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    private final MessageCodec codec;
    private final SyncMetrics metrics;
    private final List<HandlerEntry> handlers = new CopyOnWriteArrayList<>();

    public MessageBus(MessageCodec codec, SyncMetrics metrics) {
        this.codec = codec;
        this.metrics = metrics;
    }

    @Override
    public Registration onMessage(MessageHandler handler) {
        HandlerEntry entry = new HandlerEntry(handler);
        handlers.add(entry);
        return () -> handlers.remove(entry);
    }

    /**
     * Decode a raw frame and dispatch it. Malformed frames are dropped.
     */
    public void dispatchFrame(String frame) {
        ServerMessage message;
        try {
            message = codec.decode(frame);
        } catch (MalformedFrameException e) {
            metrics.recordMalformedFrame();
            log.warn("[BUS] Dropping malformed frame: {} ({})", e.getMessage(), abbreviate(frame));
            return;
        }
        dispatch(message);
    }

    public void dispatch(ServerMessage message) {
        metrics.recordMessage(message.type());
        log.trace("[BUS] {} -> {} handlers", message.type(), handlers.size());
        for (HandlerEntry entry : handlers) {
            try {
                entry.handler.onMessage(message);
            } catch (Exception e) {
                metrics.recordHandlerFailure(message.type());
                log.warn("[BUS] Handler failed on {}: {}", message.type().wireName(), e.getMessage(), e);
            }
        }
    }

    public int handlerCount() {
        return handlers.size();
    }

    private static String abbreviate(String frame) {
        if (frame == null) return "null";
        return frame.length() <= 200 ? frame : frame.substring(0, 200) + "...";
    }

    // Identity wrapper: the same handler registered twice gets two independent slots.
    private static final class HandlerEntry {
        private final MessageHandler handler;

        private HandlerEntry(MessageHandler handler) {
            this.handler = handler;
        }
    }
}
