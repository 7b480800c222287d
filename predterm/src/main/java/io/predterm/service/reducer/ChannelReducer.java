package io.predterm.service.reducer;

import io.predterm.domain.stream.ServerMessage;
import io.predterm.infrastructure.stream.MessageSource;
import io.predterm.infrastructure.stream.Registration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Folds the messages of one channel into an immutable state value.
 *
 * Subclasses implement {@link #reduce}, which must ignore messages for other
 * channels by returning the current state unchanged. State is replaced, never
 * mutated, so {@link #state()} is safe to read from any thread.
 *
 * @param <S> state type; {@code null} until the first relevant message
 */
public abstract class ChannelReducer<S> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChannelReducer.class);

    private final List<Consumer<S>> listeners = new CopyOnWriteArrayList<>();
    private volatile S state;
    private Registration registration;

    protected ChannelReducer(S initial) {
        this.state = initial;
    }

    /**
     * Start receiving messages from the source.
     */
    public synchronized ChannelReducer<S> attach(MessageSource source) {
        if (registration != null) {
            throw new IllegalStateException(getClass().getSimpleName() + " already attached");
        }
        registration = source.onMessage(this::apply);
        return this;
    }

    /**
     * Apply one message. Listeners are told only when the state actually changed.
     */
    public void apply(ServerMessage message) {
        S current = state;
        S next = reduce(current, message);
        if (next == current) {
            return;
        }
        state = next;
        for (Consumer<S> listener : listeners) {
            try {
                listener.accept(next);
            } catch (Exception e) {
                log.warn("[REDUCER] {} listener failed: {}", getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    public S state() {
        return state;
    }

    public Registration addListener(Consumer<S> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Stop receiving messages. State is kept.
     */
    @Override
    public synchronized void close() {
        if (registration != null) {
            registration.remove();
            registration = null;
        }
    }

    /**
     * @return the next state, or {@code current} itself when the message does not apply
     */
    protected abstract S reduce(S current, ServerMessage message);
}
