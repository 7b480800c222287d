package io.predterm.infrastructure.stream;

import io.predterm.domain.stream.Subscription;
import io.predterm.infrastructure.metrics.SyncMetrics;
import io.predterm.infrastructure.stream.codec.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The set of channels this client wants, keyed by {@link Subscription#key()}.
 *
 * A channel is present while it was {@link #subscribe explicitly subscribed}
 * or at least one {@link #acquire lease} on it is outstanding. Wire commands
 * are only sent on presence changes, so any number of consumers share one
 * server subscription. {@link #replay()} re-sends the whole set, in insertion
 * order, after every (re)connect.
 *
 * Mutators must be called on the connection's event loop.
 * {@link #subscriptions()} may be read from any thread.
 */
public final class SubscriptionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final MessageCodec codec;
    private final FrameSender sender;
    private final SyncMetrics metrics;

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Set<String> confirmed = new HashSet<>();
    private volatile List<Subscription> snapshot = List.of();

    public SubscriptionRegistry(MessageCodec codec, FrameSender sender, SyncMetrics metrics) {
        this.codec = codec;
        this.sender = sender;
        this.metrics = metrics;
    }

    /**
     * Record interest in a channel. Idempotent.
     */
    public void subscribe(Subscription subscription) {
        Entry entry = entries.get(subscription.key());
        if (entry != null) {
            entry.explicit = true;
            return;
        }
        entry = new Entry(subscription);
        entry.explicit = true;
        add(entry);
    }

    /**
     * Drop a channel, including any outstanding leases on it.
     */
    public void unsubscribe(Subscription subscription) {
        Entry entry = entries.remove(subscription.key());
        if (entry == null) {
            return;
        }
        removed(entry);
    }

    /**
     * Take a counted lease on a channel; the wire subscribe goes out on the first one.
     */
    public SubscriptionLease acquire(Subscription subscription) {
        Entry entry = entries.get(subscription.key());
        if (entry == null) {
            entry = new Entry(subscription);
            add(entry);
        }
        entry.leases++;
        Entry leased = entry;
        log.debug("[REGISTRY] Lease on {} ({} outstanding)", subscription.key(), entry.leases);
        return new SubscriptionLease(subscription, () -> release(leased));
    }

    /**
     * Send subscribe for every channel, in insertion order. Called once per successful open.
     */
    public void replay() {
        confirmed.clear();
        if (entries.isEmpty()) {
            return;
        }
        log.info("[REGISTRY] Replaying {} subscriptions", entries.size());
        for (Entry entry : entries.values()) {
            sender.send(codec.encodeSubscribe(entry.subscription));
        }
    }

    public void onSubscribed(Subscription subscription) {
        if (entries.containsKey(subscription.key())) {
            confirmed.add(subscription.key());
        } else {
            log.debug("[REGISTRY] Ack for channel no longer wanted: {}", subscription.key());
        }
    }

    public void onUnsubscribed(Subscription subscription) {
        confirmed.remove(subscription.key());
    }

    public void onDisconnect() {
        confirmed.clear();
    }

    public boolean contains(Subscription subscription) {
        return entries.containsKey(subscription.key());
    }

    public boolean isConfirmed(Subscription subscription) {
        return confirmed.contains(subscription.key());
    }

    public int leaseCount(Subscription subscription) {
        Entry entry = entries.get(subscription.key());
        return entry == null ? 0 : entry.leases;
    }

    /**
     * Current channels in insertion order. Safe from any thread.
     */
    public List<Subscription> subscriptions() {
        return snapshot;
    }

    public int size() {
        return snapshot.size();
    }

    private void release(Entry entry) {
        // Entry replaced or dropped by an explicit unsubscribe: nothing to give back.
        if (entries.get(entry.subscription.key()) != entry) {
            return;
        }
        entry.leases--;
        log.debug("[REGISTRY] Released {} ({} outstanding)", entry.subscription.key(), entry.leases);
        if (entry.leases <= 0 && !entry.explicit) {
            entries.remove(entry.subscription.key());
            removed(entry);
        }
    }

    private void add(Entry entry) {
        entries.put(entry.subscription.key(), entry);
        refreshSnapshot();
        log.info("[REGISTRY] + {}", entry.subscription.key());
        if (sender.isConnected()) {
            sender.send(codec.encodeSubscribe(entry.subscription));
        }
    }

    private void removed(Entry entry) {
        confirmed.remove(entry.subscription.key());
        refreshSnapshot();
        log.info("[REGISTRY] - {}", entry.subscription.key());
        if (sender.isConnected()) {
            sender.send(codec.encodeUnsubscribe(entry.subscription));
        }
    }

    private void refreshSnapshot() {
        List<Subscription> current = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            current.add(entry.subscription);
        }
        snapshot = List.copyOf(current);
        metrics.updateSubscriptionCount(current.size());
    }

    private static final class Entry {
        private final Subscription subscription;
        private int leases;
        private boolean explicit;

        private Entry(Subscription subscription) {
            this.subscription = subscription;
        }
    }
}
