package io.predterm.service.reconcile;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic request numbering for discarding stale responses.
 *
 * A response is fresh if it is newer than the last accepted one and was not
 * issued before the most recent {@link #supersede() superseding} request.
 */
public final class RequestGeneration {

    private final AtomicLong issued = new AtomicLong();
    private volatile long accepted = 0;
    private volatile long floor = 0;

    /**
     * Issue a routine request number.
     */
    public long next() {
        return issued.incrementAndGet();
    }

    /**
     * Issue a request number that invalidates every earlier outstanding request.
     */
    public long supersede() {
        long generation = issued.incrementAndGet();
        floor = generation;
        return generation;
    }

    /**
     * Accept a response if it is fresh.
     *
     * @return false if the response is stale and must be dropped
     */
    public synchronized boolean tryAccept(long generation) {
        if (generation <= accepted || generation < floor) {
            return false;
        }
        accepted = generation;
        return true;
    }

    public long latestIssued() {
        return issued.get();
    }

    public long latestAccepted() {
        return accepted;
    }
}
