package io.predterm.service.reconcile;

/**
 * Where a reconciled value came from.
 */
public enum DataSource {
    /** Pushed over the stream. */
    PUSH,
    /** Pulled snapshot, used until the stream delivers. */
    PULL,
    /** Neither source has data yet. */
    NONE
}
