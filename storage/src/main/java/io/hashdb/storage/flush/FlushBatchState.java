package io.hashdb.storage.flush;

/**
 * Lifecycle of a closed flush batch: PENDING -> STORING -> STORED.
 */
public enum FlushBatchState {
    /** Closed, not yet pulled by a durable writer. */
    PENDING,
    /** Pulled by a durable writer; commit in flight. */
    STORING,
    /** Commit acknowledged. Terminal. */
    STORED
}
