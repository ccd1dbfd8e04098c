package io.hashdb.core;

/**
 * Closed set of outcomes reported by every hash database operation.
 */
public enum ResultCode {
    SUCCESS,
    /** Root or hash could not be resolved in any storage tier. */
    DB_KEY_NOT_FOUND,
    /** Durable-store I/O failure (transient or permanent, not distinguished). */
    DB_ERROR,
    /** Invariant violation, e.g. malformed traversal state. */
    INTERNAL_ERROR,
    /** A stored node's serialized size failed the expected bounds on decode. */
    SMT_INVALID_DATA_SIZE
}
