package io.hashdb.storage.flush;

/**
 * Snapshot of flush progress for monitoring and backpressure decisions.
 * Always {@code storedFlushId <= storingFlushId <= lastFlushId}.
 */
public record FlushStatus(
        long storedFlushId,
        long storingFlushId,
        long lastFlushId,
        long pendingToFlushNodes,
        long pendingToFlushPrograms,
        long storingNodes,
        long storingPrograms,
        String proverId
) {}
