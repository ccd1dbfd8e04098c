package io.hashdb.storage.flush;

/**
 * Answer to a flush-data pull.
 *
 * @param batch the requested batch, or null when nothing is outstanding
 */
public record FlushData(long storedFlushId, FlushBatch batch) {

    public long flushId() {
        return batch == null ? 0L : batch.flushId();
    }
}
