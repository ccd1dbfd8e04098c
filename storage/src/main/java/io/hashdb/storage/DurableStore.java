package io.hashdb.storage;

import io.hashdb.storage.flush.FlushBatch;

/**
 * Long-term store that receives flushed batches and answers cache misses.
 * <p>
 * Semantics:
 *  - readNode()/readProgram() return null when the key is absent and throw
 *    DurableStoreException on I/O failure. They may be slow; callers wrap them
 *    with a deadline (see DeadlineDurableStore).
 *  - commit() must be durable before returning. Committing the same batch twice is
 *    harmless: entries are content-addressed upserts.
 */
public interface DurableStore extends AutoCloseable {

    long[] readNode(String key);

    byte[] readProgram(String key);

    void commit(FlushBatch batch);

    /** Last committed state root, or "" when none was committed yet. */
    String stateRoot();

    @Override
    void close();
}
