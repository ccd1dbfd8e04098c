package io.hashdb.core.smt;

import io.hashdb.core.FieldElementTuple;
import io.hashdb.core.ReadLog;

import java.util.Map;

/**
 * Storage seen by the SMT engine.
 * <p>
 * Semantics:
 *  - read(): returns the 12-limb entry for a hash, consulting the write buffer, the cache
 *    and finally the durable store. Reads that reach the durable store are added to
 *    {@code readLog} when it is not null. Throws HashDbException(DB_KEY_NOT_FOUND) when
 *    the hash is unknown and HashDbException(DB_ERROR) on durable-store failure.
 *  - stage(): hands every node created by one Set to the write buffer in a single
 *    critical section. Non-persistent nodes are kept in memory only and never flushed.
 */
public interface NodeSource {

    long[] read(FieldElementTuple hash, ReadLog readLog);

    /**
     * @param nodes      hash -> 12 limbs, in creation order
     * @param persistent whether the nodes (and {@code newRoot}) go to the next flush batch
     * @param newRoot    root produced by the Set, recorded as state root when persistent
     */
    void stage(Map<FieldElementTuple, long[]> nodes, boolean persistent, FieldElementTuple newRoot);
}
