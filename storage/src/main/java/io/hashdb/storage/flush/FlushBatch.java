package io.hashdb.storage.flush;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable, numbered set of writes destined for the durable store.
 * <p>
 * Inserts are keys the engine had not seen before staging; updates are keys that were
 * already known (cached or in an earlier unacknowledged batch). Keys are hash strings.
 *
 * @param stateRoot newest root produced by a persistent Set up to this batch, or ""
 */
public record FlushBatch(
        long flushId,
        Map<String, long[]> nodeInserts,
        Map<String, long[]> nodeUpdates,
        Map<String, byte[]> programInserts,
        Map<String, byte[]> programUpdates,
        String stateRoot
) {
    public FlushBatch {
        nodeInserts = freeze(nodeInserts);
        nodeUpdates = freeze(nodeUpdates);
        programInserts = freeze(programInserts);
        programUpdates = freeze(programUpdates);
        stateRoot = stateRoot == null ? "" : stateRoot;
    }

    public int nodeCount() {
        return nodeInserts.size() + nodeUpdates.size();
    }

    public int programCount() {
        return programInserts.size() + programUpdates.size();
    }

    public boolean isEmpty() {
        return nodeCount() == 0 && programCount() == 0;
    }

    private static <V> Map<String, V> freeze(Map<String, V> in) {
        return in == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(in));
    }
}
