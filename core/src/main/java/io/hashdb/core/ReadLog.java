package io.hashdb.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call record of the node entries an operation had to fetch from the durable store.
 * <p>
 * Entries are kept in traversal order; a hash read twice is recorded once. A log belongs
 * to a single request, but the stores may add to it from whichever thread serves the read,
 * so mutation is synchronized.
 */
public final class ReadLog {

    private final Map<String, long[]> entries = new LinkedHashMap<>();

    public synchronized void add(FieldElementTuple hash, long[] data) {
        entries.putIfAbsent(hash.toHex(), data.clone());
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean contains(FieldElementTuple hash) {
        return entries.containsKey(hash.toHex());
    }

    /** Snapshot of the log keyed by hash string, in traversal order. */
    public synchronized Map<String, long[]> entries() {
        Map<String, long[]> copy = new LinkedHashMap<>(entries.size());
        entries.forEach((k, v) -> copy.put(k, v.clone()));
        return Collections.unmodifiableMap(copy);
    }
}
