package io.hashdb.storage;

import io.hashdb.core.FieldElementTuple;
import io.hashdb.core.HashDbException;
import io.hashdb.core.ReadLog;
import io.hashdb.core.ResultCode;
import io.hashdb.core.hash.NodeHasher;
import io.hashdb.core.smt.NodeSource;
import io.hashdb.storage.flush.FlushBatch;
import io.hashdb.storage.flush.FlushPipeline;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Content-addressed node storage for the SMT engine.
 * <p>
 * Lookup order:
 *  1) write buffer (staged or flushed but not yet acknowledged),
 *  2) in-memory cache (loaded, cache-only, or acknowledged entries),
 *  3) durable store; a hit is recorded in the caller's read log and fills the cache.
 * <p>
 * Entries are immutable once written, so lookups take no lock.
 */
public final class NodeStore implements NodeSource {
    private static final Logger log = Logger.getLogger(NodeStore.class.getName());

    private final Map<String, long[]> cache = new ConcurrentHashMap<>();
    private final FlushPipeline pipeline;
    private final DurableStore durable;

    public NodeStore(FlushPipeline pipeline, DurableStore durable) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.durable = Objects.requireNonNull(durable, "durable");
        pipeline.onStored(this::promote);
    }

    @Override
    public long[] read(FieldElementTuple hash, ReadLog readLog) {
        String key = hash.toHex();

        long[] data = pipeline.bufferedNode(key);
        if (data == null) {
            data = cache.get(key);
        }
        if (data == null) {
            try {
                data = durable.readNode(key);
            } catch (DurableStoreException e) {
                throw new HashDbException(ResultCode.DB_ERROR, "durable read failed for node " + key, e);
            }
            if (data == null) {
                throw HashDbException.keyNotFound(hash);
            }
            if (data.length != NodeHasher.NODE_LIMBS) {
                throw HashDbException.invalidDataSize(hash, data.length);
            }
            cache.putIfAbsent(key, data);
            if (readLog != null) {
                readLog.add(hash, data);
            }
        }
        return data.clone();
    }

    @Override
    public void stage(Map<FieldElementTuple, long[]> nodes, boolean persistent, FieldElementTuple newRoot) {
        if (nodes.isEmpty() && !persistent) {
            return;
        }
        Map<String, long[]> byKey = new LinkedHashMap<>(nodes.size() * 2);
        nodes.forEach((h, v) -> byKey.put(h.toHex(), v.clone()));

        if (persistent) {
            pipeline.stageNodes(byKey, cache::containsKey, newRoot == null ? null : newRoot.toHex());
        } else {
            byKey.forEach(cache::putIfAbsent);
        }
    }

    /**
     * Bulk import of externally supplied nodes. Every entry is validated before any is
     * written: a wrong size fails with SMT_INVALID_DATA_SIZE, a key that is not the hash of
     * its content fails with IllegalArgumentException.
     */
    public void load(Map<String, long[]> nodes, boolean persistent) {
        Map<String, long[]> byKey = new LinkedHashMap<>(nodes.size() * 2);
        for (Map.Entry<String, long[]> e : nodes.entrySet()) {
            FieldElementTuple hash = FieldElementTuple.parse(e.getKey());
            long[] data = e.getValue();
            if (data == null || data.length != NodeHasher.NODE_LIMBS) {
                throw HashDbException.invalidDataSize(hash, data == null ? 0 : data.length);
            }
            FieldElementTuple actual = NodeHasher.hashEntry(data);
            if (!actual.equals(hash)) {
                throw new IllegalArgumentException("node content hashes to " + actual.toHex()
                        + ", not " + hash.toHex());
            }
            byKey.put(hash.toHex(), data.clone());
        }

        if (persistent) {
            pipeline.stageNodes(byKey, cache::containsKey, null);
        }
        byKey.forEach(cache::put);
        log.info("loaded " + byKey.size() + " nodes (persistent=" + persistent + ")");
    }

    public int cacheSize() {
        return cache.size();
    }

    public boolean isCached(String key) {
        return cache.containsKey(key);
    }

    private void promote(FlushBatch batch) {
        cache.putAll(batch.nodeInserts());
        cache.putAll(batch.nodeUpdates());
    }
}
