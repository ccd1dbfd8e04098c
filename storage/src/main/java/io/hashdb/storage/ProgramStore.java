package io.hashdb.storage;

import io.hashdb.core.FieldElementTuple;
import io.hashdb.core.HashDbException;
import io.hashdb.core.ResultCode;
import io.hashdb.storage.flush.FlushBatch;
import io.hashdb.storage.flush.FlushPipeline;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opaque byte blobs keyed by hash. Same lookup order as {@link NodeStore}; program
 * reads are not recorded in read logs.
 */
public final class ProgramStore {

    private final Map<String, byte[]> cache = new ConcurrentHashMap<>();
    private final FlushPipeline pipeline;
    private final DurableStore durable;

    public ProgramStore(FlushPipeline pipeline, DurableStore durable) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.durable = Objects.requireNonNull(durable, "durable");
        pipeline.onStored(this::promote);
    }

    public byte[] get(FieldElementTuple key) {
        String k = key.toHex();
        byte[] data = pipeline.bufferedProgram(k);
        if (data == null) {
            data = cache.get(k);
        }
        if (data == null) {
            try {
                data = durable.readProgram(k);
            } catch (DurableStoreException e) {
                throw new HashDbException(ResultCode.DB_ERROR, "durable read failed for program " + k, e);
            }
            if (data == null) {
                throw HashDbException.keyNotFound(key);
            }
            cache.putIfAbsent(k, data);
        }
        return data.clone();
    }

    /** Store a program. Persistent programs join the next flush batch; others stay cache-only. */
    public void set(FieldElementTuple key, byte[] data, boolean persistent) {
        Objects.requireNonNull(data, "data");
        String k = key.toHex();
        if (persistent) {
            pipeline.stagePrograms(Map.of(k, data.clone()), cache::containsKey);
        } else {
            cache.put(k, data.clone());
        }
    }

    /** Bulk import. Programs are accepted as given; only the key format is checked. */
    public void load(Map<String, byte[]> programs, boolean persistent) {
        Map<String, byte[]> byKey = new LinkedHashMap<>(programs.size() * 2);
        programs.forEach((k, v) -> byKey.put(FieldElementTuple.parse(k).toHex(),
                Objects.requireNonNull(v, "program bytes").clone()));
        if (persistent) {
            pipeline.stagePrograms(byKey, cache::containsKey);
        }
        byKey.forEach(cache::put);
    }

    public int cacheSize() {
        return cache.size();
    }

    private void promote(FlushBatch batch) {
        cache.putAll(batch.programInserts());
        cache.putAll(batch.programUpdates());
    }
}
