package io.hashdb.storage;

import io.hashdb.storage.flush.FlushBatch;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Durable store backed by a write-ahead log.
 * <p>
 * Responsibilities:
 *  - commit(): encode the batch as one WAL record, append+fsync, then apply it to the
 *    in-memory tables and rotate the segment if needed.
 *  - On startup: replay every WAL record in order; a torn tail record is ignored.
 *  - Reads are served from the replayed tables.
 */
public class FileDurableStore implements DurableStore {
    private static final Logger log = Logger.getLogger(FileDurableStore.class.getName());

    private final Map<String, long[]> nodes = new ConcurrentHashMap<>();
    private final Map<String, byte[]> programs = new ConcurrentHashMap<>();
    private final Wal wal;
    private volatile String stateRoot = "";
    private volatile long lastFlushId = 0;

    public FileDurableStore(Wal wal) {
        this.wal = wal;
        recover();
    }

    @Override
    public long[] readNode(String key) {
        long[] v = nodes.get(key);
        return v == null ? null : v.clone();
    }

    @Override
    public byte[] readProgram(String key) {
        byte[] v = programs.get(key);
        return v == null ? null : v.clone();
    }

    @Override
    public synchronized void commit(FlushBatch batch) {
        wal.append(RecordCodec.encode(batch));
        apply(batch.flushId(), batch.stateRoot(), batch.nodeInserts(), batch.programInserts());
        apply(batch.flushId(), batch.stateRoot(), batch.nodeUpdates(), batch.programUpdates());
        wal.rotateIfNeeded();
    }

    @Override
    public String stateRoot() {
        return stateRoot;
    }

    /** Flush id of the last batch committed or replayed. */
    public long lastFlushId() {
        return lastFlushId;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int programCount() {
        return programs.size();
    }

    @Override
    public void close() {
        wal.close();
    }

    private void recover() {
        int records = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.BatchRecord rec = RecordCodec.decode(payload);
                apply(rec.flushId(), rec.stateRoot(), rec.nodes(), rec.programs());
                records++;
            }
        } catch (DurableStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DurableStoreException("recovery failed", e);
        }
        log.info("recovered " + records + " batches: nodes=" + nodes.size() + " programs=" + programs.size()
                + " stateRoot=" + (stateRoot.isEmpty() ? "<none>" : stateRoot));
    }

    private void apply(long flushId, String root, Map<String, long[]> nodeRows, Map<String, byte[]> programRows) {
        nodeRows.forEach((k, v) -> nodes.put(k, v.clone()));
        programRows.forEach((k, v) -> programs.put(k, v.clone()));
        if (root != null && !root.isEmpty()) {
            stateRoot = root;
        }
        lastFlushId = Math.max(lastFlushId, flushId);
    }
}
