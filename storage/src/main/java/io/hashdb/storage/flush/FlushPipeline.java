package io.hashdb.storage.flush;

import io.hashdb.core.HashDbException;
import io.hashdb.core.ResultCode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Write buffer plus the queue of closed flush batches.
 * <p>
 * Responsibilities:
 *  - stage*(): add writes to the batch currently accumulating. One call is one short
 *    critical section, so everything a Set created lands in exactly one batch.
 *  - flush(): close the accumulating batch under the next flush id and open a new one.
 *    No durable I/O happens here.
 *  - getFlushData(): hand a closed batch to a durable writer (PENDING -> STORING).
 *    Repeated pulls return the same immutable batch.
 *  - acknowledge(): mark a batch STORED, let listeners promote its entries into the
 *    caches, then release them from the buffer. storedFlushId advances over the
 *    contiguous prefix of stored batches.
 * <p>
 * Buffered entries are visible to readers without locking through a per-key index that
 * counts how many unacknowledged batches still hold the key.
 * <p>
 * Invariant: storedFlushId <= storingFlushId <= lastFlushId, all non-decreasing.
 */
public final class FlushPipeline {
    private static final Logger log = Logger.getLogger(FlushPipeline.class.getName());

    private final String proverId;

    private Accumulator current = new Accumulator();
    private final NavigableMap<Long, Closed> closed = new TreeMap<>();
    private long lastFlushId = 0;
    private long storingFlushId = 0;
    private long storedFlushId = 0;
    private String stateRoot = "";

    private final Map<String, Buffered<long[]>> bufferedNodes = new ConcurrentHashMap<>();
    private final Map<String, Buffered<byte[]>> bufferedPrograms = new ConcurrentHashMap<>();
    private final List<Consumer<FlushBatch>> storedListeners = new CopyOnWriteArrayList<>();

    public FlushPipeline(String proverId) {
        this.proverId = Objects.requireNonNull(proverId, "proverId");
    }

    /** Register a callback run (under the pipeline lock) when a batch is acknowledged. */
    public void onStored(Consumer<FlushBatch> listener) {
        storedListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ---------------- staging ----------------

    /**
     * Stage node writes.
     *
     * @param known   tells whether a key is already known outside the buffer (e.g. cached)
     * @param newRoot root to record as state root, or null
     */
    public synchronized void stageNodes(Map<String, long[]> nodes, Predicate<String> known, String newRoot) {
        stage(nodes, current.nodeInserts, current.nodeUpdates, bufferedNodes, known);
        if (newRoot != null) {
            stateRoot = newRoot;
        }
    }

    public synchronized void stagePrograms(Map<String, byte[]> programs, Predicate<String> known) {
        stage(programs, current.programInserts, current.programUpdates, bufferedPrograms, known);
    }

    private static <V> void stage(Map<String, V> in, Map<String, V> inserts, Map<String, V> updates,
                                  Map<String, Buffered<V>> buffered, Predicate<String> known) {
        for (Map.Entry<String, V> e : in.entrySet()) {
            String key = e.getKey();
            if (inserts.containsKey(key) || updates.containsKey(key)) {
                continue;
            }
            boolean update = buffered.containsKey(key) || known.test(key);
            (update ? updates : inserts).put(key, e.getValue());
            buffered.merge(key, new Buffered<>(e.getValue(), 1), (a, b) -> new Buffered<>(a.value(), a.refs() + 1));
        }
    }

    /** Node content held by any unacknowledged batch (or the accumulating one), else null. */
    public long[] bufferedNode(String key) {
        Buffered<long[]> b = bufferedNodes.get(key);
        return b == null ? null : b.value();
    }

    public byte[] bufferedProgram(String key) {
        Buffered<byte[]> b = bufferedPrograms.get(key);
        return b == null ? null : b.value();
    }

    // ---------------- flush lifecycle ----------------

    public synchronized FlushTicket flush() {
        long id = ++lastFlushId;
        FlushBatch batch = current.close(id, stateRoot);
        closed.put(id, new Closed(batch));
        current = new Accumulator();
        log.info("flush " + id + " closed: nodes=" + batch.nodeCount() + " programs=" + batch.programCount()
                + " storedFlushId=" + storedFlushId);
        return new FlushTicket(id, storedFlushId);
    }

    /**
     * @param flushId batch to pull; 0 means the oldest batch not yet acknowledged
     * @throws HashDbException DB_KEY_NOT_FOUND for ids never assigned or already stored
     */
    public synchronized FlushData getFlushData(long flushId) {
        if (flushId < 0) {
            throw new IllegalArgumentException("flushId must be >= 0");
        }
        Closed c;
        if (flushId == 0) {
            c = closed.values().stream()
                    .filter(x -> x.state != FlushBatchState.STORED)
                    .findFirst()
                    .orElse(null);
            if (c == null) {
                return new FlushData(storedFlushId, null);
            }
        } else {
            c = closed.get(flushId);
            if (c == null || c.state == FlushBatchState.STORED) {
                throw new HashDbException(ResultCode.DB_KEY_NOT_FOUND,
                        "flush " + flushId + " unknown or already stored (stored=" + storedFlushId
                                + ", last=" + lastFlushId + ")");
            }
        }

        if (c.state == FlushBatchState.PENDING) {
            c.state = FlushBatchState.STORING;
            storingFlushId = Math.max(storingFlushId, c.batch.flushId());
            log.fine("flush " + c.batch.flushId() + " -> STORING");
        }
        return new FlushData(storedFlushId, c.batch);
    }

    /**
     * Acknowledge that a pulled batch was committed durably. Acknowledging an id that is
     * already stored does nothing.
     *
     * @return storedFlushId after the acknowledgement
     */
    public synchronized long acknowledge(long flushId) {
        if (flushId <= storedFlushId) {
            return storedFlushId;
        }
        Closed c = closed.get(flushId);
        if (c == null) {
            throw new HashDbException(ResultCode.DB_KEY_NOT_FOUND, "flush " + flushId + " was never assigned");
        }
        if (c.state == FlushBatchState.PENDING) {
            throw new HashDbException(ResultCode.INTERNAL_ERROR, "flush " + flushId + " acknowledged before it was pulled");
        }
        if (c.state == FlushBatchState.STORING) {
            c.state = FlushBatchState.STORED;
            for (Consumer<FlushBatch> l : storedListeners) {
                l.accept(c.batch);
            }
            release(c.batch.nodeInserts(), bufferedNodes);
            release(c.batch.nodeUpdates(), bufferedNodes);
            release(c.batch.programInserts(), bufferedPrograms);
            release(c.batch.programUpdates(), bufferedPrograms);
        }

        while (!closed.isEmpty()
                && closed.firstKey() == storedFlushId + 1
                && closed.firstEntry().getValue().state == FlushBatchState.STORED) {
            closed.pollFirstEntry();
            storedFlushId++;
        }
        log.info("flush " + flushId + " stored; storedFlushId=" + storedFlushId);
        return storedFlushId;
    }

    private static <V> void release(Map<String, V> entries, Map<String, Buffered<V>> buffered) {
        for (String key : entries.keySet()) {
            buffered.computeIfPresent(key, (k, b) -> b.refs() <= 1 ? null : new Buffered<>(b.value(), b.refs() - 1));
        }
    }

    public synchronized FlushStatus status() {
        long pendingNodes = current.nodeCount();
        long pendingPrograms = current.programCount();
        long storingNodes = 0;
        long storingPrograms = 0;
        for (Closed c : closed.values()) {
            if (c.state == FlushBatchState.PENDING) {
                pendingNodes += c.batch.nodeCount();
                pendingPrograms += c.batch.programCount();
            } else if (c.state == FlushBatchState.STORING) {
                storingNodes += c.batch.nodeCount();
                storingPrograms += c.batch.programCount();
            }
        }
        return new FlushStatus(storedFlushId, storingFlushId, lastFlushId,
                pendingNodes, pendingPrograms, storingNodes, storingPrograms, proverId);
    }

    /** True when the accumulating batch holds writes. */
    public synchronized boolean hasStagedWrites() {
        return current.nodeCount() + current.programCount() > 0;
    }

    /** State of a closed batch still tracked by the queue, or null once it left the queue. */
    public synchronized FlushBatchState stateOf(long flushId) {
        if (flushId > 0 && flushId <= storedFlushId) {
            return FlushBatchState.STORED;
        }
        Closed c = closed.get(flushId);
        return c == null ? null : c.state;
    }

    public String proverId() {
        return proverId;
    }

    // ---------------- internals ----------------

    private record Buffered<V>(V value, int refs) {}

    private static final class Closed {
        final FlushBatch batch;
        FlushBatchState state = FlushBatchState.PENDING;

        Closed(FlushBatch batch) {
            this.batch = batch;
        }
    }

    private static final class Accumulator {
        final Map<String, long[]> nodeInserts = new LinkedHashMap<>();
        final Map<String, long[]> nodeUpdates = new LinkedHashMap<>();
        final Map<String, byte[]> programInserts = new LinkedHashMap<>();
        final Map<String, byte[]> programUpdates = new LinkedHashMap<>();

        int nodeCount() {
            return nodeInserts.size() + nodeUpdates.size();
        }

        int programCount() {
            return programInserts.size() + programUpdates.size();
        }

        FlushBatch close(long id, String root) {
            return new FlushBatch(id, nodeInserts, nodeUpdates, programInserts, programUpdates, root);
        }
    }
}
