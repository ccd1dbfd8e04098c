package io.hashdb.storage;

import io.hashdb.core.FieldElementTuple;
import io.hashdb.core.HashDbException;
import io.hashdb.core.ReadLog;
import io.hashdb.core.ResultCode;
import io.hashdb.core.smt.SmtNode;
import io.hashdb.core.smt.Smt;
import io.hashdb.storage.flush.DurableWriter;
import io.hashdb.storage.flush.FlushPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NodeStoreTest {

    private FlushPipeline pipeline;
    private MemoryDurableStore durable;
    private NodeStore store;

    @BeforeEach
    void setUp() {
        pipeline = new FlushPipeline("p");
        durable = new MemoryDurableStore();
        store = new NodeStore(pipeline, durable);
    }

    private static SmtNode valueNode(long v) {
        return SmtNode.value(BigInteger.valueOf(v));
    }

    @Test
    void durable_hit_is_logged_and_fills_cache() {
        SmtNode n = valueNode(7);
        durable.nodes.put(n.hash().toHex(), n.limbs());

        ReadLog first = new ReadLog();
        assertArrayEquals(n.limbs(), store.read(n.hash(), first));
        assertEquals(1, first.size());
        assertTrue(store.isCached(n.hash().toHex()));

        ReadLog second = new ReadLog();
        store.read(n.hash(), second);
        assertEquals(0, second.size(), "cache hits are not logged");
        assertEquals(1, durable.reads.get());
    }

    @Test
    void buffered_entries_are_served_before_durable_store() {
        SmtNode n = valueNode(3);
        store.stage(Map.of(n.hash(), n.limbs()), true, n.hash());

        ReadLog log = new ReadLog();
        assertArrayEquals(n.limbs(), store.read(n.hash(), log));
        assertEquals(0, log.size());
        assertEquals(0, durable.reads.get());
    }

    @Test
    void missing_hash_is_key_not_found() {
        HashDbException e = assertThrows(HashDbException.class,
                () -> store.read(new FieldElementTuple(1, 2, 3, 4), null));
        assertEquals(ResultCode.DB_KEY_NOT_FOUND, e.code());
    }

    @Test
    void durable_failure_maps_to_db_error() {
        durable.failReads = true;
        HashDbException e = assertThrows(HashDbException.class,
                () -> store.read(new FieldElementTuple(1, 2, 3, 4), new ReadLog()));
        assertEquals(ResultCode.DB_ERROR, e.code());
    }

    @Test
    void malformed_durable_entry_is_invalid_data_size_and_not_cached() {
        var hash = new FieldElementTuple(5, 5, 5, 5);
        durable.nodes.put(hash.toHex(), new long[7]);
        HashDbException e = assertThrows(HashDbException.class, () -> store.read(hash, null));
        assertEquals(ResultCode.SMT_INVALID_DATA_SIZE, e.code());
        assertFalse(store.isCached(hash.toHex()));
    }

    @Test
    void non_persistent_nodes_stay_out_of_flush_batches() {
        SmtNode n = valueNode(11);
        store.stage(Map.of(n.hash(), n.limbs()), false, n.hash());

        assertTrue(store.isCached(n.hash().toHex()));
        long id = pipeline.flush().flushId();
        assertTrue(pipeline.getFlushData(id).batch().isEmpty());
    }

    @Test
    void acknowledged_nodes_move_into_the_cache() {
        SmtNode n = valueNode(12);
        store.stage(Map.of(n.hash(), n.limbs()), true, n.hash());
        long id = pipeline.flush().flushId();
        pipeline.getFlushData(id);
        pipeline.acknowledge(id);

        assertNull(pipeline.bufferedNode(n.hash().toHex()));
        assertTrue(store.isCached(n.hash().toHex()));
        assertArrayEquals(n.limbs(), store.read(n.hash(), null));
    }

    @Test
    void load_validates_every_entry_before_writing_any() {
        SmtNode good = valueNode(1);
        SmtNode other = valueNode(2);

        Map<String, long[]> mismatched = new LinkedHashMap<>();
        mismatched.put(good.hash().toHex(), good.limbs());
        mismatched.put(other.hash().toHex(), good.limbs());
        assertThrows(IllegalArgumentException.class, () -> store.load(mismatched, false));
        assertEquals(0, store.cacheSize());

        Map<String, long[]> shortEntry = Map.of(good.hash().toHex(), new long[3]);
        HashDbException e = assertThrows(HashDbException.class, () -> store.load(shortEntry, false));
        assertEquals(ResultCode.SMT_INVALID_DATA_SIZE, e.code());
        assertEquals(0, store.cacheSize());
    }

    @Test
    void persistent_load_is_cached_and_staged() {
        SmtNode n = valueNode(99);
        store.load(Map.of(n.hash().toHex(), n.limbs()), true);

        assertTrue(store.isCached(n.hash().toHex()));
        long id = pipeline.flush().flushId();
        assertTrue(pipeline.getFlushData(id).batch().nodeInserts().containsKey(n.hash().toHex()));
    }

    @Test
    void tree_written_through_one_store_is_readable_after_restart() {
        Smt smt = new Smt(store);
        var key = new FieldElementTuple(42, 0, 0, 0);
        FieldElementTuple root = smt.set(FieldElementTuple.ZERO, key, BigInteger.TEN, true, null).newRoot();
        pipeline.flush();
        new DurableWriter(pipeline, durable, Duration.ofSeconds(1), false).runOnce();
        assertEquals(root.toHex(), durable.stateRoot());

        NodeStore restarted = new NodeStore(new FlushPipeline("p2"), durable);
        ReadLog log = new ReadLog();
        var got = new Smt(restarted).get(root, key, log);
        assertEquals(BigInteger.TEN, got.value());
        assertEquals(2, log.size(), "leaf and value entry come from durable store");
    }
}
