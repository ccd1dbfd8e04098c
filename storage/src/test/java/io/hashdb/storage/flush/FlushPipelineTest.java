package io.hashdb.storage.flush;

import io.hashdb.core.HashDbException;
import io.hashdb.core.ResultCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class FlushPipelineTest {

    private FlushPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new FlushPipeline("prover-1");
    }

    private static Map<String, long[]> nodes(String... keys) {
        Map<String, long[]> m = new LinkedHashMap<>();
        for (String k : keys) {
            long[] v = new long[12];
            v[0] = k.hashCode();
            m.put(k, v);
        }
        return m;
    }

    private static void assertOrdered(FlushStatus s) {
        assertTrue(s.storedFlushId() <= s.storingFlushId(), "stored <= storing");
        assertTrue(s.storingFlushId() <= s.lastFlushId(), "storing <= last");
    }

    @Test
    void flush_ids_increase_and_empty_flushes_still_get_an_id() {
        FlushTicket t1 = pipeline.flush();
        pipeline.stageNodes(nodes("a"), k -> false, "r1");
        FlushTicket t2 = pipeline.flush();
        FlushTicket t3 = pipeline.flush();

        assertEquals(1, t1.flushId());
        assertEquals(2, t2.flushId());
        assertEquals(3, t3.flushId());
        assertEquals(0, t3.storedFlushId());
        assertTrue(pipeline.getFlushData(1).batch().isEmpty());
    }

    @Test
    void staged_entries_are_visible_until_acknowledged() {
        pipeline.stageNodes(nodes("a"), k -> false, null);
        assertNotNull(pipeline.bufferedNode("a"));

        long id = pipeline.flush().flushId();
        assertNotNull(pipeline.bufferedNode("a"), "closed batch still serves reads");

        pipeline.getFlushData(id);
        assertNotNull(pipeline.bufferedNode("a"), "storing batch still serves reads");

        pipeline.acknowledge(id);
        assertNull(pipeline.bufferedNode("a"));
    }

    @Test
    void key_held_by_two_batches_survives_ack_of_the_first() {
        pipeline.stageNodes(nodes("a"), k -> false, null);
        long first = pipeline.flush().flushId();
        pipeline.stageNodes(nodes("a"), k -> false, null);
        long second = pipeline.flush().flushId();

        pipeline.getFlushData(first);
        pipeline.acknowledge(first);
        assertNotNull(pipeline.bufferedNode("a"));

        pipeline.getFlushData(second);
        pipeline.acknowledge(second);
        assertNull(pipeline.bufferedNode("a"));
    }

    @Test
    void inserts_and_updates_are_told_apart() {
        pipeline.stageNodes(nodes("fresh", "cached"), "cached"::equals, null);
        long first = pipeline.flush().flushId();
        pipeline.stageNodes(nodes("fresh", "other"), k -> false, null);
        long second = pipeline.flush().flushId();

        FlushBatch b1 = pipeline.getFlushData(first).batch();
        assertEquals(List.of("fresh"), new ArrayList<>(b1.nodeInserts().keySet()));
        assertEquals(List.of("cached"), new ArrayList<>(b1.nodeUpdates().keySet()));

        FlushBatch b2 = pipeline.getFlushData(second).batch();
        assertTrue(b2.nodeUpdates().containsKey("fresh"), "key from an unacknowledged batch is an update");
        assertTrue(b2.nodeInserts().containsKey("other"));
    }

    @Test
    void duplicate_key_within_one_batch_is_kept_once() {
        pipeline.stageNodes(nodes("a", "b"), k -> false, null);
        pipeline.stageNodes(nodes("a"), k -> false, null);
        FlushBatch b = pipeline.getFlushData(pipeline.flush().flushId()).batch();
        assertEquals(2, b.nodeCount());
        assertTrue(b.nodeUpdates().isEmpty());
    }

    @Test
    void get_flush_data_is_idempotent_and_moves_batch_to_storing() {
        pipeline.stageNodes(nodes("a", "b"), k -> false, "root-1");
        long id = pipeline.flush().flushId();

        FlushData first = pipeline.getFlushData(id);
        FlushData again = pipeline.getFlushData(id);

        assertSame(first.batch(), again.batch());
        assertEquals("root-1", first.batch().stateRoot());
        assertEquals(FlushBatchState.STORING, pipeline.stateOf(id));
        assertEquals(id, pipeline.status().storingFlushId());
    }

    @Test
    void id_zero_returns_oldest_unstored_batch() {
        pipeline.stageNodes(nodes("a"), k -> false, null);
        long first = pipeline.flush().flushId();
        pipeline.stageNodes(nodes("b"), k -> false, null);
        pipeline.flush();

        assertEquals(first, pipeline.getFlushData(0).flushId());
        pipeline.acknowledge(first);
        assertEquals(first + 1, pipeline.getFlushData(0).flushId());
    }

    @Test
    void id_zero_with_nothing_outstanding_returns_empty_answer() {
        FlushData data = pipeline.getFlushData(0);
        assertNull(data.batch());
        assertEquals(0, data.flushId());
        assertEquals(0, data.storedFlushId());
    }

    @Test
    void unknown_or_stored_ids_are_key_not_found() {
        HashDbException unknown = assertThrows(HashDbException.class, () -> pipeline.getFlushData(5));
        assertEquals(ResultCode.DB_KEY_NOT_FOUND, unknown.code());

        long id = pipeline.flush().flushId();
        pipeline.getFlushData(id);
        pipeline.acknowledge(id);
        HashDbException stored = assertThrows(HashDbException.class, () -> pipeline.getFlushData(id));
        assertEquals(ResultCode.DB_KEY_NOT_FOUND, stored.code());

        // acknowledged while an older batch is still storing, so it stays queued
        long older = pipeline.flush().flushId();
        long newer = pipeline.flush().flushId();
        pipeline.getFlushData(older);
        pipeline.getFlushData(newer);
        pipeline.acknowledge(newer);
        assertEquals(FlushBatchState.STORED, pipeline.stateOf(newer));
        HashDbException queued = assertThrows(HashDbException.class, () -> pipeline.getFlushData(newer));
        assertEquals(ResultCode.DB_KEY_NOT_FOUND, queued.code());
        assertEquals(older, pipeline.getFlushData(0).flushId());
    }

    @Test
    void acknowledging_before_pull_is_an_internal_error() {
        long id = pipeline.flush().flushId();
        HashDbException e = assertThrows(HashDbException.class, () -> pipeline.acknowledge(id));
        assertEquals(ResultCode.INTERNAL_ERROR, e.code());
        assertEquals(FlushBatchState.PENDING, pipeline.stateOf(id));
    }

    @Test
    void stored_id_only_advances_over_contiguous_prefix() {
        long a = pipeline.flush().flushId();
        long b = pipeline.flush().flushId();
        long c = pipeline.flush().flushId();
        pipeline.getFlushData(a);
        pipeline.getFlushData(b);
        pipeline.getFlushData(c);

        assertEquals(0, pipeline.acknowledge(b));
        assertEquals(FlushBatchState.STORED, pipeline.stateOf(b));
        assertOrdered(pipeline.status());

        assertEquals(b, pipeline.acknowledge(a));
        assertEquals(c, pipeline.acknowledge(c));
        assertEquals(c, pipeline.acknowledge(a), "acknowledging a stored id changes nothing");
        assertOrdered(pipeline.status());
    }

    @Test
    void status_counts_pending_and_storing_entries() {
        pipeline.stageNodes(nodes("a", "b"), k -> false, null);
        pipeline.stagePrograms(Map.of("p", new byte[]{1}), k -> false);
        long id = pipeline.flush().flushId();
        pipeline.stageNodes(nodes("c"), k -> false, null);

        FlushStatus before = pipeline.status();
        assertEquals(3, before.pendingToFlushNodes());
        assertEquals(1, before.pendingToFlushPrograms());
        assertEquals(0, before.storingNodes());
        assertEquals("prover-1", before.proverId());

        pipeline.getFlushData(id);
        FlushStatus during = pipeline.status();
        assertEquals(1, during.pendingToFlushNodes());
        assertEquals(2, during.storingNodes());
        assertEquals(1, during.storingPrograms());
        assertOrdered(during);
    }

    @Test
    void state_root_is_inherited_by_later_batches() {
        pipeline.stageNodes(nodes("a"), k -> false, "root-1");
        long first = pipeline.flush().flushId();
        pipeline.stagePrograms(Map.of("p", new byte[]{9}), k -> false);
        long second = pipeline.flush().flushId();

        assertEquals("root-1", pipeline.getFlushData(first).batch().stateRoot());
        assertEquals("root-1", pipeline.getFlushData(second).batch().stateRoot());
    }

    @Test
    void listeners_see_batch_before_entries_leave_the_buffer() {
        List<Boolean> stillBuffered = new ArrayList<>();
        pipeline.onStored(b -> stillBuffered.add(pipeline.bufferedNode("a") != null));
        pipeline.stageNodes(nodes("a"), k -> false, null);
        long id = pipeline.flush().flushId();
        pipeline.getFlushData(id);
        pipeline.acknowledge(id);

        assertEquals(List.of(true), stillBuffered);
    }

    @Test
    void closed_batch_does_not_change_when_more_writes_arrive() {
        pipeline.stageNodes(nodes("a"), k -> false, null);
        long id = pipeline.flush().flushId();
        pipeline.stageNodes(nodes("b", "c"), k -> false, null);

        FlushBatch b = pipeline.getFlushData(id).batch();
        assertEquals(1, b.nodeCount());
        assertThrows(UnsupportedOperationException.class, () -> b.nodeInserts().put("x", new long[12]));
    }

    @Test
    void concurrent_staging_and_flushing_put_every_write_in_exactly_one_batch() throws Exception {
        int writers = 8;
        int perWriter = 2000;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch go = new CountDownLatch(1);
        AtomicBoolean staging = new AtomicBoolean(true);
        try {
            List<Future<?>> stagers = new ArrayList<>();
            for (int t = 0; t < writers; t++) {
                int id = t;
                stagers.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perWriter; i++) {
                        pipeline.stageNodes(nodes("w" + id + "-" + i), k -> false, null);
                    }
                    return null;
                }));
            }
            Future<?> flusher = pool.submit(() -> {
                go.await();
                while (staging.get()) {
                    pipeline.flush();
                    Thread.yield();
                }
                return null;
            });

            go.countDown();
            for (Future<?> f : stagers) {
                f.get(30, TimeUnit.SECONDS);
            }
            staging.set(false);
            flusher.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        pipeline.flush();

        Set<String> seen = new HashSet<>();
        int total = 0;
        FlushData data;
        while ((data = pipeline.getFlushData(0)).batch() != null) {
            FlushBatch batch = data.batch();
            for (String key : batch.nodeInserts().keySet()) {
                assertTrue(seen.add(key), "key in two batches: " + key);
            }
            for (String key : batch.nodeUpdates().keySet()) {
                assertTrue(seen.add(key), "key in two batches: " + key);
            }
            total += batch.nodeCount();
            assertOrdered(pipeline.status());
            pipeline.acknowledge(batch.flushId());
        }

        assertEquals(writers * perWriter, total);
        assertEquals(writers * perWriter, seen.size());
        FlushStatus s = pipeline.status();
        assertEquals(s.lastFlushId(), s.storedFlushId());
        assertEquals(0, s.pendingToFlushNodes());
        assertEquals(0, s.storingNodes());
        for (String key : seen) {
            assertNull(pipeline.bufferedNode(key), key);
        }
    }
}
