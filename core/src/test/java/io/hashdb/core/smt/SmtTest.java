package io.hashdb.core.smt;

import io.hashdb.core.FieldElementTuple;
import io.hashdb.core.HashDbException;
import io.hashdb.core.ReadLog;
import io.hashdb.core.ResultCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Engine tests:
 *  - insert / update / delete modes and canonical roots,
 *  - inclusion and non-inclusion proofs,
 *  - old roots stay readable after updates,
 *  - failure paths stage nothing.
 */
class SmtTest {

    private static final FieldElementTuple ZERO = FieldElementTuple.ZERO;

    private MemoryNodeSource source;
    private Smt smt;

    @BeforeEach
    void setUp() {
        source = new MemoryNodeSource();
        smt = new Smt(source);
    }

    private static BigInteger v(long x) {
        return BigInteger.valueOf(x);
    }

    private static List<FieldElementTuple> randomKeys(int n, long seed) {
        var rnd = new Random(seed);
        List<FieldElementTuple> keys = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            keys.add(new FieldElementTuple(rnd.nextLong(), rnd.nextLong(), rnd.nextLong(), rnd.nextLong()));
        }
        return keys;
    }

    @Test
    void insert_update_delete_scenario_from_empty_tree() {
        var k = new FieldElementTuple(1, 2, 3, 4);

        SetResult r1 = smt.set(ZERO, k, v(5), true, null);
        assertEquals(SetMode.INSERT_NOT_FOUND, r1.mode());
        assertTrue(r1.isOld0());
        assertFalse(r1.newRoot().isZero());

        SetResult r2 = smt.set(r1.newRoot(), k, v(9), true, null);
        assertEquals(SetMode.UPDATE, r2.mode());
        assertNotEquals(r1.newRoot(), r2.newRoot());
        assertEquals(v(5), r2.oldValue());
        assertEquals(v(9), r2.newValue());

        assertEquals(v(9), smt.get(r2.newRoot(), k, null).value());

        SetResult r3 = smt.set(r2.newRoot(), k, BigInteger.ZERO, true, null);
        assertEquals(SetMode.DELETE_LAST, r3.mode());
        assertEquals(ZERO, r3.newRoot());
    }

    @Test
    void set_then_get_round_trips_and_proof_recomputes_root() {
        FieldElementTuple root = ZERO;
        List<FieldElementTuple> keys = randomKeys(64, 11);
        for (int i = 0; i < keys.size(); i++) {
            root = smt.set(root, keys.get(i), v(i + 1), true, null).newRoot();
        }
        for (int i = 0; i < keys.size(); i++) {
            GetResult g = smt.get(root, keys.get(i), null);
            assertEquals(v(i + 1), g.value());
            assertFalse(g.isOld0());
            assertEquals(keys.get(i), g.insKey());
            assertEquals(root, ProofVerifier.computeRoot(keys.get(i), keys.get(i), g.value(), g.siblings()));
            assertEquals(g.siblings().size() + 2L, g.proofHashCounter());
        }
    }

    @Test
    void absent_key_yields_non_membership_proof() {
        FieldElementTuple root = ZERO;
        for (FieldElementTuple k : randomKeys(16, 3)) {
            root = smt.set(root, k, v(42), true, null).newRoot();
        }
        for (FieldElementTuple absent : randomKeys(16, 999)) {
            GetResult g = smt.get(root, absent, null);
            assertEquals(BigInteger.ZERO, g.value());
            assertTrue(ProofVerifier.verify(g), "proof must recompute queried root");
            if (!g.isOld0()) {
                assertNotEquals(absent, g.insKey());
                assertEquals(v(42), g.insValue());
            }
        }
    }

    @Test
    void get_on_empty_tree_is_old0_without_siblings() {
        GetResult g = smt.get(ZERO, new FieldElementTuple(9, 9, 9, 9), null);
        assertTrue(g.isOld0());
        assertTrue(g.siblings().isEmpty());
        assertEquals(ZERO, g.insKey());
        assertEquals(0, g.proofHashCounter());
        assertTrue(ProofVerifier.verify(g));
    }

    @Test
    void deleting_absent_key_is_a_no_op() {
        List<FieldElementTuple> keys = randomKeys(4, 5);
        FieldElementTuple root = ZERO;
        for (FieldElementTuple k : keys) {
            root = smt.set(root, k, v(1), true, null).newRoot();
        }
        SetResult r = smt.set(root, new FieldElementTuple(77, 77, 77, 77), BigInteger.ZERO, true, null);
        assertEquals(root, r.newRoot());
        assertTrue(r.mode().isNoOp());

        SetResult empty = smt.set(ZERO, new FieldElementTuple(1, 1, 1, 1), BigInteger.ZERO, true, null);
        assertEquals(SetMode.ZERO_TO_ZERO, empty.mode());
        assertEquals(ZERO, empty.newRoot());
    }

    @Test
    void old_root_still_returns_previous_value() {
        var k = new FieldElementTuple(10, 20, 30, 40);
        var other = new FieldElementTuple(11, 20, 30, 40);
        FieldElementTuple r1 = smt.set(ZERO, k, v(1), true, null).newRoot();
        r1 = smt.set(r1, other, v(2), true, null).newRoot();

        FieldElementTuple r2 = smt.set(r1, k, v(100), true, null).newRoot();
        FieldElementTuple r3 = smt.set(r2, other, BigInteger.ZERO, true, null).newRoot();

        assertEquals(v(1), smt.get(r1, k, null).value());
        assertEquals(v(2), smt.get(r1, other, null).value());
        assertEquals(v(100), smt.get(r2, k, null).value());
        assertEquals(BigInteger.ZERO, smt.get(r3, other, null).value());
        assertEquals(v(100), smt.get(r3, k, null).value());
    }

    @Test
    void root_is_independent_of_insertion_order_and_deletions() {
        List<FieldElementTuple> keys = randomKeys(40, 21);

        FieldElementTuple forward = ZERO;
        for (FieldElementTuple k : keys) {
            forward = smt.set(forward, k, v(k.fe0() & 0xffff | 1), true, null).newRoot();
        }

        List<FieldElementTuple> shuffled = new ArrayList<>(keys);
        Collections.shuffle(shuffled, new Random(4));
        FieldElementTuple backward = ZERO;
        for (FieldElementTuple k : shuffled) {
            backward = smt.set(backward, k, v(k.fe0() & 0xffff | 1), true, null).newRoot();
        }
        assertEquals(forward, backward);

        // add extra keys then remove them again: must land on the same root
        FieldElementTuple withExtras = forward;
        List<FieldElementTuple> extras = randomKeys(10, 77);
        for (FieldElementTuple e : extras) {
            withExtras = smt.set(withExtras, e, v(3), true, null).newRoot();
        }
        for (FieldElementTuple e : extras) {
            SetResult r = smt.set(withExtras, e, BigInteger.ZERO, true, null);
            assertEquals(SetMode.DELETE_FOUND, r.mode());
            withExtras = r.newRoot();
        }
        assertEquals(forward, withExtras);
    }

    @Test
    void deleting_every_key_restores_empty_tree() {
        List<FieldElementTuple> keys = randomKeys(25, 8);
        FieldElementTuple root = ZERO;
        for (FieldElementTuple k : keys) {
            root = smt.set(root, k, v(7), true, null).newRoot();
        }
        SetResult last = null;
        for (FieldElementTuple k : keys) {
            last = smt.set(root, k, BigInteger.ZERO, true, null);
            root = last.newRoot();
        }
        assertEquals(ZERO, root);
        assertEquals(SetMode.DELETE_LAST, last.mode());
    }

    @Test
    void keys_sharing_a_long_prefix_fork_deep() {
        // identical in the first 8 path levels (bits 0..1 of every limb)
        var a = new FieldElementTuple(0b1_00L, 0, 0, 0);
        var b = new FieldElementTuple(0b0_00L, 0, 0, 0);
        FieldElementTuple root = smt.set(ZERO, a, v(1), true, null).newRoot();
        SetResult r = smt.set(root, b, v(2), true, null);

        assertEquals(SetMode.INSERT_EXISTING, r.mode());
        assertFalse(r.isOld0());
        assertEquals(a, r.insKey());
        assertEquals(v(1), r.insValue());

        GetResult ga = smt.get(r.newRoot(), a, null);
        GetResult gb = smt.get(r.newRoot(), b, null);
        assertEquals(9, ga.siblings().size(), "first differing bit is level 8");
        assertEquals(v(1), ga.value());
        assertEquals(v(2), gb.value());
        assertTrue(ProofVerifier.verify(ga));
        assertTrue(ProofVerifier.verify(gb));
    }

    @Test
    void same_value_update_keeps_root_and_creates_nothing() {
        var k = new FieldElementTuple(5, 5, 5, 5);
        FieldElementTuple root = smt.set(ZERO, k, v(3), true, null).newRoot();
        int before = source.nodes.size();
        SetResult r = smt.set(root, k, v(3), true, null);
        assertEquals(root, r.newRoot());
        assertEquals(SetMode.UPDATE, r.mode());
        assertEquals(before, source.nodes.size());
    }

    @Test
    void read_log_captures_every_node_on_the_path() {
        List<FieldElementTuple> keys = randomKeys(8, 2);
        FieldElementTuple root = ZERO;
        for (FieldElementTuple k : keys) {
            root = smt.set(root, k, v(1), true, null).newRoot();
        }
        ReadLog logged = new ReadLog();
        GetResult g = smt.get(root, keys.get(0), logged);

        // internal nodes on the path + leaf + value entry
        assertEquals(g.siblings().size() + 2, logged.size());
        assertTrue(logged.contains(root));
        assertSame(logged, g.readLog());
    }

    @Test
    void persistence_flag_and_root_reach_staging() {
        var k = new FieldElementTuple(1, 0, 0, 0);
        SetResult r = smt.set(ZERO, k, v(1), false, null);
        assertEquals(1, source.stageCalls);
        assertFalse(source.lastPersistent);
        assertEquals(r.newRoot(), source.lastRoot);
    }

    @Test
    void unknown_root_fails_with_key_not_found() {
        var missing = new FieldElementTuple(1, 2, 3, 4);
        HashDbException e = assertThrows(HashDbException.class,
                () -> smt.set(missing, missing, v(1), true, null));
        assertEquals(ResultCode.DB_KEY_NOT_FOUND, e.code());
        assertEquals(0, source.stageCalls, "failed set must not stage");
    }

    @Test
    void malformed_node_fails_with_invalid_data_size() {
        var bogus = new FieldElementTuple(3, 3, 3, 3);
        source.nodes.put(bogus, new long[5]);
        HashDbException e = assertThrows(HashDbException.class,
                () -> smt.get(bogus, new FieldElementTuple(1, 1, 1, 1), null));
        assertEquals(ResultCode.SMT_INVALID_DATA_SIZE, e.code());
    }

    @Test
    void set_counter_includes_created_nodes() {
        var k = new FieldElementTuple(1, 0, 0, 0);
        SetResult r = smt.set(ZERO, k, v(1), true, null);
        // value entry + leaf, no siblings on the old path
        assertEquals(2, r.proofHashCounter());
    }
}
