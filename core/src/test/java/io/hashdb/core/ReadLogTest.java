package io.hashdb.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReadLogTest {

    @Test
    void keepsFirstReadInTraversalOrder() {
        var log = new ReadLog();
        var a = new FieldElementTuple(2, 0, 0, 0);
        var b = new FieldElementTuple(1, 0, 0, 0);
        log.add(a, new long[]{1});
        log.add(b, new long[]{2});
        log.add(a, new long[]{3});

        Map<String, long[]> entries = log.entries();
        assertEquals(List.of(a.toHex(), b.toHex()), List.copyOf(entries.keySet()));
        assertEquals(1L, entries.get(a.toHex())[0]);
        assertTrue(log.contains(b));
        assertEquals(2, log.size());
    }

    @Test
    void snapshotIsDetached() {
        var log = new ReadLog();
        long[] data = {5};
        var h = new FieldElementTuple(9, 9, 9, 9);
        log.add(h, data);
        data[0] = 6;
        log.entries().get(h.toHex())[0] = 7;
        assertEquals(5L, log.entries().get(h.toHex())[0]);
        assertThrows(UnsupportedOperationException.class, () -> log.entries().clear());
    }
}
