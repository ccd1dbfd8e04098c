package io.hashdb.storage;

import io.hashdb.storage.flush.FlushBatch;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records. One record holds one committed flush batch, so a
 * batch is either fully replayed or (torn tail) not at all.
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x5DB1
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (little-endian)]
 *     - flushId:    int64
 *     - stateRoot:  int32 len + UTF-8 bytes
 *     - nodeCount:  int32
 *         repeated: key (int32 len + UTF-8), limbCount int32, limbs int64 * limbCount
 *     - progCount:  int32
 *         repeated: key (int32 len + UTF-8), data (int32 len + bytes)
 * <p>
 * Inserts and updates are merged: the durable tables are upserted.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x5DB1;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    /** Decoded batch record. */
    record BatchRecord(long flushId, String stateRoot, Map<String, long[]> nodes, Map<String, byte[]> programs) {}

    private RecordCodec() {}

    static byte[] encode(FlushBatch batch) {
        Map<String, long[]> nodes = new LinkedHashMap<>(batch.nodeInserts());
        nodes.putAll(batch.nodeUpdates());
        Map<String, byte[]> programs = new LinkedHashMap<>(batch.programInserts());
        programs.putAll(batch.programUpdates());
        return encode(new BatchRecord(batch.flushId(), batch.stateRoot(), nodes, programs));
    }

    static byte[] encode(BatchRecord rec) {
        byte[] payload = encodePayload(rec);
        ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));

        byte[] out = new byte[HEADER_BYTES + payload.length];
        System.arraycopy(header.array(), 0, out, 0, HEADER_BYTES);
        System.arraycopy(payload, 0, out, HEADER_BYTES, payload.length);
        return out;
    }

    /** Decode a full payload (not including header). */
    static BatchRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        long flushId = b.getLong();
        String stateRoot = readString(b);

        int nodeCount = b.getInt();
        Map<String, long[]> nodes = new LinkedHashMap<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            String key = readString(b);
            long[] limbs = new long[b.getInt()];
            for (int j = 0; j < limbs.length; j++) limbs[j] = b.getLong();
            nodes.put(key, limbs);
        }

        int progCount = b.getInt();
        Map<String, byte[]> programs = new LinkedHashMap<>(progCount);
        for (int i = 0; i < progCount; i++) {
            String key = readString(b);
            programs.put(key, readBytes(b));
        }
        return new BatchRecord(flushId, stateRoot, nodes, programs);
    }

    // ----------------- helpers -----------------

    private static byte[] encodePayload(BatchRecord rec) {
        byte[] root = rec.stateRoot().getBytes(StandardCharsets.UTF_8);

        int size = 8 + 4 + root.length + 4 + 4;
        for (var e : rec.nodes().entrySet()) {
            size += 4 + utf8(e.getKey()).length + 4 + 8 * e.getValue().length;
        }
        for (var e : rec.programs().entrySet()) {
            size += 4 + utf8(e.getKey()).length + 4 + e.getValue().length;
        }

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.putLong(rec.flushId());
        writeBytes(b, root);
        b.putInt(rec.nodes().size());
        for (var e : rec.nodes().entrySet()) {
            writeBytes(b, utf8(e.getKey()));
            b.putInt(e.getValue().length);
            for (long l : e.getValue()) b.putLong(l);
        }
        b.putInt(rec.programs().size());
        for (var e : rec.programs().entrySet()) {
            writeBytes(b, utf8(e.getKey()));
            writeBytes(b, e.getValue());
        }
        return b.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        b.putInt(data.length).put(data);
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new DurableStoreException("corrupt record: length " + len);
        }
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }

    private static String readString(ByteBuffer b) {
        return new String(readBytes(b), StandardCharsets.UTF_8);
    }
}
