package io.hashdb.core.hash;

import io.hashdb.core.FieldElementTuple;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Node hash function H(in[8], capacity[4]) -> FieldElementTuple.
 * <p>
 * The twelve limbs are written as big-endian 64-bit words and hashed with SHA-256.
 * The 32-byte digest is read back as four big-endian words fe0..fe3.
 * <p>
 * Capacities:
 *  - intermediate nodes and value entries: {0,0,0,0}
 *  - leaves: {1,0,0,0}
 */
public final class NodeHasher {

    public static final int INPUT_LIMBS = 8;
    public static final int CAPACITY_LIMBS = 4;
    /** Size of every stored node entry: input limbs followed by capacity limbs. */
    public static final int NODE_LIMBS = INPUT_LIMBS + CAPACITY_LIMBS;

    public static final long[] CAPACITY_ZERO = {0, 0, 0, 0};
    public static final long[] CAPACITY_LEAF = {1, 0, 0, 0};

    private NodeHasher() {}

    public static FieldElementTuple hash(long[] in, long[] capacity) {
        if (in.length != INPUT_LIMBS) throw new IllegalArgumentException("need 8 input limbs, got " + in.length);
        if (capacity.length != CAPACITY_LIMBS) throw new IllegalArgumentException("need 4 capacity limbs");

        ByteBuffer buf = ByteBuffer.allocate(NODE_LIMBS * Long.BYTES).order(ByteOrder.BIG_ENDIAN);
        for (long l : in) buf.putLong(l);
        for (long l : capacity) buf.putLong(l);

        byte[] digest = newDigest().digest(buf.array());
        ByteBuffer out = ByteBuffer.wrap(digest).order(ByteOrder.BIG_ENDIAN);
        return new FieldElementTuple(out.getLong(), out.getLong(), out.getLong(), out.getLong());
    }

    /** Hash a full 12-limb node entry (input followed by capacity). */
    public static FieldElementTuple hashEntry(long[] entry) {
        if (entry.length != NODE_LIMBS) throw new IllegalArgumentException("need 12 limbs, got " + entry.length);
        long[] in = new long[INPUT_LIMBS];
        long[] cap = new long[CAPACITY_LIMBS];
        System.arraycopy(entry, 0, in, 0, INPUT_LIMBS);
        System.arraycopy(entry, INPUT_LIMBS, cap, 0, CAPACITY_LIMBS);
        return hash(in, cap);
    }

    static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
