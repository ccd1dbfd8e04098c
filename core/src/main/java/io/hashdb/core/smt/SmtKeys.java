package io.hashdb.core.smt;

import io.hashdb.core.FieldElementTuple;

/**
 * Key bit helpers for the sparse Merkle tree.
 * <p>
 * Path bit for level L (root is level 0) is bit L/4 (LSB first) of limb L%4, so the
 * four limbs are consumed interleaved. A leaf sitting at level L stores its key with
 * the first L path bits removed ("remaining key"); {@link #joinKey} restores it.
 */
public final class SmtKeys {

    /** Number of path bits in a key, i.e. the maximum tree depth. */
    public static final int MAX_LEVELS = 256;

    private SmtKeys() {}

    public static int bit(FieldElementTuple key, int level) {
        if (level < 0 || level >= MAX_LEVELS) throw new IllegalArgumentException("level out of range: " + level);
        return (int) ((key.limb(level % 4) >>> (level / 4)) & 1L);
    }

    /** The first {@code levels} path bits of {@code key}. */
    public static int[] pathBits(FieldElementTuple key, int levels) {
        int[] bits = new int[levels];
        for (int i = 0; i < levels; i++) {
            bits[i] = bit(key, i);
        }
        return bits;
    }

    public static FieldElementTuple removeKeyBits(FieldElementTuple key, int nBits) {
        int fullLevels = nBits / 4;
        int extra = nBits % 4;
        long[] out = new long[4];
        for (int j = 0; j < 4; j++) {
            int shift = fullLevels + (j < extra ? 1 : 0);
            out[j] = shift >= 64 ? 0L : key.limb(j) >>> shift;
        }
        return FieldElementTuple.of(out, 0);
    }

    /** Rebuild a full key from the path bits that led to a leaf and the leaf's remaining key. */
    public static FieldElementTuple joinKey(int[] bits, FieldElementTuple remainingKey) {
        long[] acc = new long[4];
        int[] used = new int[4];
        for (int level = 0; level < bits.length; level++) {
            int j = level % 4;
            if (bits[level] == 1) {
                acc[j] |= 1L << used[j];
            }
            used[j]++;
        }
        long[] out = new long[4];
        for (int j = 0; j < 4; j++) {
            long high = used[j] >= 64 ? 0L : remainingKey.limb(j) << used[j];
            out[j] = high | acc[j];
        }
        return FieldElementTuple.of(out, 0);
    }
}
