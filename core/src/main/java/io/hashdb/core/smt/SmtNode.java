package io.hashdb.core.smt;

import io.hashdb.core.FieldElementTuple;
import io.hashdb.core.HashDbException;
import io.hashdb.core.hash.NodeHasher;
import io.hashdb.core.hash.Scalars;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * One entry of the nodes table: twelve limbs [in0..in7, cap0..cap3] keyed by H(in, cap).
 * <p>
 * Layouts:
 *  - intermediate: in = left(4) ++ right(4), cap = {0,0,0,0}
 *  - leaf:         in = remainingKey(4) ++ valueHash(4), cap = {1,0,0,0}
 *  - value:        in = value as eight 32-bit limbs, cap = {0,0,0,0}
 * <p>
 * Intermediate and value entries share a layout; which one an entry is follows from
 * where it is referenced (child slot vs leaf value hash).
 */
public final class SmtNode {

    private final long[] limbs;
    private final FieldElementTuple hash;

    private SmtNode(long[] limbs, FieldElementTuple hash) {
        this.limbs = limbs;
        this.hash = hash;
    }

    public static SmtNode intermediate(FieldElementTuple left, FieldElementTuple right) {
        long[] in = new long[NodeHasher.INPUT_LIMBS];
        System.arraycopy(left.toArray(), 0, in, 0, 4);
        System.arraycopy(right.toArray(), 0, in, 4, 4);
        return build(in, NodeHasher.CAPACITY_ZERO);
    }

    public static SmtNode leaf(FieldElementTuple remainingKey, FieldElementTuple valueHash) {
        long[] in = new long[NodeHasher.INPUT_LIMBS];
        System.arraycopy(remainingKey.toArray(), 0, in, 0, 4);
        System.arraycopy(valueHash.toArray(), 0, in, 4, 4);
        return build(in, NodeHasher.CAPACITY_LEAF);
    }

    public static SmtNode value(BigInteger value) {
        return build(Scalars.toLimbs32(value), NodeHasher.CAPACITY_ZERO);
    }

    /**
     * Wrap limbs read from storage under {@code hash}. The content is trusted to match the
     * hash (it was checked when it entered the store); only its size is validated here.
     */
    public static SmtNode decode(FieldElementTuple hash, long[] data) {
        if (data == null || data.length != NodeHasher.NODE_LIMBS) {
            throw HashDbException.invalidDataSize(hash, data == null ? 0 : data.length);
        }
        return new SmtNode(data.clone(), hash);
    }

    private static SmtNode build(long[] in, long[] capacity) {
        long[] limbs = new long[NodeHasher.NODE_LIMBS];
        System.arraycopy(in, 0, limbs, 0, NodeHasher.INPUT_LIMBS);
        System.arraycopy(capacity, 0, limbs, NodeHasher.INPUT_LIMBS, NodeHasher.CAPACITY_LIMBS);
        return new SmtNode(limbs, NodeHasher.hash(in, capacity));
    }

    public FieldElementTuple hash() {
        return hash;
    }

    public long[] limbs() {
        return limbs.clone();
    }

    public boolean isLeaf() {
        return limbs[8] == 1L;
    }

    /** Child hash for branch {@code bit} (0 = left, 1 = right) of an intermediate node. */
    public FieldElementTuple child(int bit) {
        return FieldElementTuple.of(limbs, bit == 0 ? 0 : 4);
    }

    public FieldElementTuple remainingKey() {
        return FieldElementTuple.of(limbs, 0);
    }

    public FieldElementTuple valueHash() {
        return FieldElementTuple.of(limbs, 4);
    }

    /** Scalar held by a value entry. */
    public BigInteger valueScalar() {
        return Scalars.fromLimbs32(limbs, 0);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SmtNode other && Arrays.equals(limbs, other.limbs);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(limbs);
    }

    @Override
    public String toString() {
        return (isLeaf() ? "Leaf" : "Node") + "[" + hash.toHex() + "]";
    }
}
