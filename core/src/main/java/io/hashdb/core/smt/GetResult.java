package io.hashdb.core.smt;

import io.hashdb.core.FieldElementTuple;
import io.hashdb.core.ReadLog;

import java.math.BigInteger;
import java.util.List;

/**
 * Outcome of a Get: the value plus a Merkle proof against {@code root}.
 *
 * @param siblings         sibling hash per level, root level first
 * @param insKey           key of the leaf ending the path (zero when the path ended empty)
 * @param insValue         value of that leaf
 * @param isOld0           true when the path ended in an empty slot
 * @param proofHashCounter hash evaluations needed to check the proof
 * @param readLog          durable reads performed, or null when not requested
 */
public record GetResult(
        FieldElementTuple root,
        FieldElementTuple key,
        List<FieldElementTuple> siblings,
        FieldElementTuple insKey,
        BigInteger insValue,
        boolean isOld0,
        BigInteger value,
        long proofHashCounter,
        ReadLog readLog
) {}
