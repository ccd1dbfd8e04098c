package io.hashdb.core.smt;

import io.hashdb.core.FieldElementTuple;
import io.hashdb.core.ReadLog;

import java.math.BigInteger;
import java.util.List;

/**
 * Outcome of a Set. {@code siblings}, {@code insKey}, {@code insValue} and {@code isOld0}
 * describe the path in the old tree, as for {@link GetResult}.
 */
public record SetResult(
        FieldElementTuple oldRoot,
        FieldElementTuple newRoot,
        FieldElementTuple key,
        List<FieldElementTuple> siblings,
        FieldElementTuple insKey,
        BigInteger insValue,
        boolean isOld0,
        BigInteger oldValue,
        BigInteger newValue,
        SetMode mode,
        long proofHashCounter,
        ReadLog readLog
) {}
