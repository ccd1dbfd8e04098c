package io.hashdb.core.smt;

import io.hashdb.core.FieldElementTuple;

import java.math.BigInteger;
import java.util.List;

/**
 * Recomputes a root from a Merkle proof returned by Get or Set.
 * <p>
 * The terminal slot sits at level siblings.size(). It holds either nothing (isOld0) or a
 * leaf built from (leafKey, leafValue); the path key's bits decide on which side each
 * sibling is folded in on the way up.
 */
public final class ProofVerifier {

    private ProofVerifier() {}

    /**
     * @param pathKey   key whose bits describe the path
     * @param leafKey   key of the terminal leaf, or null when the slot is empty
     * @param leafValue value of the terminal leaf (ignored when {@code leafKey} is null)
     * @param siblings  sibling per level, root level first
     */
    public static FieldElementTuple computeRoot(FieldElementTuple pathKey,
                                                FieldElementTuple leafKey,
                                                BigInteger leafValue,
                                                List<FieldElementTuple> siblings) {
        int depth = siblings.size();
        FieldElementTuple cur = FieldElementTuple.ZERO;
        if (leafKey != null) {
            FieldElementTuple valueHash = SmtNode.value(leafValue).hash();
            cur = SmtNode.leaf(SmtKeys.removeKeyBits(leafKey, depth), valueHash).hash();
        }
        for (int level = depth - 1; level >= 0; level--) {
            FieldElementTuple sibling = siblings.get(level);
            cur = SmtKeys.bit(pathKey, level) == 0
                    ? SmtNode.intermediate(cur, sibling).hash()
                    : SmtNode.intermediate(sibling, cur).hash();
        }
        return cur;
    }

    /** Root implied by a Get proof. */
    public static FieldElementTuple rootOf(GetResult r) {
        return r.isOld0()
                ? computeRoot(r.key(), null, BigInteger.ZERO, r.siblings())
                : computeRoot(r.key(), r.insKey(), r.insValue(), r.siblings());
    }

    public static boolean verify(GetResult r) {
        return rootOf(r).equals(r.root());
    }
}
