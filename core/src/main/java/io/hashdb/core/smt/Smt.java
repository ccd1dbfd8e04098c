package io.hashdb.core.smt;

import io.hashdb.core.FieldElementTuple;
import io.hashdb.core.HashDbException;
import io.hashdb.core.ReadLog;
import io.hashdb.core.ResultCode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sparse Merkle tree over content-addressed nodes.
 * <p>
 * Shape:
 *  - the all-zero hash is the empty tree and the empty child,
 *  - a leaf sits at the highest level where its key prefix is unique and stores the
 *    remaining key bits plus the hash of its value entry,
 *  - internal nodes hash their two children.
 * <p>
 * Nodes are never modified. A Set rebuilds the path from the changed slot to the root
 * and reuses every untouched sibling, so old and new roots share all other subtrees.
 * The engine itself holds no state: all nodes created by one Set are collected locally
 * and handed to {@link NodeSource#stage} once the whole computation succeeded, so a
 * failing read stages nothing.
 * <p>
 * Deletion keeps the tree canonical: an internal node left with one leaf child and one
 * empty child is replaced by that leaf, repeatedly up the path.
 */
public final class Smt {
    private static final Logger log = Logger.getLogger(Smt.class.getName());

    private final NodeSource source;

    public Smt(NodeSource source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Look up {@code key} under {@code root}.
     *
     * @param readLog collects durable reads when not null
     */
    public GetResult get(FieldElementTuple root, FieldElementTuple key, ReadLog readLog) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(key, "key");

        Path path = walk(root, key, readLog);
        Leaf leaf = path.leaf();

        BigInteger value = BigInteger.ZERO;
        FieldElementTuple insKey = FieldElementTuple.ZERO;
        BigInteger insValue = BigInteger.ZERO;
        if (leaf != null) {
            insKey = leaf.key();
            insValue = leaf.value();
            if (leaf.key().equals(key)) {
                value = leaf.value();
            }
        }

        if (log.isLoggable(Level.FINE)) {
            log.fine("get root=" + root + " key=" + key + " depth=" + path.depth() + " found=" + (value.signum() != 0));
        }
        return new GetResult(root, key, path.siblings(), insKey, insValue, leaf == null,
                value, path.proofHashes(), readLog);
    }

    /**
     * Set {@code key} to {@code value} under {@code oldRoot}; a zero value deletes the key.
     *
     * @param persistent whether created nodes join the next flush batch
     * @param readLog    collects durable reads when not null
     */
    public SetResult set(FieldElementTuple oldRoot, FieldElementTuple key, BigInteger value,
                         boolean persistent, ReadLog readLog) {
        Objects.requireNonNull(oldRoot, "oldRoot");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        Path path = walk(oldRoot, key, readLog);
        Leaf leaf = path.leaf();
        int depth = path.depth();
        boolean keyFound = leaf != null && leaf.key().equals(key);
        BigInteger oldValue = keyFound ? leaf.value() : BigInteger.ZERO;

        Map<FieldElementTuple, long[]> created = new LinkedHashMap<>();
        SetMode mode;
        FieldElementTuple newRoot;

        if (value.signum() != 0) {
            if (keyFound && oldValue.equals(value)) {
                mode = SetMode.UPDATE;
                newRoot = oldRoot;
            } else if (keyFound) {
                mode = SetMode.UPDATE;
                FieldElementTuple valueHash = put(created, SmtNode.value(value));
                newRoot = climb(Subtree.leaf(key, valueHash, depth), path, key, created, readLog);
            } else if (leaf != null) {
                mode = SetMode.INSERT_EXISTING;
                FieldElementTuple valueHash = put(created, SmtNode.value(value));
                FieldElementTuple fork = insertBeside(leaf, key, valueHash, depth, created);
                newRoot = climb(Subtree.internal(fork), path, key, created, readLog);
            } else {
                mode = SetMode.INSERT_NOT_FOUND;
                FieldElementTuple valueHash = put(created, SmtNode.value(value));
                newRoot = climb(Subtree.leaf(key, valueHash, depth), path, key, created, readLog);
            }
        } else if (keyFound) {
            newRoot = climb(Subtree.EMPTY, path, key, created, readLog);
            mode = newRoot.isZero() ? SetMode.DELETE_LAST : SetMode.DELETE_FOUND;
        } else {
            mode = leaf != null ? SetMode.DELETE_NOT_FOUND : SetMode.ZERO_TO_ZERO;
            newRoot = oldRoot;
        }

        source.stage(created, persistent, newRoot);

        if (log.isLoggable(Level.FINE)) {
            log.fine("set mode=" + mode.wireName() + " oldRoot=" + oldRoot + " newRoot=" + newRoot
                    + " created=" + created.size() + " persistent=" + persistent);
        }

        FieldElementTuple insKey = leaf == null ? FieldElementTuple.ZERO : leaf.key();
        BigInteger insValue = leaf == null ? BigInteger.ZERO : leaf.value();
        return new SetResult(oldRoot, newRoot, key, path.siblings(), insKey, insValue, leaf == null,
                oldValue, value, mode, path.proofHashes() + created.size(), readLog);
    }

    // ---------------- traversal ----------------

    private Path walk(FieldElementTuple root, FieldElementTuple key, ReadLog readLog) {
        List<FieldElementTuple> siblings = new ArrayList<>();
        FieldElementTuple cursor = root;
        int level = 0;

        while (!cursor.isZero()) {
            SmtNode node = load(cursor, readLog);
            if (node.isLeaf()) {
                SmtNode valueEntry = load(node.valueHash(), readLog);
                FieldElementTuple leafKey = SmtKeys.joinKey(SmtKeys.pathBits(key, level), node.remainingKey());
                BigInteger leafValue;
                try {
                    leafValue = valueEntry.valueScalar();
                } catch (IllegalArgumentException e) {
                    throw new HashDbException(ResultCode.SMT_INVALID_DATA_SIZE,
                            "malformed value entry " + node.valueHash(), e);
                }
                return new Path(List.copyOf(siblings), new Leaf(leafKey, node.valueHash(), leafValue));
            }
            if (level >= SmtKeys.MAX_LEVELS) {
                throw new HashDbException(ResultCode.INTERNAL_ERROR, "tree deeper than " + SmtKeys.MAX_LEVELS + " levels");
            }
            int bit = SmtKeys.bit(key, level);
            siblings.add(node.child(1 - bit));
            cursor = node.child(bit);
            level++;
        }
        return new Path(List.copyOf(siblings), null);
    }

    private SmtNode load(FieldElementTuple hash, ReadLog readLog) {
        return SmtNode.decode(hash, source.read(hash, readLog));
    }

    // ---------------- mutation ----------------

    /**
     * Split the slot held by {@code existing} at {@code depth} into a subtree holding both
     * leaves. The two keys share their path down to the first differing bit; one-sided
     * internal nodes fill the levels between {@code depth} and that bit.
     */
    private static FieldElementTuple insertBeside(Leaf existing, FieldElementTuple key, FieldElementTuple valueHash,
                                                  int depth, Map<FieldElementTuple, long[]> created) {
        int split = depth;
        while (SmtKeys.bit(key, split) == SmtKeys.bit(existing.key(), split)) {
            split++;
            if (split >= SmtKeys.MAX_LEVELS) {
                throw new HashDbException(ResultCode.INTERNAL_ERROR, "keys share every path bit: " + key);
            }
        }

        FieldElementTuple oldLeaf = put(created,
                SmtNode.leaf(SmtKeys.removeKeyBits(existing.key(), split + 1), existing.valueHash()));
        FieldElementTuple newLeaf = put(created,
                SmtNode.leaf(SmtKeys.removeKeyBits(key, split + 1), valueHash));

        FieldElementTuple node = SmtKeys.bit(key, split) == 0
                ? put(created, SmtNode.intermediate(newLeaf, oldLeaf))
                : put(created, SmtNode.intermediate(oldLeaf, newLeaf));

        for (int level = split - 1; level >= depth; level--) {
            node = SmtKeys.bit(key, level) == 0
                    ? put(created, SmtNode.intermediate(node, FieldElementTuple.ZERO))
                    : put(created, SmtNode.intermediate(FieldElementTuple.ZERO, node));
        }
        return node;
    }

    /**
     * Rebuild the path above {@code start} (which replaces the slot at the path's terminal
     * level), applying leaf pull-up while climbing.
     */
    private FieldElementTuple climb(Subtree start, Path path, FieldElementTuple key,
                                    Map<FieldElementTuple, long[]> created, ReadLog readLog) {
        Subtree cur = start;
        List<FieldElementTuple> siblings = path.siblings();

        for (int level = path.depth() - 1; level >= 0; level--) {
            FieldElementTuple sibling = siblings.get(level);
            int bit = SmtKeys.bit(key, level);

            if (sibling.isZero()) {
                if (cur.isEmpty()) {
                    continue;
                }
                if (cur.isLeaf()) {
                    cur = cur.atLevel(level);
                    continue;
                }
            } else if (cur.isEmpty()) {
                SmtNode siblingNode = load(sibling, readLog);
                if (siblingNode.isLeaf()) {
                    int[] bits = new int[level + 1];
                    System.arraycopy(SmtKeys.pathBits(key, level), 0, bits, 0, level);
                    bits[level] = 1 - bit;
                    FieldElementTuple siblingKey = SmtKeys.joinKey(bits, siblingNode.remainingKey());
                    cur = Subtree.leaf(siblingKey, siblingNode.valueHash(), level);
                    continue;
                }
            }

            FieldElementTuple child = cur.materialize(created);
            cur = Subtree.internal(bit == 0
                    ? put(created, SmtNode.intermediate(child, sibling))
                    : put(created, SmtNode.intermediate(sibling, child)));
        }
        return cur.materialize(created);
    }

    private static FieldElementTuple put(Map<FieldElementTuple, long[]> created, SmtNode node) {
        created.putIfAbsent(node.hash(), node.limbs());
        return node.hash();
    }

    // ---------------- internal views ----------------

    /** Leaf that terminated a traversal, with its full key restored. */
    private record Leaf(FieldElementTuple key, FieldElementTuple valueHash, BigInteger value) {}

    /** Siblings met on the way down plus the terminal leaf (null when the path ended empty). */
    private record Path(List<FieldElementTuple> siblings, Leaf leaf) {
        int depth() {
            return siblings.size();
        }

        long proofHashes() {
            return siblings.size() + (leaf != null ? 2L : 0L);
        }
    }

    /**
     * Subtree replacing a path slot while climbing. Leaves are kept unhashed until they
     * settle, so pulling a leaf up several levels creates a single node.
     */
    private record Subtree(Kind kind, FieldElementTuple hash, FieldElementTuple key,
                           FieldElementTuple valueHash, int level) {

        enum Kind { EMPTY, LEAF, INTERNAL }

        static final Subtree EMPTY = new Subtree(Kind.EMPTY, FieldElementTuple.ZERO, null, null, 0);

        static Subtree leaf(FieldElementTuple key, FieldElementTuple valueHash, int level) {
            return new Subtree(Kind.LEAF, null, key, valueHash, level);
        }

        static Subtree internal(FieldElementTuple hash) {
            return new Subtree(Kind.INTERNAL, hash, null, null, 0);
        }

        boolean isEmpty() {
            return kind == Kind.EMPTY;
        }

        boolean isLeaf() {
            return kind == Kind.LEAF;
        }

        Subtree atLevel(int newLevel) {
            return leaf(key, valueHash, newLevel);
        }

        FieldElementTuple materialize(Map<FieldElementTuple, long[]> created) {
            if (kind != Kind.LEAF) {
                return hash;
            }
            return put(created, SmtNode.leaf(SmtKeys.removeKeyBits(key, level), valueHash));
        }
    }
}
