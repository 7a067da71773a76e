package io.merkla.core.merkle;

import io.merkla.core.MerkleTreeException;
import io.merkla.core.TreeOptions;
import io.merkla.core.hash.HashFunction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Merkle tree stored as flat per-level arrays.
 * <p>
 * Layout:
 *  - levels[0]      = leaf hashes, in input order
 *  - levels[i + 1]  = ceil(levels[i].length / 2) parent hashes
 *  - levels[last]   = { root }
 * <p>
 * Addressing is purely arithmetic:
 *  - sibling of node i = i ^ 1 (the node itself if that index does not exist)
 *  - parent of node i  = i / 2
 * <p>
 * Internal nodes:
 *  - hash = H(leftChildHash || rightChildHash), or H(min || max) in SORTED mode.
 */
final class LevelMerkle implements MerkleTree {
    private static final Logger log = Logger.getLogger(LevelMerkle.class.getName());

    private final byte[][] leaves;     // leaf hashes as given (== levels[0] when built)
    private final byte[][][] levels;   // level -> position -> hash
    private final TreeOptions options;

    LevelMerkle(List<byte[]> data, TreeOptions options) {
        Objects.requireNonNull(options, "options");
        if (data == null || data.isEmpty()) throw MerkleTreeException.emptyInput();
        this.options = options;
        HashFunction fn = options.hashFunction();

        // 1) hash every leaf exactly once
        byte[][] leafLevel = new byte[data.size()][];
        for (int i = 0; i < leafLevel.length; i++) {
            byte[] item = data.get(i);
            try {
                if (item == null) throw new NullPointerException("leaf is null");
                leafLevel[i] = digest(fn, item);
            } catch (RuntimeException e) {
                throw MerkleTreeException.leafHashFailure(i, e);
            }
        }

        // 2) pair upwards until a single node remains
        List<byte[][]> built = new ArrayList<>();
        built.add(leafLevel);
        byte[][] current = leafLevel;
        while (current.length > 1) {
            int level = built.size();
            byte[][] next = new byte[(current.length + 1) >>> 1][];
            for (int i = 0; i < current.length; i += 2) {
                byte[] left = current[i];
                byte[] right = i + 1 < current.length ? current[i + 1] : left; // self-pair
                try {
                    next[i >>> 1] = h(fn, options.pairing(), left, right);
                } catch (RuntimeException e) {
                    throw MerkleTreeException.hashFailure(
                            "node %d at level %d".formatted(i >>> 1, level), e);
                }
            }
            built.add(next);
            current = next;
        }

        this.leaves = leafLevel;
        this.levels = built.toArray(new byte[0][][]);
        log.fine(() -> "built tree: leaves=%d depth=%d hash=%s pairing=%s".formatted(
                leaves.length, levels.length, options.algorithmName(), options.pairing()));
    }

    private LevelMerkle(byte[][] leaves, byte[][][] levels, TreeOptions options) {
        this.leaves = leaves;
        this.levels = levels;
        this.options = options;
    }

    /**
     * Rebuild from known hashes. The level shape must follow the usual
     * halving rule and end in a single root; hash values are not recomputed.
     */
    static LevelMerkle restore(List<byte[]> leaves, List<List<byte[]>> levels, TreeOptions options) {
        if (leaves == null || leaves.isEmpty()) throw MerkleTreeException.malformed("leaves must not be empty");
        if (levels == null || levels.isEmpty()) throw MerkleTreeException.malformed("tree must not be empty");

        byte[][] leafArr = copyLevel(leaves, "leaves");
        byte[][][] levelArr = new byte[levels.size()][][];
        for (int l = 0; l < levelArr.length; l++) {
            levelArr[l] = copyLevel(levels.get(l), "tree level " + l);
            if (levelArr[l].length == 0) {
                throw MerkleTreeException.malformed("tree level %d must not be empty".formatted(l));
            }
        }

        if (levelArr[0].length != leafArr.length) {
            throw MerkleTreeException.malformed("tree level 0 has %d entries but leaves has %d"
                    .formatted(levelArr[0].length, leafArr.length));
        }
        for (int i = 0; i < leafArr.length; i++) {
            if (!Arrays.equals(levelArr[0][i], leafArr[i])) {
                throw MerkleTreeException.malformed("tree[0] must duplicate leaves (differs at %d)".formatted(i));
            }
        }
        for (int l = 1; l < levelArr.length; l++) {
            int expected = (levelArr[l - 1].length + 1) >>> 1;
            if (levelArr[l].length != expected) {
                throw MerkleTreeException.malformed("tree level %d has %d entries, expected %d"
                        .formatted(l, levelArr[l].length, expected));
            }
        }
        if (levelArr[levelArr.length - 1].length != 1) {
            throw MerkleTreeException.malformed("top tree level must hold exactly one root hash");
        }
        return new LevelMerkle(leafArr, levelArr, options);
    }

    @Override public byte[] root() { return levels[levels.length - 1][0].clone(); }

    @Override public int leafCount() { return leaves.length; }

    @Override public int depth() { return levels.length; }

    @Override public byte[] leafHash(int index) {
        checkIndex(index);
        return leaves[index].clone();
    }

    @Override public List<byte[]> leafHashes() { return copyOut(leaves); }

    @Override public List<List<byte[]>> levels() {
        List<List<byte[]>> out = new ArrayList<>(levels.length);
        for (byte[][] level : levels) out.add(copyOut(level));
        return List.copyOf(out);
    }

    @Override public TreeOptions options() { return options; }

    @Override public List<ProofStep> proveInclusion(int index) {
        checkIndex(index);
        List<ProofStep> proof = new ArrayList<>(levels.length - 1);
        int idx = index;
        for (int level = 0; level < levels.length - 1; level++) {
            byte[][] nodes = levels[level];
            boolean isRightNode = (idx & 1) == 1;
            int siblingIdx = idx ^ 1;
            // missing sibling only happens for the tail of an odd level: pair with self
            byte[] sibling = siblingIdx < nodes.length ? nodes[siblingIdx] : nodes[idx];
            proof.add(new ProofStep(
                    sibling,
                    isRightNode ? ProofStep.Position.LEFT : ProofStep.Position.RIGHT
            ));
            idx >>>= 1;
        }
        return List.copyOf(proof);
    }

    // ---------------- helpers ----------------

    private void checkIndex(int index) {
        if (index < 0 || index >= leaves.length) {
            throw MerkleTreeException.indexOutOfRange(index, leaves.length);
        }
    }

    /**
     * Hash two child hashes into a parent hash.
     * In SORTED mode the pair is ordered by unsigned byte comparison first;
     * a self-pair is unaffected by the ordering.
     */
    static byte[] h(HashFunction fn, PairingMode mode, byte[] left, byte[] right) {
        byte[] a = left;
        byte[] b = right;
        if (mode == PairingMode.SORTED && Arrays.compareUnsigned(left, right) > 0) {
            a = right;
            b = left;
        }
        byte[] joined = new byte[a.length + b.length];
        System.arraycopy(a, 0, joined, 0, a.length);
        System.arraycopy(b, 0, joined, a.length, b.length);
        return digest(fn, joined);
    }

    static byte[] digest(HashFunction fn, byte[] data) {
        byte[] out = fn.hash(data);
        if (out == null) throw new NullPointerException("hash function returned null");
        return out;
    }

    private static byte[][] copyLevel(List<byte[]> level, String what) {
        if (level == null) throw MerkleTreeException.malformed(what + " must be an array");
        byte[][] out = new byte[level.size()][];
        for (int i = 0; i < out.length; i++) {
            byte[] h = level.get(i);
            if (h == null || h.length == 0) {
                throw MerkleTreeException.malformed("%s[%d] must be a non-empty hash".formatted(what, i));
            }
            out[i] = h.clone();
        }
        return out;
    }

    private static List<byte[]> copyOut(byte[][] level) {
        List<byte[]> out = new ArrayList<>(level.length);
        for (byte[] h : level) out.add(h.clone());
        return List.copyOf(out);
    }
}
