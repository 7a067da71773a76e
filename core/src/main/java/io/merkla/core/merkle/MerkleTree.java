package io.merkla.core.merkle;

import io.merkla.core.TreeOptions;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Binary Merkle tree over an ordered list of leaves.
 * <p>
 * At a high level:
 *  - Each leaf input is hashed once into a leaf hash (level 0).
 *  - Each next level pairs adjacent hashes: parent = H(left || right).
 *  - The last node of an odd-sized level is paired with itself.
 *  - The single hash of the top level is the root.
 * <p>
 * Trees are immutable once built. Every accessor returns copies, so a tree
 * can be read from several threads without locking.
 */
public interface MerkleTree {

    /** Root hash. Identical roots imply identical leaf sequences. */
    byte[] root();

    int leafCount();

    /** Number of levels including the leaf level; 1 for a single leaf. */
    int depth();

    /**
     * Hash of the leaf at {@code index}.
     *
     * @throws io.merkla.core.MerkleTreeException INDEX_OUT_OF_RANGE outside [0, leafCount)
     */
    byte[] leafHash(int index);

    List<byte[]> leafHashes();

    /** Every level bottom-up; {@code levels().get(0)} are the leaf hashes. */
    List<List<byte[]>> levels();

    TreeOptions options();

    /**
     * Inclusion proof for the leaf at {@code index}: one step per level
     * below the root, ordered from the leaf upwards.
     * Time: O(log n)
     *
     * @throws io.merkla.core.MerkleTreeException INDEX_OUT_OF_RANGE outside [0, leafCount)
     */
    List<ProofStep> proveInclusion(int index);

    /** Verify a proof against this tree's root, hash function and pairing mode. */
    default boolean verify(byte[] leafHash, List<ProofStep> proof) {
        return ProofVerifier.verifyInclusion(
                leafHash, proof, root(), options().hashFunction(), options().pairing());
    }

    /**
     * Build a tree with SHA-256 and plain concatenation.
     * O(n) to build.
     */
    static MerkleTree build(List<byte[]> leaves) {
        return build(leaves, TreeOptions.defaults());
    }

    static MerkleTree build(List<byte[]> leaves, TreeOptions options) {
        return new LevelMerkle(leaves, options);
    }

    /** Build from text leaves, each encoded as UTF-8. */
    static MerkleTree buildFromStrings(List<String> leaves) {
        return buildFromStrings(leaves, TreeOptions.defaults());
    }

    static MerkleTree buildFromStrings(List<String> leaves, TreeOptions options) {
        List<byte[]> raw = null;
        if (leaves != null) {
            raw = new ArrayList<>(leaves.size());
            for (String s : leaves) {
                raw.add(s == null ? null : s.getBytes(StandardCharsets.UTF_8));
            }
        }
        return build(raw, options);
    }

    /**
     * Rebuild a tree from already computed hashes without re-hashing anything.
     * Only the shape is checked; the hashes are trusted as given.
     *
     * @throws io.merkla.core.MerkleTreeException MALFORMED_SERIALIZATION if the shape is broken
     */
    static MerkleTree restore(List<byte[]> leaves, List<List<byte[]>> levels, TreeOptions options) {
        Objects.requireNonNull(options, "options");
        return LevelMerkle.restore(leaves, levels, options);
    }
}
