package io.merkla.core.merkle;

import io.merkla.core.MerkleTreeException;
import io.merkla.core.hash.HashFunction;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Recomputes a root from a leaf hash and an inclusion proof.
 * <p>
 * Needs byte values only, never the tree that produced the proof, which is
 * what makes proofs transmissible.
 * <p>
 * Outcomes:
 *  - true:  the proof folds to exactly the claimed root,
 *  - false: the proof is well formed but folds to anything else,
 *  - INVALID_PROOF: the inputs are structurally broken.
 */
public final class ProofVerifier {
    private static final Logger log = Logger.getLogger(ProofVerifier.class.getName());

    private ProofVerifier() {}

    /** Verify a proof produced by a tree built with plain concatenation. */
    public static boolean verifyInclusion(byte[] leafHash, List<ProofStep> proof, byte[] root, HashFunction fn) {
        return verifyInclusion(leafHash, proof, root, fn, PairingMode.CONCATENATE);
    }

    /**
     * Fold the proof over the leaf hash and compare with {@code root}.
     * Time: O(proof length)
     *
     * @param mode must match the pairing mode of the tree the proof came from
     * @throws MerkleTreeException INVALID_PROOF for malformed input, HASH_FAILURE if {@code fn} fails
     */
    public static boolean verifyInclusion(
            byte[] leafHash,
            List<ProofStep> proof,
            byte[] root,
            HashFunction fn,
            PairingMode mode
    ) {
        Objects.requireNonNull(fn, "hashFunction");
        Objects.requireNonNull(mode, "mode");
        validate(leafHash, proof, root);

        byte[] current = leafHash;
        for (int i = 0; i < proof.size(); i++) {
            ProofStep step = proof.get(i);
            byte[] sibling = step.sibling();
            try {
                current = step.position() == ProofStep.Position.LEFT
                        ? LevelMerkle.h(fn, mode, sibling, current)
                        : LevelMerkle.h(fn, mode, current, sibling);
            } catch (RuntimeException e) {
                throw MerkleTreeException.hashFailure("proof step " + i, e);
            }
        }

        boolean ok = Arrays.equals(current, root);
        if (!ok) {
            log.fine(() -> "proof of %d steps does not lead to the claimed root".formatted(proof.size()));
        }
        return ok;
    }

    private static void validate(byte[] leafHash, List<ProofStep> proof, byte[] root) {
        if (leafHash == null) throw MerkleTreeException.invalidProof("leaf hash is missing");
        if (root == null) throw MerkleTreeException.invalidProof("root hash is missing");
        if (proof == null) throw MerkleTreeException.invalidProof("proof must be a list");
        for (int i = 0; i < proof.size(); i++) {
            ProofStep step = proof.get(i);
            if (step == null) {
                throw MerkleTreeException.invalidProof("step " + i + " is null");
            }
            byte[] sibling = step.sibling();
            if (sibling == null || sibling.length == 0) {
                throw MerkleTreeException.invalidProof("step " + i + " has no sibling hash");
            }
            if (step.position() == null) {
                throw MerkleTreeException.invalidProof("step " + i + " has no position");
            }
        }
    }
}
