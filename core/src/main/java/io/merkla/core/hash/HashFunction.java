package io.merkla.core.hash;

/**
 * Pure mapping from an arbitrary byte sequence to a digest.
 * <p>
 * Contract:
 *  - deterministic: the same input always yields the same output bytes,
 *  - side-effect free and safe to call from several threads,
 *  - never returns null.
 * <p>
 * No output length is enforced. Callers must use the same function to build
 * a tree and to verify its proofs.
 */
@FunctionalInterface
public interface HashFunction {

    byte[] hash(byte[] data);

    /** Hash function backed by one of the named algorithms. */
    static HashFunction of(HashAlgorithm algorithm) {
        return algorithm.function();
    }

    /** SHA-256, the default for new trees. */
    static HashFunction sha256() {
        return HashAlgorithm.SHA256.function();
    }
}
