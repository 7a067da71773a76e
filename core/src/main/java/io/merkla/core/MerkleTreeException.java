package io.merkla.core;

import java.util.OptionalInt;

/**
 * Failure raised by tree construction, queries, proof verification and decoding.
 * <p>
 * Every failure is a caller-input problem, so none of them is retried.
 * A proof that is well formed but does not lead to the expected root is not
 * an error: verification simply returns false.
 */
public final class MerkleTreeException extends RuntimeException {

    public enum Kind {
        /** Tree construction with zero leaves. */
        EMPTY_INPUT,
        /** Leaf or proof query outside [0, leafCount). */
        INDEX_OUT_OF_RANGE,
        /** Structurally malformed proof or proof step. */
        INVALID_PROOF,
        /** The configured hash function failed or returned null. */
        HASH_FAILURE,
        /** Decode-time structural or encoding violation. */
        MALFORMED_SERIALIZATION
    }

    private final Kind kind;
    private final int leafIndex; // -1 when not tied to a leaf

    private MerkleTreeException(Kind kind, String message, int leafIndex, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.leafIndex = leafIndex;
    }

    public Kind kind() { return kind; }

    /** Index of the offending leaf, when the failure concerns one. */
    public OptionalInt leafIndex() {
        return leafIndex < 0 ? OptionalInt.empty() : OptionalInt.of(leafIndex);
    }

    public static MerkleTreeException emptyInput() {
        return new MerkleTreeException(Kind.EMPTY_INPUT, "Cannot create tree from empty data", -1, null);
    }

    public static MerkleTreeException indexOutOfRange(int index, int leafCount) {
        return new MerkleTreeException(
                Kind.INDEX_OUT_OF_RANGE,
                "Leaf index %d out of bounds [0, %d)".formatted(index, leafCount),
                -1,
                null
        );
    }

    public static MerkleTreeException invalidProof(String reason) {
        return new MerkleTreeException(Kind.INVALID_PROOF, "Invalid proof: " + reason, -1, null);
    }

    public static MerkleTreeException invalidProof(String reason, Throwable cause) {
        return new MerkleTreeException(Kind.INVALID_PROOF, "Invalid proof: " + reason, -1, cause);
    }

    /** Hashing of the leaf at {@code leafIndex} failed. */
    public static MerkleTreeException leafHashFailure(int leafIndex, Throwable cause) {
        return new MerkleTreeException(
                Kind.HASH_FAILURE,
                "Failed to hash leaf at index %d: %s".formatted(leafIndex, describe(cause)),
                leafIndex,
                cause
        );
    }

    /** Hashing of an internal node (or a verification step) failed. */
    public static MerkleTreeException hashFailure(String where, Throwable cause) {
        return new MerkleTreeException(
                Kind.HASH_FAILURE,
                "Failed to hash %s: %s".formatted(where, describe(cause)),
                -1,
                cause
        );
    }

    public static MerkleTreeException malformed(String reason) {
        return new MerkleTreeException(Kind.MALFORMED_SERIALIZATION, "Invalid tree data: " + reason, -1, null);
    }

    public static MerkleTreeException malformed(String reason, Throwable cause) {
        return new MerkleTreeException(Kind.MALFORMED_SERIALIZATION, "Invalid tree data: " + reason, -1, cause);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
