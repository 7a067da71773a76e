package io.merkla.core.merkle;

import io.merkla.core.MerkleTreeException;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * One level of an inclusion proof: the sibling hash and the side it sits on
 * relative to the running path value.
 * <p>
 * LEFT  => next = H(sibling || current)
 * RIGHT => next = H(current || sibling)
 * <p>
 * For the last node of an odd-sized level the sibling is the node itself.
 */
public record ProofStep(byte[] sibling, Position position) {

    public enum Position {
        LEFT("left"),
        RIGHT("right");

        private final String tag;

        Position(String tag) { this.tag = tag; }

        /** Wire tag, "left" or "right". */
        public String tag() { return tag; }

        /**
         * Parse a wire tag. Only the exact lowercase tags are accepted.
         *
         * @throws MerkleTreeException INVALID_PROOF for any other value
         */
        public static Position fromTag(String tag) {
            if ("left".equals(tag)) return LEFT;
            if ("right".equals(tag)) return RIGHT;
            throw MerkleTreeException.invalidProof(
                    "position must be either \"left\" or \"right\", got " + tag);
        }
    }

    public ProofStep {
        // nulls are accepted here; ProofVerifier rejects them as INVALID_PROOF
        sibling = sibling == null ? null : sibling.clone();
    }

    @Override public byte[] sibling() { return sibling == null ? null : sibling.clone(); }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProofStep other)) return false;
        return Arrays.equals(sibling, other.sibling) && position == other.position;
    }

    @Override public int hashCode() {
        return 31 * Arrays.hashCode(sibling) + Objects.hashCode(position);
    }

    @Override public String toString() {
        String hex = sibling == null ? "null" : HexFormat.of().formatHex(sibling);
        return "ProofStep[" + position + " " + hex + "]";
    }
}
