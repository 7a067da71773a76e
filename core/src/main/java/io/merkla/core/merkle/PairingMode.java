package io.merkla.core.merkle;

/**
 * How two child hashes are combined into their parent.
 * <p>
 * CONCATENATE:
 *   - parent = H(left || right), order taken from the tree position.
 *   - Proof positions decide the concatenation order during verification.
 * <p>
 * SORTED:
 *   - the two child hashes are ordered by unsigned byte comparison first,
 *     parent = H(min || max).
 *   - Proof positions are still recorded but do not affect the result.
 * <p>
 * The two modes produce different roots for the same leaves. A proof must be
 * verified with the mode its tree was built with.
 */
public enum PairingMode {
    CONCATENATE,
    SORTED
}
