package io.merkla.core.codec;

import java.util.List;

/**
 * Interchange snapshot of a tree.
 * <p>
 *  - leaves: leaf hashes as lowercase hex
 *  - tree:   every level bottom-up as lowercase hex; tree[0] duplicates leaves
 * <p>
 * Only hashes are carried. Raw leaf data cannot be recovered from it.
 */
public record SerializedTree(List<String> leaves, List<List<String>> tree) {
    public SerializedTree {
        leaves = List.copyOf(leaves);
        tree = tree.stream().map(List::copyOf).toList();
    }
}
