package io.merkla.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.merkla.core.MerkleTreeException;
import io.merkla.core.TreeOptions;
import io.merkla.core.hash.HashFunction;
import io.merkla.core.merkle.MerkleTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * JSON form of a tree:
 * <pre>
 * { "leaves": ["&lt;hex&gt;", ...], "tree": [["&lt;hex&gt;", ...], ["&lt;hex&gt;", ...], ...] }
 * </pre>
 * Encoding writes lowercase hex in level order and in-level order.
 * <p>
 * Decoding checks structure and hex encoding only. It does not recompute any
 * hash, so a hand-edited tree decodes fine; callers that need assurance must
 * compare the root against a known-good value or verify proofs.
 */
public final class TreeCodec {
    private static final Logger log = Logger.getLogger(TreeCodec.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private TreeCodec() {}

    public static SerializedTree toSerialized(MerkleTree tree) {
        List<String> leaves = tree.leafHashes().stream().map(Hex::encode).toList();
        List<List<String>> levels = tree.levels().stream()
                .map(level -> level.stream().map(Hex::encode).toList())
                .toList();
        return new SerializedTree(leaves, levels);
    }

    public static String serialize(MerkleTree tree) {
        try {
            return MAPPER.writeValueAsString(toSerialized(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tree", e);
        }
    }

    /** Decode with a custom hash function and plain concatenation. */
    public static MerkleTree deserialize(String json, HashFunction fn) {
        Objects.requireNonNull(fn, "hashFunction");
        return deserialize(json, TreeOptions.defaults().withHashFunction(fn));
    }

    /**
     * Decode a tree. The options are attached to the result for later proof
     * checks via {@link MerkleTree#verify}; they are not used to re-hash.
     *
     * @throws MerkleTreeException MALFORMED_SERIALIZATION naming the broken field
     */
    public static MerkleTree deserialize(String json, TreeOptions options) {
        Objects.requireNonNull(options, "options");
        if (json == null) throw MerkleTreeException.malformed("input is null");
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw MerkleTreeException.malformed("not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw MerkleTreeException.malformed("must be an object");
        }

        JsonNode leavesNode = root.get("leaves");
        if (leavesNode == null || !leavesNode.isArray()) {
            throw MerkleTreeException.malformed("leaves must be an array");
        }
        JsonNode treeNode = root.get("tree");
        if (treeNode == null || !treeNode.isArray()) {
            throw MerkleTreeException.malformed("tree must be an array");
        }

        List<byte[]> leaves = readHashes(leavesNode, "leaves");
        List<List<byte[]>> levels = new ArrayList<>(treeNode.size());
        for (int l = 0; l < treeNode.size(); l++) {
            JsonNode level = treeNode.get(l);
            if (!level.isArray()) {
                throw MerkleTreeException.malformed("tree levels must be arrays (tree[%d])".formatted(l));
            }
            levels.add(readHashes(level, "tree[" + l + "]"));
        }

        MerkleTree tree = MerkleTree.restore(leaves, levels, options);
        log.fine(() -> "decoded tree: leaves=%d depth=%d".formatted(tree.leafCount(), tree.depth()));
        return tree;
    }

    private static List<byte[]> readHashes(JsonNode array, String field) {
        List<byte[]> out = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonNode n = array.get(i);
            if (!n.isTextual()) {
                throw MerkleTreeException.malformed("%s[%d] must be a hex string".formatted(field, i));
            }
            String problem = Hex.problem(n.textValue());
            if (problem != null) {
                throw MerkleTreeException.malformed("%s[%d] %s".formatted(field, i, problem));
            }
            out.add(Hex.decode(n.textValue()));
        }
        return out;
    }
}
