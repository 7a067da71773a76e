package io.merkla.core.codec;

import io.merkla.core.MerkleTreeException;
import io.merkla.core.hash.HashFunction;
import io.merkla.core.merkle.MerkleTree;
import io.merkla.core.merkle.ProofStep;
import io.merkla.core.merkle.ProofVerifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A proof shipped as JSON verifies on the receiving side without the tree,
 * and malformed proof documents fail as INVALID_PROOF.
 */
class ProofCodecTest {

    @Test
    void transmitted_proof_verifies_without_the_tree() {
        MerkleTree tree = MerkleTree.buildFromStrings(List.of("a", "b", "c", "d", "e", "f", "g"));
        String wire = ProofCodec.encode(tree.proveInclusion(6));
        byte[] leaf = tree.leafHash(6);
        byte[] root = tree.root();

        List<ProofStep> received = ProofCodec.decode(wire);

        assertEquals(tree.proveInclusion(6), received);
        assertTrue(ProofVerifier.verifyInclusion(leaf, received, root, HashFunction.sha256()));
    }

    @Test
    void encoded_form_uses_sibling_and_position_tags() {
        MerkleTree tree = MerkleTree.buildFromStrings(List.of("a", "b"));

        String wire = ProofCodec.encode(tree.proveInclusion(1));

        assertTrue(wire.startsWith("[{\"sibling\":\""), wire);
        assertTrue(wire.contains("\"position\":\"left\""), wire);
    }

    @Test
    void empty_proof_round_trips() {
        assertEquals("[]", ProofCodec.encode(List.of()));
        assertTrue(ProofCodec.decode("[]").isEmpty());
    }

    @Test
    void malformed_documents_are_invalid_proofs() {
        String h = "cd".repeat(32);
        assertInvalid("{");
        assertInvalid(null);
        assertInvalid("{\"sibling\": \"" + h + "\", \"position\": \"left\"}");
        assertInvalid("[\"" + h + "\"]");
        assertInvalid("[{\"position\": \"left\"}]");
        assertInvalid("[{\"sibling\": \"xyz1\", \"position\": \"left\"}]");
        assertInvalid("[{\"sibling\": \"" + h + "\"}]");
        assertInvalid("[{\"sibling\": \"" + h + "\", \"position\": 1}]");
        assertInvalid("[{\"sibling\": \"" + h + "\", \"position\": \"up\"}]");
        assertInvalid("[{\"sibling\": \"" + h + "\", \"position\": \"LEFT\"}]");
        assertInvalid("[{\"sibling\": \"" + h + "\", \"position\": \"left\"}] {oops");
        assertInvalid("[] []");
    }

    private static void assertInvalid(String json) {
        var e = assertThrows(MerkleTreeException.class, () -> ProofCodec.decode(json));
        assertEquals(MerkleTreeException.Kind.INVALID_PROOF, e.kind());
    }
}
