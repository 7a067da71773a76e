package io.merkla.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.merkla.core.MerkleTreeException;
import io.merkla.core.merkle.ProofStep;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of an inclusion proof, for sending proofs to a verifier that
 * does not hold the tree:
 * <pre>
 * [ { "sibling": "&lt;hex&gt;", "position": "right" }, ... ]
 * </pre>
 * Steps are ordered from the leaf upwards.
 */
public final class ProofCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private ProofCodec() {}

    public static String encode(List<ProofStep> proof) {
        ArrayNode out = MAPPER.createArrayNode();
        for (ProofStep step : proof) {
            out.addObject()
                    .put("sibling", Hex.encode(step.sibling()))
                    .put("position", step.position().tag());
        }
        try {
            return MAPPER.writeValueAsString(out);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize proof", e);
        }
    }

    /**
     * @throws MerkleTreeException INVALID_PROOF for anything that is not a list of
     *                             well-formed {sibling, position} objects
     */
    public static List<ProofStep> decode(String json) {
        if (json == null) throw MerkleTreeException.invalidProof("input is null");
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw MerkleTreeException.invalidProof("not valid JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw MerkleTreeException.invalidProof("proof must be an array");
        }

        List<ProofStep> steps = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode item = root.get(i);
            if (!item.isObject()) {
                throw MerkleTreeException.invalidProof("step " + i + " must be an object");
            }
            JsonNode sibling = item.get("sibling");
            if (sibling == null || !sibling.isTextual()) {
                throw MerkleTreeException.invalidProof("step " + i + " sibling must be a hex string");
            }
            String problem = Hex.problem(sibling.textValue());
            if (problem != null) {
                throw MerkleTreeException.invalidProof("step " + i + " sibling " + problem);
            }
            JsonNode position = item.get("position");
            if (position == null || !position.isTextual()) {
                throw MerkleTreeException.invalidProof("step " + i + " position must be a string");
            }
            steps.add(new ProofStep(
                    Hex.decode(sibling.textValue()),
                    ProofStep.Position.fromTag(position.textValue())
            ));
        }
        return List.copyOf(steps);
    }
}
