package org.learningjava.biasscore.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Typed view of the metadata blob carried by a {@link ModelScore}.
 * <p>
 * Decoding is tolerant: blank input, malformed JSON, a missing field or a field of the
 * wrong type all decode to the field's zero value. A score whose metadata cannot be read
 * therefore has confidence 0.
 */
public record ScoreMetadata(double confidence, String explanation, String perspective) {

    private static final ObjectMapper OM = new ObjectMapper();

    public static final ScoreMetadata EMPTY = new ScoreMetadata(0.0, "", "");

    public static ScoreMetadata parse(String json) {
        if (json == null || json.isBlank()) return EMPTY;
        JsonNode root;
        try {
            root = OM.readTree(json);
        } catch (JsonProcessingException e) {
            return EMPTY;
        }
        if (root == null || !root.isObject()) return EMPTY;

        JsonNode c = root.get("confidence");
        double confidence = (c != null && c.isNumber()) ? c.asDouble() : 0.0;
        if (Double.isNaN(confidence)) confidence = 0.0;

        JsonNode e = root.get("explanation");
        JsonNode p = root.get("perspective");
        return new ScoreMetadata(
                confidence,
                e != null && e.isTextual() ? e.asText() : "",
                p != null && p.isTextual() ? p.asText() : ""
        );
    }

    public String toJson() {
        ObjectNode n = OM.createObjectNode();
        n.put("explanation", explanation == null ? "" : explanation);
        n.put("confidence", confidence);
        if (perspective != null && !perspective.isBlank()) n.put("perspective", perspective);
        return n.toString();
    }
}
