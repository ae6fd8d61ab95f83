package io.xaio.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import io.xaio.model.Stage;

import java.util.Map;

/**
 * Everything an adapter may see for one invocation. {@code upstream} is the immediate predecessor's artifact
 * (null for capture); {@code lineage} holds the current DONE artifacts of all earlier stages.
 */
public record StageInput(
        String itemId,
        Stage stage,
        String canonicalKey,
        JsonNode upstream,
        Map<Stage, JsonNode> lineage,
        String inputHash,
        int attempt
) {
    public StageInput {
        lineage = Map.copyOf(lineage);
    }

    public JsonNode artifactOf(Stage earlier) {
        JsonNode node = lineage.get(earlier);
        if (node == null) {
            throw new IllegalStateException("No " + earlier.wireName() + " artifact in lineage of " + itemId);
        }
        return node;
    }
}
