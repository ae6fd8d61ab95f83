package io.xaio.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.xaio.model.Stage;
import io.xaio.util.Jsons;

import java.util.HashSet;
import java.util.Set;

/**
 * Extracts atomic claims from the full text. The response must carry a {@code claims} array; entries are
 * whitespace-normalized and deduplicated on (text, type). The output names the meta artifact it was built
 * from, so merge reruns whenever meta changed even if the extracted claims did not.
 */
public final class ClaimsAdapter implements StageAdapter {
    private final AiTransformClient client;
    private final String promptSetId;

    public ClaimsAdapter(AiTransformClient client, String promptSetId) {
        this.client = client;
        this.promptSetId = promptSetId;
    }

    @Override
    public Stage stage() {
        return Stage.CLAIMS;
    }

    @Override
    public StageResult transform(StageInput input) {
        JsonNode envelope = input.artifactOf(Stage.REDUCE);
        JsonNode meta = input.upstream();

        ObjectNode request = Jsons.object();
        String canonical = Jsons.text(envelope, "url.clean.canonical");
        if (canonical.isEmpty()) {
            canonical = Jsons.text(envelope, "url.final");
        }
        request.put("canonical_url", canonical);
        request.set("meta", envelope.path("meta").deepCopy());
        request.set("meta_parsed", meta == null ? Jsons.object() : meta.deepCopy());
        request.putObject("content").put("extracted_text_full", Jsons.text(envelope, "content.extracted_text_full"));

        JsonNode response;
        try {
            response = client.run(promptSetId, request);
        } catch (StageException e) {
            return StageResult.failure(e);
        }
        if (response == null || !response.path("claims").isArray()) {
            return StageResult.validationFailure("claims response must contain a 'claims' array");
        }

        ArrayNode cleaned = Jsons.mapper().createArrayNode();
        Set<String> seen = new HashSet<>();
        for (JsonNode claim : response.path("claims")) {
            String text = normalize(claim.path("claim_text").asText(""));
            String type = claim.path("claim_type").asText("").trim();
            if (text.isEmpty() || !seen.add(text + "\u0000" + type)) {
                continue;
            }
            ObjectNode c = cleaned.addObject();
            c.put("claim_text", text);
            c.put("claim_type", type);
        }
        ObjectNode out = Jsons.object();
        out.set("claims", cleaned);
        out.put("meta_sha256", input.inputHash());
        return StageResult.ok(out);
    }

    static String normalize(String raw) {
        return raw == null ? "" : raw.replaceAll("\\s+", " ").trim();
    }
}
