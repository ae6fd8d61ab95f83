package io.xaio.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.xaio.model.Stage;
import io.xaio.util.Jsons;

/**
 * Final record: meta fields, then the claims array, then the verbatim text and counts from the reduce envelope.
 */
public final class MergeAdapter implements StageAdapter {
    @Override
    public Stage stage() {
        return Stage.MERGE;
    }

    @Override
    public StageResult transform(StageInput input) {
        JsonNode meta = input.artifactOf(Stage.META);
        JsonNode envelope = input.artifactOf(Stage.REDUCE);
        JsonNode claims = input.upstream();
        if (!meta.isObject()) {
            return StageResult.validationFailure("meta artifact must be a JSON object");
        }
        ObjectNode out = Jsons.object();
        out.setAll((ObjectNode) meta.deepCopy());
        JsonNode claimList = claims == null ? null : claims.get("claims");
        if (claimList != null && claimList.isArray()) {
            out.set("claims", claimList.deepCopy());
        } else {
            out.putArray("claims");
        }
        JsonNode content = envelope.path("content");
        out.put("extracted_text_full", content.path("extracted_text_full").asText(""));
        if (content.has("char_count")) {
            out.set("char_count", content.get("char_count").deepCopy());
        }
        if (content.has("word_count")) {
            out.set("word_count", content.get("word_count").deepCopy());
        }
        return StageResult.ok(out);
    }
}
