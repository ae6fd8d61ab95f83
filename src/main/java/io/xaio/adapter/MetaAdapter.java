package io.xaio.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.xaio.model.Stage;
import io.xaio.util.Jsons;

/**
 * Sends the reduce envelope without its full text to the meta prompt set, then overwrites the fields that can
 * be derived deterministically from the envelope.
 */
public final class MetaAdapter implements StageAdapter {
    private final AiTransformClient client;
    private final String promptSetId;

    public MetaAdapter(AiTransformClient client, String promptSetId) {
        this.client = client;
        this.promptSetId = promptSetId;
    }

    @Override
    public Stage stage() {
        return Stage.META;
    }

    @Override
    public StageResult transform(StageInput input) {
        JsonNode envelope = input.upstream();
        if (envelope == null || !envelope.isObject()) {
            return StageResult.validationFailure("reduce artifact must be a JSON object");
        }
        ObjectNode metaInput = stripFullText(envelope);
        JsonNode response;
        try {
            response = client.run(promptSetId, metaInput);
        } catch (StageException e) {
            return StageResult.failure(e);
        }
        if (response == null || !response.isObject()) {
            return StageResult.validationFailure("meta response must be a JSON object");
        }
        ObjectNode out = ((ObjectNode) response).deepCopy();
        applyDeterministicFields(out, envelope);
        // claims reads the envelope too, so a changed envelope must change this artifact
        out.put("envelope_sha256", input.inputHash());
        return StageResult.ok(out);
    }

    static ObjectNode stripFullText(JsonNode envelope) {
        ObjectNode copy = ((ObjectNode) envelope).deepCopy();
        JsonNode content = copy.get("content");
        if (content != null && content.isObject()) {
            ((ObjectNode) content).remove("extracted_text_full");
        }
        return copy;
    }

    private static void applyDeterministicFields(ObjectNode out, JsonNode envelope) {
        String canonical = firstNonEmpty(
                Jsons.text(envelope, "url.clean.canonical"),
                Jsons.text(envelope, "url.canonical_hint"),
                Jsons.text(envelope, "url.final"),
                Jsons.text(envelope, "url.original")
        );
        putIfPresent(out, "canonical_url", canonical);
        putIfPresent(out, "domain", Jsons.text(envelope, "url.domain"));
        putIfPresent(out, "site_name", Jsons.text(envelope, "meta.site_name"));
        putIfPresent(out, "collected_at_utc", Jsons.text(envelope, "capture.collected_at_utc"));
        putIfPresent(out, "published_at", firstNonEmpty(
                Jsons.at(envelope, "meta.meta_whitelist").path("article:published_time").asText(""),
                Jsons.text(envelope, "meta.published_at_hint")
        ));
        JsonNode content = envelope.path("content");
        if (content.path("char_count").isNumber()) {
            out.put("char_count", content.path("char_count").asInt());
        }
        if (content.path("word_count").isNumber()) {
            out.put("word_count", content.path("word_count").asInt());
        }
    }

    private static void putIfPresent(ObjectNode out, String field, String value) {
        if (value != null && !value.isBlank()) {
            out.put(field, value.trim());
        }
    }

    private static String firstNonEmpty(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return "";
    }
}
