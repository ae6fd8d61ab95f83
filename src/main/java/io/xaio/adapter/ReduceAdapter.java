package io.xaio.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.xaio.model.Stage;
import io.xaio.util.Hashing;
import io.xaio.util.Jsons;
import io.xaio.util.UrlCanonicalizer;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the compact AI envelope from a capture document: cleaned URLs, a few page signals, the full extracted
 * text and its statistics. Pure, so the same capture always reduces to the same bytes.
 */
public final class ReduceAdapter implements StageAdapter {
    static final String ENVELOPE_VERSION = "1.0";

    private final String promptSetId;
    private final List<String> metaWhitelist;

    public ReduceAdapter(String promptSetId, List<String> metaWhitelist) {
        this.promptSetId = promptSetId;
        this.metaWhitelist = List.copyOf(metaWhitelist);
    }

    @Override
    public Stage stage() {
        return Stage.REDUCE;
    }

    @Override
    public StageResult transform(StageInput input) {
        JsonNode capture = input.upstream();
        if (capture == null || !capture.isObject()) {
            return StageResult.validationFailure("capture artifact must be a JSON object");
        }
        String originalUrl = first(capture, "url.original", "urls.original", "payload.url.original", "canonical_key");
        String finalUrl = first(capture, "url.final", "urls.final", "fetch.final_url", "page.url");
        if (finalUrl.isEmpty()) {
            finalUrl = originalUrl;
        }
        String canonicalHint = first(capture, "url.canonical", "urls.canonical", "page.canonical_url",
                "page.meta.canonical", "page.meta.og:url");
        if (canonicalHint.isEmpty()) {
            canonicalHint = finalUrl;
        }
        String text = first(capture, "content.text", "content.extracted_text", "extracted_text",
                "payload.extracted_text");
        String textSha = text.isEmpty() ? "" : Hashing.sha256Hex(text);

        String originalClean = UrlCanonicalizer.clean(originalUrl);
        String finalClean = UrlCanonicalizer.clean(finalUrl);
        String canonicalClean = UrlCanonicalizer.clean(canonicalHint);
        String domainSource = !finalClean.isEmpty() ? finalClean : !canonicalClean.isEmpty() ? canonicalClean : originalClean;

        ObjectNode envelope = Jsons.object();
        envelope.put("xaio_parse_request_version", ENVELOPE_VERSION);

        ObjectNode cap = envelope.putObject("capture");
        cap.put("capture_id", input.itemId() + "__textsha:" + (textSha.isEmpty() ? "no_text" : textSha.substring(0, 12)));
        cap.put("collected_at_utc", first(capture, "ingest.seen_at", "submitted_at", "fetched_at"));

        ObjectNode url = envelope.putObject("url");
        url.put("original", originalUrl);
        url.put("final", finalUrl);
        url.put("canonical_hint", canonicalHint);
        ObjectNode clean = url.putObject("clean");
        clean.put("original", originalClean);
        clean.put("final", finalClean);
        clean.put("canonical", canonicalClean);
        url.put("domain", UrlCanonicalizer.domainOf(domainSource));

        ObjectNode meta = envelope.putObject("meta");
        meta.put("title", first(capture, "page.title", "page.meta.og:title", "page.meta.twitter:title", "title"));
        meta.put("description", first(capture, "page.description", "page.meta.og:description",
                "page.meta.description", "description"));
        meta.put("site_name", first(capture, "page.site_name", "page.meta.og:site_name", "site.name"));
        meta.put("published_at_hint", first(capture, "page.published_at", "page.meta.article:published_time",
                "page.meta.og:published_time", "published_at"));
        meta.put("author_hint", first(capture, "page.byline", "page.author", "page.meta.author",
                "page.meta.article:author", "author"));
        meta.put("fetch_method", first(capture, "fetch.method", "payload.fetch.method", "method"));
        ObjectNode whitelisted = meta.putObject("meta_whitelist");
        JsonNode pageMeta = capture.path("page").path("meta");
        for (String key : metaWhitelist) {
            JsonNode v = pageMeta.path(key);
            if (v.isTextual() && !v.asText().isBlank()) {
                whitelisted.put(key, v.asText().trim());
            }
        }
        JsonNode jsonld = capture.path("page").path("jsonld_extracted");
        ObjectNode identity = meta.putObject("identity_candidates");
        identity.set("organization_names", uniqueStrings(jsonld.path("publisher_names")));
        identity.set("author_names", uniqueStrings(jsonld.path("author_names")));
        identity.set("date_published", uniqueStrings(jsonld.path("date_published")));
        identity.set("date_modified", uniqueStrings(jsonld.path("date_modified")));

        ObjectNode content = envelope.putObject("content");
        content.put("extracted_text_full", text);
        content.put("char_count", text.length());
        content.put("word_count", wordCount(text));
        content.put("sha256", textSha);

        ObjectNode instructions = envelope.putObject("instructions");
        instructions.put("target_cpt", "content");
        instructions.put("prompt_set_id", promptSetId);
        instructions.put("claims_granularity", "atomic");
        instructions.put("claims_should_be_verifiable", true);
        instructions.put("verdict_default", "unverified");
        return StageResult.ok(envelope);
    }

    static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }

    private static String first(JsonNode root, String... paths) {
        for (String path : paths) {
            String v = Jsons.text(root, path);
            if (!v.isEmpty()) {
                return v;
            }
        }
        return "";
    }

    private static ArrayNode uniqueStrings(JsonNode items) {
        Set<String> seen = new LinkedHashSet<>();
        if (items.isArray()) {
            for (JsonNode item : items) {
                if (item.isTextual() && !item.asText().isBlank()) {
                    seen.add(item.asText().trim());
                }
            }
        }
        ArrayNode out = Jsons.mapper().createArrayNode();
        seen.forEach(out::add);
        return out;
    }
}
