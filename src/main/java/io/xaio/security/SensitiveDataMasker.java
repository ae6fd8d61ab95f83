package io.xaio.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.xaio.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credentials before they reach the audit log or the ledger's error details. Collaborator scripts tend
 * to echo API keys and bearer tokens in their diagnostics.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );
    private static final Pattern ASSIGNMENT = Pattern.compile(
            "(?i)\\b([a-z_\\-]*(?:password|passwd|secret|token|api[_\\-]?key|credential)[a-z_\\-]*)\\s*([=:])\\s*(\"[^\"]*\"|\\S+)");
    private static final Pattern BEARER = Pattern.compile("(?i)\\bbearer\\s+[A-Za-z0-9+/=_\\-.]+");
    private static final Pattern OPAQUE = Pattern.compile("\\b(?:sk|pk|ghp|xox[bp])[-_][A-Za-z0-9\\-_]{16,}\\b");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey();
                if (isSensitiveKey(key)) {
                    out.put(key, MASK);
                } else {
                    out.set(key, masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            String text = input.asText("");
            String m = maskText(text);
            return m.equals(text) ? input : Jsons.mapper().valueToTree(m);
        }
        return input;
    }

    /**
     * Masks {@code key=value} pairs with sensitive key names, bearer tokens and well-known API key shapes inside
     * free-form text.
     */
    public static String maskText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String out = ASSIGNMENT.matcher(text).replaceAll("$1$2" + MASK);
        out = BEARER.matcher(out).replaceAll("Bearer " + MASK);
        return OPAQUE.matcher(out).replaceAll(MASK);
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
