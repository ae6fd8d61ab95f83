package io.xaio.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stable byte form for artifacts: object keys sorted recursively, compact, UTF-8. Two producers emitting the
 * same logical document get the same hash.
 */
public final class CanonicalJson {
    private static final ObjectMapper COMPACT = new ObjectMapper();

    private CanonicalJson() {
    }

    public static byte[] bytes(JsonNode node) {
        try {
            return COMPACT.writeValueAsString(sorted(node)).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to canonicalize JSON", e);
        }
    }

    public static String hash(JsonNode node) {
        return Hashing.sha256Hex(bytes(node));
    }

    static JsonNode sorted(JsonNode node) {
        if (node == null) {
            return COMPACT.nullNode();
        }
        if (node.isObject()) {
            TreeMap<String, JsonNode> ordered = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                ordered.put(e.getKey(), sorted(e.getValue()));
            }
            ObjectNode out = COMPACT.createObjectNode();
            ordered.forEach(out::set);
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = COMPACT.createArrayNode();
            for (JsonNode child : node) {
                out.add(sorted(child));
            }
            return out;
        }
        return node;
    }
}
