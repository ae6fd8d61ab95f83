package io.xaio.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;

public final class Jsons {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    public static JsonNode parse(byte[] raw) throws IOException {
        return MAPPER.readTree(raw);
    }

    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }

    /**
     * Reads a dotted path such as {@code "content.extracted_text_full"}; missing segments yield a missing node.
     */
    public static JsonNode at(JsonNode root, String dottedPath) {
        JsonNode cur = root == null ? MAPPER.missingNode() : root;
        for (String part : dottedPath.split("\\.")) {
            cur = cur.path(part);
        }
        return cur;
    }

    public static String text(JsonNode root, String dottedPath) {
        JsonNode node = at(root, dottedPath);
        if (node.isMissingNode() || node.isNull()) {
            return "";
        }
        return node.isValueNode() ? node.asText("").trim() : "";
    }
}
