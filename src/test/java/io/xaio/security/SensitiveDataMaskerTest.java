package io.xaio.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.xaio.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SensitiveDataMaskerTest {

    @Test
    void masksSensitiveKeysRecursively() {
        ObjectNode in = Jsons.object();
        in.put("url", "https://example.com/a");
        in.putObject("auth").put("apiKey", "k-123").put("user", "ann");
        in.putArray("headers").addObject().put("Authorization", "Bearer abc.def");

        JsonNode out = SensitiveDataMasker.masked(in);

        Assertions.assertEquals("https://example.com/a", out.path("url").asText());
        Assertions.assertEquals("***", out.path("auth").path("apiKey").asText());
        Assertions.assertEquals("ann", out.path("auth").path("user").asText());
        Assertions.assertEquals("***", out.path("headers").get(0).path("Authorization").asText());
        Assertions.assertEquals("k-123", in.path("auth").path("apiKey").asText());
    }

    @Test
    void masksSecretsInsideFreeText() {
        String text = "call failed token=abc123 with Bearer xyz.987 using sk-ABCDEFGHIJKLMNOPQRST";
        String masked = SensitiveDataMasker.maskText(text);
        Assertions.assertFalse(masked.contains("abc123"));
        Assertions.assertFalse(masked.contains("xyz.987"));
        Assertions.assertFalse(masked.contains("ABCDEFGHIJKLMNOPQRST"));
        Assertions.assertTrue(masked.startsWith("call failed token=***"));
        Assertions.assertEquals("plain message", SensitiveDataMasker.maskText("plain message"));
    }
}
