package io.xaio.adapter.script;

import com.fasterxml.jackson.databind.JsonNode;
import io.xaio.adapter.TransientStageException;
import io.xaio.adapter.ValidationStageException;
import io.xaio.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class ScriptInvokerTest {

    @Test
    void payloadGoesInOnStdinAndJsonComesBackOnStdout() throws Exception {
        ScriptInvoker invoker = new ScriptInvoker(List.of("sh", "-c", "cat"), 10_000L);
        JsonNode out = invoker.invoke(List.of(), Jsons.object().put("url", "https://example.com/a"));
        Assertions.assertEquals("https://example.com/a", out.path("url").asText());
    }

    @Test
    void extraArgsAreAppended() throws Exception {
        ScriptInvoker invoker = new ScriptInvoker(
                List.of("sh", "-c", "cat > /dev/null; printf '{\"prompt\":\"%s\"}' \"$2\"", "ai"), 10_000L);
        JsonNode out = invoker.invoke(List.of("--prompt-set", "meta.v1"), Jsons.object());
        Assertions.assertEquals("meta.v1", out.path("prompt").asText());
    }

    @Test
    void dataErrExitIsValidationOtherExitIsTransient() {
        ScriptInvoker rejects = new ScriptInvoker(List.of("sh", "-c", "echo 'bad field' >&2; exit 65"), 10_000L);
        ValidationStageException v = Assertions.assertThrows(ValidationStageException.class,
                () -> rejects.invoke(List.of(), Jsons.object()));
        Assertions.assertTrue(v.getMessage().contains("bad field"));

        ScriptInvoker flaky = new ScriptInvoker(List.of("sh", "-c", "echo 'upstream 503' >&2; exit 3"), 10_000L);
        TransientStageException t = Assertions.assertThrows(TransientStageException.class,
                () -> flaky.invoke(List.of(), Jsons.object()));
        Assertions.assertTrue(t.getMessage().contains("exit=3"));
    }

    @Test
    void nonJsonOutputIsValidationFailure() {
        ScriptInvoker invoker = new ScriptInvoker(List.of("sh", "-c", "cat > /dev/null; echo '<html>'"), 10_000L);
        Assertions.assertThrows(ValidationStageException.class, () -> invoker.invoke(List.of(), Jsons.object()));
    }

    @Test
    void timeoutAndMissingBinaryAreTransient() {
        ScriptInvoker slow = new ScriptInvoker(List.of("sh", "-c", "exec sleep 10"), 200L);
        TransientStageException timeout = Assertions.assertThrows(TransientStageException.class,
                () -> slow.invoke(List.of(), Jsons.object()));
        Assertions.assertTrue(timeout.getMessage().startsWith("script timeout"));

        ScriptInvoker missing = new ScriptInvoker(List.of("/nonexistent/xaio-script"), 1_000L);
        Assertions.assertThrows(TransientStageException.class, () -> missing.invoke(List.of(), Jsons.object()));
    }

    @Test
    void errorTextIsMaskedAndCapped() {
        String masked = ScriptInvoker.truncate("auth failed: api_key=abc123secret\n" + "x".repeat(2_000));
        Assertions.assertFalse(masked.contains("abc123secret"));
        Assertions.assertTrue(masked.endsWith("..."));
        Assertions.assertFalse(masked.contains("\n"));
    }

    @Test
    void publishClientReadsExternalIdOrId() throws Exception {
        ScriptPublishClient client = new ScriptPublishClient(
                new ScriptInvoker(List.of("sh", "-c", "cat > /dev/null; echo '{\"id\":\"post-42\"}'"), 10_000L));
        Assertions.assertEquals("post-42", client.upsert(Jsons.object()));

        ScriptPublishClient empty = new ScriptPublishClient(
                new ScriptInvoker(List.of("sh", "-c", "cat > /dev/null; echo '{}'"), 10_000L));
        Assertions.assertThrows(ValidationStageException.class, () -> empty.upsert(Jsons.object()));
    }
}
