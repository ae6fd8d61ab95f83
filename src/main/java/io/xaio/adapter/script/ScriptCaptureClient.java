package io.xaio.adapter.script;

import com.fasterxml.jackson.databind.JsonNode;
import io.xaio.adapter.CaptureClient;
import io.xaio.adapter.TransientStageException;
import io.xaio.adapter.ValidationStageException;
import io.xaio.util.Jsons;

import java.util.List;

/**
 * Capture through an external fetcher: receives {@code {"url": ...}} and prints the capture document.
 */
public final class ScriptCaptureClient implements CaptureClient {
    private final ScriptInvoker invoker;

    public ScriptCaptureClient(ScriptInvoker invoker) {
        this.invoker = invoker;
    }

    @Override
    public JsonNode capture(String canonicalKey) throws TransientStageException, ValidationStageException {
        return invoker.invoke(List.of(), Jsons.object().put("url", canonicalKey));
    }
}
