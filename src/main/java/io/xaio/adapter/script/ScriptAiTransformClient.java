package io.xaio.adapter.script;

import com.fasterxml.jackson.databind.JsonNode;
import io.xaio.adapter.AiTransformClient;
import io.xaio.adapter.TransientStageException;
import io.xaio.adapter.ValidationStageException;

import java.util.List;

/**
 * The prompt set id is passed as {@code --prompt-set <id>}; the input document goes to stdin.
 */
public final class ScriptAiTransformClient implements AiTransformClient {
    private final ScriptInvoker invoker;

    public ScriptAiTransformClient(ScriptInvoker invoker) {
        this.invoker = invoker;
    }

    @Override
    public JsonNode run(String promptSetId, JsonNode input) throws TransientStageException, ValidationStageException {
        return invoker.invoke(List.of("--prompt-set", promptSetId), input);
    }
}
