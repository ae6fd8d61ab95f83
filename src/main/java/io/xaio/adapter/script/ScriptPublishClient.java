package io.xaio.adapter.script;

import com.fasterxml.jackson.databind.JsonNode;
import io.xaio.adapter.PublishClient;
import io.xaio.adapter.TransientStageException;
import io.xaio.adapter.ValidationStageException;

import java.util.List;

public final class ScriptPublishClient implements PublishClient {
    private final ScriptInvoker invoker;

    public ScriptPublishClient(ScriptInvoker invoker) {
        this.invoker = invoker;
    }

    @Override
    public String upsert(JsonNode finalRecord) throws TransientStageException, ValidationStageException {
        JsonNode response = invoker.invoke(List.of(), finalRecord);
        String id = response.path("external_publish_id").asText("");
        if (id.isBlank()) {
            id = response.path("id").asText("");
        }
        if (id.isBlank()) {
            throw new ValidationStageException("publish script returned no external_publish_id");
        }
        return id;
    }
}
