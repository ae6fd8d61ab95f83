package io.xaio.adapter;

import com.fasterxml.jackson.databind.JsonNode;

public interface AiTransformClient {
    JsonNode run(String promptSetId, JsonNode input) throws TransientStageException, ValidationStageException;
}
