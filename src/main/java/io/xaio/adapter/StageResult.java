package io.xaio.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import io.xaio.model.ErrorKind;

public record StageResult(
        boolean success,
        JsonNode output,
        ErrorKind errorKind,
        String error
) {
    public static StageResult ok(JsonNode output) {
        if (output == null || output.isMissingNode() || output.isNull()) {
            throw new IllegalArgumentException("stage output must not be empty");
        }
        return new StageResult(true, output, null, null);
    }

    public static StageResult transientFailure(String error) {
        return new StageResult(false, null, ErrorKind.TRANSIENT, error);
    }

    public static StageResult validationFailure(String error) {
        return new StageResult(false, null, ErrorKind.VALIDATION, error);
    }

    public static StageResult failure(StageException e) {
        return new StageResult(false, null, e.kind(), e.getMessage());
    }
}
