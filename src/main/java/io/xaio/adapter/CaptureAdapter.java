package io.xaio.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.xaio.model.Stage;

public final class CaptureAdapter implements StageAdapter {
    private final CaptureClient client;

    public CaptureAdapter(CaptureClient client) {
        this.client = client;
    }

    @Override
    public Stage stage() {
        return Stage.CAPTURE;
    }

    @Override
    public StageResult transform(StageInput input) {
        JsonNode doc;
        try {
            doc = client.capture(input.canonicalKey());
        } catch (StageException e) {
            return StageResult.failure(e);
        }
        if (doc == null || !doc.isObject()) {
            return StageResult.validationFailure("capture document must be a JSON object");
        }
        ObjectNode out = ((ObjectNode) doc).deepCopy();
        out.put("canonical_key", input.canonicalKey());
        out.put("item_id", input.itemId());
        return StageResult.ok(out);
    }
}
