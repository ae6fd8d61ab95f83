package io.xaio.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.xaio.model.Stage;
import io.xaio.util.CanonicalJson;
import io.xaio.util.Jsons;

public final class PublishAdapter implements StageAdapter {
    private final PublishClient client;

    public PublishAdapter(PublishClient client) {
        this.client = client;
    }

    @Override
    public Stage stage() {
        return Stage.PUBLISH;
    }

    @Override
    public StageResult transform(StageInput input) {
        JsonNode merged = input.upstream();
        if (merged == null || !merged.isObject()) {
            return StageResult.validationFailure("merge artifact must be a JSON object");
        }
        ObjectNode record = ((ObjectNode) merged).deepCopy();
        // upsert key on the publish side
        record.put("xaio_item_id", input.itemId());
        String publishId;
        try {
            publishId = client.upsert(record);
        } catch (StageException e) {
            return StageResult.failure(e);
        }
        if (publishId == null || publishId.isBlank()) {
            return StageResult.transientFailure("publish returned no external id");
        }
        ObjectNode out = Jsons.object();
        out.put("external_publish_id", publishId.trim());
        out.put("item_id", input.itemId());
        out.put("published_record_sha256", CanonicalJson.hash(record));
        return StageResult.ok(out);
    }
}
