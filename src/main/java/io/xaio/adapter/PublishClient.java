package io.xaio.adapter;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Publish-side upsert. Calling it twice with the same record must not create a second entry.
 */
public interface PublishClient {
    /**
     * @return the external id of the published entry
     */
    String upsert(JsonNode finalRecord) throws TransientStageException, ValidationStageException;
}
