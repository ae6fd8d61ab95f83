package io.xaio.adapter;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Fetches a page and returns the capture document: URLs, page metadata and extracted text.
 */
public interface CaptureClient {
    JsonNode capture(String canonicalKey) throws TransientStageException, ValidationStageException;
}
