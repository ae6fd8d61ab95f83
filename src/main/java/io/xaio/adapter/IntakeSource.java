package io.xaio.adapter;

import java.util.List;

public interface IntakeSource {
    String STATUS_QUEUED = "QUEUED";
    String STATUS_PUBLISHED = "PUBLISHED";
    String STATUS_FAILED_PREFIX = "FAILED:";
    String STATUS_REJECTED = "REJECTED";

    List<IntakeItem> listNewItems() throws TransientStageException;

    void markStatus(String externalId, String status) throws TransientStageException;
}
