package io.xaio.model;

public record WorkItem(
        String itemId,
        String canonicalKey,
        String keyHash,
        String externalId,
        long createdAtMs
) {
}
