package io.xaio.model;

public record StageTransition(
        long id,
        String itemId,
        String stage,
        int version,
        String fromStatus,
        String toStatus,
        int attempt,
        String detail,
        long atMs
) {
}
