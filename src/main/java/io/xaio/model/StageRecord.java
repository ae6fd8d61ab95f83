package io.xaio.model;

public record StageRecord(
        String itemId,
        Stage stage,
        int version,
        long revision,
        StageStatus status,
        String artifactRef,
        String inputHash,
        ErrorKind errorKind,
        String errorDetail,
        int attempt,
        boolean terminal,
        long nextEligibleAtMs,
        long createdAtMs,
        long updatedAtMs
) {
    public boolean isDoneFor(String upstreamHash) {
        return status == StageStatus.DONE && upstreamHash != null && upstreamHash.equals(inputHash);
    }

    public boolean isTerminalFailure() {
        return status == StageStatus.FAILED && terminal;
    }
}
