package io.xaio.model;

public record Lease(
        String leaseKey,
        String itemId,
        Stage stage,
        String token,
        String owner,
        long acquiredAtMs,
        long expiresAtMs
) {
    public boolean isGlobal() {
        return itemId == null;
    }
}
