package io.xaio.model;

public record EligibleItem(String itemId, String upstreamHash, long upstreamUpdatedAtMs) {
}
