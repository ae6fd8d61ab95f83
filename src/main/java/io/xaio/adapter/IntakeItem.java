package io.xaio.adapter;

/**
 * One row offered by the intake queue. {@code url} is raw; the scheduler canonicalizes it.
 */
public record IntakeItem(String externalId, String url) {
}
