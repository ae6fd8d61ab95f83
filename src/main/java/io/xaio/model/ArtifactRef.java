package io.xaio.model;

import java.nio.file.Path;

/**
 * Result of storing an artifact. {@code created} is false when identical bytes were already present.
 */
public record ArtifactRef(String hash, long sizeBytes, Path blobPath, boolean created) {
}
