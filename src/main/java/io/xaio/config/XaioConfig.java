package io.xaio.config;

import io.xaio.model.Stage;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class XaioConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 60_000L;
    public static final long DEFAULT_ITEM_LEASE_TTL_MS = 15L * 60L * 1000L;
    public static final long DEFAULT_SWEEP_LEASE_TTL_MS = 60L * 60L * 1000L;
    public static final int DEFAULT_BATCH_SIZE = 50;
    public static final long DEFAULT_SCRIPT_TIMEOUT_MS = 120_000L;
    public static final String DEFAULT_META_PROMPT_SET = "xaio.meta.v1";
    public static final String DEFAULT_CLAIMS_PROMPT_SET = "xaio.claims.v1";

    private final Path rootDir;

    public XaioConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static XaioConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new XaioConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("xaio.db");
    }

    public Path artifactsRoot() {
        return rootDir.resolve("artifacts");
    }

    public Path blobRoot() {
        return artifactsRoot().resolve("blobs");
    }

    public Path stageViewDir(Stage stage) {
        return artifactsRoot().resolve(stage.wireName());
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }
}
