package io.xaio.config;

import io.xaio.model.Stage;
import io.xaio.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolved pipeline settings. The JSON file named by {@code --config} is read into {@link SettingsFile}, whose
 * fields are all optional, and each value is sanitized against the defaults.
 */
public record PipelineSettings(
        Path rootDir,
        int maxAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        long itemLeaseTtlMs,
        long itemLeaseRenewMs,
        long sweepLeaseTtlMs,
        int batchSize,
        String workerId,
        String metaPromptSet,
        String claimsPromptSet,
        List<String> metaWhitelist,
        Map<Stage, List<String>> commands,
        long scriptTimeoutMs,
        IntakeSettings intake
) {
    static final long MIN_RENEW_INTERVAL_MS = 10L;

    public PipelineSettings {
        metaWhitelist = List.copyOf(metaWhitelist);
        commands = Map.copyOf(commands);
    }

    public static PipelineSettings defaults(Path rootDir) {
        return new PipelineSettings(
                rootDir.toAbsolutePath().normalize(),
                XaioConfig.DEFAULT_MAX_ATTEMPTS,
                XaioConfig.DEFAULT_BASE_BACKOFF_MS,
                XaioConfig.DEFAULT_MAX_BACKOFF_MS,
                XaioConfig.DEFAULT_ITEM_LEASE_TTL_MS,
                renewIntervalFor(XaioConfig.DEFAULT_ITEM_LEASE_TTL_MS),
                XaioConfig.DEFAULT_SWEEP_LEASE_TTL_MS,
                XaioConfig.DEFAULT_BATCH_SIZE,
                "worker-local",
                XaioConfig.DEFAULT_META_PROMPT_SET,
                XaioConfig.DEFAULT_CLAIMS_PROMPT_SET,
                List.of("og:title", "og:description", "og:site_name", "article:published_time", "author"),
                Map.of(),
                XaioConfig.DEFAULT_SCRIPT_TIMEOUT_MS,
                null
        );
    }

    public static PipelineSettings load(Path configFile) {
        if (configFile == null) {
            throw new IllegalArgumentException("config path is required");
        }
        Path file = configFile.toAbsolutePath().normalize();
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Config file not found: " + file);
        }
        SettingsFile raw;
        try {
            raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to parse config file: " + file + ": " + e.getMessage(), e);
        }
        Path baseDir = file.getParent();
        return fromFile(raw, baseDir);
    }

    static PipelineSettings fromFile(SettingsFile file, Path baseDir) {
        PipelineSettings defaults = defaults(baseDir.resolve(XaioConfig.DEFAULT_ROOT));
        if (file == null) {
            return defaults;
        }
        Path root = file.root() == null || file.root().isBlank()
                ? defaults.rootDir()
                : baseDir.resolve(file.root().trim()).toAbsolutePath().normalize();
        int maxAttempts = sanitizeInt(file.maxAttempts(), defaults.maxAttempts(), 1);
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 0L);
        long maxBackoff = Math.max(baseBackoff, sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), 0L));
        long itemLeaseTtl = sanitizeLong(file.itemLeaseTtlMs(), defaults.itemLeaseTtlMs(), 1_000L);
        long itemLeaseRenew = file.itemLeaseRenewMs() == null
                ? renewIntervalFor(itemLeaseTtl)
                : Math.min(itemLeaseTtl / 2L, Math.max(MIN_RENEW_INTERVAL_MS, file.itemLeaseRenewMs()));
        long sweepLeaseTtl = Math.max(itemLeaseTtl, sanitizeLong(file.sweepLeaseTtlMs(), defaults.sweepLeaseTtlMs(), 1_000L));
        int batchSize = sanitizeInt(file.batchSize(), defaults.batchSize(), 1);
        String workerId = sanitizeText(file.workerId(), defaults.workerId());
        Map<String, String> prompts = file.promptSets() == null ? Map.of() : file.promptSets();
        String metaPrompt = sanitizeText(prompts.get("meta"), defaults.metaPromptSet());
        String claimsPrompt = sanitizeText(prompts.get("claims"), defaults.claimsPromptSet());
        List<String> whitelist = file.metaWhitelist() == null ? defaults.metaWhitelist() : file.metaWhitelist();
        long scriptTimeout = sanitizeLong(file.scriptTimeoutMs(), defaults.scriptTimeoutMs(), 1_000L);

        Map<Stage, List<String>> commands = new EnumMap<>(Stage.class);
        if (file.commands() != null) {
            for (Map.Entry<String, List<String>> e : file.commands().entrySet()) {
                Stage stage = Stage.fromString(e.getKey());
                List<String> argv = e.getValue();
                if (argv == null || argv.isEmpty() || argv.stream().anyMatch(s -> s == null || s.isBlank())) {
                    throw new IllegalArgumentException("commands." + e.getKey() + " must be a non-empty argv list");
                }
                commands.put(stage, List.copyOf(argv));
            }
        }
        if (!commands.isEmpty() && itemLeaseTtl <= scriptTimeout) {
            throw new IllegalArgumentException("itemLeaseTtlMs (" + itemLeaseTtl
                    + ") must be greater than scriptTimeoutMs (" + scriptTimeout + ")");
        }

        IntakeSettings intake = null;
        if (file.intake() != null && file.intake().file() != null && !file.intake().file().isBlank()) {
            IntakeFile in = file.intake();
            intake = new IntakeSettings(
                    baseDir.resolve(in.file().trim()).toAbsolutePath().normalize(),
                    sanitizeInt(in.firstDataRow(), 2, 1),
                    IntakeColumnMapping.fromLetters(in.columns())
            );
        }

        return new PipelineSettings(
                root,
                maxAttempts,
                baseBackoff,
                maxBackoff,
                itemLeaseTtl,
                itemLeaseRenew,
                sweepLeaseTtl,
                batchSize,
                workerId,
                metaPrompt,
                claimsPrompt,
                whitelist,
                commands,
                scriptTimeout,
                intake
        );
    }

    public XaioConfig config() {
        return new XaioConfig(rootDir);
    }

    /**
     * {@code min(maxBackoffMs, baseBackoffMs * 2^(attempt-1))}, saturating instead of overflowing.
     */
    public long backoffMs(int attempt) {
        if (baseBackoffMs <= 0L) {
            return 0L;
        }
        int shift = Math.min(20, Math.max(0, attempt - 1));
        if (baseBackoffMs > (maxBackoffMs >> shift)) {
            return maxBackoffMs;
        }
        return Math.min(maxBackoffMs, baseBackoffMs << shift);
    }

    /**
     * A third of the TTL, so two renewals can be missed before the lease lapses.
     */
    static long renewIntervalFor(long itemLeaseTtlMs) {
        return Math.max(MIN_RENEW_INTERVAL_MS, itemLeaseTtlMs / 3L);
    }

    public PipelineSettings withRoot(Path root) {
        return new PipelineSettings(root.toAbsolutePath().normalize(), maxAttempts, baseBackoffMs, maxBackoffMs,
                itemLeaseTtlMs, itemLeaseRenewMs, sweepLeaseTtlMs, batchSize, workerId, metaPromptSet, claimsPromptSet,
                metaWhitelist, commands, scriptTimeoutMs, intake);
    }

    public PipelineSettings withRetryPolicy(int attempts, long baseBackoff, long maxBackoff) {
        return new PipelineSettings(rootDir, Math.max(1, attempts), Math.max(0L, baseBackoff), Math.max(baseBackoff, maxBackoff),
                itemLeaseTtlMs, itemLeaseRenewMs, sweepLeaseTtlMs, batchSize, workerId, metaPromptSet, claimsPromptSet,
                metaWhitelist, commands, scriptTimeoutMs, intake);
    }

    public PipelineSettings withLeaseTtls(long itemTtlMs, long sweepTtlMs) {
        return new PipelineSettings(rootDir, maxAttempts, baseBackoffMs, maxBackoffMs,
                itemTtlMs, renewIntervalFor(itemTtlMs), Math.max(itemTtlMs, sweepTtlMs), batchSize, workerId,
                metaPromptSet, claimsPromptSet, metaWhitelist, commands, scriptTimeoutMs, intake);
    }

    public PipelineSettings withItemLeaseRenewMs(long renewMs) {
        return new PipelineSettings(rootDir, maxAttempts, baseBackoffMs, maxBackoffMs,
                itemLeaseTtlMs, Math.max(1L, renewMs), sweepLeaseTtlMs, batchSize, workerId, metaPromptSet,
                claimsPromptSet, metaWhitelist, commands, scriptTimeoutMs, intake);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeText(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    public record IntakeSettings(Path file, int firstDataRow, IntakeColumnMapping columns) {
    }

    record SettingsFile(
            String root,
            Integer maxAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Long itemLeaseTtlMs,
            Long itemLeaseRenewMs,
            Long sweepLeaseTtlMs,
            Integer batchSize,
            String workerId,
            Map<String, String> promptSets,
            List<String> metaWhitelist,
            Map<String, List<String>> commands,
            Long scriptTimeoutMs,
            IntakeFile intake
    ) {
    }

    record IntakeFile(String file, Integer firstDataRow, Map<String, String> columns) {
    }
}
