package io.xaio.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.xaio.security.SensitiveDataMasker;
import io.xaio.storage.InfrastructureException;
import io.xaio.util.Hashing;
import io.xaio.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL audit trail. Every row carries the hash of the previous row, so truncation or edits in the
 * middle of the file show up in {@link #verify()}.
 */
public final class AuditLogger {
    private static final Logger LOG = LoggerFactory.getLogger(AuditLogger.class);
    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper();

    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
        } catch (IOException e) {
            throw new InfrastructureException("Failed to initialize audit log directory: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("item_id", event.itemId());
        row.put("stage", event.stage());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        String line = toCompactJson(row) + "\n";
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new InfrastructureException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Recomputes the hash chain from the first row.
     */
    @SuppressWarnings("unchecked")
    public synchronized VerifyResult verify() {
        List<String> lines = readLines();
        String prev = "";
        int rows = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            rows++;
            Map<String, Object> row;
            try {
                row = Jsons.mapper().readValue(line, LinkedHashMap.class);
            } catch (IOException e) {
                return new VerifyResult(false, rows, "unparsable row " + rows);
            }
            Object claimed = row.remove("hash");
            if (!prev.equals(row.get("prev_hash"))) {
                return new VerifyResult(false, rows, "broken chain at row " + rows);
            }
            String actual = Hashing.sha256Hex(toCompactJson(row));
            if (!actual.equals(claimed)) {
                return new VerifyResult(false, rows, "hash mismatch at row " + rows);
            }
            prev = actual;
        }
        return new VerifyResult(true, rows, "");
    }

    private String loadLastHash() {
        String last = "";
        for (String line : readLines()) {
            if (!line.isBlank()) {
                last = line;
            }
        }
        if (last.isBlank()) {
            return "";
        }
        try {
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            LOG.warn("audit log tail is unreadable, starting a new chain: {}", e.getMessage());
            return "";
        }
    }

    private List<String> readLines() {
        if (!Files.exists(auditFile)) {
            return List.of();
        }
        try {
            return Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InfrastructureException("Failed to read audit log: " + auditFile, e);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, LinkedHashMap.class);
    }

    private String toCompactJson(Map<String, Object> row) {
        try {
            return COMPACT_MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit row", e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String itemId,
            String stage,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String itemId,
                String stage,
                String result,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, itemId, stage, result, details == null ? Map.of() : details);
        }
    }

    public record VerifyResult(boolean valid, int rows, String problem) {
    }
}
