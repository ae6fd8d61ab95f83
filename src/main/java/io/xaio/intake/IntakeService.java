package io.xaio.intake;

import io.xaio.adapter.IntakeItem;
import io.xaio.adapter.IntakeSource;
import io.xaio.adapter.TransientStageException;
import io.xaio.observability.AuditLogger;
import io.xaio.storage.StateLedger;
import io.xaio.util.UrlCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pulls new rows from the intake queue into the ledger as work items. Registration is idempotent on the
 * canonical key, so pulling the same row twice is harmless.
 */
public final class IntakeService {
    private static final Logger LOG = LoggerFactory.getLogger(IntakeService.class);

    private final IntakeSource source;
    private final StateLedger ledger;
    private final AuditLogger audit;
    private final String workerId;

    public IntakeService(IntakeSource source, StateLedger ledger, AuditLogger audit, String workerId) {
        this.source = source;
        this.ledger = ledger;
        this.audit = audit;
        this.workerId = workerId;
    }

    public IntakeReport pull(long nowMs) {
        int seen = 0;
        int registered = 0;
        int duplicates = 0;
        int rejected = 0;
        int unreachable = 0;
        List<IntakeItem> items;
        try {
            items = source.listNewItems();
        } catch (TransientStageException e) {
            LOG.warn("intake unavailable: {}", e.getMessage());
            return new IntakeReport(0, 0, 0, 0, 1);
        }
        for (IntakeItem item : items) {
            seen++;
            String canonical;
            try {
                canonical = UrlCanonicalizer.canonicalize(item.url());
            } catch (IllegalArgumentException e) {
                rejected++;
                LOG.warn("rejecting intake row {}: {}", item.externalId(), e.getMessage());
                if (!mark(item.externalId(), IntakeSource.STATUS_REJECTED)) {
                    unreachable++;
                }
                continue;
            }
            StateLedger.Registration reg = ledger.registerItem(canonical, item.externalId(), nowMs);
            if (reg.created()) {
                registered++;
            } else {
                duplicates++;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("external_id", item.externalId());
            details.put("canonical_key", canonical);
            details.put("created", reg.created());
            audit.log(AuditLogger.AuditEvent.of("intake.register", workerId, reg.item().itemId(), null, "ok", details));
            if (!mark(item.externalId(), IntakeSource.STATUS_QUEUED)) {
                unreachable++;
            }
        }
        LOG.info("intake pulled seen={} registered={} duplicates={} rejected={}", seen, registered, duplicates, rejected);
        return new IntakeReport(seen, registered, duplicates, rejected, unreachable);
    }

    /**
     * Best-effort status write-back used for QUEUED and REJECTED; a row whose write failed keeps a blank status
     * and is listed again by the next pull.
     */
    public boolean mark(String externalId, String status) {
        return deliver(externalId, status) == WriteBack.WRITTEN;
    }

    /**
     * One write-back attempt. Completion statuses are queued in the ledger and replayed through here until they
     * come back {@link WriteBack#WRITTEN} or {@link WriteBack#ROW_GONE}.
     */
    public WriteBack deliver(String externalId, String status) {
        if (externalId == null || externalId.isBlank()) {
            return WriteBack.WRITTEN;
        }
        try {
            source.markStatus(externalId, status);
            return WriteBack.WRITTEN;
        } catch (TransientStageException e) {
            LOG.warn("intake status write failed for {} -> {}: {}", externalId, status, e.getMessage());
            return WriteBack.RETRY;
        } catch (IllegalArgumentException e) {
            // row removed from the intake after it was registered
            LOG.warn("intake row {} is gone, status {} not written: {}", externalId, status, e.getMessage());
            return WriteBack.ROW_GONE;
        }
    }

    public enum WriteBack {
        WRITTEN,
        RETRY,
        ROW_GONE
    }

    public record IntakeReport(int seen, int registered, int duplicates, int rejected, int writeFailures) {
    }
}
