package io.xaio.runtime;

import io.xaio.adapter.IntakeSource;
import io.xaio.config.PipelineSettings;
import io.xaio.intake.IntakeService;
import io.xaio.model.Lease;
import io.xaio.model.Stage;
import io.xaio.model.WorkItem;
import io.xaio.observability.AuditLogger;
import io.xaio.runtime.StageRunOutcome.ItemOutcome;
import io.xaio.runtime.StageRunOutcome.ItemResult;
import io.xaio.storage.InfrastructureException;
import io.xaio.storage.IntakeReportStore;
import io.xaio.storage.LeaseManager;
import io.xaio.storage.StateLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One sweep: pull intake, run every stage in order, report progress back to the intake. Only one sweep runs at a
 * time across processes; the global lease enforces it.
 */
public final class PipelineScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(PipelineScheduler.class);
    private static final int REPORT_REPLAY_LIMIT = 1_000;

    private final List<StageRunner> runners;
    private final StateLedger ledger;
    private final LeaseManager leases;
    private final IntakeService intake;
    private final IntakeReportStore reports;
    private final AuditLogger audit;
    private final PipelineSettings settings;
    private final Clock clock;

    /**
     * @param intake may be null when no intake source is configured
     */
    public PipelineScheduler(
            List<StageRunner> runners,
            StateLedger ledger,
            LeaseManager leases,
            IntakeService intake,
            IntakeReportStore reports,
            AuditLogger audit,
            PipelineSettings settings,
            Clock clock
    ) {
        List<StageRunner> ordered = new ArrayList<>(runners);
        ordered.sort((a, b) -> a.stage().compareTo(b.stage()));
        this.runners = List.copyOf(ordered);
        this.ledger = ledger;
        this.leases = leases;
        this.intake = intake;
        this.reports = reports;
        this.audit = audit;
        this.settings = settings;
        this.clock = clock;
    }

    public SweepOutcome sweep(int batchSize) {
        long started = clock.millis();
        LeaseManager.LeaseGrant grant = leases.acquireGlobal(settings.workerId(), settings.sweepLeaseTtlMs(), started);
        if (!grant.granted()) {
            LOG.info("sweep skipped: global lease held by {}", grant.holder());
            return SweepOutcome.busy(grant.holder());
        }
        Lease lease = grant.lease();
        audit.log(AuditLogger.AuditEvent.of("sweep.start", settings.workerId(), null, null, "started",
                Map.of("batch_size", batchSize)));
        try {
            IntakeService.IntakeReport intakeReport = intake == null ? null : intake.pull(clock.millis());
            List<StageRunOutcome> outcomes = new ArrayList<>();
            boolean lost = false;
            for (StageRunner runner : runners) {
                outcomes.add(runner.run(batchSize));
                if (!leases.renew(lease, settings.sweepLeaseTtlMs(), clock.millis())) {
                    LOG.warn("sweep lost its global lease after {}; stopping", runner.stage().wireName());
                    lost = true;
                    break;
                }
            }
            int[] reported = report(outcomes);
            int[] delivered = deliverReports();
            long duration = clock.millis() - started;
            SweepOutcome out = new SweepOutcome(false, settings.workerId(), lost, intakeReport, outcomes,
                    reported[0], reported[1], delivered[0], delivered[1], duration);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("published", out.published());
            details.put("failed", out.failed());
            details.put("reports_delivered", out.reportsDelivered());
            details.put("reports_pending", out.reportsPending());
            details.put("lease_lost", lost);
            details.put("duration_ms", duration);
            audit.log(AuditLogger.AuditEvent.of("sweep.finish", settings.workerId(), null, null, "ok", details));
            LOG.info("sweep finished published={} failed={} reports_delivered={} reports_pending={} duration_ms={}",
                    out.published(), out.failed(), out.reportsDelivered(), out.reportsPending(), duration);
            return out;
        } catch (InfrastructureException e) {
            LOG.error("sweep aborted: {}", e.getMessage(), e);
            audit.log(AuditLogger.AuditEvent.of("sweep.finish", settings.workerId(), null, null, "aborted",
                    Map.of("error", String.valueOf(e.getMessage()))));
            throw e;
        } finally {
            leases.release(lease);
        }
    }

    /**
     * Queues PUBLISHED or FAILED:&lt;stage&gt; for items that reached either state during this sweep. The writes
     * themselves happen in {@link #deliverReports()}.
     */
    private int[] report(List<StageRunOutcome> outcomes) {
        int published = 0;
        int failed = 0;
        for (StageRunOutcome outcome : outcomes) {
            for (ItemResult r : outcome.items()) {
                String status = null;
                if (r.stage() == Stage.PUBLISH && (r.outcome() == ItemOutcome.DONE || r.outcome() == ItemOutcome.REUSED)) {
                    status = IntakeSource.STATUS_PUBLISHED;
                    published++;
                } else if (r.outcome() == ItemOutcome.FAILED_TERMINAL) {
                    status = IntakeSource.STATUS_FAILED_PREFIX + r.stage().wireName();
                    failed++;
                }
                if (status != null && intake != null) {
                    Optional<String> externalId = ledger.getItem(r.itemId()).map(WorkItem::externalId);
                    if (externalId.isPresent() && !externalId.get().isBlank()) {
                        reports.enqueue(r.itemId(), externalId.get(), status, clock.millis());
                    }
                }
            }
        }
        return new int[]{published, failed};
    }

    /**
     * Replays every pending write-back, this sweep's and those left over from earlier sweeps.
     *
     * @return delivered count and the count still pending afterwards
     */
    private int[] deliverReports() {
        if (intake == null) {
            return new int[]{0, 0};
        }
        int delivered = 0;
        for (IntakeReportStore.ReportRow row : reports.pending(REPORT_REPLAY_LIMIT)) {
            long now = clock.millis();
            switch (intake.deliver(row.externalId(), row.status())) {
                case WRITTEN -> {
                    reports.markDelivered(row, now);
                    delivered++;
                }
                case ROW_GONE -> reports.markDropped(row, now);
                case RETRY -> reports.markFailed(row, now);
            }
        }
        int pending = reports.countPending();
        if (pending > 0) {
            LOG.warn("{} intake write-backs still pending; replayed next sweep", pending);
        }
        return new int[]{delivered, pending};
    }
}
