package io.xaio.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.xaio.adapter.StageAdapter;
import io.xaio.adapter.StageException;
import io.xaio.adapter.StageInput;
import io.xaio.adapter.StageResult;
import io.xaio.config.PipelineSettings;
import io.xaio.model.ArtifactRef;
import io.xaio.model.EligibleItem;
import io.xaio.model.ErrorKind;
import io.xaio.model.Lease;
import io.xaio.model.Stage;
import io.xaio.model.StageRecord;
import io.xaio.model.StageStatus;
import io.xaio.model.WorkItem;
import io.xaio.observability.AuditLogger;
import io.xaio.runtime.StageRunOutcome.ItemOutcome;
import io.xaio.runtime.StageRunOutcome.ItemResult;
import io.xaio.security.SensitiveDataMasker;
import io.xaio.storage.ArtifactStore;
import io.xaio.storage.LeaseManager;
import io.xaio.storage.StateLedger;
import io.xaio.storage.StateLedger.TransitionRequest;
import io.xaio.storage.StateLedger.TransitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one stage over a batch of eligible items. Each item is handled under its own lease; a failure of one
 * item never stops the batch. Only {@link io.xaio.storage.InfrastructureException} escapes.
 */
public final class StageRunner {
    private static final Logger LOG = LoggerFactory.getLogger(StageRunner.class);

    private final Stage stage;
    private final StageAdapter adapter;
    private final StateLedger ledger;
    private final LeaseManager leases;
    private final ArtifactStore artifacts;
    private final AuditLogger audit;
    private final PipelineSettings settings;
    private final Clock clock;

    public StageRunner(
            StageAdapter adapter,
            StateLedger ledger,
            LeaseManager leases,
            ArtifactStore artifacts,
            AuditLogger audit,
            PipelineSettings settings,
            Clock clock
    ) {
        this.stage = adapter.stage();
        this.adapter = adapter;
        this.ledger = ledger;
        this.leases = leases;
        this.artifacts = artifacts;
        this.audit = audit;
        this.settings = settings;
        this.clock = clock;
    }

    public Stage stage() {
        return stage;
    }

    public StageRunOutcome run(int limit) {
        int batch = Math.max(1, limit);
        StageRunOutcome.Tally tally = new StageRunOutcome.Tally(stage);
        StateLedger.ReclaimSummary reclaim = ledger.reclaimOrphans(stage, settings.maxAttempts(), now(), batch);
        if (reclaim.reclaimed() > 0) {
            tally.reclaimed(reclaim.reclaimed());
            LOG.warn("{}: reclaimed {} orphaned records ({} terminal)", stage.wireName(), reclaim.reclaimed(), reclaim.terminal());
            audit.log(AuditLogger.AuditEvent.of("stage.reclaim", settings.workerId(), null, stage.wireName(), "reclaimed",
                    Map.of("reclaimed", reclaim.reclaimed(), "terminal", reclaim.terminal())));
        }
        List<EligibleItem> eligible = ledger.listEligible(stage, settings.maxAttempts(), batch, now());
        tally.eligible(eligible.size());
        for (EligibleItem item : eligible) {
            tally.add(process(item.itemId(), true, tally));
        }
        StageRunOutcome outcome = tally.build();
        LOG.info("{}: eligible={} done={} reused={} retry={} terminal={} busy={} idempotent={} conflicts={}",
                stage.wireName(), outcome.eligible(), outcome.done(), outcome.reused(), outcome.retryScheduled(),
                outcome.failedTerminal(), outcome.skippedBusy(), outcome.skippedIdempotent(), outcome.conflicts());
        return outcome;
    }

    /**
     * Runs a single item through this stage regardless of its position in the eligibility order and of any
     * retry cool-down. Terminal failures still require a reset first.
     */
    public StageRunOutcome runItem(String itemId) {
        StageRunOutcome.Tally tally = new StageRunOutcome.Tally(stage);
        tally.eligible(1);
        tally.add(process(itemId, false, tally));
        return tally.build();
    }

    private ItemResult process(String itemId, boolean honorCooldown, StageRunOutcome.Tally tally) {
        LeaseManager.LeaseGrant grant = leases.acquire(itemId, stage, settings.workerId(), settings.itemLeaseTtlMs(), now());
        if (!grant.granted()) {
            return result(itemId, ItemOutcome.SKIPPED_BUSY, "lease held by " + grant.holder());
        }
        Lease lease = grant.lease();
        try {
            return processLeased(itemId, lease, honorCooldown, tally);
        } finally {
            leases.release(lease);
        }
    }

    private ItemResult processLeased(String itemId, Lease lease, boolean honorCooldown, StageRunOutcome.Tally tally) {
        Optional<String> upstream = ledger.upstreamHash(itemId, stage);
        if (upstream.isEmpty()) {
            return result(itemId, ItemOutcome.NOT_READY, "upstream is not DONE");
        }
        String inputHash = upstream.get();
        Optional<StageRecord> current = ledger.get(itemId, stage);
        if (current.isPresent() && inputHash.equals(current.get().inputHash())) {
            StageRecord cur = current.get();
            if (cur.status() == StageStatus.DONE) {
                return result(itemId, ItemOutcome.SKIPPED_IDEMPOTENT, cur.artifactRef());
            }
            if (cur.isTerminalFailure()) {
                return result(itemId, ItemOutcome.BLOCKED_TERMINAL, cur.errorDetail());
            }
            if (honorCooldown && cur.status() == StageStatus.FAILED && cur.nextEligibleAtMs() > now()) {
                return result(itemId, ItemOutcome.NOT_DUE, "retry at " + cur.nextEligibleAtMs());
            }
        }

        StageRecord rec = ledger.open(itemId, stage, inputHash, now());
        if (rec.status() == StageStatus.RUNNING) {
            // we hold the lease now, so whoever left this RUNNING is gone
            boolean exhausted = rec.attempt() >= settings.maxAttempts();
            TransitionResult orphan = ledger.transition(TransitionRequest.toFailed(
                    rec, ErrorKind.TRANSIENT, "orphaned: lease expired", exhausted, now(), now()));
            if (!orphan.applied()) {
                return result(itemId, ItemOutcome.CONFLICT, orphan.reason());
            }
            tally.reclaimed(1);
            rec = orphan.record();
            if (exhausted) {
                return finish(rec, ItemOutcome.FAILED_TERMINAL, rec.errorDetail());
            }
        }
        TransitionResult running = ledger.transition(TransitionRequest.toRunning(rec, now()));
        if (!running.applied()) {
            return result(itemId, ItemOutcome.CONFLICT, running.reason());
        }
        rec = running.record();

        Optional<StageRecord> reusable = ledger.findDoneByInputHash(itemId, stage, inputHash);
        if (reusable.isPresent() && artifacts.exists(reusable.get().artifactRef())) {
            String hash = reusable.get().artifactRef();
            TransitionResult done = ledger.transition(TransitionRequest.toDone(rec, hash, now()));
            if (!done.applied()) {
                return onConflict(rec, done);
            }
            artifacts.writeView(stage, itemId, hash);
            return finish(done.record(), ItemOutcome.REUSED, "v" + reusable.get().version());
        }

        StageResult outcome = invokeLeased(buildInput(itemId, rec), lease);
        if (outcome.success()) {
            ArtifactRef ref = artifacts.put(outcome.output());
            TransitionResult done = ledger.transition(TransitionRequest.toDone(rec, ref.hash(), now()));
            if (!done.applied()) {
                return onConflict(rec, done);
            }
            artifacts.writeView(stage, itemId, ref.hash());
            return finish(done.record(), ItemOutcome.DONE, ref.hash());
        }

        ErrorKind kind = outcome.errorKind() == null ? ErrorKind.TRANSIENT : outcome.errorKind();
        boolean terminal = kind == ErrorKind.VALIDATION || rec.attempt() >= settings.maxAttempts();
        long now = now();
        long nextEligible = terminal ? now : now + settings.backoffMs(rec.attempt());
        String detail = SensitiveDataMasker.maskText(outcome.error() == null ? kind.name() : outcome.error());
        TransitionResult failed = ledger.transition(TransitionRequest.toFailed(rec, kind, detail, terminal, nextEligible, now));
        if (!failed.applied()) {
            return onConflict(rec, failed);
        }
        return finish(failed.record(), terminal ? ItemOutcome.FAILED_TERMINAL : ItemOutcome.RETRY_SCHEDULED, detail);
    }

    /**
     * Adapter calls may outlast the item lease TTL, so the lease is renewed on a side thread for as long as the
     * call runs.
     */
    private StageResult invokeLeased(StageInput input, Lease lease) {
        try (LeaseHeartbeat heartbeat = LeaseHeartbeat.start(
                leases, lease, settings.itemLeaseTtlMs(), settings.itemLeaseRenewMs(), clock)) {
            StageResult result = invoke(input);
            if (heartbeat.lost()) {
                LOG.warn("{}: lease on {} lapsed after {} renewals; commit left to the ledger check",
                        stage.wireName(), input.itemId(), heartbeat.renewals());
            }
            return result;
        }
    }

    private StageResult invoke(StageInput input) {
        try {
            StageResult r = adapter.transform(input);
            return r == null ? StageResult.transientFailure("adapter returned no result") : r;
        } catch (StageException e) {
            return StageResult.failure(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StageResult.transientFailure("interrupted");
        } catch (Exception e) {
            LOG.warn("{}: adapter threw for {}", stage.wireName(), input.itemId(), e);
            return StageResult.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private StageInput buildInput(String itemId, StageRecord rec) {
        WorkItem item = ledger.getItem(itemId)
                .orElseThrow(() -> new IllegalStateException("Unknown work item: " + itemId));
        Map<Stage, JsonNode> lineage = new EnumMap<>(Stage.class);
        for (Stage earlier : Stage.values()) {
            if (earlier.ordinal() >= stage.ordinal()) {
                break;
            }
            ledger.get(itemId, earlier)
                    .filter(r -> r.status() == StageStatus.DONE)
                    .ifPresent(r -> lineage.put(earlier, artifacts.get(r.artifactRef())));
        }
        JsonNode upstream = stage.upstream().map(lineage::get).orElse(null);
        return new StageInput(itemId, stage, item.canonicalKey(), upstream, lineage, rec.inputHash(), rec.attempt());
    }

    /**
     * A rejected write means either another worker changed the record, or the upstream moved while we ran. In
     * the second case our RUNNING revision is still current and is parked as STALE_INPUT for the next sweep.
     */
    private ItemResult onConflict(StageRecord ours, TransitionResult rejected) {
        Optional<StageRecord> latest = ledger.get(ours.itemId(), stage);
        if (latest.isPresent()
                && latest.get().version() == ours.version()
                && latest.get().revision() == ours.revision()
                && latest.get().status() == StageStatus.RUNNING) {
            TransitionResult stale = ledger.transition(TransitionRequest.toFailed(
                    ours, ErrorKind.STALE_INPUT, "upstream changed during run: " + rejected.reason(), false, now(), now()));
            if (stale.applied()) {
                return finish(stale.record(), ItemOutcome.STALE_INPUT, rejected.reason());
            }
        }
        LOG.info("{}: conflict on {}: {}", stage.wireName(), ours.itemId(), rejected.reason());
        return result(ours.itemId(), ItemOutcome.CONFLICT, rejected.reason());
    }

    private ItemResult finish(StageRecord rec, ItemOutcome outcome, String detail) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("version", rec.version());
        details.put("attempt", rec.attempt());
        details.put("status", rec.status().name());
        if (rec.artifactRef() != null) {
            details.put("artifact", rec.artifactRef());
        }
        if (rec.errorKind() != null) {
            details.put("error_kind", rec.errorKind().name());
            details.put("error", rec.errorDetail());
        }
        audit.log(AuditLogger.AuditEvent.of("stage.run", settings.workerId(), rec.itemId(), stage.wireName(),
                outcome.name().toLowerCase(Locale.ROOT), details));
        if (outcome == ItemOutcome.FAILED_TERMINAL) {
            LOG.warn("{}: {} failed terminally after attempt {}: {}", stage.wireName(), rec.itemId(), rec.attempt(), detail);
        }
        return result(rec.itemId(), outcome, detail);
    }

    private ItemResult result(String itemId, ItemOutcome outcome, String detail) {
        return new ItemResult(itemId, stage, outcome, detail == null ? "" : detail);
    }

    private long now() {
        return clock.millis();
    }
}
