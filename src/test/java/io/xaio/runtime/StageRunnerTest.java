package io.xaio.runtime;

import io.xaio.adapter.MetaAdapter;
import io.xaio.adapter.ValidationStageException;
import io.xaio.model.ErrorKind;
import io.xaio.model.Lease;
import io.xaio.model.Stage;
import io.xaio.model.StageRecord;
import io.xaio.model.StageStatus;
import io.xaio.runtime.StageRunOutcome.ItemOutcome;
import io.xaio.storage.LeaseManager;
import io.xaio.storage.StateLedger;
import io.xaio.testing.PipelineHarness;
import io.xaio.testing.ScriptedAiClient;
import io.xaio.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

final class StageRunnerTest {
    private static final String URL_A = "https://example.com/a";
    private static final String URL_B = "https://example.com/b";

    @Test
    void stageDoesNotRunBeforeItsUpstreamIsDone() throws Exception {
        try (PipelineHarness h = new PipelineHarness()) {
            String itemId = h.register(URL_A);

            StageRunOutcome reduce = h.runtime.runStage(Stage.REDUCE, 10);
            Assertions.assertEquals(0, reduce.eligible());
            StageRunOutcome forced = h.runtime.runItem(Stage.REDUCE, itemId);
            Assertions.assertEquals(ItemOutcome.NOT_READY, forced.items().get(0).outcome());
            Assertions.assertTrue(h.runtime.ledger().get(itemId, Stage.REDUCE).isEmpty());
            Assertions.assertEquals(0, h.meta.calls());
        }
    }

    @Test
    void secondPassOverFinishedItemsCallsNothingAndWritesNothing() throws Exception {
        try (PipelineHarness h = new PipelineHarness()) {
            String a = h.register(URL_A);
            h.register(URL_B);

            Map<Stage, StageRunOutcome> first = h.runAll();
            for (Stage stage : Stage.values()) {
                Assertions.assertEquals(2, first.get(stage).done(), stage.wireName());
            }
            long writes = h.runtime.artifacts().writes();
            int captures = h.capture.calls().size();

            Map<Stage, StageRunOutcome> second = h.runAll();
            for (Stage stage : Stage.values()) {
                Assertions.assertEquals(0, second.get(stage).eligible(), stage.wireName());
            }
            Assertions.assertEquals(writes, h.runtime.artifacts().writes());
            Assertions.assertEquals(captures, h.capture.calls().size());
            Assertions.assertEquals(2, h.meta.calls());
            Assertions.assertEquals(2, h.claims.calls());
            Assertions.assertEquals(2, h.publish.calls());

            StageRunOutcome forced = h.runtime.runItem(Stage.PUBLISH, a);
            Assertions.assertEquals(ItemOutcome.SKIPPED_IDEMPOTENT, forced.items().get(0).outcome());
            Assertions.assertEquals(2, h.publish.calls());
            for (StageRecord rec : h.runtime.ledger().currentRecords(a)) {
                Assertions.assertEquals(StageStatus.DONE, rec.status());
                Assertions.assertEquals(1, rec.version());
                Assertions.assertTrue(h.runtime.artifacts().exists(rec.artifactRef()));
            }
        }
    }

    @Test
    void validationFailureIsTerminalAndBlocksDownstream() throws Exception {
        try (PipelineHarness h = new PipelineHarness()) {
            String itemId = h.register(URL_A);
            h.meta.failNext(new ValidationStageException("meta response failed schema"));

            Map<Stage, StageRunOutcome> pass = h.runAll();
            Assertions.assertEquals(1, pass.get(Stage.META).failedTerminal());
            Assertions.assertEquals(0, pass.get(Stage.CLAIMS).eligible());

            StageRecord meta = h.runtime.ledger().get(itemId, Stage.META).orElseThrow();
            Assertions.assertEquals(StageStatus.FAILED, meta.status());
            Assertions.assertEquals(ErrorKind.VALIDATION, meta.errorKind());
            Assertions.assertTrue(meta.terminal());
            Assertions.assertEquals(1, meta.attempt());
            Assertions.assertEquals(1, h.runtime.failed(Stage.META, 10).size());

            h.clock.advanceMs(3_600_000L);
            Assertions.assertEquals(0, h.runtime.runStage(Stage.META, 10).eligible());
            Assertions.assertEquals(ItemOutcome.BLOCKED_TERMINAL,
                    h.runtime.runItem(Stage.META, itemId).items().get(0).outcome());
            Assertions.assertEquals(1, h.meta.calls());

            Assertions.assertTrue(h.runtime.reset(itemId, Stage.META, "prompt fixed", "operator").isPresent());
            Map<Stage, StageRunOutcome> after = h.runAll();
            Assertions.assertEquals(1, after.get(Stage.META).done());
            Assertions.assertEquals(1, after.get(Stage.PUBLISH).done());
            Assertions.assertEquals(2, h.runtime.ledger().get(itemId, Stage.META).orElseThrow().version());
        }
    }

    @Test
    void transientFailuresBackOffUntilAttemptsRunOut() throws Exception {
        try (PipelineHarness h = new PipelineHarness()) {
            String itemId = h.register(URL_A);
            h.publish.failTransiently(10);

            StageRunOutcome first = h.runAll().get(Stage.PUBLISH);
            Assertions.assertEquals(1, first.retryScheduled());
            StageRecord rec = h.runtime.ledger().get(itemId, Stage.PUBLISH).orElseThrow();
            Assertions.assertEquals(1, rec.attempt());
            Assertions.assertEquals(h.clock.millis() + 1_000L, rec.nextEligibleAtMs());

            Assertions.assertEquals(0, h.runtime.runStage(Stage.PUBLISH, 10).eligible());
            h.clock.advanceMs(1_000L);
            Assertions.assertEquals(1, h.runtime.runStage(Stage.PUBLISH, 10).retryScheduled());
            Assertions.assertEquals(h.clock.millis() + 2_000L,
                    h.runtime.ledger().get(itemId, Stage.PUBLISH).orElseThrow().nextEligibleAtMs());

            h.clock.advanceMs(2_000L);
            StageRunOutcome last = h.runtime.runStage(Stage.PUBLISH, 10);
            Assertions.assertEquals(1, last.failedTerminal());
            rec = h.runtime.ledger().get(itemId, Stage.PUBLISH).orElseThrow();
            Assertions.assertEquals(StageStatus.FAILED, rec.status());
            Assertions.assertEquals(ErrorKind.TRANSIENT, rec.errorKind());
            Assertions.assertTrue(rec.terminal());
            Assertions.assertEquals(3, rec.attempt());
            Assertions.assertEquals(3, h.publish.calls());

            h.clock.advanceMs(600_000L);
            Assertions.assertEquals(0, h.runtime.runStage(Stage.PUBLISH, 10).eligible());
        }
    }

    @Test
    void runningRecordOfDeadWorkerIsRetriedAfterLeaseExpiry() throws Exception {
        try (PipelineHarness h = new PipelineHarness()) {
            String itemId = h.register(URL_A);
            StateLedger ledger = h.runtime.ledger();
            long now = h.clock.millis();
            Assertions.assertTrue(h.runtime.leases().acquire(itemId, Stage.CAPTURE, "dead-worker", 60_000L, now).granted());
            StageRecord pending = ledger.open(itemId, Stage.CAPTURE, ledger.upstreamHash(itemId, Stage.CAPTURE).orElseThrow(), now);
            Assertions.assertTrue(ledger.transition(StateLedger.TransitionRequest.toRunning(pending, now)).applied());

            StageRunOutcome whileLeased = h.runtime.runStage(Stage.CAPTURE, 10);
            Assertions.assertEquals(0, whileLeased.eligible());
            Assertions.assertEquals(0, whileLeased.reclaimed());
            Assertions.assertEquals(ItemOutcome.SKIPPED_BUSY, h.runtime.runItem(Stage.CAPTURE, itemId).items().get(0).outcome());

            h.clock.advanceMs(60_000L);
            StageRunOutcome afterExpiry = h.runtime.runStage(Stage.CAPTURE, 10);
            Assertions.assertEquals(1, afterExpiry.reclaimed());
            Assertions.assertEquals(1, afterExpiry.done());
            StageRecord done = ledger.get(itemId, Stage.CAPTURE).orElseThrow();
            Assertions.assertEquals(StageStatus.DONE, done.status());
            Assertions.assertEquals(2, done.attempt());
            Assertions.assertTrue(h.runtime.leases().current(LeaseManager.itemLeaseKey(itemId, Stage.CAPTURE)).isEmpty());
        }
    }

    @Test
    void busyItemIsSkippedWithoutTouchingItsRecord() throws Exception {
        try (PipelineHarness h = new PipelineHarness()) {
            String itemId = h.register(URL_A);
            h.runtime.leases().acquire(itemId, Stage.CAPTURE, "other-worker", 60_000L, h.clock.millis());

            StageRunOutcome outcome = h.runtime.runStage(Stage.CAPTURE, 10);
            Assertions.assertEquals(1, outcome.skippedBusy());
            Assertions.assertEquals("lease held by other-worker", outcome.items().get(0).detail());
            Assertions.assertTrue(h.runtime.ledger().get(itemId, Stage.CAPTURE).isEmpty());
            Assertions.assertTrue(h.capture.calls().isEmpty());
        }
    }

    @Test
    void recaptureWithChangedPageRecomputesOnlyThatItem() throws Exception {
        try (PipelineHarness h = new PipelineHarness()) {
            String a = h.register(URL_A);
            String b = h.register(URL_B);
            h.runAll();
            String oldCapture = h.runtime.ledger().get(a, Stage.CAPTURE).orElseThrow().artifactRef();
            String publishedId = h.runtime.artifacts()
                    .get(h.runtime.ledger().get(a, Stage.PUBLISH).orElseThrow().artifactRef())
                    .path("external_publish_id").asText();

            h.capture.bumpRevision(URL_A);
            h.runtime.reset(a, Stage.CAPTURE, "page edited", "operator");
            Map<Stage, StageRunOutcome> pass = h.runAll();

            for (Stage stage : Stage.values()) {
                Assertions.assertEquals(1, pass.get(stage).done(), stage.wireName());
                Assertions.assertEquals(a, pass.get(stage).items().get(0).itemId());
                Assertions.assertEquals(2, h.runtime.ledger().get(a, stage).orElseThrow().version());
                Assertions.assertEquals(1, h.runtime.ledger().get(b, stage).orElseThrow().version());
            }
            Assertions.assertNotEquals(oldCapture, h.runtime.ledger().get(a, Stage.CAPTURE).orElseThrow().artifactRef());
            Assertions.assertEquals(3, h.meta.calls());
            Assertions.assertEquals(3, h.claims.calls());
            Assertions.assertEquals(3, h.publish.calls());
            Assertions.assertEquals(publishedId, h.runtime.artifacts()
                    .get(h.runtime.ledger().get(a, Stage.PUBLISH).orElseThrow().artifactRef())
                    .path("external_publish_id").asText());
            Assertions.assertTrue(h.publish.published().get(a).path("extracted_text_full").asText().contains("revision 1"));
        }
    }

    @Test
    void recaptureOfUnchangedPageStopsAtCapture() throws Exception {
        try (PipelineHarness h = new PipelineHarness()) {
            String a = h.register(URL_A);
            h.runAll();

            h.runtime.reset(a, Stage.CAPTURE, "periodic recheck", "operator");
            Map<Stage, StageRunOutcome> pass = h.runAll();

            Assertions.assertEquals(1, pass.get(Stage.CAPTURE).done());
            Assertions.assertEquals(0, pass.get(Stage.REDUCE).eligible());
            Assertions.assertEquals(2, h.capture.calls().size());
            Assertions.assertEquals(1, h.meta.calls());
            Assertions.assertEquals(1, h.runtime.ledger().get(a, Stage.REDUCE).orElseThrow().version());
        }
    }

    @Test
    void earlierOutputIsReusedWhenInputReturnsToAPreviousValue() throws Exception {
        try (PipelineHarness h = new PipelineHarness()) {
            String a = h.register(URL_A);
            h.runAll();
            String reduceV1 = h.runtime.ledger().get(a, Stage.REDUCE).orElseThrow().artifactRef();

            h.capture.setRevision(URL_A, 1);
            h.runtime.reset(a, Stage.CAPTURE, "edit", "operator");
            h.runtime.runStage(Stage.CAPTURE, 10);
            Assertions.assertEquals(1, h.runtime.runStage(Stage.REDUCE, 10).done());

            h.capture.setRevision(URL_A, 0);
            h.runtime.reset(a, Stage.CAPTURE, "edit reverted", "operator");
            h.runtime.runStage(Stage.CAPTURE, 10);
            StageRunOutcome reduce = h.runtime.runStage(Stage.REDUCE, 10);

            Assertions.assertEquals(1, reduce.reused());
            Assertions.assertEquals("v1", reduce.items().get(0).detail());
            StageRecord current = h.runtime.ledger().get(a, Stage.REDUCE).orElseThrow();
            Assertions.assertEquals(3, current.version());
            Assertions.assertEquals(reduceV1, current.artifactRef());
            Assertions.assertEquals(0, h.runtime.runStage(Stage.META, 10).eligible());
            Assertions.assertEquals(1, h.meta.calls());
        }
    }

    @Test
    void upstreamChangeDuringRunParksRecordAsStaleInput() throws Exception {
        try (PipelineHarness h = new PipelineHarness()) {
            String a = h.register(URL_A);
            h.runtime.runStage(Stage.CAPTURE, 10);
            h.runtime.runStage(Stage.REDUCE, 10);

            ScriptedAiClient racing = new ScriptedAiClient(input -> {
                h.runtime.ledger().reset(a, Stage.REDUCE, "recomputed elsewhere", h.clock.millis());
                return Jsons.object().put("title", "late");
            });
            StageRunner meta = new StageRunner(new MetaAdapter(racing, "m"), h.runtime.ledger(), h.runtime.leases(),
                    h.runtime.artifacts(), h.runtime.audit(), h.settings, h.clock);

            StageRunOutcome outcome = meta.run(10);
            Assertions.assertEquals(1, outcome.staleInput());
            StageRecord parked = h.runtime.ledger().get(a, Stage.META).orElseThrow();
            Assertions.assertEquals(StageStatus.FAILED, parked.status());
            Assertions.assertEquals(ErrorKind.STALE_INPUT, parked.errorKind());
            Assertions.assertFalse(parked.terminal());
            Assertions.assertNull(parked.artifactRef());

            Assertions.assertEquals(1, h.runtime.runStage(Stage.REDUCE, 10).done());
            Assertions.assertEquals(1, h.runtime.runStage(Stage.META, 10).done());
            Assertions.assertEquals(StageStatus.DONE, h.runtime.ledger().get(a, Stage.META).orElseThrow().status());
        }
    }

    @Test
    void leaseIsRenewedWhileAdapterCallOutlivesItsTtl() throws Exception {
        try (PipelineHarness h = new PipelineHarness()) {
            String a = h.register(URL_A);
            h.runtime.runStage(Stage.CAPTURE, 10);
            h.runtime.runStage(Stage.REDUCE, 10);
            String leaseKey = LeaseManager.itemLeaseKey(a, Stage.META);

            ScriptedAiClient otherClient = new ScriptedAiClient(input -> Jsons.object().put("title", "other"));
            StageRunner other = new StageRunner(new MetaAdapter(otherClient, "m"), h.runtime.ledger(),
                    h.runtime.leases(), h.runtime.artifacts(), h.runtime.audit(), h.settings, h.clock);
            AtomicReference<StageRunOutcome> otherOutcome = new AtomicReference<>();
            ScriptedAiClient slow = new ScriptedAiClient(input -> {
                // 61s of call time against a 60s TTL, in steps the heartbeat can keep up with
                for (long step : new long[]{30_000L, 30_000L, 1_000L}) {
                    h.clock.advanceMs(step);
                    awaitRenewal(h, leaseKey);
                }
                otherOutcome.set(other.runItem(a));
                return Jsons.object().put("title", "slow");
            });
            StageRunner first = new StageRunner(new MetaAdapter(slow, "m"), h.runtime.ledger(), h.runtime.leases(),
                    h.runtime.artifacts(), h.runtime.audit(), h.settings.withItemLeaseRenewMs(10L), h.clock);

            StageRunOutcome outcome = first.run(10);

            Assertions.assertEquals(1, outcome.done());
            Assertions.assertEquals(ItemOutcome.SKIPPED_BUSY, otherOutcome.get().items().get(0).outcome());
            Assertions.assertEquals(0, otherClient.calls());
            Assertions.assertEquals(0, other.run(10).eligible());
            StageRecord meta = h.runtime.ledger().get(a, Stage.META).orElseThrow();
            Assertions.assertEquals(StageStatus.DONE, meta.status());
            Assertions.assertEquals(1, meta.attempt());
            Assertions.assertTrue(h.runtime.leases().current(leaseKey).isEmpty());
        }
    }

    private static void awaitRenewal(PipelineHarness h, String leaseKey) {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (System.nanoTime() < deadline) {
            Optional<Lease> lease = h.runtime.leases().current(leaseKey);
            if (lease.isPresent() && lease.get().expiresAtMs() >= h.clock.millis() + 60_000L) {
                return;
            }
            try {
                Thread.sleep(5L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
        Assertions.fail("lease " + leaseKey + " was not renewed");
    }
}
