package io.xaio.intake;

import io.xaio.adapter.IntakeItem;
import io.xaio.adapter.IntakeSource;
import io.xaio.adapter.TransientStageException;
import io.xaio.config.XaioConfig;
import io.xaio.model.WorkItem;
import io.xaio.observability.AuditLogger;
import io.xaio.storage.Database;
import io.xaio.storage.StateLedger;
import io.xaio.testing.InMemoryIntakeSource;
import io.xaio.testing.MutableClock;
import io.xaio.util.UrlCanonicalizer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

final class IntakeServiceTest {

    @Test
    void registersQueuesAndRejects() throws Exception {
        Path root = Files.createTempDirectory("xaio-test-intake-pull-");
        try {
            XaioConfig config = XaioConfig.fromRoot(root.toString());
            Database db = new Database(config);
            db.init();
            StateLedger ledger = new StateLedger(db);
            AuditLogger audit = new AuditLogger(config.auditFile(), new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
            InMemoryIntakeSource source = new InMemoryIntakeSource();
            source.add("r1", "https://example.com/a?utm_source=x");
            source.add("r2", "https://EXAMPLE.com/a");
            source.add("r3", "not a url");
            IntakeService intake = new IntakeService(source, ledger, audit, "worker-a");

            IntakeService.IntakeReport report = intake.pull(1_000L);

            Assertions.assertEquals(new IntakeService.IntakeReport(3, 1, 1, 1, 0), report);
            Assertions.assertEquals(IntakeSource.STATUS_QUEUED, source.status("r1"));
            Assertions.assertEquals(IntakeSource.STATUS_QUEUED, source.status("r2"));
            Assertions.assertEquals(IntakeSource.STATUS_REJECTED, source.status("r3"));
            WorkItem item = ledger.getItem(UrlCanonicalizer.itemIdFor("https://example.com/a")).orElseThrow();
            Assertions.assertEquals("r1", item.externalId());
            Assertions.assertEquals(new IntakeService.IntakeReport(0, 0, 0, 0, 0), intake.pull(2_000L));
            Assertions.assertTrue(audit.verify().valid());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unreachableSourceAndVanishedRowsAreCounted() throws Exception {
        Path root = Files.createTempDirectory("xaio-test-intake-unreachable-");
        try {
            XaioConfig config = XaioConfig.fromRoot(root.toString());
            Database db = new Database(config);
            db.init();
            StateLedger ledger = new StateLedger(db);
            AuditLogger audit = new AuditLogger(config.auditFile(), new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
            IntakeSource down = new IntakeSource() {
                @Override
                public List<IntakeItem> listNewItems() throws TransientStageException {
                    throw new TransientStageException("sheet unavailable");
                }

                @Override
                public void markStatus(String externalId, String status) throws TransientStageException {
                    throw new TransientStageException("sheet unavailable");
                }
            };
            IntakeService intake = new IntakeService(down, ledger, audit, "worker-a");
            Assertions.assertEquals(new IntakeService.IntakeReport(0, 0, 0, 0, 1), intake.pull(1_000L));
            Assertions.assertFalse(intake.mark("r1", IntakeSource.STATUS_PUBLISHED));

            IntakeService memory = new IntakeService(new InMemoryIntakeSource(), ledger, audit, "worker-a");
            Assertions.assertFalse(memory.mark("r-gone", IntakeSource.STATUS_PUBLISHED));
            Assertions.assertTrue(memory.mark(null, IntakeSource.STATUS_PUBLISHED));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
