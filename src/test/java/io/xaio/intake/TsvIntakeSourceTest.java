package io.xaio.intake;

import io.xaio.adapter.IntakeItem;
import io.xaio.adapter.IntakeSource;
import io.xaio.adapter.TransientStageException;
import io.xaio.config.IntakeColumnMapping;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class TsvIntakeSourceTest {

    @Test
    void listsRowsWithUrlAndEmptyStatus() throws Exception {
        Path root = Files.createTempDirectory("xaio-test-tsv-list-");
        try {
            Path file = root.resolve("intake.tsv");
            Files.write(file, List.of(
                    "url\tstatus\titem_id",
                    "https://example.com/a\t\tA-1",
                    "https://example.com/b\tQUEUED\tB-1",
                    "\t\t",
                    "https://example.com/c"
            ), StandardCharsets.UTF_8);
            TsvIntakeSource source = new TsvIntakeSource(file, 2, IntakeColumnMapping.defaults());

            List<IntakeItem> items = source.listNewItems();
            Assertions.assertEquals(List.of(
                    new IntakeItem("A-1", "https://example.com/a"),
                    new IntakeItem("row:5", "https://example.com/c")
            ), items);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void markStatusRewritesOnlyTheStatusCell() throws Exception {
        Path root = Files.createTempDirectory("xaio-test-tsv-mark-");
        try {
            Path file = root.resolve("intake.tsv");
            Files.write(file, List.of(
                    "url\tstatus\titem_id",
                    "https://example.com/a\t\tA-1",
                    "https://example.com/c"
            ), StandardCharsets.UTF_8);
            TsvIntakeSource source = new TsvIntakeSource(file, 2, IntakeColumnMapping.defaults());

            source.markStatus("A-1", IntakeSource.STATUS_QUEUED);
            source.markStatus("row:3", IntakeSource.STATUS_FAILED_PREFIX + "meta");

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Assertions.assertEquals("https://example.com/a\tQUEUED\tA-1", lines.get(1));
            Assertions.assertEquals("https://example.com/c\tFAILED:meta\t", lines.get(2));
            Assertions.assertTrue(source.listNewItems().isEmpty());
            Assertions.assertThrows(IllegalArgumentException.class, () -> source.markStatus("row:1", "QUEUED"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> source.markStatus("Z-9", "QUEUED"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void customColumnsAndMissingFile() throws Exception {
        Path root = Files.createTempDirectory("xaio-test-tsv-columns-");
        try {
            Path file = root.resolve("intake.tsv");
            Files.write(file, List.of("notes\t\thttps://example.com/a"), StandardCharsets.UTF_8);
            TsvIntakeSource source = new TsvIntakeSource(file, 1, new IntakeColumnMapping(2, 1, -1));
            Assertions.assertEquals(List.of(new IntakeItem("row:1", "https://example.com/a")), source.listNewItems());

            TsvIntakeSource missing = new TsvIntakeSource(root.resolve("absent.tsv"), 2, IntakeColumnMapping.defaults());
            Assertions.assertThrows(TransientStageException.class, missing::listNewItems);
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
