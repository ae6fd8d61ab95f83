package io.xaio.storage;

import io.xaio.config.XaioConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.stream.Stream;

final class DatabaseTest {

    @Test
    void initIsRepeatableAndRecordsMigrationsOnce() throws Exception {
        Path root = Files.createTempDirectory("xaio-test-db-init-");
        try {
            Database db = new Database(XaioConfig.fromRoot(root.toString()));
            db.init();
            db.init();

            List<Database.SchemaMigrationRow> rows = db.listSchemaMigrations();
            Assertions.assertEquals(3, rows.size());
            Assertions.assertTrue(rows.stream().allMatch(Database.SchemaMigrationRow::success));
            Assertions.assertTrue(Files.isRegularFile(root.resolve("xaio.db")));
            try (Connection c = db.openConnection(); Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("PRAGMA journal_mode")) {
                Assertions.assertTrue(rs.next());
                Assertions.assertEquals("wal", rs.getString(1).toLowerCase(java.util.Locale.ROOT));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void onlyOneCurrentVersionPerItemAndStage() throws Exception {
        Path root = Files.createTempDirectory("xaio-test-db-current-");
        try {
            Database db = new Database(XaioConfig.fromRoot(root.toString()));
            db.init();
            new StateLedger(db).registerItem("https://example.com/a", null, 1L);
            String itemId = io.xaio.util.UrlCanonicalizer.itemIdFor("https://example.com/a");
            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                st.executeUpdate(insert(itemId, 1));
                Assertions.assertThrows(SQLException.class, () -> st.executeUpdate(insert(itemId, 2)));
                Assertions.assertThrows(SQLException.class, () -> st.executeUpdate(insert("missing-item", 1)));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    private static String insert(String itemId, int version) {
        return "INSERT INTO stage_records(item_id,stage,version,revision,status,input_hash,attempt,terminal,"
                + "next_eligible_at_ms,is_current,reusable,created_at_ms,updated_at_ms) VALUES('"
                + itemId + "','capture'," + version + ",0,'PENDING','h',0,0,0,1,1,1,1)";
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
