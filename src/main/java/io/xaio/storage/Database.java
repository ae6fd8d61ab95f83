package io.xaio.storage;

import io.xaio.config.XaioConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "xaio.schema.migration.v1";
    static final int BUSY_TIMEOUT_MS = 5000;

    private final XaioConfig config;
    private final String jdbcUrl;

    public Database(XaioConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public XaioConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    /**
     * Every connection carries its own busy timeout so that concurrent workers sharing the file wait on the
     * write lock instead of failing fast. Transactions start IMMEDIATE: the read-check-write sequences in the
     * ledger must hold the write lock from their first read.
     */
    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", Integer.toString(BUSY_TIMEOUT_MS));
        props.setProperty("foreign_keys", "true");
        props.setProperty("transaction_mode", "IMMEDIATE");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.artifactsRoot());
            Files.createDirectories(config.blobRoot());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.securityRoot());
        } catch (IOException e) {
            throw new InfrastructureException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS work_items (
                        item_id TEXT PRIMARY KEY,
                        canonical_key TEXT NOT NULL UNIQUE,
                        key_hash TEXT NOT NULL,
                        external_id TEXT,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS stage_records (
                        item_id TEXT NOT NULL,
                        stage TEXT NOT NULL,
                        version INTEGER NOT NULL,
                        revision INTEGER NOT NULL,
                        status TEXT NOT NULL,
                        artifact_ref TEXT,
                        input_hash TEXT NOT NULL,
                        error_kind TEXT,
                        error_detail TEXT,
                        attempt INTEGER NOT NULL DEFAULT 0,
                        terminal INTEGER NOT NULL DEFAULT 0,
                        next_eligible_at_ms INTEGER NOT NULL DEFAULT 0,
                        is_current INTEGER NOT NULL DEFAULT 1,
                        reusable INTEGER NOT NULL DEFAULT 1,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(item_id, stage, version),
                        FOREIGN KEY(item_id) REFERENCES work_items(item_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS stage_transitions (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        item_id TEXT NOT NULL,
                        stage TEXT NOT NULL,
                        version INTEGER NOT NULL,
                        from_status TEXT,
                        to_status TEXT NOT NULL,
                        attempt INTEGER NOT NULL,
                        detail TEXT,
                        at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS leases (
                        lease_key TEXT PRIMARY KEY,
                        item_id TEXT,
                        stage TEXT,
                        token TEXT NOT NULL,
                        owner TEXT NOT NULL,
                        acquired_at_ms INTEGER NOT NULL,
                        expires_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE UNIQUE INDEX IF NOT EXISTS idx_stage_records_current ON stage_records(item_id, stage) WHERE is_current=1");
            st.execute("CREATE INDEX IF NOT EXISTS idx_stage_records_stage_status ON stage_records(stage, status, is_current)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_stage_records_input ON stage_records(item_id, stage, input_hash, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_stage_transitions_item ON stage_transitions(item_id, id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_leases_expires ON leases(expires_at_ms)");
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to initialize schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261001_001_work_item_external_index",
                "Index work items by intake external id",
                List.of("CREATE INDEX IF NOT EXISTS idx_work_items_external ON work_items(external_id)")
        ));
        steps.add(new MigrationStep(
                "20261001_002_lease_owner_index",
                "Index leases by owner for operator inspection",
                List.of("CREATE INDEX IF NOT EXISTS idx_leases_owner ON leases(owner)")
        ));
        steps.add(new MigrationStep(
                "20261019_003_intake_reports",
                "Durable intake status write-backs, replayed until delivered",
                List.of(
                        """
                        CREATE TABLE IF NOT EXISTS intake_reports (
                            item_id TEXT PRIMARY KEY,
                            external_id TEXT NOT NULL,
                            status TEXT NOT NULL,
                            state TEXT NOT NULL,
                            attempts INTEGER NOT NULL DEFAULT 0,
                            updated_at_ms INTEGER NOT NULL,
                            delivered_at_ms INTEGER,
                            FOREIGN KEY(item_id) REFERENCES work_items(item_id)
                        )
                        """,
                        "CREATE INDEX IF NOT EXISTS idx_intake_reports_state ON intake_reports(state, updated_at_ms)"
                )
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
            validatePragma(st, "busy_timeout", Integer.toString(BUSY_TIMEOUT_MS));
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY version
                """;
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms"),
                        rs.getInt("success") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
