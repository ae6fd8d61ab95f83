package io.xaio.storage;

import io.xaio.model.EligibleItem;
import io.xaio.model.ErrorKind;
import io.xaio.model.Stage;
import io.xaio.model.StageRecord;
import io.xaio.model.StageStatus;
import io.xaio.model.StageTransition;
import io.xaio.model.WorkItem;
import io.xaio.util.Hashing;
import io.xaio.util.UrlCanonicalizer;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Durable per-item, per-stage records. Status changes go through {@link #transition(TransitionRequest)}, which
 * compares version, revision and input hash and checks the status edge inside one transaction; {@link #open} and
 * {@link #reset} only ever insert new versions.
 */
public final class StateLedger {
    private static final int DETAIL_MAX = 2000;
    private static final String RECORD_COLUMNS = """
            item_id,stage,version,revision,status,artifact_ref,input_hash,error_kind,error_detail,
            attempt,terminal,next_eligible_at_ms,created_at_ms,updated_at_ms
            """;

    private final Database database;

    public StateLedger(Database database) {
        this.database = database;
    }

    public Registration registerItem(String canonicalKey, String externalId, long nowMs) {
        if (canonicalKey == null || canonicalKey.isBlank()) {
            throw new IllegalArgumentException("canonicalKey must not be blank");
        }
        String itemId = UrlCanonicalizer.itemIdFor(canonicalKey);
        String keyHash = Hashing.sha256Hex(canonicalKey);
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ins = c.prepareStatement(
                    "INSERT OR IGNORE INTO work_items(item_id,canonical_key,key_hash,external_id,created_at_ms) VALUES(?,?,?,?,?)");
                 PreparedStatement ext = c.prepareStatement(
                         "UPDATE work_items SET external_id=? WHERE item_id=? AND external_id IS NULL")) {
                ins.setString(1, itemId);
                ins.setString(2, canonicalKey);
                ins.setString(3, keyHash);
                ins.setString(4, externalId);
                ins.setLong(5, nowMs);
                boolean created = ins.executeUpdate() > 0;
                if (!created && externalId != null) {
                    ext.setString(1, externalId);
                    ext.setString(2, itemId);
                    ext.executeUpdate();
                }
                WorkItem item = readItem(c, itemId).orElseThrow(
                        () -> new IllegalStateException("work item vanished after insert: " + itemId));
                if (!item.canonicalKey().equals(canonicalKey)) {
                    throw new IllegalStateException("item id collision for " + itemId);
                }
                c.commit();
                return new Registration(item, created);
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to register work item", e);
        }
    }

    public Optional<WorkItem> getItem(String itemId) {
        try (Connection c = database.openConnection()) {
            return readItem(c, itemId);
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to read work item: " + itemId, e);
        }
    }

    public Optional<StageRecord> get(String itemId, Stage stage) {
        try (Connection c = database.openConnection()) {
            return readCurrent(c, itemId, stage);
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to read stage record", e);
        }
    }

    /**
     * Hash of the input the stage would consume right now: the work item's key hash for capture, otherwise the
     * artifact of the upstream stage's current DONE record. Empty while the upstream is not DONE.
     */
    public Optional<String> upstreamHash(String itemId, Stage stage) {
        try (Connection c = database.openConnection()) {
            return readUpstreamHash(c, itemId, stage);
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to read upstream hash", e);
        }
    }

    public List<StageRecord> currentRecords(String itemId) {
        String sql = "SELECT " + RECORD_COLUMNS + " FROM stage_records WHERE item_id=? AND is_current=1";
        List<StageRecord> out = queryRecords(sql, ps -> ps.setString(1, itemId), "Failed to read current records");
        out.sort(Comparator.comparing(StageRecord::stage));
        return out;
    }

    /**
     * Makes sure the current record of this (item, stage) was opened for {@code inputHash}. A missing record is
     * created as version 1; a record for a different input is superseded by a fresh PENDING version.
     */
    public StageRecord open(String itemId, Stage stage, String inputHash, long nowMs) {
        if (inputHash == null || inputHash.isBlank()) {
            throw new IllegalArgumentException("inputHash must not be blank");
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                Optional<StageRecord> cur = readCurrent(c, itemId, stage);
                StageRecord out;
                if (cur.isPresent() && inputHash.equals(cur.get().inputHash())) {
                    out = cur.get();
                } else if (cur.isPresent()) {
                    out = insertVersion(c, cur.get(), inputHash, nowMs, "input changed");
                } else {
                    out = insertVersion(c, itemId, stage, 1, inputHash, nowMs);
                    logTransition(c, out, null, "opened", nowMs);
                }
                c.commit();
                return out;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to open stage record", e);
        }
    }

    public TransitionResult transition(TransitionRequest req) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                TransitionResult result = applyTransition(c, req);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to transition " + req.itemId() + "/" + req.stage().wireName(), e);
        }
    }

    private TransitionResult applyTransition(Connection c, TransitionRequest req) throws SQLException {
        Optional<StageRecord> curOpt = readCurrent(c, req.itemId(), req.stage());
        if (curOpt.isEmpty()) {
            return TransitionResult.conflict("no current record", null);
        }
        StageRecord cur = curOpt.get();
        if (cur.version() != req.expectedVersion()) {
            return TransitionResult.conflict("version changed: expected=" + req.expectedVersion() + " actual=" + cur.version(), cur);
        }
        if (cur.revision() != req.expectedRevision()) {
            return TransitionResult.conflict("revision changed: expected=" + req.expectedRevision() + " actual=" + cur.revision(), cur);
        }
        if (!cur.inputHash().equals(req.expectedInputHash())) {
            return TransitionResult.conflict("input hash changed", cur);
        }
        if (!cur.status().canTransitionTo(req.newStatus())) {
            return TransitionResult.conflict("illegal transition " + cur.status() + "->" + req.newStatus(), cur);
        }
        if (req.newStatus() == StageStatus.DONE) {
            if (req.artifactRef() == null || req.artifactRef().isBlank()) {
                throw new IllegalArgumentException("DONE requires an artifact reference");
            }
            Optional<String> upstream = readUpstreamHash(c, req.itemId(), req.stage());
            if (upstream.isEmpty() || !upstream.get().equals(cur.inputHash())) {
                return TransitionResult.conflict("upstream no longer matches input", cur);
            }
        }

        int attempt = req.newStatus() == StageStatus.RUNNING ? cur.attempt() + 1 : cur.attempt();
        boolean failed = req.newStatus() == StageStatus.FAILED;
        String artifact = req.newStatus() == StageStatus.DONE ? req.artifactRef() : cur.artifactRef();
        ErrorKind kind = failed ? req.errorKind() : null;
        String detail = failed ? truncate(req.errorDetail()) : null;
        boolean terminal = failed && req.terminal();
        long nextEligible = failed ? Math.max(req.nowMs(), req.nextEligibleAtMs()) : 0L;

        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE stage_records
                SET status=?,artifact_ref=?,error_kind=?,error_detail=?,attempt=?,terminal=?,
                    next_eligible_at_ms=?,revision=revision+1,updated_at_ms=?
                WHERE item_id=? AND stage=? AND version=? AND revision=? AND is_current=1
                """)) {
            ps.setString(1, req.newStatus().name());
            ps.setString(2, artifact);
            ps.setString(3, kind == null ? null : kind.name());
            ps.setString(4, detail);
            ps.setInt(5, attempt);
            ps.setInt(6, terminal ? 1 : 0);
            ps.setLong(7, nextEligible);
            ps.setLong(8, req.nowMs());
            ps.setString(9, req.itemId());
            ps.setString(10, req.stage().wireName());
            ps.setInt(11, cur.version());
            ps.setLong(12, cur.revision());
            if (ps.executeUpdate() == 0) {
                return TransitionResult.conflict("concurrent update", cur);
            }
        }
        StageRecord updated = new StageRecord(
                cur.itemId(),
                cur.stage(),
                cur.version(),
                cur.revision() + 1,
                req.newStatus(),
                artifact,
                cur.inputHash(),
                kind,
                detail,
                attempt,
                terminal,
                nextEligible,
                cur.createdAtMs(),
                req.nowMs()
        );
        String logDetail = failed
                ? kind + (terminal ? " terminal" : "") + ": " + (detail == null ? "" : detail)
                : artifact;
        logTransition(c, updated, cur.status(), logDetail, req.nowMs());
        return TransitionResult.applied(updated);
    }

    /**
     * Items whose upstream is DONE and for which this stage has work: no record yet, a PENDING record, a
     * retryable FAILED record past its cool-down, or a record opened for an older upstream artifact.
     * Oldest upstream completion first.
     */
    public List<EligibleItem> listEligible(Stage stage, int maxAttempts, int limit, long nowMs) {
        String eligibility = """
                (s.item_id IS NULL
                 OR s.input_hash <> %1$s
                 OR s.status='PENDING'
                 OR (s.status='FAILED' AND s.terminal=0 AND s.attempt<? AND s.next_eligible_at_ms<=?))
                """;
        String sql;
        if (stage.upstream().isEmpty()) {
            sql = """
                    SELECT w.item_id AS item_id, w.key_hash AS upstream_hash, w.created_at_ms AS upstream_updated
                    FROM work_items w
                    LEFT JOIN stage_records s ON s.item_id=w.item_id AND s.stage=? AND s.is_current=1
                    WHERE """ + eligibility.formatted("w.key_hash") + """
                    ORDER BY w.created_at_ms ASC, w.item_id ASC
                    LIMIT ?
                    """;
        } else {
            sql = """
                    SELECT u.item_id AS item_id, u.artifact_ref AS upstream_hash, u.updated_at_ms AS upstream_updated
                    FROM stage_records u
                    LEFT JOIN stage_records s ON s.item_id=u.item_id AND s.stage=? AND s.is_current=1
                    WHERE u.stage=? AND u.is_current=1 AND u.status='DONE'
                      AND """ + eligibility.formatted("u.artifact_ref") + """
                    ORDER BY u.updated_at_ms ASC, u.item_id ASC
                    LIMIT ?
                    """;
        }
        List<EligibleItem> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            ps.setString(i++, stage.wireName());
            if (stage.upstream().isPresent()) {
                ps.setString(i++, stage.upstream().get().wireName());
            }
            ps.setInt(i++, Math.max(1, maxAttempts));
            ps.setLong(i++, nowMs);
            ps.setInt(i, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new EligibleItem(
                            rs.getString("item_id"),
                            rs.getString("upstream_hash"),
                            rs.getLong("upstream_updated")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to list eligible items for " + stage.wireName(), e);
        }
    }

    /**
     * RUNNING records of this stage whose item lease is gone or expired; the worker that owned them died or
     * was stopped mid-run.
     */
    public List<StageRecord> listOrphans(Stage stage, long nowMs, int limit) {
        String sql = "SELECT " + RECORD_COLUMNS + """
                FROM stage_records s
                WHERE s.stage=? AND s.is_current=1 AND s.status='RUNNING'
                  AND NOT EXISTS (
                      SELECT 1 FROM leases l WHERE l.lease_key=('item:' || s.item_id || ':' || s.stage) AND l.expires_at_ms>?
                  )
                ORDER BY s.updated_at_ms ASC
                LIMIT ?
                """;
        return queryRecords(sql, ps -> {
            ps.setString(1, stage.wireName());
            ps.setLong(2, nowMs);
            ps.setInt(3, Math.max(1, limit));
        }, "Failed to list orphaned records");
    }

    public ReclaimSummary reclaimOrphans(Stage stage, int maxAttempts, long nowMs, int limit) {
        int reclaimed = 0;
        int terminal = 0;
        for (StageRecord orphan : listOrphans(stage, nowMs, limit)) {
            boolean exhausted = orphan.attempt() >= maxAttempts;
            TransitionResult r = transition(TransitionRequest.toFailed(
                    orphan, ErrorKind.TRANSIENT, "orphaned: lease expired", exhausted, nowMs, nowMs));
            if (r.applied()) {
                reclaimed++;
                if (exhausted) {
                    terminal++;
                }
            }
        }
        return new ReclaimSummary(reclaimed, terminal);
    }

    /**
     * Operator reset: supersedes the current record with a fresh PENDING version for the same input and stops
     * earlier DONE versions from being reused, so the stage is recomputed on the next run.
     */
    public Optional<StageRecord> reset(String itemId, Stage stage, String reason, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                Optional<StageRecord> cur = readCurrent(c, itemId, stage);
                if (cur.isEmpty()) {
                    c.commit();
                    return Optional.empty();
                }
                try (PreparedStatement ps = c.prepareStatement(
                        "UPDATE stage_records SET reusable=0 WHERE item_id=? AND stage=?")) {
                    ps.setString(1, itemId);
                    ps.setString(2, stage.wireName());
                    ps.executeUpdate();
                }
                String why = reason == null || reason.isBlank() ? "operator reset" : "reset: " + reason.trim();
                StageRecord fresh = insertVersion(c, cur.get(), cur.get().inputHash(), nowMs, why);
                c.commit();
                return Optional.of(fresh);
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to reset stage record", e);
        }
    }

    /**
     * Most recent superseded DONE version computed from {@code inputHash}, if it may be reused.
     */
    public Optional<StageRecord> findDoneByInputHash(String itemId, Stage stage, String inputHash) {
        String sql = "SELECT " + RECORD_COLUMNS + """
                FROM stage_records
                WHERE item_id=? AND stage=? AND input_hash=? AND status='DONE' AND reusable=1 AND is_current=0
                ORDER BY version DESC
                LIMIT 1
                """;
        List<StageRecord> rows = queryRecords(sql, ps -> {
            ps.setString(1, itemId);
            ps.setString(2, stage.wireName());
            ps.setString(3, inputHash);
        }, "Failed to look up reusable artifact");
        return rows.stream().findFirst();
    }

    public List<StageRecord> history(String itemId, Stage stage) {
        String sql = "SELECT " + RECORD_COLUMNS + " FROM stage_records WHERE item_id=? AND stage=? ORDER BY version ASC";
        return queryRecords(sql, ps -> {
            ps.setString(1, itemId);
            ps.setString(2, stage.wireName());
        }, "Failed to read stage history");
    }

    public List<StageTransition> transitions(String itemId) {
        List<StageTransition> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement("""
                SELECT id,item_id,stage,version,from_status,to_status,attempt,detail,at_ms
                FROM stage_transitions
                WHERE item_id=?
                ORDER BY id ASC
                """)) {
            ps.setString(1, itemId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new StageTransition(
                            rs.getLong("id"),
                            rs.getString("item_id"),
                            rs.getString("stage"),
                            rs.getInt("version"),
                            rs.getString("from_status"),
                            rs.getString("to_status"),
                            rs.getInt("attempt"),
                            rs.getString("detail"),
                            rs.getLong("at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to read transitions", e);
        }
    }

    /**
     * Current FAILED records that no sweep will pick up again: those marked terminal, and retryable ones whose
     * attempts already reach {@code maxAttempts} (left behind when the budget was lowered).
     */
    public List<StageRecord> listFailed(Stage stage, int maxAttempts, int limit) {
        String sql = "SELECT " + RECORD_COLUMNS + """
                FROM stage_records
                WHERE is_current=1 AND status='FAILED' AND (terminal=1 OR attempt>=?) AND (? IS NULL OR stage=?)
                ORDER BY updated_at_ms DESC, item_id ASC
                LIMIT ?
                """;
        String stageName = stage == null ? null : stage.wireName();
        return queryRecords(sql, ps -> {
            ps.setInt(1, Math.max(1, maxAttempts));
            ps.setString(2, stageName);
            ps.setString(3, stageName);
            ps.setInt(4, Math.max(1, limit));
        }, "Failed to list failed records");
    }

    public List<StatusCount> countByStatus() {
        List<StatusCount> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement("""
                SELECT stage,status,COUNT(*) AS cnt
                FROM stage_records
                WHERE is_current=1
                GROUP BY stage,status
                """);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new StatusCount(
                        Stage.fromString(rs.getString("stage")),
                        StageStatus.valueOf(rs.getString("status")),
                        rs.getInt("cnt")
                ));
            }
            out.sort(Comparator.comparing(StatusCount::stage).thenComparing(StatusCount::status));
            return out;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to count stage records", e);
        }
    }

    private Optional<WorkItem> readItem(Connection c, String itemId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT item_id,canonical_key,key_hash,external_id,created_at_ms FROM work_items WHERE item_id=?")) {
            ps.setString(1, itemId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new WorkItem(
                        rs.getString("item_id"),
                        rs.getString("canonical_key"),
                        rs.getString("key_hash"),
                        rs.getString("external_id"),
                        rs.getLong("created_at_ms")
                ));
            }
        }
    }

    private Optional<StageRecord> readCurrent(Connection c, String itemId, Stage stage) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + RECORD_COLUMNS + " FROM stage_records WHERE item_id=? AND stage=? AND is_current=1")) {
            ps.setString(1, itemId);
            ps.setString(2, stage.wireName());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRecord(rs)) : Optional.empty();
            }
        }
    }

    private Optional<String> readUpstreamHash(Connection c, String itemId, Stage stage) throws SQLException {
        if (stage.upstream().isEmpty()) {
            return readItem(c, itemId).map(WorkItem::keyHash);
        }
        return readCurrent(c, itemId, stage.upstream().get())
                .filter(r -> r.status() == StageStatus.DONE)
                .map(StageRecord::artifactRef);
    }

    private StageRecord insertVersion(Connection c, StageRecord superseded, String inputHash, long nowMs,
                                      String detail) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE stage_records SET is_current=0 WHERE item_id=? AND stage=? AND version=?")) {
            ps.setString(1, superseded.itemId());
            ps.setString(2, superseded.stage().wireName());
            ps.setInt(3, superseded.version());
            ps.executeUpdate();
        }
        StageRecord fresh = insertVersion(c, superseded.itemId(), superseded.stage(), superseded.version() + 1,
                inputHash, nowMs);
        logTransition(c, fresh, superseded.status(), "v" + superseded.version() + " superseded: " + detail, nowMs);
        return fresh;
    }

    private StageRecord insertVersion(Connection c, String itemId, Stage stage, int version, String inputHash,
                                      long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO stage_records(item_id,stage,version,revision,status,input_hash,attempt,terminal,
                    next_eligible_at_ms,is_current,reusable,created_at_ms,updated_at_ms)
                VALUES(?,?,?,0,?,?,0,0,0,1,1,?,?)
                """)) {
            ps.setString(1, itemId);
            ps.setString(2, stage.wireName());
            ps.setInt(3, version);
            ps.setString(4, StageStatus.PENDING.name());
            ps.setString(5, inputHash);
            ps.setLong(6, nowMs);
            ps.setLong(7, nowMs);
            ps.executeUpdate();
        }
        return new StageRecord(itemId, stage, version, 0L, StageStatus.PENDING, null, inputHash,
                null, null, 0, false, 0L, nowMs, nowMs);
    }

    private void logTransition(Connection c, StageRecord record, StageStatus from, String detail, long nowMs)
            throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO stage_transitions(item_id,stage,version,from_status,to_status,attempt,detail,at_ms)
                VALUES(?,?,?,?,?,?,?,?)
                """)) {
            ps.setString(1, record.itemId());
            ps.setString(2, record.stage().wireName());
            ps.setInt(3, record.version());
            ps.setString(4, from == null ? null : from.name());
            ps.setString(5, record.status().name());
            ps.setInt(6, record.attempt());
            ps.setString(7, truncate(detail));
            ps.setLong(8, nowMs);
            ps.executeUpdate();
        }
    }

    private List<StageRecord> queryRecords(String sql, Binder binder, String failure) {
        List<StageRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapRecord(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new InfrastructureException(failure, e);
        }
    }

    private static StageRecord mapRecord(ResultSet rs) throws SQLException {
        return new StageRecord(
                rs.getString("item_id"),
                Stage.fromString(rs.getString("stage")),
                rs.getInt("version"),
                rs.getLong("revision"),
                StageStatus.valueOf(rs.getString("status")),
                rs.getString("artifact_ref"),
                rs.getString("input_hash"),
                ErrorKind.fromNullable(rs.getString("error_kind")),
                rs.getString("error_detail"),
                rs.getInt("attempt"),
                rs.getInt("terminal") == 1,
                rs.getLong("next_eligible_at_ms"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private static String truncate(String value) {
        if (value == null) {
            return null;
        }
        return value.length() <= DETAIL_MAX ? value : value.substring(0, DETAIL_MAX);
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    public record Registration(WorkItem item, boolean created) {
    }

    public record ReclaimSummary(int reclaimed, int terminal) {
    }

    public record StatusCount(Stage stage, StageStatus status, int count) {
    }

    public record TransitionRequest(
            String itemId,
            Stage stage,
            int expectedVersion,
            long expectedRevision,
            String expectedInputHash,
            StageStatus newStatus,
            String artifactRef,
            ErrorKind errorKind,
            String errorDetail,
            boolean terminal,
            long nextEligibleAtMs,
            long nowMs
    ) {
        public static TransitionRequest toRunning(StageRecord from, long nowMs) {
            return new TransitionRequest(from.itemId(), from.stage(), from.version(), from.revision(), from.inputHash(),
                    StageStatus.RUNNING, null, null, null, false, 0L, nowMs);
        }

        public static TransitionRequest toDone(StageRecord from, String artifactHash, long nowMs) {
            return new TransitionRequest(from.itemId(), from.stage(), from.version(), from.revision(), from.inputHash(),
                    StageStatus.DONE, artifactHash, null, null, false, 0L, nowMs);
        }

        public static TransitionRequest toFailed(StageRecord from, ErrorKind kind, String detail, boolean terminal,
                                                 long nextEligibleAtMs, long nowMs) {
            return new TransitionRequest(from.itemId(), from.stage(), from.version(), from.revision(), from.inputHash(),
                    StageStatus.FAILED, null, kind, detail, terminal, nextEligibleAtMs, nowMs);
        }
    }

    public record TransitionResult(boolean applied, StageRecord record, String reason) {
        public static TransitionResult applied(StageRecord record) {
            return new TransitionResult(true, record, "");
        }

        /**
         * {@code current} is the record as found, or null when there is none.
         */
        public static TransitionResult conflict(String reason, StageRecord current) {
            return new TransitionResult(false, current, reason);
        }
    }
}
