package io.xaio.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Outbox of intake status write-backs, one row per work item holding the latest status to report. A row stays
 * PENDING until the intake accepts it, so a failed write is replayed by every later sweep.
 */
public final class IntakeReportStore {
    public static final String STATE_PENDING = "PENDING";
    public static final String STATE_DELIVERED = "DELIVERED";
    public static final String STATE_DROPPED = "DROPPED";

    private final Database database;

    public IntakeReportStore(Database database) {
        this.database = database;
    }

    /**
     * Queues {@code status} for the item. Re-queuing a status that is already pending or delivered is a no-op.
     *
     * @return true when a new write-back was queued
     */
    public boolean enqueue(String itemId, String externalId, String status, long nowMs) {
        String sql = """
                INSERT INTO intake_reports(item_id,external_id,status,state,attempts,updated_at_ms,delivered_at_ms)
                VALUES(?,?,?,?,0,?,NULL)
                ON CONFLICT(item_id) DO UPDATE SET
                    external_id=excluded.external_id,
                    status=excluded.status,
                    state=excluded.state,
                    attempts=0,
                    updated_at_ms=excluded.updated_at_ms,
                    delivered_at_ms=NULL
                WHERE intake_reports.status<>excluded.status OR intake_reports.state=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, itemId);
            ps.setString(2, externalId);
            ps.setString(3, status);
            ps.setString(4, STATE_PENDING);
            ps.setLong(5, nowMs);
            ps.setString(6, STATE_DROPPED);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to queue intake report for " + itemId, e);
        }
    }

    public List<ReportRow> pending(int limit) {
        List<ReportRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement("""
                SELECT item_id,external_id,status,state,attempts,updated_at_ms,delivered_at_ms
                FROM intake_reports
                WHERE state=?
                ORDER BY updated_at_ms ASC, item_id ASC
                LIMIT ?
                """)) {
            ps.setString(1, STATE_PENDING);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to list pending intake reports", e);
        }
    }

    public int countPending() {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(
                "SELECT COUNT(*) FROM intake_reports WHERE state=?")) {
            ps.setString(1, STATE_PENDING);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to count pending intake reports", e);
        }
    }

    public boolean markDelivered(ReportRow report, long nowMs) {
        return settle(report, STATE_DELIVERED, nowMs);
    }

    /**
     * The intake row no longer exists; the report can never be delivered.
     */
    public boolean markDropped(ReportRow report, long nowMs) {
        return settle(report, STATE_DROPPED, nowMs);
    }

    public boolean markFailed(ReportRow report, long nowMs) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement("""
                UPDATE intake_reports SET attempts=attempts+1, updated_at_ms=?
                WHERE item_id=? AND status=? AND state=?
                """)) {
            ps.setLong(1, nowMs);
            ps.setString(2, report.itemId());
            ps.setString(3, report.status());
            ps.setString(4, STATE_PENDING);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to record intake report failure for " + report.itemId(), e);
        }
    }

    // only the status that was attempted is settled; a newer status queued meanwhile stays pending
    private boolean settle(ReportRow report, String state, long nowMs) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement("""
                UPDATE intake_reports SET state=?, updated_at_ms=?, delivered_at_ms=?
                WHERE item_id=? AND status=? AND state=?
                """)) {
            ps.setString(1, state);
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setString(4, report.itemId());
            ps.setString(5, report.status());
            ps.setString(6, STATE_PENDING);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to settle intake report for " + report.itemId(), e);
        }
    }

    private static ReportRow map(ResultSet rs) throws SQLException {
        long delivered = rs.getLong("delivered_at_ms");
        Long deliveredAt = rs.wasNull() ? null : delivered;
        return new ReportRow(
                rs.getString("item_id"),
                rs.getString("external_id"),
                rs.getString("status"),
                rs.getString("state"),
                rs.getInt("attempts"),
                rs.getLong("updated_at_ms"),
                deliveredAt
        );
    }

    public record ReportRow(
            String itemId,
            String externalId,
            String status,
            String state,
            int attempts,
            long updatedAtMs,
            Long deliveredAtMs
    ) {
    }
}
