package io.xaio.storage;

import io.xaio.model.Lease;
import io.xaio.model.Stage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;

/**
 * TTL leases over (item, stage) pairs and over the whole sweep. Acquisition is one conditional upsert, so two
 * workers racing for the same key cannot both win: the row is written only when absent or expired.
 */
public final class LeaseManager {
    public static final String GLOBAL_SWEEP_KEY = "sweep:global";

    private final Database database;

    public LeaseManager(Database database) {
        this.database = database;
    }

    public static String itemLeaseKey(String itemId, Stage stage) {
        return "item:" + itemId + ":" + stage.wireName();
    }

    public LeaseGrant acquire(String itemId, Stage stage, String owner, long ttlMs, long nowMs) {
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId must not be blank");
        }
        return acquireKey(itemLeaseKey(itemId, stage), itemId, stage, owner, ttlMs, nowMs);
    }

    public LeaseGrant acquireGlobal(String owner, long ttlMs, long nowMs) {
        return acquireKey(GLOBAL_SWEEP_KEY, null, null, owner, ttlMs, nowMs);
    }

    private LeaseGrant acquireKey(String key, String itemId, Stage stage, String owner, long ttlMs, long nowMs) {
        if (ttlMs <= 0L) {
            throw new IllegalArgumentException("lease ttl must be > 0");
        }
        String safeOwner = owner == null || owner.isBlank() ? "unknown" : owner.trim();
        Lease lease = new Lease(
                key,
                itemId,
                stage,
                UUID.randomUUID().toString(),
                safeOwner,
                nowMs,
                nowMs + ttlMs
        );
        String sql = """
                INSERT INTO leases(lease_key,item_id,stage,token,owner,acquired_at_ms,expires_at_ms)
                VALUES(?,?,?,?,?,?,?)
                ON CONFLICT(lease_key) DO UPDATE SET
                    item_id=excluded.item_id,
                    stage=excluded.stage,
                    token=excluded.token,
                    owner=excluded.owner,
                    acquired_at_ms=excluded.acquired_at_ms,
                    expires_at_ms=excluded.expires_at_ms
                WHERE leases.expires_at_ms <= excluded.acquired_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, lease.leaseKey());
            ps.setString(2, lease.itemId());
            ps.setString(3, stage == null ? null : stage.wireName());
            ps.setString(4, lease.token());
            ps.setString(5, lease.owner());
            ps.setLong(6, lease.acquiredAtMs());
            ps.setLong(7, lease.expiresAtMs());
            if (ps.executeUpdate() == 0) {
                String holder = current(c, key).map(Lease::owner).orElse("");
                return LeaseGrant.busy(holder);
            }
            return LeaseGrant.granted(lease);
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to acquire lease: " + key, e);
        }
    }

    /**
     * Extends a lease still held by its token. Returns false once the lease expired or was taken over.
     */
    public boolean renew(Lease lease, long ttlMs, long nowMs) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(
                "UPDATE leases SET expires_at_ms=? WHERE lease_key=? AND token=? AND expires_at_ms>?")) {
            ps.setLong(1, nowMs + Math.max(1L, ttlMs));
            ps.setString(2, lease.leaseKey());
            ps.setString(3, lease.token());
            ps.setLong(4, nowMs);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to renew lease: " + lease.leaseKey(), e);
        }
    }

    public boolean release(Lease lease) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(
                "DELETE FROM leases WHERE lease_key=? AND token=?")) {
            ps.setString(1, lease.leaseKey());
            ps.setString(2, lease.token());
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to release lease: " + lease.leaseKey(), e);
        }
    }

    public Optional<Lease> current(String leaseKey) {
        try (Connection c = database.openConnection()) {
            return current(c, leaseKey);
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to read lease: " + leaseKey, e);
        }
    }

    public boolean isLive(String leaseKey, long nowMs) {
        return current(leaseKey).map(l -> l.expiresAtMs() > nowMs).orElse(false);
    }

    public int purgeExpired(long nowMs) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(
                "DELETE FROM leases WHERE expires_at_ms<=?")) {
            ps.setLong(1, nowMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to purge expired leases", e);
        }
    }

    private Optional<Lease> current(Connection c, String leaseKey) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT lease_key,item_id,stage,token,owner,acquired_at_ms,expires_at_ms FROM leases WHERE lease_key=?")) {
            ps.setString(1, leaseKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                String stage = rs.getString("stage");
                return Optional.of(new Lease(
                        rs.getString("lease_key"),
                        rs.getString("item_id"),
                        stage == null ? null : Stage.fromString(stage),
                        rs.getString("token"),
                        rs.getString("owner"),
                        rs.getLong("acquired_at_ms"),
                        rs.getLong("expires_at_ms")
                ));
            }
        }
    }

    public record LeaseGrant(boolean granted, Lease lease, String holder) {
        public static LeaseGrant granted(Lease lease) {
            return new LeaseGrant(true, lease, lease.owner());
        }

        public static LeaseGrant busy(String holder) {
            return new LeaseGrant(false, null, holder);
        }
    }
}
