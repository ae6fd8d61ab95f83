package io.xaio.runtime;

import io.xaio.model.Lease;
import io.xaio.storage.InfrastructureException;
import io.xaio.storage.LeaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps an item lease alive while a stage call is in flight. Runs on its own daemon thread and stops at the
 * first refused renewal: once the lease is gone, only the ledger's compare-and-set decides who commits.
 */
final class LeaseHeartbeat implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(LeaseHeartbeat.class);

    private final LeaseManager leases;
    private final Lease lease;
    private final long ttlMs;
    private final long intervalMs;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicBoolean lost = new AtomicBoolean(false);
    private final AtomicInteger renewals = new AtomicInteger();
    private final Thread thread;

    private LeaseHeartbeat(LeaseManager leases, Lease lease, long ttlMs, long intervalMs, Clock clock) {
        this.leases = leases;
        this.lease = lease;
        this.ttlMs = ttlMs;
        this.intervalMs = Math.max(1L, intervalMs);
        this.clock = clock;
        this.thread = new Thread(this::loop, "xaio-lease-heartbeat");
        this.thread.setDaemon(true);
    }

    static LeaseHeartbeat start(LeaseManager leases, Lease lease, long ttlMs, long intervalMs, Clock clock) {
        LeaseHeartbeat heartbeat = new LeaseHeartbeat(leases, lease, ttlMs, intervalMs, clock);
        heartbeat.thread.start();
        return heartbeat;
    }

    private void loop() {
        while (running.get()) {
            try {
                Thread.sleep(intervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (!running.get()) {
                return;
            }
            try {
                if (leases.renew(lease, ttlMs, clock.millis())) {
                    renewals.incrementAndGet();
                } else {
                    lost.set(true);
                    LOG.warn("lease {} expired or was taken over during the stage call", lease.leaseKey());
                    return;
                }
            } catch (InfrastructureException e) {
                // the lease keeps its remaining TTL; the next beat tries again
                LOG.warn("lease {} renewal failed: {}", lease.leaseKey(), e.getMessage());
            }
        }
    }

    boolean lost() {
        return lost.get();
    }

    int renewals() {
        return renewals.get();
    }

    @Override
    public void close() {
        running.set(false);
        thread.interrupt();
        try {
            thread.join(intervalMs + 1_000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
