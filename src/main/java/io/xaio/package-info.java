/**
 * Staged idempotent pipeline engine.
 *
 * <p>Work items (canonical source URLs) move through capture, reduce, meta, claims, merge and publish. Every
 * stage output is an immutable content-addressed artifact, progress lives in a SQLite ledger, and TTL leases
 * keep concurrent workers from running the same (item, stage) twice.
 */
package io.xaio;
