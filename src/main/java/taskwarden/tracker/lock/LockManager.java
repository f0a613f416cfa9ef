package taskwarden.tracker.lock;

import taskwarden.tracker.model.LockLease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Mutual exclusion with expiry on top of a {@link LockStore}.
 *
 * <p>{@link #acquire} makes exactly one set-if-absent attempt and never waits:
 * a held key means "skip this run", not "queue for a turn".
 *
 * <p>The TTL is mandatory and is the only crash recovery: a holder that dies
 * without releasing is reclaimed once its TTL elapses. Picking it is up to the
 * call site. Shorter than the slowest legitimate run and a second copy can start
 * while the first is still working; much longer than that and a crashed run
 * blocks re-runs until it expires.
 */
public class LockManager {

    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    static final String KEY_PREFIX = "taskwarden_task_lock:";

    private final LockStore store;

    public LockManager(LockStore store) {
        this.store = store;
    }

    /**
     * Try once to take the lock.
     *
     * @return the lease carrying the expiry the store recorded, or empty if the
     *         key is held by someone else
     * @throws IllegalArgumentException if the key is blank or the TTL is not positive
     */
    public Optional<LockLease> acquire(String key, Duration ttl) {
        requireKey(key);
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Lock TTL must be positive: " + ttl);
        }

        String token = UUID.randomUUID().toString();

        Optional<Instant> expiresAt = store.setIfAbsent(KEY_PREFIX + key, token, ttl);
        if (expiresAt.isPresent()) {
            log.info("Acquired task lock {} (ttl {}, expires {})", key, ttl, expiresAt.get());
            return Optional.of(new LockLease(key, token, expiresAt.get()));
        }

        log.warn("Task lock {} already held", key);
        return Optional.empty();
    }

    /**
     * Release the lock if this token still owns it. Releasing an expired or
     * foreign-owned key changes nothing.
     *
     * @return true if the lock was deleted
     */
    public boolean release(String key, String token) {
        requireKey(key);
        boolean released = store.compareAndDelete(KEY_PREFIX + key, token);
        if (released) {
            log.info("Released task lock {}", key);
        } else {
            log.debug("Task lock {} not owned by this token, release is a no-op", key);
        }
        return released;
    }

    public boolean release(LockLease lease) {
        return release(lease.key(), lease.token());
    }

    /**
     * Point-in-time check for observability. Races with concurrent acquire and
     * release, so never use it to decide whether work may run.
     */
    public boolean isLocked(String key) {
        requireKey(key);
        return store.get(KEY_PREFIX + key).isPresent();
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Lock key is required");
        }
    }
}
