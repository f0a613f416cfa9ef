package taskwarden.tracker.lock;

import taskwarden.tracker.model.GuardedResult;
import taskwarden.tracker.model.LockLease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Runs a unit of work only if its lock can be taken, and always releases the
 * lock afterwards, including when the work throws.
 *
 * <p>The guard decides only whether the work runs. Exceptions thrown by the
 * work reach the caller unchanged; a busy lock produces a skipped result and
 * the work is never invoked.
 *
 * <p>Calls without a TTL use the guard's default TTL.
 */
public class DuplicateGuard {

    private static final Logger log = LoggerFactory.getLogger(DuplicateGuard.class);

    static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private final LockManager lockManager;
    private final Duration defaultTtl;

    public DuplicateGuard(LockManager lockManager) {
        this(lockManager, DEFAULT_TTL);
    }

    public DuplicateGuard(LockManager lockManager, Duration defaultTtl) {
        if (defaultTtl == null || defaultTtl.isZero() || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("Default lock TTL must be positive: " + defaultTtl);
        }
        this.lockManager = lockManager;
        this.defaultTtl = defaultTtl;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    /**
     * Guarded call with the default TTL.
     */
    public <T> GuardedResult<T> call(String key, Callable<T> work) throws Exception {
        return call(key, defaultTtl, work);
    }

    public <T> GuardedResult<T> call(String key, Duration ttl, Callable<T> work) throws Exception {
        Optional<LockLease> lease;
        try {
            lease = lockManager.acquire(key, ttl);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to acquire task lock {}", key, e);
            return GuardedResult.skipped(key, GuardedResult.REASON_LOCK_FAILED,
                    "Failed to acquire lock for " + key);
        }

        if (lease.isEmpty()) {
            return GuardedResult.skipped(key, GuardedResult.REASON_ALREADY_RUNNING,
                    "Task " + key + " is already running");
        }

        try (HeldLock ignored = new HeldLock(lease.get())) {
            return GuardedResult.ran(key, work.call());
        }
    }

    /**
     * Guarded run with the default TTL.
     */
    public GuardedResult<Void> run(String key, Runnable work) {
        return run(key, defaultTtl, work);
    }

    /**
     * Guarded run of work that throws no checked exceptions.
     */
    public GuardedResult<Void> run(String key, Duration ttl, Runnable work) {
        try {
            return call(key, ttl, () -> {
                work.run();
                return null;
            });
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected checked exception from " + key, e);
        }
    }

    /**
     * Wrap work so that every invocation of the returned callable is guarded
     * by the same lock key.
     */
    public <T> Callable<GuardedResult<T>> wrap(String key, Duration ttl, Callable<T> work) {
        return () -> call(key, ttl, work);
    }

    /**
     * Wrap per-argument work so that each invocation locks on the lock name
     * scoped by a value taken from the argument. Two calls with different
     * scope values may run at once; two with the same value may not.
     */
    public <A, T> Function<A, GuardedResult<T>> wrapScoped(String lockName, String scopeParam,
            Function<A, ?> scopeValue, Duration ttl, Function<A, T> work) {
        return arg -> {
            String key = LockKeys.scoped(lockName, scopeParam, scopeValue.apply(arg));
            try {
                return call(key, ttl, () -> work.apply(arg));
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException("Unexpected checked exception from " + key, e);
            }
        };
    }

    /** Releases its lease on close; a failed release is left to the TTL. */
    private final class HeldLock implements AutoCloseable {
        private final LockLease lease;

        HeldLock(LockLease lease) {
            this.lease = lease;
        }

        @Override
        public void close() {
            try {
                lockManager.release(lease);
            } catch (RuntimeException e) {
                log.warn("Failed to release task lock {}, it expires at {}: {}",
                        lease.key(), lease.expiresAt(), e.getMessage());
            }
        }
    }
}
