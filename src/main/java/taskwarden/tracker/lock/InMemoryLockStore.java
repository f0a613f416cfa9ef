package taskwarden.tracker.lock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lock store for a single process. Expired entries are replaced lazily on the
 * next acquire attempt and hidden from reads.
 */
public class InMemoryLockStore implements LockStore {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryLockStore() {
        this(Clock.systemUTC());
    }

    public InMemoryLockStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Instant> setIfAbsent(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        Entry fresh = new Entry(value, now.plus(ttl));
        Entry stored = entries.compute(key, (k, existing) ->
                existing == null || existing.isExpired(now) ? fresh : existing);
        return stored == fresh ? Optional.of(fresh.expiresAt) : Optional.empty();
    }

    @Override
    public boolean compareAndDelete(String key, String expectedValue) {
        AtomicBoolean deleted = new AtomicBoolean(false);
        entries.computeIfPresent(key, (k, existing) -> {
            if (existing.value.equals(expectedValue)) {
                deleted.set(true);
                return null;
            }
            return existing;
        });
        return deleted.get();
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    private record Entry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
