package taskwarden.tracker.lock;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Shared key/value store with expiry, the sole arbiter of lock ownership.
 * Implementations must make each operation atomic for a single key and must
 * treat an entry as absent once its expiry has passed, whether or not the
 * owning process is still alive.
 */
public interface LockStore {

    /**
     * Store the value only if no live entry exists for the key. The expiry is
     * taken from the store's own clock.
     *
     * @return the expiry as stored if this call stored the value, otherwise empty
     */
    Optional<Instant> setIfAbsent(String key, String value, Duration ttl);

    /**
     * Delete the entry only if its current value equals the expected one.
     *
     * @return true if an entry was deleted
     */
    boolean compareAndDelete(String key, String expectedValue);

    /**
     * Current live value, if any.
     */
    Optional<String> get(String key);
}
