package taskwarden.tracker.repository;

import java.util.Optional;

/**
 * Persisted global config overrides, keyed by name.
 * Values are stored as JSON and come back as plain maps, lists and scalars.
 */
public interface TaskConfigRepository {

    /**
     * Create or replace the value for a key.
     *
     * @throws IllegalArgumentException if the key is blank or the value is null
     */
    void set(String key, Object value);

    Optional<Object> get(String key);

    /**
     * @return true if a value was removed
     */
    boolean delete(String key);
}
