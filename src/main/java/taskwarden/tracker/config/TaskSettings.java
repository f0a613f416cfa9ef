package taskwarden.tracker.config;

import taskwarden.tracker.repository.TaskConfigRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Janitor settings resolved at each pass: a persisted override from the
 * task_config table wins, otherwise the static {@link TrackerConfig} value.
 *
 * <p>An override is either a positive integer or an object holding one under
 * the same key, e.g. {@code 30} or {@code {"retention_days": 30}}. Anything
 * else is ignored.
 */
public class TaskSettings {

    private static final Logger log = LoggerFactory.getLogger(TaskSettings.class);

    public static final String RETENTION_DAYS = "retention_days";
    public static final String TIMEOUT_MINUTES = "timeout_minutes";

    private final TrackerConfig config;
    private final TaskConfigRepository overrides;

    public TaskSettings(TrackerConfig config, TaskConfigRepository overrides) {
        this.config = config;
        this.overrides = overrides;
    }

    /**
     * Settings taken from the static config only.
     */
    public static TaskSettings fixed(TrackerConfig config) {
        return new TaskSettings(config, null);
    }

    public TrackerConfig config() {
        return config;
    }

    public Duration taskTimeout() {
        return positiveOverride(TIMEOUT_MINUTES).map(Duration::ofMinutes).orElse(config.taskTimeout());
    }

    public Duration retention() {
        return positiveOverride(RETENTION_DAYS).map(Duration::ofDays).orElse(config.retention());
    }

    public boolean cleanupOnlyCompleted() {
        return config.cleanupOnlyCompleted();
    }

    public int cleanupBatchSize() {
        return config.cleanupBatchSize();
    }

    private Optional<Long> positiveOverride(String key) {
        if (overrides == null) {
            return Optional.empty();
        }

        Object raw;
        try {
            raw = overrides.get(key).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Failed to read task config {}, using static setting: {}", key, e.getMessage());
            return Optional.empty();
        }

        if (raw instanceof Map<?, ?> map) {
            raw = map.get(key);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof BigInteger) {
            long value = ((Number) raw).longValue();
            if (value > 0) {
                return Optional.of(value);
            }
        }
        if (raw != null) {
            log.debug("Ignoring task config {}={}", key, raw);
        }
        return Optional.empty();
    }
}
