package taskwarden.tracker.config;

import taskwarden.tracker.repository.TaskConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TaskSettingsTest {

    private final Map<String, Object> stored = new HashMap<>();
    private TaskSettings settings;

    @BeforeEach
    void setup() {
        stored.clear();
        settings = new TaskSettings(TrackerConfig.defaults(), new MapRepository(stored));
    }

    @Test
    void fallsBackToStaticConfigWithoutOverride() {
        assertEquals(Duration.ofMinutes(10), settings.taskTimeout());
        assertEquals(Duration.ofDays(180), settings.retention());
    }

    @Test
    void plainIntegerOverride() {
        stored.put(TaskSettings.TIMEOUT_MINUTES, 20);
        stored.put(TaskSettings.RETENTION_DAYS, 30L);

        assertEquals(Duration.ofMinutes(20), settings.taskTimeout());
        assertEquals(Duration.ofDays(30), settings.retention());
    }

    @Test
    void objectOverrideUnderSameKey() {
        stored.put(TaskSettings.RETENTION_DAYS, Map.of("retention_days", BigInteger.valueOf(14)));
        stored.put(TaskSettings.TIMEOUT_MINUTES, Map.of("retention_days", 99));

        assertEquals(Duration.ofDays(14), settings.retention());
        assertEquals(Duration.ofMinutes(10), settings.taskTimeout());
    }

    @Test
    void invalidOverridesAreIgnored() {
        stored.put(TaskSettings.TIMEOUT_MINUTES, 0);
        stored.put(TaskSettings.RETENTION_DAYS, "30");
        assertEquals(Duration.ofMinutes(10), settings.taskTimeout());
        assertEquals(Duration.ofDays(180), settings.retention());

        stored.put(TaskSettings.TIMEOUT_MINUTES, 2.5);
        stored.put(TaskSettings.RETENTION_DAYS, Map.of("retention_days", -1));
        assertEquals(Duration.ofMinutes(10), settings.taskTimeout());
        assertEquals(Duration.ofDays(180), settings.retention());
    }

    @Test
    void unreadableOverridesFallBackToStaticConfig() {
        TaskConfigRepository down = new MapRepository(stored) {
            @Override
            public Optional<Object> get(String key) {
                throw new IllegalStateException("store down");
            }
        };
        TaskSettings resilient = new TaskSettings(
                TrackerConfig.defaults().withTaskTimeout(Duration.ofMinutes(3)), down);

        assertEquals(Duration.ofMinutes(3), resilient.taskTimeout());
    }

    @Test
    void fixedSettingsReadStaticConfigOnly() {
        TrackerConfig config = TrackerConfig.defaults().withRetention(Duration.ofDays(7)).withCleanupBatchSize(50);
        TaskSettings fixed = TaskSettings.fixed(config);

        assertEquals(Duration.ofDays(7), fixed.retention());
        assertEquals(50, fixed.cleanupBatchSize());
        assertTrue(fixed.cleanupOnlyCompleted());
        assertSame(config, fixed.config());
    }

    private static class MapRepository implements TaskConfigRepository {
        private final Map<String, Object> values;

        MapRepository(Map<String, Object> values) {
            this.values = values;
        }

        @Override
        public void set(String key, Object value) {
            values.put(key, value);
        }

        @Override
        public Optional<Object> get(String key) {
            return Optional.ofNullable(values.get(key));
        }

        @Override
        public boolean delete(String key) {
            return values.remove(key) != null;
        }
    }
}
