package taskwarden.tracker.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate execution counts, overall and broken down by module and task name.
 */
public record TaskStats(
        StatusCounts summary,
        Map<String, StatusCounts> byModule,
        Map<String, StatusCounts> byTaskName) {

    /** Total plus one count per status; statuses with no rows count as zero. */
    public record StatusCounts(long total, Map<TaskStatus, Long> byStatus) {

        public StatusCounts {
            EnumMap<TaskStatus, Long> filled = new EnumMap<>(TaskStatus.class);
            for (TaskStatus s : TaskStatus.values()) {
                filled.put(s, byStatus.getOrDefault(s, 0L));
            }
            byStatus = Collections.unmodifiableMap(filled);
        }

        public long count(TaskStatus status) {
            return byStatus.get(status);
        }
    }
}
