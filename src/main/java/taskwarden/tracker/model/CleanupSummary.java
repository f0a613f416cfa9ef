package taskwarden.tracker.model;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts from one retention cleaner pass.
 */
public record CleanupSummary(
        Duration retention,
        boolean onlyCompleted,
        Instant cutoff,
        int deleted,
        int batches) {

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("retention_days", retention.toDays());
        out.put("only_completed", onlyCompleted);
        out.put("cutoff", cutoff.toString());
        out.put("deleted_count", deleted);
        out.put("batches", batches);
        return out;
    }
}
