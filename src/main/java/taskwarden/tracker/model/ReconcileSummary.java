package taskwarden.tracker.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts from one reconciliation batch.
 *
 * @param scanned    non-terminal records looked up
 * @param updated    records whose stored state changed
 * @param unchanged  records already matching the external status
 * @param mismatched records whose external status was not recognized
 * @param failed     records whose lookup or update threw
 */
public record ReconcileSummary(
        int scanned,
        int updated,
        int unchanged,
        int mismatched,
        int failed) {

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("synced_count", scanned);
        out.put("synced_updated_count", updated);
        out.put("synced_unchanged_count", unchanged);
        out.put("synced_mismatched_count", mismatched);
        out.put("synced_failed_count", failed);
        return out;
    }
}
