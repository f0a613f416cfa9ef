package taskwarden.tracker.model;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts from one stale-run reaper pass.
 *
 * @param stale      candidates found past the cutoff
 * @param refreshed  candidates that turned out terminal after the fresh status check
 * @param timedOut   candidates marked FAILURE
 * @param failed     candidates whose processing threw
 */
public record ReapSummary(
        Duration timeout,
        Instant cutoff,
        int stale,
        int refreshed,
        int timedOut,
        int failed) {

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("timeout_minutes", timeout.toMinutes());
        out.put("cutoff", cutoff.toString());
        out.put("stale_count", stale);
        out.put("refreshed_count", refreshed);
        out.put("updated_count", timedOut);
        out.put("failed_count", failed);
        return out;
    }
}
