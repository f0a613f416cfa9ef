package taskwarden.tracker.model;

import java.util.Map;
import java.util.Objects;

/**
 * Merge-update applied to a stored execution.
 * Null payload fields leave the stored value untouched; metadata keys are merged
 * one by one into the stored map.
 *
 * @param override allow a terminal record to move to a different status
 */
public record TaskUpdate(
        TaskStatus status,
        Object result,
        String error,
        String traceback,
        Map<String, Object> metadata,
        boolean override) {

    public TaskUpdate {
        Objects.requireNonNull(status, "status is required");
    }

    public static TaskUpdate to(TaskStatus status) {
        return new TaskUpdate(status, null, null, null, null, false);
    }

    public TaskUpdate withResult(Object result) {
        return new TaskUpdate(status, result, error, traceback, metadata, override);
    }

    public TaskUpdate withError(String error) {
        return new TaskUpdate(status, result, error, traceback, metadata, override);
    }

    public TaskUpdate withTraceback(String traceback) {
        return new TaskUpdate(status, result, error, traceback, metadata, override);
    }

    public TaskUpdate withMetadata(Map<String, Object> metadata) {
        return new TaskUpdate(status, result, error, traceback, metadata, override);
    }

    public TaskUpdate overriding() {
        return new TaskUpdate(status, result, error, traceback, metadata, true);
    }
}
