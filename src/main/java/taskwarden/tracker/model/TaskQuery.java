package taskwarden.tracker.model;

import java.time.Instant;

/**
 * Optional filters for listing and counting executions. Null means "any".
 *
 * @param createdFrom inclusive lower bound on created_at
 * @param createdTo   inclusive upper bound on created_at
 */
public record TaskQuery(
        String module,
        String taskName,
        TaskStatus status,
        String createdBy,
        Instant createdFrom,
        Instant createdTo) {

    public static TaskQuery all() {
        return new TaskQuery(null, null, null, null, null, null);
    }

    public TaskQuery withModule(String module) {
        return new TaskQuery(module, taskName, status, createdBy, createdFrom, createdTo);
    }

    public TaskQuery withTaskName(String taskName) {
        return new TaskQuery(module, taskName, status, createdBy, createdFrom, createdTo);
    }

    public TaskQuery withStatus(TaskStatus status) {
        return new TaskQuery(module, taskName, status, createdBy, createdFrom, createdTo);
    }

    public TaskQuery withCreatedBy(String createdBy) {
        return new TaskQuery(module, taskName, status, createdBy, createdFrom, createdTo);
    }

    public TaskQuery createdBetween(Instant from, Instant to) {
        return new TaskQuery(module, taskName, status, createdBy, from, to);
    }
}
