package taskwarden.tracker.service;

import taskwarden.tracker.error.TaskNotFoundException;
import taskwarden.tracker.model.ExternalStatus;
import taskwarden.tracker.model.ReconcileSummary;
import taskwarden.tracker.model.SyncOutcome;
import taskwarden.tracker.model.TaskExecution;
import taskwarden.tracker.model.TaskStatus;
import taskwarden.tracker.model.TaskUpdate;
import taskwarden.tracker.repository.TaskExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Folds the dispatcher's authoritative status into local execution records.
 *
 * <p>Re-applying the same external status is a no-op, terminal records are
 * never touched, and an unrecognized external status is logged and skipped.
 * A lookup failure for one record does not stop the rest of a batch.
 */
public class Reconciler {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final TaskTracker tracker;
    private final TaskExecutionRepository repository;
    private final StatusSource statusSource;

    public Reconciler(TaskTracker tracker, TaskExecutionRepository repository, StatusSource statusSource) {
        this.tracker = tracker;
        this.repository = repository;
        this.statusSource = statusSource;
    }

    /**
     * Reconcile one record.
     * Lookup and store failures propagate to the caller.
     */
    public SyncOutcome sync(String taskId) {
        Optional<TaskExecution> found = repository.findById(taskId);
        if (found.isEmpty()) {
            log.warn("Task execution not found {}", taskId);
            return SyncOutcome.NOT_FOUND;
        }

        TaskExecution current = found.get();
        if (current.isTerminal()) {
            log.debug("Task execution {} already terminal ({}), not syncing", taskId, current.status());
            return SyncOutcome.UNCHANGED;
        }

        Optional<ExternalStatus> external = statusSource.lookup(taskId);
        if (external.isEmpty()) {
            return SyncOutcome.UNCHANGED;
        }

        ExternalStatus reported = external.get();
        Optional<TaskStatus> parsed = TaskStatus.parse(reported.status());
        if (parsed.isEmpty()) {
            log.warn("Reconciliation mismatch for task execution {}: unknown external status '{}'",
                    taskId, reported.status());
            return SyncOutcome.MISMATCHED;
        }

        TaskStatus status = parsed.get();
        if (status == current.status()) {
            return SyncOutcome.UNCHANGED;
        }
        if (status == TaskStatus.PENDING) {
            // dispatchers report PENDING for ids they no longer know; never step back to it
            log.debug("Ignoring external PENDING for task execution {} in {}", taskId, current.status());
            return SyncOutcome.UNCHANGED;
        }

        TaskUpdate update = TaskUpdate.to(status);
        if (status.isTerminal()) {
            update = update.withResult(reported.result())
                    .withError(reported.error())
                    .withTraceback(reported.traceback());
        }

        try {
            TaskExecution stored = tracker.update(taskId, update);
            return stored.status() == current.status() ? SyncOutcome.UNCHANGED : SyncOutcome.UPDATED;
        } catch (TaskNotFoundException e) {
            return SyncOutcome.NOT_FOUND;
        }
    }

    /**
     * Reconcile non-terminal records, oldest created first.
     *
     * @param maxSync cap on records processed; 0 for no cap
     */
    public ReconcileSummary syncAllUnfinished(int maxSync) {
        List<TaskExecution> unfinished = repository.findUnfinished(maxSync);

        int updated = 0;
        int unchanged = 0;
        int mismatched = 0;
        int failed = 0;

        for (TaskExecution execution : unfinished) {
            try {
                switch (sync(execution.taskId())) {
                    case UPDATED -> updated++;
                    case MISMATCHED -> mismatched++;
                    case UNCHANGED, NOT_FOUND -> unchanged++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to sync task execution {}", execution.taskId(), e);
            }
        }

        ReconcileSummary summary = new ReconcileSummary(unfinished.size(), updated, unchanged, mismatched, failed);
        if (!unfinished.isEmpty()) {
            log.info("Reconciler: {} synced, {} updated, {} mismatched, {} failed",
                    summary.scanned(), updated, mismatched, failed);
        }
        return summary;
    }

    /**
     * Best-effort sync, then read. A failed lookup still returns the stored record.
     */
    public Optional<TaskExecution> refresh(String taskId) {
        try {
            sync(taskId);
        } catch (RuntimeException e) {
            log.warn("Sync failed for task execution {}, returning stored state: {}", taskId, e.getMessage());
        }
        return tracker.get(taskId);
    }
}
