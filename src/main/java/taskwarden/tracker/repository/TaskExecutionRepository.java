package taskwarden.tracker.repository;

import taskwarden.tracker.model.TaskExecution;
import taskwarden.tracker.model.TaskQuery;
import taskwarden.tracker.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Repository interface for execution record persistence.
 * Every method is atomic on its own; none holds a lock across calls.
 */
public interface TaskExecutionRepository {

    /**
     * Insert a new execution.
     *
     * @throws taskwarden.tracker.error.TaskAlreadyExistsException if the task id is taken
     */
    void save(TaskExecution execution);

    Optional<TaskExecution> findById(String taskId);

    /**
     * Read-modify-write one execution under a row lock.
     * The change function sees the current row and returns the row to store.
     *
     * @return the stored row, or empty if the task id is unknown
     */
    Optional<TaskExecution> update(String taskId, UnaryOperator<TaskExecution> change);

    /**
     * Non-terminal executions, oldest created first.
     *
     * @param limit maximum results; 0 for no limit
     */
    List<TaskExecution> findUnfinished(int limit);

    /**
     * Non-terminal executions whose started_at is before the cutoff, oldest first.
     */
    List<TaskExecution> findStale(Instant startedBefore, int limit);

    /**
     * Mark an execution FAILURE with the given error, only if it is still non-terminal.
     *
     * @return true if the row changed
     */
    boolean markTimedOut(String taskId, String error, Instant finishedAt);

    /**
     * Ids of executions created before the cutoff, optionally only terminal ones.
     */
    List<String> findExpiredIds(Instant createdBefore, boolean onlyCompleted, int limit);

    /**
     * Delete the given executions.
     *
     * @return number of rows deleted
     */
    int deleteByIds(List<String> taskIds);

    /**
     * Executions matching the query, newest created first.
     */
    List<TaskExecution> find(TaskQuery query, int limit);

    /**
     * Row counts matching the query, grouped by module, task name and status.
     */
    List<GroupCount> countGrouped(TaskQuery query);

    record GroupCount(String module, String taskName, TaskStatus status, long count) {
    }
}
