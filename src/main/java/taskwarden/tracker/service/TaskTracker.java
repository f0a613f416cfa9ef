package taskwarden.tracker.service;

import taskwarden.tracker.error.TaskNotFoundException;
import taskwarden.tracker.model.TaskExecution;
import taskwarden.tracker.model.TaskQuery;
import taskwarden.tracker.model.TaskStats;
import taskwarden.tracker.model.TaskStats.StatusCounts;
import taskwarden.tracker.model.TaskStatus;
import taskwarden.tracker.model.TaskUpdate;
import taskwarden.tracker.repository.TaskExecutionRepository;
import taskwarden.tracker.repository.TaskExecutionRepository.GroupCount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Service layer for execution records: registration at dispatch time,
 * merge-updates from running work and janitors, reads, listing and stats.
 */
public class TaskTracker {

    private static final Logger log = LoggerFactory.getLogger(TaskTracker.class);

    private final TaskExecutionRepository repository;
    private final Clock clock;

    public TaskTracker(TaskExecutionRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public TaskTracker(TaskExecutionRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Register a PENDING run.
     *
     * @throws taskwarden.tracker.error.TaskAlreadyExistsException if the task id is taken
     */
    public TaskExecution register(String taskId, String taskName, String module) {
        requireText(taskId, "taskId");
        requireText(taskName, "taskName");
        requireText(module, "module");
        return register(TaskExecution.builder()
                .taskId(taskId)
                .taskName(taskName)
                .module(module)
                .build());
    }

    /**
     * Register a run from a draft. created_at is stamped now; a draft with
     * status STARTED gets started_at, a terminal one gets finished_at.
     * The existing row is never overwritten.
     *
     * @throws taskwarden.tracker.error.TaskAlreadyExistsException if the task id is taken
     */
    public TaskExecution register(TaskExecution draft) {
        requireText(draft.taskId(), "taskId");
        requireText(draft.taskName(), "taskName");
        requireText(draft.module(), "module");

        Instant now = clock.instant();
        TaskExecution.Builder builder = draft.toBuilder()
                .createdAt(draft.createdAt() != null ? draft.createdAt() : now);
        if (draft.status() == TaskStatus.STARTED && draft.startedAt() == null) {
            builder.startedAt(now);
        }
        if (draft.status().isTerminal() && draft.finishedAt() == null) {
            builder.finishedAt(now);
        }
        TaskExecution execution = builder.build();

        repository.save(execution);
        log.info("Registered task execution {} name={} module={} status={}",
                execution.taskId(), execution.taskName(), execution.module(), execution.status());
        return execution;
    }

    /**
     * Apply a merge-update atomically.
     *
     * @return the stored record after the update
     * @throws TaskNotFoundException if no record has this id
     */
    public TaskExecution update(String taskId, TaskUpdate update) {
        requireText(taskId, "taskId");

        TaskStatus[] before = new TaskStatus[1];
        TaskExecution stored = repository.update(taskId, current -> {
            before[0] = current.status();
            return merge(current, update, clock.instant());
        }).orElseThrow(() -> {
            log.warn("Task execution not found {}", taskId);
            return new TaskNotFoundException(taskId);
        });

        if (before[0] != stored.status()) {
            log.info("Updated task execution {} name={} {} -> {}",
                    taskId, stored.taskName(), before[0], stored.status());
        }
        return stored;
    }

    public Optional<TaskExecution> get(String taskId) {
        return repository.findById(taskId);
    }

    /**
     * Executions matching the query, newest first.
     */
    public List<TaskExecution> list(TaskQuery query, int limit) {
        return repository.find(query, limit);
    }

    /**
     * Totals and per-status counts for the query, overall and per module and task name.
     */
    public TaskStats stats(TaskQuery query) {
        List<GroupCount> rows = repository.countGrouped(query);

        Map<TaskStatus, Long> summary = new EnumMap<>(TaskStatus.class);
        Map<String, Map<TaskStatus, Long>> byModule = new TreeMap<>();
        Map<String, Map<TaskStatus, Long>> byTaskName = new TreeMap<>();

        for (GroupCount row : rows) {
            summary.merge(row.status(), row.count(), Long::sum);
            byModule.computeIfAbsent(row.module(), k -> new EnumMap<>(TaskStatus.class))
                    .merge(row.status(), row.count(), Long::sum);
            byTaskName.computeIfAbsent(row.taskName(), k -> new EnumMap<>(TaskStatus.class))
                    .merge(row.status(), row.count(), Long::sum);
        }

        return new TaskStats(counts(summary), countsByKey(byModule), countsByKey(byTaskName));
    }

    /**
     * Merge an update into the current record.
     *
     * <p>started_at is set on the first transition into STARTED and finished_at
     * on the first transition into a terminal status; neither moves afterwards.
     * result, error and traceback replace the stored value only when given.
     * metadata is merged per top-level key: given keys overwrite, absent keys
     * stay, nested values are replaced whole.
     *
     * <p>A terminal record keeps its status unless the update repeats that same
     * status or carries the override flag; a refused status change is logged and
     * only the metadata is merged.
     */
    static TaskExecution merge(TaskExecution current, TaskUpdate update, Instant now) {
        TaskExecution.Builder next = current.toBuilder()
                .metadata(mergeMetadata(current.metadata(), update.metadata()));

        TaskStatus status = update.status();
        if (current.isTerminal() && status != current.status() && !update.override()) {
            log.warn("Refusing to move terminal task execution {} from {} to {} without override",
                    current.taskId(), current.status(), status);
            return next.build();
        }

        next.status(status);
        if (status == TaskStatus.STARTED && current.startedAt() == null) {
            next.startedAt(now);
        }
        if (status.isTerminal()) {
            if (current.finishedAt() == null) {
                next.finishedAt(now);
            }
        } else if (current.isTerminal()) {
            // reopened by override
            next.finishedAt(null);
        }

        if (update.result() != null) {
            next.result(update.result());
        }
        if (update.error() != null) {
            next.error(update.error());
        }
        if (update.traceback() != null) {
            next.traceback(update.traceback());
        }
        return next.build();
    }

    private static Map<String, Object> mergeMetadata(Map<String, Object> stored, Map<String, Object> incoming) {
        Map<String, Object> merged = new LinkedHashMap<>(stored);
        if (incoming != null) {
            merged.putAll(incoming);
        }
        return merged;
    }

    private static StatusCounts counts(Map<TaskStatus, Long> byStatus) {
        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
        return new StatusCounts(total, byStatus);
    }

    private static Map<String, StatusCounts> countsByKey(Map<String, Map<TaskStatus, Long>> grouped) {
        Map<String, StatusCounts> out = new LinkedHashMap<>();
        grouped.forEach((key, byStatus) -> out.put(key, counts(byStatus)));
        return out;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
