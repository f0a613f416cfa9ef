package taskwarden.tracker.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of one tracked run, keyed by the dispatcher's task id.
 * result, taskArgs, taskKwargs and metadata are opaque payloads owned by callers.
 */
public final class TaskExecution {
    private final String taskId;
    private final String taskName;
    private final String module;
    private final TaskStatus status;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final List<Object> taskArgs;
    private final Map<String, Object> taskKwargs;
    private final Object result;
    private final String error;
    private final String traceback;
    private final String createdBy;
    private final Map<String, Object> metadata;

    private TaskExecution(Builder builder) {
        this.taskId = Objects.requireNonNull(builder.taskId, "taskId is required");
        this.taskName = Objects.requireNonNull(builder.taskName, "taskName is required");
        this.module = Objects.requireNonNull(builder.module, "module is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
        this.taskArgs = builder.taskArgs == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(builder.taskArgs));
        this.taskKwargs = builder.taskKwargs == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.taskKwargs));
        this.result = builder.result;
        this.error = builder.error;
        this.traceback = builder.traceback;
        this.createdBy = builder.createdBy;
        this.metadata = builder.metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public String taskId() {
        return taskId;
    }

    public String taskName() {
        return taskName;
    }

    public String module() {
        return module;
    }

    public TaskStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public List<Object> taskArgs() {
        return taskArgs;
    }

    public Map<String, Object> taskKwargs() {
        return taskKwargs;
    }

    public Object result() {
        return result;
    }

    public String error() {
        return error;
    }

    public String traceback() {
        return traceback;
    }

    public String createdBy() {
        return createdBy;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isRunning() {
        return status.isRunning();
    }

    /**
     * Wall time of the run: finished minus started, or now minus started while
     * still running. Empty if the run never started.
     */
    public Optional<Duration> duration(Instant now) {
        if (startedAt == null) {
            return Optional.empty();
        }
        Instant end = finishedAt != null ? finishedAt : now;
        return Optional.of(Duration.between(startedAt, end));
    }

    public Builder toBuilder() {
        return new Builder()
                .taskId(taskId)
                .taskName(taskName)
                .module(module)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .taskArgs(taskArgs)
                .taskKwargs(taskKwargs)
                .result(result)
                .error(error)
                .traceback(traceback)
                .createdBy(createdBy)
                .metadata(metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String taskId;
        private String taskName;
        private String module;
        private TaskStatus status = TaskStatus.PENDING;
        private Instant createdAt;
        private Instant startedAt;
        private Instant finishedAt;
        private List<Object> taskArgs;
        private Map<String, Object> taskKwargs;
        private Object result;
        private String error;
        private String traceback;
        private String createdBy;
        private Map<String, Object> metadata;

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder taskName(String taskName) {
            this.taskName = taskName;
            return this;
        }

        public Builder module(String module) {
            this.module = module;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder taskArgs(List<Object> taskArgs) {
            this.taskArgs = taskArgs;
            return this;
        }

        public Builder taskKwargs(Map<String, Object> taskKwargs) {
            this.taskKwargs = taskKwargs;
            return this;
        }

        public Builder result(Object result) {
            this.result = result;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder traceback(String traceback) {
            this.traceback = traceback;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public TaskExecution build() {
            return new TaskExecution(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskExecution that))
            return false;
        return Objects.equals(taskId, that.taskId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId);
    }

    @Override
    public String toString() {
        return "TaskExecution{taskId='" + taskId + "', taskName='" + taskName + "', status=" + status + "}";
    }
}
