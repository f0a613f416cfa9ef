package taskwarden.tracker.error;

/**
 * A run with the same task id is already registered. Not retried.
 */
public class TaskAlreadyExistsException extends TrackerException {

    private final String taskId;

    public TaskAlreadyExistsException(String taskId, Throwable cause) {
        super("Task execution already registered: " + taskId, cause);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
