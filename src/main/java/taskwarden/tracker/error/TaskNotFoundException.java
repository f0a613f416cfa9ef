package taskwarden.tracker.error;

/**
 * No execution is registered under the given task id.
 */
public class TaskNotFoundException extends TrackerException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task execution not found: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
