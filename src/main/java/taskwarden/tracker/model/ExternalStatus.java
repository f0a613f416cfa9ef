package taskwarden.tracker.model;

/**
 * Status of a run as reported by the external dispatcher.
 * The status is kept as the raw string so unknown values can be detected and skipped.
 */
public record ExternalStatus(
        String status,
        Object result,
        String error,
        String traceback) {

    public static ExternalStatus of(String status) {
        return new ExternalStatus(status, null, null, null);
    }

    public static ExternalStatus success(Object result) {
        return new ExternalStatus(TaskStatus.SUCCESS.name(), result, null, null);
    }

    public static ExternalStatus failure(String error, String traceback) {
        return new ExternalStatus(TaskStatus.FAILURE.name(), null, error, traceback);
    }
}
