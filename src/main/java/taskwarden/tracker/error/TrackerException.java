package taskwarden.tracker.error;

/**
 * Base type for data-level failures raised by the tracker.
 */
public class TrackerException extends RuntimeException {

    public TrackerException(String message) {
        super(message);
    }

    public TrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
