package taskwarden.tracker.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a call made through the duplicate guard: either the work ran and
 * produced a value, or it was skipped because the lock could not be taken.
 */
public final class GuardedResult<T> {

    public static final String REASON_ALREADY_RUNNING = "task_already_running";
    public static final String REASON_LOCK_FAILED = "lock_acquisition_failed";

    private final boolean ran;
    private final T value;
    private final String lockKey;
    private final String reason;
    private final String message;

    private GuardedResult(boolean ran, T value, String lockKey, String reason, String message) {
        this.ran = ran;
        this.value = value;
        this.lockKey = lockKey;
        this.reason = reason;
        this.message = message;
    }

    public static <T> GuardedResult<T> ran(String lockKey, T value) {
        return new GuardedResult<>(true, value, lockKey, null, null);
    }

    public static <T> GuardedResult<T> skipped(String lockKey, String reason, String message) {
        return new GuardedResult<>(false, null, lockKey, Objects.requireNonNull(reason), message);
    }

    public boolean ran() {
        return ran;
    }

    public boolean skipped() {
        return !ran;
    }

    /** Value returned by the work; null when skipped. */
    public T value() {
        return value;
    }

    public String lockKey() {
        return lockKey;
    }

    public String reason() {
        return reason;
    }

    public String message() {
        return message;
    }

    /** Structured skip payload, suitable for recording as a run result. */
    public Map<String, Object> toSkipPayload() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", false);
        out.put("status", "skipped");
        out.put("reason", reason);
        out.put("error", message);
        return out;
    }

    @Override
    public String toString() {
        return ran
                ? "GuardedResult{ran, lockKey='" + lockKey + "'}"
                : "GuardedResult{skipped, lockKey='" + lockKey + "', reason=" + reason + "}";
    }
}
