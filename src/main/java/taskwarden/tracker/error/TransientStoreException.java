package taskwarden.tracker.error;

/**
 * I/O failure talking to the record or lock store.
 * Safe to retry with backoff at the caller or janitor level.
 */
public class TransientStoreException extends TrackerException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
