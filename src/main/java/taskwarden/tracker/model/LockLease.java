package taskwarden.tracker.model;

import java.time.Instant;

/**
 * Handle to a lock held in the shared lock store.
 * The lock itself lives in the store; this only proves which attempt acquired it.
 * expiresAt is the expiry the store recorded, on the store's clock.
 */
public record LockLease(
        String key,
        String token,
        Instant expiresAt) {
}
