package taskwarden.tracker.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Execution status of a tracked run.
 * PENDING, STARTED and RETRY are non-terminal; SUCCESS, FAILURE and REVOKED are terminal.
 */
public enum TaskStatus {
    /** Registered at dispatch time, not yet picked up by a worker */
    PENDING,
    /** A worker is executing the run */
    STARTED,
    /** Finished successfully */
    SUCCESS,
    /** Finished with an error, or reaped after a timeout */
    FAILURE,
    /** The dispatcher scheduled another attempt */
    RETRY,
    /** Revoked by the dispatcher; observed only, never initiated here */
    REVOKED;

    private static final Set<TaskStatus> TERMINAL = EnumSet.of(SUCCESS, FAILURE, REVOKED);
    private static final Set<TaskStatus> RUNNING = EnumSet.of(STARTED, RETRY);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isRunning() {
        return RUNNING.contains(this);
    }

    public static Set<TaskStatus> terminal() {
        return EnumSet.copyOf(TERMINAL);
    }

    public static Set<TaskStatus> nonTerminal() {
        return EnumSet.complementOf(EnumSet.copyOf(TERMINAL));
    }

    /**
     * Parse a status string reported by an external source.
     *
     * @return the status, or empty if the string names none of the six variants
     */
    public static Optional<TaskStatus> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
