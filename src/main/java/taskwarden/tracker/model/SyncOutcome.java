package taskwarden.tracker.model;

/**
 * Result of reconciling one execution against the external dispatcher.
 */
public enum SyncOutcome {
    /** Stored state changed to match the dispatcher */
    UPDATED,

    /** Already matching, already terminal, or the dispatcher had nothing to report */
    UNCHANGED,

    /** The dispatcher reported a status outside the six known ones; nothing written */
    MISMATCHED,

    /** No execution with this id */
    NOT_FOUND
}
