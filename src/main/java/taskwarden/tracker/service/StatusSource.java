package taskwarden.tracker.service;

import taskwarden.tracker.model.ExternalStatus;

import java.util.Optional;

/**
 * Authoritative status lookup in the external dispatcher, by run id.
 */
@FunctionalInterface
public interface StatusSource {

    /**
     * @return the dispatcher's view of the run, or empty if it has nothing to report
     */
    Optional<ExternalStatus> lookup(String taskId);

    /** Source for deployments without a queryable dispatcher. */
    static StatusSource none() {
        return taskId -> Optional.empty();
    }
}
