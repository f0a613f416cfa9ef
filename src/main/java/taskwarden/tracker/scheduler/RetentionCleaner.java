package taskwarden.tracker.scheduler;

import taskwarden.tracker.config.TaskSettings;
import taskwarden.tracker.config.TrackerConfig;
import taskwarden.tracker.model.CleanupSummary;
import taskwarden.tracker.repository.TaskExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Deletes execution records created before the retention cutoff, in bounded
 * batches so no single delete holds storage locks for long.
 * By default only terminal records go; with onlyCompleted off, orphaned
 * non-terminal records past retention go too.
 */
public class RetentionCleaner {

    private static final Logger log = LoggerFactory.getLogger(RetentionCleaner.class);

    private final TaskExecutionRepository repository;
    private final TaskSettings settings;
    private final Clock clock;

    public RetentionCleaner(TaskExecutionRepository repository, TrackerConfig config) {
        this(repository, TaskSettings.fixed(config), Clock.systemUTC());
    }

    public RetentionCleaner(TaskExecutionRepository repository, TaskSettings settings) {
        this(repository, settings, Clock.systemUTC());
    }

    public RetentionCleaner(TaskExecutionRepository repository, TaskSettings settings, Clock clock) {
        this.repository = repository;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Clean with the current retention: the persisted override if one is set,
     * otherwise the static config.
     */
    public CleanupSummary clean() {
        return clean(settings.retention(), settings.cleanupOnlyCompleted(), settings.cleanupBatchSize());
    }

    /**
     * @param retention     records created longer ago than this are deleted
     * @param onlyCompleted restrict deletion to SUCCESS, FAILURE and REVOKED
     * @param batchSize     maximum rows per delete statement
     */
    public CleanupSummary clean(Duration retention, boolean onlyCompleted, int batchSize) {
        if (retention == null || retention.isNegative()) {
            throw new IllegalArgumentException("retention must not be negative: " + retention);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }

        Instant cutoff = clock.instant().minus(retention);
        int deleted = 0;
        int batches = 0;

        try {
            while (true) {
                List<String> ids = repository.findExpiredIds(cutoff, onlyCompleted, batchSize);
                if (ids.isEmpty()) {
                    break;
                }
                deleted += repository.deleteByIds(ids);
                batches++;
                log.debug("Retention cleaner batch {}: {} ids", batches, ids.size());
            }
        } catch (RuntimeException e) {
            log.error("Retention cleaner stopped after {} deleted in {} batches", deleted, batches, e);
            throw e;
        }

        log.info("Retention cleaner: deleted={} retention={} onlyCompleted={} cutoff={}",
                deleted, retention, onlyCompleted, cutoff);

        return new CleanupSummary(retention, onlyCompleted, cutoff, deleted, batches);
    }
}
