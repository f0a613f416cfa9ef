package taskwarden.tracker.scheduler;

import taskwarden.tracker.config.TaskSettings;
import taskwarden.tracker.config.TrackerConfig;
import taskwarden.tracker.model.ReapSummary;
import taskwarden.tracker.model.TaskExecution;
import taskwarden.tracker.repository.TaskExecutionRepository;
import taskwarden.tracker.service.Reconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fails runs stuck in a non-terminal status past the timeout.
 *
 * Runs get stuck if:
 * - A worker crashes before reporting
 * - The dispatcher never reports "finished"
 * - The status report is lost on the way
 *
 * For each run whose started_at is older than the cutoff the reaper:
 * 1. Asks the dispatcher for a fresh status, since only the local copy may be stale
 * 2. If the run is still non-terminal, marks it FAILURE with a timeout error
 */
public class StaleRunReaper {

    private static final Logger log = LoggerFactory.getLogger(StaleRunReaper.class);

    static final int BATCH_SIZE = 1000;

    private final TaskExecutionRepository repository;
    private final Reconciler reconciler;
    private final TaskSettings settings;
    private final Clock clock;

    public StaleRunReaper(TaskExecutionRepository repository, Reconciler reconciler, TrackerConfig config) {
        this(repository, reconciler, TaskSettings.fixed(config), Clock.systemUTC());
    }

    public StaleRunReaper(TaskExecutionRepository repository, Reconciler reconciler, TrackerConfig config,
            Clock clock) {
        this(repository, reconciler, TaskSettings.fixed(config), clock);
    }

    public StaleRunReaper(TaskExecutionRepository repository, Reconciler reconciler, TaskSettings settings) {
        this(repository, reconciler, settings, Clock.systemUTC());
    }

    public StaleRunReaper(TaskExecutionRepository repository, Reconciler reconciler, TaskSettings settings,
            Clock clock) {
        this.repository = repository;
        this.reconciler = reconciler;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Reap with the current timeout: the persisted override if one is set,
     * otherwise the static config.
     */
    public ReapSummary reap() {
        return reap(settings.taskTimeout(), Set.of());
    }

    /**
     * Find and fail stale runs.
     *
     * @param timeout runs started longer ago than this are candidates; zero means any started run
     * @param exclude task ids never reaped in this pass
     * @return counts for this pass
     */
    public ReapSummary reap(Duration timeout, Set<String> exclude) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }

        Instant now = clock.instant();
        Instant cutoff = now.minus(timeout);
        String error = "Task timeout (exceeded " + describe(timeout) + ", started before " + cutoff + ")";

        List<TaskExecution> stale = repository.findStale(cutoff, BATCH_SIZE);

        if (stale.isEmpty()) {
            log.debug("No stale task executions found");
            return new ReapSummary(timeout, cutoff, 0, 0, 0, 0);
        }

        int refreshed = 0;
        int timedOut = 0;
        int failed = 0;
        int candidates = 0;

        for (TaskExecution execution : stale) {
            String taskId = execution.taskId();
            if (exclude.contains(taskId)) {
                continue;
            }
            candidates++;
            try {
                try {
                    reconciler.sync(taskId);
                } catch (RuntimeException e) {
                    log.warn("Fresh status check failed for task execution {}, reaping on local state: {}",
                            taskId, e.getMessage());
                }

                Optional<TaskExecution> current = repository.findById(taskId);
                if (current.isEmpty() || current.get().isTerminal()) {
                    refreshed++;
                    log.info("Task execution {} finished after status refresh, not reaped", taskId);
                    continue;
                }

                if (repository.markTimedOut(taskId, error, clock.instant())) {
                    timedOut++;
                    log.warn("Task execution {} ({}) timed out, started at {}",
                            taskId, execution.taskName(), execution.startedAt());
                } else {
                    refreshed++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to reap task execution {}", taskId, e);
            }
        }

        log.info("Stale-run reaper: {} timed out, {} refreshed, {} failed, {} stale",
                timedOut, refreshed, failed, candidates);

        return new ReapSummary(timeout, cutoff, candidates, refreshed, timedOut, failed);
    }

    private static String describe(Duration timeout) {
        if (timeout.toSeconds() % 60 == 0) {
            return timeout.toMinutes() + " minutes";
        }
        return timeout.toMillis() + " ms";
    }
}
