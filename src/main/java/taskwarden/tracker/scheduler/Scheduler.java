package taskwarden.tracker.scheduler;

import taskwarden.tracker.config.TaskSettings;
import taskwarden.tracker.config.TrackerConfig;
import taskwarden.tracker.error.TaskNotFoundException;
import taskwarden.tracker.lock.DuplicateGuard;
import taskwarden.tracker.lock.LockKeys;
import taskwarden.tracker.model.GuardedResult;
import taskwarden.tracker.model.ReapSummary;
import taskwarden.tracker.model.ReconcileSummary;
import taskwarden.tracker.model.TaskExecution;
import taskwarden.tracker.model.TaskStatus;
import taskwarden.tracker.model.TaskUpdate;
import taskwarden.tracker.service.Reconciler;
import taskwarden.tracker.service.TaskTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Coordinates the janitor jobs:
 * - Stale-run reaper: reconciles unfinished runs, then fails the ones past the timeout
 * - Retention cleaner: deletes records past the retention age
 *
 * Each tick runs under the duplicate guard with its own lock, so it never
 * overlaps a previous tick of the same job, even one in another process.
 * Each tick also records itself as an execution (module "taskwarden").
 *
 * A stopped scheduler can be started again; each start gets a fresh executor.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    public static final String MODULE = "taskwarden";
    public static final String TASK_MARK_TIMEOUT = "mark_timed_out_task_executions";
    public static final String TASK_CLEANUP = "cleanup_old_task_executions";

    private final DuplicateGuard guard;
    private final TaskTracker tracker;
    private final Reconciler reconciler;
    private final StaleRunReaper reaper;
    private final RetentionCleaner cleaner;
    private final TaskSettings settings;
    private final TrackerConfig config;
    private final AtomicInteger threadNo = new AtomicInteger();

    private ScheduledExecutorService executor;
    private volatile boolean running = false;

    public Scheduler(DuplicateGuard guard, TaskTracker tracker, Reconciler reconciler, StaleRunReaper reaper,
            RetentionCleaner cleaner, TaskSettings settings) {
        this.guard = guard;
        this.tracker = tracker;
        this.reconciler = reconciler;
        this.reaper = reaper;
        this.cleaner = cleaner;
        this.settings = settings;
        this.config = settings.config();
    }

    /**
     * Start the scheduler. Disabled jobs are not scheduled.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        executor = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "taskwarden-scheduler-" + threadNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        running = true;

        if (config.reaperEnabled()) {
            long reaperIntervalMs = config.reaperInterval().toMillis();
            executor.scheduleAtFixedRate(
                    wrapRunnable("stale-run-reaper", this::runReaperTick),
                    reaperIntervalMs, // initial delay
                    reaperIntervalMs, // interval
                    TimeUnit.MILLISECONDS);
            log.info("Stale-run reaper scheduled every {}ms", reaperIntervalMs);
        }

        if (config.cleanupEnabled()) {
            long cleanupIntervalMs = config.cleanupInterval().toMillis();
            executor.scheduleAtFixedRate(
                    wrapRunnable("retention-cleaner", this::runCleanupTick),
                    cleanupIntervalMs,
                    cleanupIntervalMs,
                    TimeUnit.MILLISECONDS);
            log.info("Retention cleaner scheduled every {}ms", cleanupIntervalMs);
        }

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        ScheduledExecutorService executor = this.executor;
        this.executor = null;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * One reaper tick: reconcile unfinished runs, then reap stale ones.
     * Also usable as a manual trigger.
     *
     * @return the tick's result map, or a skipped result if another tick holds the lock
     */
    public GuardedResult<Map<String, Object>> runReaperTick() throws Exception {
        Duration timeout = settings.taskTimeout();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("timeout_minutes", timeout.toMinutes());

        return guard.call(LockKeys.of(TASK_MARK_TIMEOUT), config.reaperLockTtl(),
                () -> recorded(TASK_MARK_TIMEOUT, params, runId -> {
                    if (!config.reaperEnabled()) {
                        return skippedPayload("mark_timeout_disabled");
                    }
                    ReconcileSummary sync = reconciler.syncAllUnfinished(config.reconcileMaxSync());
                    ReapSummary reap = reaper.reap(timeout, Set.of(runId));

                    Map<String, Object> out = new LinkedHashMap<>(reap.toMap());
                    out.putAll(sync.toMap());
                    return out;
                }));
    }

    /**
     * One cleaner tick. Also usable as a manual trigger.
     *
     * @return the tick's result map, or a skipped result if another tick holds the lock
     */
    public GuardedResult<Map<String, Object>> runCleanupTick() throws Exception {
        Duration retention = settings.retention();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("retention_days", retention.toDays());
        params.put("only_completed", settings.cleanupOnlyCompleted());

        return guard.call(LockKeys.of(TASK_CLEANUP), config.cleanupLockTtl(),
                () -> recorded(TASK_CLEANUP, params, runId -> {
                    if (!config.cleanupEnabled()) {
                        return skippedPayload("cleanup_disabled");
                    }
                    return cleaner.clean(retention, settings.cleanupOnlyCompleted(), settings.cleanupBatchSize())
                            .toMap();
                }));
    }

    /**
     * Run a janitor body while recording the run itself: STARTED on entry, then
     * SUCCESS with the body's result or FAILURE with the error and stack trace.
     */
    private Map<String, Object> recorded(String taskName, Map<String, Object> params,
            Function<String, Map<String, Object>> body) {
        String runId = taskName + "-" + UUID.randomUUID();
        tracker.register(TaskExecution.builder()
                .taskId(runId)
                .taskName(taskName)
                .module(MODULE)
                .status(TaskStatus.STARTED)
                .metadata(params)
                .build());

        log.info("Starting {}", taskName);
        try {
            Map<String, Object> out = body.apply(runId);
            finish(runId, TaskUpdate.to(TaskStatus.SUCCESS).withResult(out));
            log.info("Finished {} {}", taskName, out);
            return out;
        } catch (RuntimeException e) {
            log.error("Failed {}", taskName, e);
            try {
                finish(runId, TaskUpdate.to(TaskStatus.FAILURE)
                        .withError(String.valueOf(e.getMessage()))
                        .withTraceback(stackTrace(e)));
            } catch (RuntimeException recordFailure) {
                e.addSuppressed(recordFailure);
            }
            throw e;
        }
    }

    private void finish(String runId, TaskUpdate update) {
        try {
            tracker.update(runId, update);
        } catch (TaskNotFoundException e) {
            // a cleaner pass with onlyCompleted off may delete its own run record
            log.warn("Run record {} was removed before it finished", runId);
        }
    }

    private static Map<String, Object> skippedPayload(String reason) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("skipped", true);
        out.put("reason", reason);
        return out;
    }

    private static String stackTrace(Throwable e) {
        StringWriter sw = new StringWriter();
        e.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    /**
     * Wrap a tick with error handling so a failed tick does not cancel the schedule.
     */
    private Runnable wrapRunnable(String name, Tick tick) {
        return () -> {
            try {
                GuardedResult<Map<String, Object>> result = tick.run();
                if (result.skipped()) {
                    log.info("{} skipped: {}", name, result.reason());
                }
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }

    @FunctionalInterface
    private interface Tick {
        GuardedResult<Map<String, Object>> run() throws Exception;
    }
}
