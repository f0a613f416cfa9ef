package taskwarden.tracker.scheduler;

import taskwarden.tracker.MutableClock;
import taskwarden.tracker.config.TaskSettings;
import taskwarden.tracker.config.TrackerConfig;
import taskwarden.tracker.model.ExternalStatus;
import taskwarden.tracker.model.ReapSummary;
import taskwarden.tracker.model.TaskExecution;
import taskwarden.tracker.model.TaskStatus;
import taskwarden.tracker.model.TaskUpdate;
import taskwarden.tracker.service.Reconciler;
import taskwarden.tracker.service.StatusSource;
import taskwarden.tracker.service.TaskTracker;
import taskwarden.tracker.store.Database;
import taskwarden.tracker.store.JdbcTaskConfigRepository;
import taskwarden.tracker.store.JdbcTaskExecutionRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StaleRunReaper functionality.
 */
class StaleRunReaperTest {

    private static Database db;
    private static JdbcTaskExecutionRepository repo;
    private static JdbcTaskConfigRepository overrides;
    private static TrackerConfig config;

    private final Map<String, ExternalStatus> dispatcher = new ConcurrentHashMap<>();

    @BeforeAll
    static void setup() {
        config = TrackerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-reaper;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withTaskTimeout(Duration.ofMinutes(10));

        db = new Database(config);
        repo = new JdbcTaskExecutionRepository(db);
        overrides = new JdbcTaskConfigRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanExecutions() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM task_executions");
            st.execute("DELETE FROM task_config");
            conn.commit();
        }
        dispatcher.clear();
    }

    @Test
    void reapsStartedRunWithZeroTimeout() throws InterruptedException {
        TaskTracker tracker = new TaskTracker(repo);
        tracker.register(started("run-stuck"));

        // Let started_at fall behind the cutoff
        Thread.sleep(20);

        ReapSummary summary = reaper(tracker, StatusSource.none()).reap(Duration.ZERO, Set.of());

        assertEquals(1, summary.timedOut());

        TaskExecution reaped = repo.findById("run-stuck").orElseThrow();
        assertEquals(TaskStatus.FAILURE, reaped.status());
        assertTrue(reaped.error().toLowerCase().contains("timeout"));
        assertNotNull(reaped.finishedAt());
    }

    @Test
    void doesNotTouchCompletedRuns() throws InterruptedException {
        TaskTracker tracker = new TaskTracker(repo);
        tracker.register(started("run-done"));
        tracker.update("run-done", TaskUpdate.to(TaskStatus.SUCCESS).withResult("ok"));
        TaskExecution before = repo.findById("run-done").orElseThrow();

        Thread.sleep(20);

        ReapSummary summary = reaper(tracker, StatusSource.none()).reap(Duration.ZERO, Set.of());

        assertEquals(0, summary.timedOut());
        TaskExecution after = repo.findById("run-done").orElseThrow();
        assertEquals(TaskStatus.SUCCESS, after.status());
        assertEquals(before.finishedAt(), after.finishedAt());
        assertNull(after.error());
    }

    @Test
    void freshExternalSuccessPreventsReaping() throws InterruptedException {
        TaskTracker tracker = new TaskTracker(repo);
        tracker.register(started("run-finished-elsewhere"));
        dispatcher.put("run-finished-elsewhere", ExternalStatus.success(Map.of("rows", 1)));

        Thread.sleep(20);

        ReapSummary summary = reaper(tracker, this::lookup).reap(Duration.ZERO, Set.of());

        assertEquals(1, summary.refreshed());
        assertEquals(0, summary.timedOut());

        TaskExecution stored = repo.findById("run-finished-elsewhere").orElseThrow();
        assertEquals(TaskStatus.SUCCESS, stored.status());
        assertNull(stored.error());
    }

    @Test
    void lookupFailureStillReapsOnLocalState() throws InterruptedException {
        TaskTracker tracker = new TaskTracker(repo);
        tracker.register(started("run-unreachable"));
        StatusSource down = taskId -> {
            throw new IllegalStateException("dispatcher down");
        };

        Thread.sleep(20);

        ReapSummary summary = reaper(tracker, down).reap(Duration.ZERO, Set.of());

        assertEquals(1, summary.timedOut());
        assertEquals(TaskStatus.FAILURE, repo.findById("run-unreachable").orElseThrow().status());
    }

    @Test
    void doesNotReapRecentlyStartedRuns() {
        MutableClock clock = MutableClock.startingNow();
        TaskTracker tracker = new TaskTracker(repo, clock);
        tracker.register(started("run-recent"));

        clock.advance(Duration.ofMinutes(5));
        StaleRunReaper reaper = new StaleRunReaper(repo,
                new Reconciler(tracker, repo, StatusSource.none()), config, clock);

        assertEquals(0, reaper.reap().timedOut());
        assertEquals(TaskStatus.STARTED, repo.findById("run-recent").orElseThrow().status());

        clock.advance(Duration.ofMinutes(6));

        assertEquals(1, reaper.reap().timedOut());
        TaskExecution reaped = repo.findById("run-recent").orElseThrow();
        assertEquals(TaskStatus.FAILURE, reaped.status());
        assertTrue(reaped.error().contains("10 minutes"));
    }

    @Test
    void persistedTimeoutOverrideWinsOverStaticConfig() {
        MutableClock clock = MutableClock.startingNow();
        TaskTracker tracker = new TaskTracker(repo, clock);
        tracker.register(started("run-slow"));

        clock.advance(Duration.ofMinutes(6));
        StaleRunReaper reaper = new StaleRunReaper(repo, new Reconciler(tracker, repo, StatusSource.none()),
                new TaskSettings(config, overrides), clock);

        assertEquals(0, reaper.reap().timedOut());

        overrides.set(TaskSettings.TIMEOUT_MINUTES, 5);
        ReapSummary summary = reaper.reap();

        assertEquals(1, summary.timedOut());
        assertEquals(Duration.ofMinutes(5), summary.timeout());
        assertTrue(repo.findById("run-slow").orElseThrow().error().contains("5 minutes"));
    }

    @Test
    void pendingRunsAreNotStale() throws InterruptedException {
        TaskTracker tracker = new TaskTracker(repo);
        tracker.register("run-pending", "export", "billing");

        Thread.sleep(20);

        assertEquals(0, reaper(tracker, StatusSource.none()).reap(Duration.ZERO, Set.of()).stale());
        assertEquals(TaskStatus.PENDING, repo.findById("run-pending").orElseThrow().status());
    }

    @Test
    void excludedRunsAreSkipped() throws InterruptedException {
        TaskTracker tracker = new TaskTracker(repo);
        tracker.register(started("run-self"));
        tracker.register(started("run-other"));

        Thread.sleep(20);

        ReapSummary summary = reaper(tracker, StatusSource.none()).reap(Duration.ZERO, Set.of("run-self"));

        assertEquals(1, summary.timedOut());
        assertEquals(TaskStatus.STARTED, repo.findById("run-self").orElseThrow().status());
        assertEquals(TaskStatus.FAILURE, repo.findById("run-other").orElseThrow().status());
    }

    @Test
    void rejectsNegativeTimeout() {
        StaleRunReaper reaper = reaper(new TaskTracker(repo), StatusSource.none());
        assertThrows(IllegalArgumentException.class, () -> reaper.reap(Duration.ofMinutes(-1), Set.of()));
    }

    @Test
    void summaryMapReportsUpdatedCount() throws InterruptedException {
        TaskTracker tracker = new TaskTracker(repo);
        tracker.register(started("run-a"));
        tracker.register(started("run-b"));

        Thread.sleep(20);

        Map<String, Object> result = reaper(tracker, StatusSource.none()).reap(Duration.ZERO, Set.of()).toMap();

        assertEquals(2, result.get("updated_count"));
        assertEquals(0L, result.get("timeout_minutes"));
    }

    private Optional<ExternalStatus> lookup(String taskId) {
        return Optional.ofNullable(dispatcher.get(taskId));
    }

    private static StaleRunReaper reaper(TaskTracker tracker, StatusSource source) {
        return new StaleRunReaper(repo, new Reconciler(tracker, repo, source), config);
    }

    private static TaskExecution started(String id) {
        return TaskExecution.builder()
                .taskId(id)
                .taskName("export")
                .module("billing")
                .status(TaskStatus.STARTED)
                .build();
    }
}
