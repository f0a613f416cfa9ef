package taskwarden.tracker.service;

import taskwarden.tracker.MutableClock;
import taskwarden.tracker.error.TaskAlreadyExistsException;
import taskwarden.tracker.error.TaskNotFoundException;
import taskwarden.tracker.model.TaskExecution;
import taskwarden.tracker.model.TaskQuery;
import taskwarden.tracker.model.TaskStats;
import taskwarden.tracker.model.TaskStatus;
import taskwarden.tracker.model.TaskUpdate;
import taskwarden.tracker.store.Database;
import taskwarden.tracker.store.JdbcTaskExecutionRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for registration, merge-updates and reads.
 */
class TaskTrackerTest {

    private static Database db;
    private static JdbcTaskExecutionRepository repo;

    private MutableClock clock;
    private TaskTracker tracker;

    @BeforeAll
    static void setupDb() {
        db = new Database("jdbc:h2:mem:test-tracker;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE",
                5);
        repo = new JdbcTaskExecutionRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setup() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM task_executions");
            conn.commit();
        }
        clock = new MutableClock(Instant.now().truncatedTo(ChronoUnit.MILLIS));
        tracker = new TaskTracker(repo, clock);
    }

    @Test
    void registerCreatesPendingRecord() {
        TaskExecution registered = tracker.register("run-1", "send_report", "reports");

        assertEquals(TaskStatus.PENDING, registered.status());
        assertEquals(clock.instant(), registered.createdAt());

        TaskExecution stored = tracker.get("run-1").orElseThrow();
        assertEquals("send_report", stored.taskName());
        assertEquals("reports", stored.module());
        assertNull(stored.startedAt());
        assertNull(stored.finishedAt());
    }

    @Test
    void registerStartedDraftStampsStartedAt() {
        TaskExecution registered = tracker.register(TaskExecution.builder()
                .taskId("run-2")
                .taskName("sync")
                .module("crm")
                .status(TaskStatus.STARTED)
                .taskArgs(List.of(42))
                .createdBy("alice")
                .build());

        assertEquals(clock.instant(), registered.startedAt());
        TaskExecution stored = tracker.get("run-2").orElseThrow();
        assertEquals(TaskStatus.STARTED, stored.status());
        assertEquals(List.of(42), stored.taskArgs());
        assertEquals("alice", stored.createdBy());
    }

    @Test
    void duplicateRegisterFailsAndKeepsOriginal() {
        tracker.register("run-3", "send_report", "reports");
        tracker.update("run-3", TaskUpdate.to(TaskStatus.STARTED));

        assertThrows(TaskAlreadyExistsException.class,
                () -> tracker.register("run-3", "other_name", "other_module"));

        TaskExecution stored = tracker.get("run-3").orElseThrow();
        assertEquals("send_report", stored.taskName());
        assertEquals(TaskStatus.STARTED, stored.status());
    }

    @Test
    void registerValidatesArguments() {
        assertThrows(IllegalArgumentException.class, () -> tracker.register("", "n", "m"));
        assertThrows(IllegalArgumentException.class, () -> tracker.register("id", null, "m"));
        assertThrows(IllegalArgumentException.class, () -> tracker.register("id", "n", " "));
    }

    @Test
    void lifecycleTimestampsAreSetOnce() {
        tracker.register("run-4", "export", "billing");

        clock.advance(Duration.ofSeconds(5));
        Instant startedAt = clock.instant();
        tracker.update("run-4", TaskUpdate.to(TaskStatus.STARTED));

        clock.advance(Duration.ofSeconds(5));
        tracker.update("run-4", TaskUpdate.to(TaskStatus.STARTED));

        clock.advance(Duration.ofSeconds(5));
        Instant finishedAt = clock.instant();
        tracker.update("run-4", TaskUpdate.to(TaskStatus.SUCCESS).withResult(Map.of("rows", 3)));

        clock.advance(Duration.ofSeconds(5));
        tracker.update("run-4", TaskUpdate.to(TaskStatus.SUCCESS));

        TaskExecution stored = tracker.get("run-4").orElseThrow();
        assertEquals(TaskStatus.SUCCESS, stored.status());
        assertEquals(startedAt, stored.startedAt());
        assertEquals(finishedAt, stored.finishedAt());
        assertEquals(Map.of("rows", 3), stored.result());
    }

    @Test
    void updateIsIdempotent() {
        tracker.register("run-5", "export", "billing");
        TaskUpdate update = TaskUpdate.to(TaskStatus.FAILURE)
                .withError("boom")
                .withTraceback("trace")
                .withMetadata(Map.of("host", "w1"));

        TaskExecution once = tracker.update("run-5", update);
        clock.advance(Duration.ofMinutes(1));
        TaskExecution twice = tracker.update("run-5", update);

        assertEquals(once.status(), twice.status());
        assertEquals(once.finishedAt(), twice.finishedAt());
        assertEquals(once.error(), twice.error());
        assertEquals(once.traceback(), twice.traceback());
        assertEquals(once.metadata(), twice.metadata());
    }

    @Test
    void metadataIsMergedPerKey() {
        tracker.register("run-6", "export", "billing");

        tracker.update("run-6", TaskUpdate.to(TaskStatus.STARTED).withMetadata(Map.of("a", 1)));
        tracker.update("run-6", TaskUpdate.to(TaskStatus.STARTED).withMetadata(Map.of("b", 2)));
        tracker.update("run-6", TaskUpdate.to(TaskStatus.STARTED).withMetadata(Map.of("a", 1)));

        assertEquals(Map.of("a", 1, "b", 2), tracker.get("run-6").orElseThrow().metadata());
    }

    @Test
    void concurrentMetadataUpdatesAreAllKept() throws Exception {
        tracker.register("run-m1", "export", "billing");
        int updaters = 40;

        ExecutorService pool = Executors.newFixedThreadPool(updaters);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<TaskExecution>> updates = new ArrayList<>();
            for (int i = 0; i < updaters; i++) {
                String key = "k" + i;
                int value = i;
                updates.add(pool.submit(() -> {
                    start.await();
                    return tracker.update("run-m1",
                            TaskUpdate.to(TaskStatus.STARTED).withMetadata(Map.of(key, value)));
                }));
            }
            start.countDown();

            for (Future<TaskExecution> update : updates) {
                assertEquals(TaskStatus.STARTED, update.get(30, TimeUnit.SECONDS).status());
            }
        } finally {
            pool.shutdownNow();
        }

        Map<String, Object> metadata = tracker.get("run-m1").orElseThrow().metadata();
        assertEquals(updaters, metadata.size());
        for (int i = 0; i < updaters; i++) {
            assertEquals(i, metadata.get("k" + i));
        }
    }

    @Test
    void absentPayloadFieldsAreKept() {
        tracker.register("run-7", "export", "billing");
        tracker.update("run-7", TaskUpdate.to(TaskStatus.RETRY).withError("first attempt failed"));
        tracker.update("run-7", TaskUpdate.to(TaskStatus.STARTED));

        assertEquals("first attempt failed", tracker.get("run-7").orElseThrow().error());
    }

    @Test
    void terminalStatusIsStickyWithoutOverride() {
        tracker.register("run-8", "export", "billing");
        tracker.update("run-8", TaskUpdate.to(TaskStatus.SUCCESS));

        TaskExecution after = tracker.update("run-8",
                TaskUpdate.to(TaskStatus.STARTED).withMetadata(Map.of("late", true)));

        assertEquals(TaskStatus.SUCCESS, after.status());
        assertNotNull(after.finishedAt());
        // metadata still merges
        assertEquals(true, after.metadata().get("late"));
    }

    @Test
    void overrideReopensTerminalRecord() {
        tracker.register("run-9", "export", "billing");
        tracker.update("run-9", TaskUpdate.to(TaskStatus.FAILURE).withError("boom"));

        TaskExecution reopened = tracker.update("run-9", TaskUpdate.to(TaskStatus.RETRY).overriding());

        assertEquals(TaskStatus.RETRY, reopened.status());
        assertNull(reopened.finishedAt());

        TaskExecution finished = tracker.update("run-9", TaskUpdate.to(TaskStatus.SUCCESS));
        assertEquals(TaskStatus.SUCCESS, finished.status());
        assertEquals(clock.instant(), finished.finishedAt());
    }

    @Test
    void updateOfUnknownIdFails() {
        TaskNotFoundException e = assertThrows(TaskNotFoundException.class,
                () -> tracker.update("ghost", TaskUpdate.to(TaskStatus.SUCCESS)));
        assertEquals("ghost", e.taskId());
        assertTrue(tracker.get("ghost").isEmpty());
    }

    @Test
    void listFiltersByStatus() {
        tracker.register("a", "export", "billing");
        tracker.register("b", "export", "billing");
        tracker.update("b", TaskUpdate.to(TaskStatus.SUCCESS));

        List<TaskExecution> done = tracker.list(TaskQuery.all().withStatus(TaskStatus.SUCCESS), 10);

        assertEquals(1, done.size());
        assertEquals("b", done.get(0).taskId());
    }

    @Test
    void statsGroupByModuleAndTaskName() {
        tracker.register("1", "export", "billing");
        tracker.register("2", "export", "billing");
        tracker.register("3", "invoice", "billing");
        tracker.register("4", "sync", "crm");
        tracker.update("1", TaskUpdate.to(TaskStatus.SUCCESS));
        tracker.update("2", TaskUpdate.to(TaskStatus.FAILURE));
        tracker.update("4", TaskUpdate.to(TaskStatus.STARTED));

        TaskStats stats = tracker.stats(TaskQuery.all());

        assertEquals(4, stats.summary().total());
        assertEquals(1, stats.summary().count(TaskStatus.SUCCESS));
        assertEquals(1, stats.summary().count(TaskStatus.FAILURE));
        assertEquals(1, stats.summary().count(TaskStatus.PENDING));
        assertEquals(0, stats.summary().count(TaskStatus.REVOKED));

        assertEquals(3, stats.byModule().get("billing").total());
        assertEquals(1, stats.byModule().get("crm").count(TaskStatus.STARTED));
        assertEquals(2, stats.byTaskName().get("export").total());
        assertEquals(List.of("billing", "crm"), List.copyOf(stats.byModule().keySet()));

        TaskStats crmOnly = tracker.stats(TaskQuery.all().withModule("crm"));
        assertEquals(1, crmOnly.summary().total());
    }

    @Test
    void mergeLeavesNestedMetadataWhole() {
        TaskExecution current = TaskExecution.builder()
                .taskId("x")
                .taskName("n")
                .module("m")
                .metadata(Map.of("progress", Map.of("done", 1, "total", 10)))
                .build();

        TaskExecution merged = TaskTracker.merge(current,
                TaskUpdate.to(TaskStatus.STARTED).withMetadata(Map.of("progress", Map.of("done", 2))),
                clock.instant());

        assertEquals(Map.of("done", 2), merged.metadata().get("progress"));
    }
}
