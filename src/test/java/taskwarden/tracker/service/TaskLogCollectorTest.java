package taskwarden.tracker.service;

import taskwarden.tracker.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the per-run log collector.
 */
class TaskLogCollectorTest {

    @Test
    void collectsEntriesInOrder() {
        MutableClock clock = MutableClock.startingNow();
        TaskLogCollector logs = new TaskLogCollector(10, clock);

        logs.info("fetched 12 rows");
        clock.advance(Duration.ofSeconds(1));
        logs.debug("batch 1 done");

        List<TaskLogCollector.Entry> entries = logs.logs();
        assertEquals(2, entries.size());
        assertEquals(TaskLogCollector.Level.INFO, entries.get(0).level());
        assertEquals("fetched 12 rows", entries.get(0).message());
        assertEquals(clock.instant().minusSeconds(1), entries.get(0).timestamp());
        assertEquals(TaskLogCollector.Level.DEBUG, entries.get(1).level());
    }

    @Test
    void dropsOldestEntriesWhenFull() {
        TaskLogCollector logs = new TaskLogCollector(3);

        for (int i = 1; i <= 5; i++) {
            logs.info("step " + i);
        }

        List<TaskLogCollector.Entry> entries = logs.logs();
        assertEquals(3, entries.size());
        assertEquals("step 3", entries.get(0).message());
        assertEquals("step 5", entries.get(2).message());
    }

    @Test
    void filtersWarningsAndErrors() {
        TaskLogCollector logs = new TaskLogCollector();

        logs.info("start");
        logs.warning("slow upstream");
        logs.error("upload failed", new IllegalStateException("bucket missing"));
        logs.debug("cleanup");

        List<TaskLogCollector.Entry> problems = logs.warningsAndErrors();
        assertEquals(2, problems.size());
        assertEquals("slow upstream", problems.get(0).message());
        assertNull(problems.get(0).exception());
        assertTrue(problems.get(1).exception().contains("bucket missing"));
    }

    @Test
    void summaryCountsByLevel() {
        TaskLogCollector logs = new TaskLogCollector();
        logs.info("a");
        logs.info("b");
        logs.error("c");

        Map<String, Object> summary = logs.summary();

        assertEquals(3, summary.get("total"));
        assertEquals(Map.of("INFO", 2, "ERROR", 1), summary.get("by_level"));
    }

    @Test
    void entryMapIsPayloadFriendly() {
        TaskLogCollector logs = new TaskLogCollector();
        logs.error("upload failed", new IllegalStateException("bucket missing"));

        Map<String, Object> map = logs.logs().get(0).toMap();

        assertEquals("ERROR", map.get("level"));
        assertEquals("upload failed", map.get("message"));
        assertTrue(map.containsKey("timestamp"));
        assertEquals("java.lang.IllegalStateException: bucket missing", map.get("exception"));
    }

    @Test
    void clearEmptiesTheBuffer() {
        TaskLogCollector logs = new TaskLogCollector();
        logs.warning("x");

        logs.clear();

        assertTrue(logs.logs().isEmpty());
        assertEquals(0, logs.summary().get("total"));
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new TaskLogCollector(0));
    }
}
