package taskwarden.tracker.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded in-memory log for one task run.
 *
 * Keeps the most recent entries only: once full, each new entry evicts the
 * oldest. Every entry is also written to the regular application log. The
 * collected entries or {@link #summary()} are meant to be stored in the run's
 * result or metadata when it finishes.
 */
public class TaskLogCollector {

    private static final Logger log = LoggerFactory.getLogger(TaskLogCollector.class);

    public static final int DEFAULT_MAX_ENTRIES = 1000;

    public enum Level {
        DEBUG, INFO, WARNING, ERROR
    }

    public record Entry(Level level, String message, Instant timestamp, String exception) {

        /**
         * JSON-friendly form for storing in a run payload.
         */
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("level", level.name());
            map.put("message", message);
            map.put("timestamp", timestamp.toString());
            if (exception != null) {
                map.put("exception", exception);
            }
            return map;
        }
    }

    private final int maxEntries;
    private final Clock clock;
    private final Deque<Entry> entries = new ArrayDeque<>();

    public TaskLogCollector() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public TaskLogCollector(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    public TaskLogCollector(int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public void debug(String message) {
        log.debug(message);
        add(Level.DEBUG, message, null);
    }

    public void info(String message) {
        log.info(message);
        add(Level.INFO, message, null);
    }

    public void warning(String message) {
        log.warn(message);
        add(Level.WARNING, message, null);
    }

    public void error(String message) {
        log.error(message);
        add(Level.ERROR, message, null);
    }

    public void error(String message, Throwable exception) {
        log.error(message, exception);
        add(Level.ERROR, message, String.valueOf(exception));
    }

    /**
     * @return a copy of the collected entries, oldest first
     */
    public synchronized List<Entry> logs() {
        return new ArrayList<>(entries);
    }

    public synchronized List<Entry> warningsAndErrors() {
        List<Entry> out = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.level() == Level.WARNING || entry.level() == Level.ERROR) {
                out.add(entry);
            }
        }
        return out;
    }

    /**
     * Entry counts: {@code {"total": n, "by_level": {"INFO": n, ...}}}.
     * Levels with no entries are left out.
     */
    public synchronized Map<String, Object> summary() {
        Map<Level, Integer> counts = new EnumMap<>(Level.class);
        for (Entry entry : entries) {
            counts.merge(entry.level(), 1, Integer::sum);
        }
        Map<String, Object> byLevel = new LinkedHashMap<>();
        counts.forEach((level, count) -> byLevel.put(level.name(), count));

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", entries.size());
        summary.put("by_level", byLevel);
        return summary;
    }

    public synchronized void clear() {
        entries.clear();
    }

    private synchronized void add(Level level, String message, String exception) {
        if (entries.size() >= maxEntries) {
            entries.removeFirst();
        }
        entries.addLast(new Entry(level, message, clock.instant(), exception));
    }
}
