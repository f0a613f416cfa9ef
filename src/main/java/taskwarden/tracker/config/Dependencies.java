package taskwarden.tracker.config;

import taskwarden.tracker.lock.DuplicateGuard;
import taskwarden.tracker.lock.JdbcLockStore;
import taskwarden.tracker.lock.LockManager;
import taskwarden.tracker.lock.LockStore;
import taskwarden.tracker.repository.TaskConfigRepository;
import taskwarden.tracker.repository.TaskExecutionRepository;
import taskwarden.tracker.scheduler.RetentionCleaner;
import taskwarden.tracker.scheduler.Scheduler;
import taskwarden.tracker.scheduler.StaleRunReaper;
import taskwarden.tracker.service.Reconciler;
import taskwarden.tracker.service.StatusSource;
import taskwarden.tracker.service.TaskTracker;
import taskwarden.tracker.store.Database;
import taskwarden.tracker.store.JdbcTaskConfigRepository;
import taskwarden.tracker.store.JdbcTaskExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires the tracker, the lock manager and the janitors.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(TrackerConfig.fromEnv(), statusSource);
 * deps.startScheduler(); // start janitors
 * TaskTracker tracker = deps.tracker();
 * // ... register and update executions ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final TrackerConfig config;
    private final Database database;
    private final TaskExecutionRepository repository;
    private final TaskConfigRepository configRepository;
    private final TaskSettings settings;
    private final LockStore lockStore;
    private final LockManager lockManager;
    private final DuplicateGuard guard;
    private final TaskTracker tracker;
    private final Reconciler reconciler;
    private final StaleRunReaper reaper;
    private final RetentionCleaner cleaner;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(TrackerConfig config, StatusSource statusSource) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Stores
        this.repository = new JdbcTaskExecutionRepository(database);
        this.configRepository = new JdbcTaskConfigRepository(database);
        this.lockStore = new JdbcLockStore(database);

        // Persisted overrides on top of the static config
        this.settings = new TaskSettings(config, configRepository);

        // Locking
        this.lockManager = new LockManager(lockStore);
        this.guard = new DuplicateGuard(lockManager, config.defaultLockTtl());

        // Services
        this.tracker = new TaskTracker(repository);
        this.reconciler = new Reconciler(tracker, repository, statusSource);

        // Janitors
        this.reaper = new StaleRunReaper(repository, reconciler, settings);
        this.cleaner = new RetentionCleaner(repository, settings);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and dispatcher status source.
     */
    public static Dependencies create(TrackerConfig config, StatusSource statusSource) {
        return new Dependencies(config, statusSource);
    }

    /**
     * Create dependencies with environment-based config and no dispatcher to reconcile against.
     */
    public static Dependencies create() {
        return create(TrackerConfig.fromEnv(), StatusSource.none());
    }

    // Getters
    public TrackerConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public TaskExecutionRepository repository() {
        return repository;
    }

    public TaskConfigRepository configRepository() {
        return configRepository;
    }

    public TaskSettings settings() {
        return settings;
    }

    public LockManager lockManager() {
        return lockManager;
    }

    public DuplicateGuard guard() {
        return guard;
    }

    public TaskTracker tracker() {
        return tracker;
    }

    public Reconciler reconciler() {
        return reconciler;
    }

    public StaleRunReaper reaper() {
        return reaper;
    }

    public RetentionCleaner cleaner() {
        return cleaner;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(guard, tracker, reconciler, reaper, cleaner, settings);
        }
        return scheduler;
    }

    /**
     * Start the background janitors.
     */
    public void startScheduler() {
        scheduler().start();
    }

    /**
     * Stop the background janitors.
     */
    public synchronized void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        try {
            stopScheduler();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
