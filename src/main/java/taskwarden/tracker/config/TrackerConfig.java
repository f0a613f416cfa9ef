package taskwarden.tracker.config;

import java.time.Duration;

/**
 * Configuration holder for the execution tracker.
 * All settings have sensible defaults; {@link #fromEnv()} overrides them from
 * TASKWARDEN_* environment variables.
 */
public final class TrackerConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/taskwarden;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Lock settings
    private Duration defaultLockTtl = Duration.ofHours(1);

    // Stale-run reaper
    private boolean reaperEnabled = true;
    private Duration taskTimeout = Duration.ofMinutes(10);
    private Duration reaperInterval = Duration.ofMinutes(30);
    private Duration reaperLockTtl = Duration.ofHours(1);
    private int reconcileMaxSync = 0;

    // Retention cleaner
    private boolean cleanupEnabled = true;
    private Duration retention = Duration.ofDays(180);
    private boolean cleanupOnlyCompleted = true;
    private int cleanupBatchSize = 5000;
    private Duration cleanupInterval = Duration.ofHours(24);
    private Duration cleanupLockTtl = Duration.ofHours(24);

    private TrackerConfig() {
    }

    public static TrackerConfig defaults() {
        return new TrackerConfig();
    }

    public static TrackerConfig fromEnv() {
        TrackerConfig config = new TrackerConfig();

        String dbUrl = env("TASKWARDEN_DB_URL");
        if (dbUrl != null) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = env("TASKWARDEN_DB_POOL_SIZE");
        if (poolSize != null) {
            config.databasePoolSize = Integer.parseInt(poolSize);
        }

        String lockTtl = env("TASKWARDEN_LOCK_TTL_SECONDS");
        if (lockTtl != null) {
            config.defaultLockTtl = Duration.ofSeconds(Long.parseLong(lockTtl));
        }

        String reaperEnabled = env("TASKWARDEN_REAPER_ENABLED");
        if (reaperEnabled != null) {
            config.reaperEnabled = Boolean.parseBoolean(reaperEnabled);
        }

        String timeoutMinutes = env("TASKWARDEN_TASK_TIMEOUT_MINUTES");
        if (timeoutMinutes != null) {
            config.taskTimeout = Duration.ofMinutes(Long.parseLong(timeoutMinutes));
        }

        String reaperInterval = env("TASKWARDEN_REAPER_INTERVAL_SECONDS");
        if (reaperInterval != null) {
            config.reaperInterval = Duration.ofSeconds(Long.parseLong(reaperInterval));
        }

        String maxSync = env("TASKWARDEN_RECONCILE_MAX_SYNC");
        if (maxSync != null) {
            config.reconcileMaxSync = Integer.parseInt(maxSync);
        }

        String cleanupEnabled = env("TASKWARDEN_CLEANUP_ENABLED");
        if (cleanupEnabled != null) {
            config.cleanupEnabled = Boolean.parseBoolean(cleanupEnabled);
        }

        String retentionDays = env("TASKWARDEN_RETENTION_DAYS");
        if (retentionDays != null) {
            config.retention = Duration.ofDays(Long.parseLong(retentionDays));
        }

        String onlyCompleted = env("TASKWARDEN_CLEANUP_ONLY_COMPLETED");
        if (onlyCompleted != null) {
            config.cleanupOnlyCompleted = Boolean.parseBoolean(onlyCompleted);
        }

        String batchSize = env("TASKWARDEN_CLEANUP_BATCH_SIZE");
        if (batchSize != null) {
            config.cleanupBatchSize = Integer.parseInt(batchSize);
        }

        String cleanupHours = env("TASKWARDEN_CLEANUP_INTERVAL_HOURS");
        if (cleanupHours != null) {
            config.cleanupInterval = Duration.ofHours(Long.parseLong(cleanupHours));
        }

        return config.validate();
    }

    private static String env(String name) {
        String value = System.getenv(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * Reject settings the janitors cannot run with.
     *
     * @throws IllegalArgumentException on the first invalid setting
     */
    public TrackerConfig validate() {
        requirePositive("defaultLockTtl", defaultLockTtl);
        requirePositive("reaperLockTtl", reaperLockTtl);
        requirePositive("cleanupLockTtl", cleanupLockTtl);
        requirePositive("reaperInterval", reaperInterval);
        requirePositive("cleanupInterval", cleanupInterval);
        if (taskTimeout.isNegative()) {
            throw new IllegalArgumentException("taskTimeout must not be negative: " + taskTimeout);
        }
        if (retention.isNegative()) {
            throw new IllegalArgumentException("retention must not be negative: " + retention);
        }
        if (cleanupBatchSize <= 0) {
            throw new IllegalArgumentException("cleanupBatchSize must be positive: " + cleanupBatchSize);
        }
        if (reconcileMaxSync < 0) {
            throw new IllegalArgumentException("reconcileMaxSync must not be negative: " + reconcileMaxSync);
        }
        if (databasePoolSize <= 0) {
            throw new IllegalArgumentException("databasePoolSize must be positive: " + databasePoolSize);
        }
        return this;
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration defaultLockTtl() {
        return defaultLockTtl;
    }

    public boolean reaperEnabled() {
        return reaperEnabled;
    }

    public Duration taskTimeout() {
        return taskTimeout;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public Duration reaperLockTtl() {
        return reaperLockTtl;
    }

    /** Cap on records reconciled before a reaper pass; 0 means no cap. */
    public int reconcileMaxSync() {
        return reconcileMaxSync;
    }

    public boolean cleanupEnabled() {
        return cleanupEnabled;
    }

    public Duration retention() {
        return retention;
    }

    public boolean cleanupOnlyCompleted() {
        return cleanupOnlyCompleted;
    }

    public int cleanupBatchSize() {
        return cleanupBatchSize;
    }

    public Duration cleanupInterval() {
        return cleanupInterval;
    }

    public Duration cleanupLockTtl() {
        return cleanupLockTtl;
    }

    // Fluent setters for testing/customization
    public TrackerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public TrackerConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public TrackerConfig withDefaultLockTtl(Duration ttl) {
        this.defaultLockTtl = ttl;
        return this;
    }

    public TrackerConfig withReaperEnabled(boolean enabled) {
        this.reaperEnabled = enabled;
        return this;
    }

    public TrackerConfig withTaskTimeout(Duration timeout) {
        this.taskTimeout = timeout;
        return this;
    }

    public TrackerConfig withReaperInterval(Duration interval) {
        this.reaperInterval = interval;
        return this;
    }

    public TrackerConfig withReconcileMaxSync(int maxSync) {
        this.reconcileMaxSync = maxSync;
        return this;
    }

    public TrackerConfig withCleanupEnabled(boolean enabled) {
        this.cleanupEnabled = enabled;
        return this;
    }

    public TrackerConfig withRetention(Duration retention) {
        this.retention = retention;
        return this;
    }

    public TrackerConfig withCleanupOnlyCompleted(boolean onlyCompleted) {
        this.cleanupOnlyCompleted = onlyCompleted;
        return this;
    }

    public TrackerConfig withCleanupBatchSize(int batchSize) {
        this.cleanupBatchSize = batchSize;
        return this;
    }

    public TrackerConfig withCleanupInterval(Duration interval) {
        this.cleanupInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "TrackerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", reaperEnabled=" + reaperEnabled +
                ", taskTimeout=" + taskTimeout +
                ", reaperInterval=" + reaperInterval +
                ", cleanupEnabled=" + cleanupEnabled +
                ", retention=" + retention +
                ", onlyCompleted=" + cleanupOnlyCompleted +
                ", batchSize=" + cleanupBatchSize +
                '}';
    }
}
