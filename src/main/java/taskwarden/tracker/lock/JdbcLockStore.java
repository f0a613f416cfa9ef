package taskwarden.tracker.lock;

import taskwarden.tracker.error.TransientStoreException;
import taskwarden.tracker.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Lock store backed by the task_locks table.
 * The primary key on lock_key is what makes set-if-absent atomic: of several
 * concurrent inserts for one key, exactly one commits.
 */
public class JdbcLockStore implements LockStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcLockStore.class);

    private final Database db;
    private final Clock clock;

    public JdbcLockStore(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcLockStore(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public Optional<Instant> setIfAbsent(String key, String value, Duration ttl) {
        String evictSql = "DELETE FROM task_locks WHERE lock_key = ? AND expires_at <= ?";
        String insertSql = "INSERT INTO task_locks (lock_key, owner_token, expires_at) VALUES (?, ?, ?)";

        Instant now = clock.instant();
        // column precision is microseconds; the returned expiry must match the row
        Instant expiresAt = now.plus(ttl).truncatedTo(ChronoUnit.MICROS);

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement evict = conn.prepareStatement(evictSql);
                    PreparedStatement insert = conn.prepareStatement(insertSql)) {

                evict.setString(1, key);
                evict.setTimestamp(2, Timestamp.from(now));
                int evicted = evict.executeUpdate();
                if (evicted > 0) {
                    log.debug("Evicted expired lock {}", key);
                }

                insert.setString(1, key);
                insert.setString(2, value);
                insert.setTimestamp(3, Timestamp.from(expiresAt));
                insert.executeUpdate();

                conn.commit();
                return Optional.of(expiresAt);
            } catch (SQLException e) {
                Database.rollback(conn, e);
                if (isConstraintViolation(e)) {
                    return Optional.empty();
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to acquire lock: " + key, e);
        }
    }

    @Override
    public boolean compareAndDelete(String key, String expectedValue) {
        String sql = "DELETE FROM task_locks WHERE lock_key = ? AND owner_token = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            ps.setString(2, expectedValue);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to release lock: " + key, e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        String sql = "SELECT owner_token FROM task_locks WHERE lock_key = ? AND expires_at > ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            ps.setTimestamp(2, Timestamp.from(clock.instant()));
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getString(1));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to read lock: " + key, e);
        }
    }

    private static boolean isConstraintViolation(SQLException e) {
        return e instanceof SQLIntegrityConstraintViolationException
                || (e.getSQLState() != null && e.getSQLState().startsWith("23"));
    }
}
