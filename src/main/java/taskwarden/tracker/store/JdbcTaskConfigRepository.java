package taskwarden.tracker.store;

import taskwarden.tracker.error.TransientStoreException;
import taskwarden.tracker.repository.TaskConfigRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.Optional;

/**
 * JDBC implementation of TaskConfigRepository over the task_config table.
 */
public class JdbcTaskConfigRepository implements TaskConfigRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskConfigRepository.class);

    private final Database db;

    public JdbcTaskConfigRepository(Database db) {
        this.db = db;
    }

    @Override
    public void set(String key, Object value) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("Config value is required for " + key);
        }

        String updateSql = "UPDATE task_config SET config_value = ?, updated_at = ? WHERE config_key = ?";
        String insertSql = "INSERT INTO task_config (config_key, config_value, updated_at) VALUES (?, ?, ?)";

        String json = Json.write(value);
        Timestamp now = Timestamp.from(Instant.now());

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement update = conn.prepareStatement(updateSql);
                    PreparedStatement insert = conn.prepareStatement(insertSql)) {

                update.setString(1, json);
                update.setTimestamp(2, now);
                update.setString(3, key);
                if (update.executeUpdate() == 0) {
                    insert.setString(1, key);
                    insert.setString(2, json);
                    insert.setTimestamp(3, now);
                    insert.executeUpdate();
                }

                conn.commit();
                log.info("Task config {} set to {}", key, json);
            } catch (SQLException e) {
                Database.rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to set task config: " + key, e);
        }
    }

    @Override
    public Optional<Object> get(String key) {
        requireKey(key);
        String sql = "SELECT config_value FROM task_config WHERE config_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(Json.readValue(rs.getString(1)));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to read task config: " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        requireKey(key);
        String sql = "DELETE FROM task_config WHERE config_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to delete task config: " + key, e);
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Config key is required");
        }
    }
}
