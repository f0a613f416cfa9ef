package taskwarden.tracker.store;

import taskwarden.tracker.error.TaskAlreadyExistsException;
import taskwarden.tracker.error.TransientStoreException;
import taskwarden.tracker.model.TaskExecution;
import taskwarden.tracker.model.TaskQuery;
import taskwarden.tracker.model.TaskStatus;
import taskwarden.tracker.repository.TaskExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * JDBC implementation of TaskExecutionRepository.
 * Merge-updates lock the row with SELECT ... FOR UPDATE inside one transaction.
 */
public class JdbcTaskExecutionRepository implements TaskExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskExecutionRepository.class);

    private static final String NON_TERMINAL_IN = inClause(TaskStatus.nonTerminal().size());
    private static final String TERMINAL_IN = inClause(TaskStatus.terminal().size());

    private final Database db;

    public JdbcTaskExecutionRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(TaskExecution execution) {
        String sql = """
                    INSERT INTO task_executions (task_id, task_name, module, status, created_at, started_at,
                                                 finished_at, task_args, task_kwargs, result, error, traceback,
                                                 created_by, metadata)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, execution.taskId());
                ps.setString(2, execution.taskName());
                ps.setString(3, execution.module());
                ps.setString(4, execution.status().name());
                setTimestamp(ps, 5, execution.createdAt() != null ? execution.createdAt() : Instant.now());
                setTimestamp(ps, 6, execution.startedAt());
                setTimestamp(ps, 7, execution.finishedAt());
                ps.setString(8, Json.write(execution.taskArgs()));
                ps.setString(9, Json.write(execution.taskKwargs()));
                ps.setString(10, Json.write(execution.result()));
                ps.setString(11, execution.error());
                ps.setString(12, execution.traceback());
                ps.setString(13, execution.createdBy());
                ps.setString(14, Json.write(execution.metadata()));

                ps.executeUpdate();
                conn.commit();
            } catch (SQLException e) {
                Database.rollback(conn, e);
                if (isConstraintViolation(e)) {
                    throw new TaskAlreadyExistsException(execution.taskId(), e);
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to save task execution: " + execution.taskId(), e);
        }
    }

    @Override
    public Optional<TaskExecution> findById(String taskId) {
        String sql = "SELECT * FROM task_executions WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to find task execution: " + taskId, e);
        }
    }

    @Override
    public Optional<TaskExecution> update(String taskId, UnaryOperator<TaskExecution> change) {
        String selectSql = "SELECT * FROM task_executions WHERE task_id = ? FOR UPDATE";

        String updateSql = """
                    UPDATE task_executions
                    SET status = ?, started_at = ?, finished_at = ?, result = ?, error = ?, traceback = ?,
                        metadata = ?
                    WHERE task_id = ?
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement updatePs = conn.prepareStatement(updateSql)) {

                selectPs.setString(1, taskId);
                TaskExecution current;
                try (ResultSet rs = selectPs.executeQuery()) {
                    if (!rs.next()) {
                        conn.rollback();
                        return Optional.empty();
                    }
                    current = mapRow(rs);
                }

                TaskExecution next = change.apply(current);

                updatePs.setString(1, next.status().name());
                setTimestamp(updatePs, 2, next.startedAt());
                setTimestamp(updatePs, 3, next.finishedAt());
                updatePs.setString(4, Json.write(next.result()));
                updatePs.setString(5, next.error());
                updatePs.setString(6, next.traceback());
                updatePs.setString(7, Json.write(next.metadata()));
                updatePs.setString(8, taskId);
                updatePs.executeUpdate();

                conn.commit();
                return Optional.of(next);
            } catch (SQLException | RuntimeException e) {
                Database.rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to update task execution: " + taskId, e);
        }
    }

    @Override
    public List<TaskExecution> findUnfinished(int limit) {
        String sql = "SELECT * FROM task_executions WHERE status IN " + NON_TERMINAL_IN
                + " ORDER BY created_at LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = bindStatuses(ps, 1, TaskStatus.nonTerminal());
            ps.setInt(idx, limit > 0 ? limit : Integer.MAX_VALUE);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to find unfinished task executions", e);
        }
    }

    @Override
    public List<TaskExecution> findStale(Instant startedBefore, int limit) {
        String sql = "SELECT * FROM task_executions WHERE status IN " + NON_TERMINAL_IN
                + " AND started_at IS NOT NULL AND started_at < ? ORDER BY started_at LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = bindStatuses(ps, 1, TaskStatus.nonTerminal());
            setTimestamp(ps, idx++, startedBefore);
            ps.setInt(idx, limit > 0 ? limit : Integer.MAX_VALUE);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to find stale task executions", e);
        }
    }

    @Override
    public boolean markTimedOut(String taskId, String error, Instant finishedAt) {
        String sql = "UPDATE task_executions SET status = 'FAILURE', error = ?, "
                + "finished_at = COALESCE(finished_at, ?) WHERE task_id = ? AND status IN " + NON_TERMINAL_IN;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, error);
            setTimestamp(ps, 2, finishedAt);
            ps.setString(3, taskId);
            bindStatuses(ps, 4, TaskStatus.nonTerminal());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task execution {} marked FAILURE: {}", taskId, error);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to mark task execution timed out: " + taskId, e);
        }
    }

    @Override
    public List<String> findExpiredIds(Instant createdBefore, boolean onlyCompleted, int limit) {
        String sql = "SELECT task_id FROM task_executions WHERE created_at < ?"
                + (onlyCompleted ? " AND status IN " + TERMINAL_IN : "")
                + " ORDER BY created_at LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            setTimestamp(ps, idx++, createdBefore);
            if (onlyCompleted) {
                idx = bindStatuses(ps, idx, TaskStatus.terminal());
            }
            ps.setInt(idx, limit);

            List<String> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString(1));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to find expired task executions", e);
        }
    }

    @Override
    public int deleteByIds(List<String> taskIds) {
        if (taskIds.isEmpty())
            return 0;

        String sql = "DELETE FROM task_executions WHERE task_id IN " + inClause(taskIds.size());

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            for (int i = 0; i < taskIds.size(); i++) {
                ps.setString(i + 1, taskIds.get(i));
            }
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to delete " + taskIds.size() + " task executions", e);
        }
    }

    @Override
    public List<TaskExecution> find(TaskQuery query, int limit) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT * FROM task_executions" + where(query, params) + " ORDER BY created_at DESC LIMIT ?";
        params.add(limit > 0 ? limit : Integer.MAX_VALUE);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bindAll(ps, params);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to query task executions", e);
        }
    }

    @Override
    public List<GroupCount> countGrouped(TaskQuery query) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT module, task_name, status, COUNT(*) AS cnt FROM task_executions"
                + where(query, params) + " GROUP BY module, task_name, status";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bindAll(ps, params);
            List<GroupCount> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new GroupCount(
                            rs.getString("module"),
                            rs.getString("task_name"),
                            TaskStatus.valueOf(rs.getString("status")),
                            rs.getLong("cnt")));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to count task executions", e);
        }
    }

    // Helper methods

    private static String where(TaskQuery query, List<Object> params) {
        List<String> clauses = new ArrayList<>();
        if (query.module() != null) {
            clauses.add("module = ?");
            params.add(query.module());
        }
        if (query.taskName() != null) {
            clauses.add("task_name = ?");
            params.add(query.taskName());
        }
        if (query.status() != null) {
            clauses.add("status = ?");
            params.add(query.status().name());
        }
        if (query.createdBy() != null) {
            clauses.add("created_by = ?");
            params.add(query.createdBy());
        }
        if (query.createdFrom() != null) {
            clauses.add("created_at >= ?");
            params.add(Timestamp.from(query.createdFrom()));
        }
        if (query.createdTo() != null) {
            clauses.add("created_at <= ?");
            params.add(Timestamp.from(query.createdTo()));
        }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }

    private static void bindAll(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    private static int bindStatuses(PreparedStatement ps, int start, Iterable<TaskStatus> statuses)
            throws SQLException {
        int idx = start;
        for (TaskStatus s : statuses) {
            ps.setString(idx++, s.name());
        }
        return idx;
    }

    private static String inClause(int size) {
        return Collections.nCopies(size, "?").stream().collect(Collectors.joining(", ", "(", ")"));
    }

    private static boolean isConstraintViolation(SQLException e) {
        return e instanceof SQLIntegrityConstraintViolationException
                || (e.getSQLState() != null && e.getSQLState().startsWith("23"));
    }

    private List<TaskExecution> executeQuery(PreparedStatement ps) throws SQLException {
        List<TaskExecution> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private TaskExecution mapRow(ResultSet rs) throws SQLException {
        return TaskExecution.builder()
                .taskId(rs.getString("task_id"))
                .taskName(rs.getString("task_name"))
                .module(rs.getString("module"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .taskArgs(Json.readList(rs.getString("task_args")))
                .taskKwargs(Json.readMap(rs.getString("task_kwargs")))
                .result(Json.readValue(rs.getString("result")))
                .error(rs.getString("error"))
                .traceback(rs.getString("traceback"))
                .createdBy(rs.getString("created_by"))
                .metadata(Json.readMap(rs.getString("metadata")))
                .build();
    }

    private static void setTimestamp(PreparedStatement ps, int idx, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(idx, Timestamp.from(instant));
        } else {
            ps.setNull(idx, Types.TIMESTAMP);
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
