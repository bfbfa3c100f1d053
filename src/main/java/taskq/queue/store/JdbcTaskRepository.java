package taskq.queue.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import taskq.queue.model.Task;
import taskq.queue.model.TaskStatus;
import taskq.queue.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JDBC implementation of TaskRepository.
 * State changes are guarded by the current status in the WHERE clause, so a
 * lost race shows up as zero updated rows instead of a clobbered row.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private static final TypeReference<Map<String, String>> ENV_TYPE = new TypeReference<>() {
    };

    private final Database db;
    private final ObjectMapper mapper;

    public JdbcTaskRepository(Database db) {
        this(db, new ObjectMapper());
    }

    public JdbcTaskRepository(Database db, ObjectMapper mapper) {
        this.db = db;
        this.mapper = mapper;
    }

    @Override
    public long insert(Task task) {
        String sql = """
                    INSERT INTO tasks (name, command, priority, created_at, status, environment, cwd,
                                       stdout_file, stderr_file, timeout_seconds)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, task.name());
            ps.setString(2, task.command());
            ps.setInt(3, task.priority());
            setTimestamp(ps, 4, task.createdAt() != null ? task.createdAt() : Instant.now());
            ps.setString(5, task.status().name());
            ps.setString(6, writeEnvironment(task.environment()));
            ps.setString(7, task.cwd());
            ps.setString(8, task.stdoutFile());
            ps.setString(9, task.stderrFile());
            setIntOrNull(ps, 10, task.timeoutSeconds());

            ps.executeUpdate();

            long id;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    conn.rollback();
                    throw new SQLException("No generated id returned");
                }
                id = keys.getLong(1);
            }
            conn.commit();

            log.debug("Inserted task {} '{}'", id, task.name());
            return id;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert task: " + task.name(), e);
        }
    }

    @Override
    public Optional<Task> findById(long taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, taskId);
            List<Task> found = executeQuery(ps);
            conn.commit();
            return found.stream().findFirst();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<Task> list(Set<TaskStatus> statuses) {
        StringBuilder sql = new StringBuilder("SELECT * FROM tasks");
        List<TaskStatus> filter = statuses == null ? List.of() : List.copyOf(statuses);
        if (!filter.isEmpty()) {
            sql.append(" WHERE status IN (")
                    .append(filter.stream().map(s -> "?").collect(Collectors.joining(", ")))
                    .append(")");
        }
        sql.append(" ORDER BY priority, created_at, id");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            for (int i = 0; i < filter.size(); i++) {
                ps.setString(i + 1, filter.get(i).name());
            }
            List<Task> tasks = executeQuery(ps);
            conn.commit();
            return tasks;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list tasks", e);
        }
    }

    @Override
    public List<Task> findPending(int limit) {
        String sql = """
                    SELECT * FROM tasks
                    WHERE status = 'PENDING'
                    ORDER BY priority, created_at, id
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<Task> tasks = executeQuery(ps);
            conn.commit();
            return tasks;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find pending tasks", e);
        }
    }

    @Override
    public int countByStatus(TaskStatus status) {
        String sql = "SELECT COUNT(*) FROM tasks WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            int count = 0;
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    count = rs.getInt(1);
                }
            }
            conn.commit();
            return count;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks", e);
        }
    }

    @Override
    public boolean updateStatus(long taskId, TaskStatus status) {
        return executeUpdate("UPDATE tasks SET status = ? WHERE id = ?", taskId, ps -> {
            ps.setString(1, status.name());
            ps.setLong(2, taskId);
        });
    }

    @Override
    public boolean updatePid(long taskId, long pid) {
        return executeUpdate("UPDATE tasks SET pid = ? WHERE id = ?", taskId, ps -> {
            ps.setLong(1, pid);
            ps.setLong(2, taskId);
        });
    }

    @Override
    public boolean updateStartTime(long taskId, Instant startTime) {
        return executeUpdate("UPDATE tasks SET start_time = ? WHERE id = ?", taskId, ps -> {
            setTimestamp(ps, 1, startTime);
            ps.setLong(2, taskId);
        });
    }

    @Override
    public boolean updateEndTime(long taskId, Instant endTime) {
        return executeUpdate("UPDATE tasks SET end_time = ? WHERE id = ? AND end_time IS NULL", taskId, ps -> {
            setTimestamp(ps, 1, endTime);
            ps.setLong(2, taskId);
        });
    }

    @Override
    public boolean markRunning(long taskId, Instant startTime) {
        String sql = """
                    UPDATE tasks
                    SET status = 'RUNNING', start_time = ?
                    WHERE id = ? AND status = 'PENDING'
                """;

        boolean updated = executeUpdate(sql, taskId, ps -> {
            setTimestamp(ps, 1, startTime);
            ps.setLong(2, taskId);
        });
        if (updated) {
            log.debug("Task {} marked RUNNING", taskId);
        }
        return updated;
    }

    @Override
    public boolean finish(long taskId, TaskStatus status, Instant endTime, Integer exitCode, String errorMessage) {
        String sql = """
                    UPDATE tasks
                    SET status = ?, end_time = ?, exit_code = ?, error_message = ?
                    WHERE id = ? AND status = 'RUNNING'
                """;

        boolean updated = executeUpdate(sql, taskId, ps -> {
            ps.setString(1, status.name());
            setTimestamp(ps, 2, endTime);
            setIntOrNull(ps, 3, exitCode);
            ps.setString(4, trimErr(errorMessage));
            ps.setLong(5, taskId);
        });
        if (updated) {
            log.debug("Task {} finished as {}", taskId, status);
        }
        return updated;
    }

    @Override
    public boolean cancel(long taskId, TaskStatus from, Instant endTime) {
        String sql = endTime != null
                ? "UPDATE tasks SET status = 'CANCELLED', end_time = COALESCE(end_time, ?) WHERE id = ? AND status = ?"
                : "UPDATE tasks SET status = 'CANCELLED' WHERE id = ? AND status = ?";

        return executeUpdate(sql, taskId, ps -> {
            int i = 1;
            if (endTime != null) {
                setTimestamp(ps, i++, endTime);
            }
            ps.setLong(i++, taskId);
            ps.setString(i, from.name());
        });
    }

    // Helper methods

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private boolean executeUpdate(String sql, long taskId, Binder binder) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update task: " + taskId, e);
        }
    }

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .command(rs.getString("command"))
                .priority(rs.getInt("priority"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .environment(readEnvironment(rs.getString("environment")))
                .cwd(rs.getString("cwd"))
                .stdoutFile(rs.getString("stdout_file"))
                .stderrFile(rs.getString("stderr_file"))
                .pid(getLongOrNull(rs, "pid"))
                .timeoutSeconds(getIntOrNull(rs, "timeout_seconds"))
                .startTime(toInstant(rs.getTimestamp("start_time")))
                .endTime(toInstant(rs.getTimestamp("end_time")))
                .exitCode(getIntOrNull(rs, "exit_code"))
                .errorMessage(rs.getString("error_message"))
                .build();
    }

    private String writeEnvironment(Map<String, String> env) {
        try {
            return mapper.writeValueAsString(env == null ? Map.of() : env);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Environment is not serializable", e);
        }
    }

    /**
     * A row whose environment column cannot be parsed maps to null; the
     * executor fails such a task instead of running it with a guessed env.
     */
    private Map<String, String> readEnvironment(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, ENV_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Malformed environment column: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String trimErr(String m) {
        if (m == null) return null;
        m = m.replaceAll("\\s+", " ").trim();
        return m.length() > 2000 ? m.substring(0, 2000) : m;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    private static void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    private static Long getLongOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
