package io.conductor.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.conductor.model.TaskRecord;
import io.conductor.model.TaskStatus;
import io.conductor.model.TaskSummary;
import io.conductor.util.Jsons;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative store of task records, shared by the orchestrator and every execution process.
 *
 * <p>All state lives in the SQLite file; nothing is cached between calls. Terminal transitions are
 * single conditional updates on {@code status='RUNNING'}, so a completion report racing a stale
 * reclamation resolves to exactly one winner.
 */
public final class TaskLedger {
    private static final String COLUMNS = "task_id,project_path,agent_kind,model,status,content_fingerprint,"
            + "created_at_ms,finished_at_ms,files_modified,summary,error,cli_output,execution_pid";
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final Database database;

    public TaskLedger(Database database) {
        this.database = database;
    }

    public void create(TaskRecord record) {
        try (Connection c = database.openConnection()) {
            insert(c, record);
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed to create task", e);
        }
    }

    public Optional<TaskRecord> get(String taskId) {
        try (Connection c = database.openConnection()) {
            return selectById(c, taskId);
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed to read task", e);
        }
    }

    public Optional<TaskRecord> findRunning(String projectPath) {
        try (Connection c = database.openConnection()) {
            return selectRunning(c, projectPath);
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed to find running task", e);
        }
    }

    public Optional<TaskRecord> findRecentByFingerprint(String fingerprint, long sinceMs) {
        try (Connection c = database.openConnection()) {
            return selectRecentByFingerprint(c, fingerprint, sinceMs, null);
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed to find task by fingerprint", e);
        }
    }

    public TransitionOutcome complete(String taskId, List<String> filesModified, String summary, String cliOutput,
                                      long nowMs) {
        String sql = "UPDATE tasks SET status=?,finished_at_ms=?,files_modified=?,summary=?,cli_output=? "
                + "WHERE task_id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.COMPLETED.name());
            ps.setLong(2, nowMs);
            ps.setString(3, Jsons.toCompactJson(filesModified == null ? List.of() : filesModified));
            ps.setString(4, summary);
            ps.setString(5, cliOutput);
            ps.setString(6, taskId);
            ps.setString(7, TaskStatus.RUNNING.name());
            if (ps.executeUpdate() == 1) {
                return TransitionOutcome.APPLIED;
            }
            return missOutcome(c, taskId);
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed to complete task", e);
        }
    }

    public TransitionOutcome fail(String taskId, String error, long nowMs) {
        try (Connection c = database.openConnection()) {
            if (updateFailed(c, taskId, error, nowMs, Long.MAX_VALUE)) {
                return TransitionOutcome.APPLIED;
            }
            return missOutcome(c, taskId);
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed to fail task", e);
        }
    }

    /**
     * Fails the task only if it is still running and was created before {@code createdBeforeMs}.
     */
    public TransitionOutcome failIfRunningOlderThan(String taskId, long createdBeforeMs, String error, long nowMs) {
        try (Connection c = database.openConnection()) {
            if (updateFailed(c, taskId, error, nowMs, createdBeforeMs)) {
                return TransitionOutcome.APPLIED;
            }
            return missOutcome(c, taskId);
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed to reclaim task", e);
        }
    }

    public boolean attachExecutionPid(String taskId, long pid) {
        String sql = "UPDATE tasks SET execution_pid=? WHERE task_id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, pid);
            ps.setString(2, taskId);
            ps.setString(3, TaskStatus.RUNNING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed to attach execution pid", e);
        }
    }

    public List<TaskRecord> listRunning() {
        String sql = "SELECT " + COLUMNS + " FROM tasks WHERE status=? ORDER BY created_at_ms";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.RUNNING.name());
            return readAll(ps);
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed to list running tasks", e);
        }
    }

    public List<TaskRecord> listRecent(int limit) {
        String sql = "SELECT " + COLUMNS + " FROM tasks ORDER BY created_at_ms DESC, rowid DESC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            return readAll(ps);
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed to list tasks", e);
        }
    }

    public List<TaskSummary> listRecentSummaries(int limit) {
        return listRecent(limit).stream().map(TaskSummary::of).toList();
    }

    /**
     * Runs {@code work} inside one immediate transaction. The database write lock is held from the
     * first statement until commit or rollback, across all processes sharing the file.
     */
    public <T> T inExclusiveTransaction(LedgerWork<T> work) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                T result = work.run(new Transaction(c));
                c.commit();
                return result;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed exclusive ledger transaction", e);
        }
    }

    @FunctionalInterface
    public interface LedgerWork<T> {
        T run(Transaction tx) throws SQLException;
    }

    /**
     * Ledger operations bound to the connection of an open exclusive transaction.
     */
    public final class Transaction {
        private final Connection connection;

        private Transaction(Connection connection) {
            this.connection = connection;
        }

        public Optional<TaskRecord> findRunning(String projectPath) throws SQLException {
            return selectRunning(connection, projectPath);
        }

        public Optional<TaskRecord> findRecentByFingerprint(String fingerprint, long sinceMs, String excludeTaskId)
                throws SQLException {
            return selectRecentByFingerprint(connection, fingerprint, sinceMs, excludeTaskId);
        }

        public boolean failIfRunningOlderThan(String taskId, long createdBeforeMs, String error, long nowMs)
                throws SQLException {
            return updateFailed(connection, taskId, error, nowMs, createdBeforeMs);
        }

        public void create(TaskRecord record) throws SQLException {
            insert(connection, record);
        }
    }

    private void insert(Connection c, TaskRecord record) throws SQLException {
        if (record.status() != TaskStatus.RUNNING) {
            throw new IllegalArgumentException("New task must be running: " + record.taskId());
        }
        if (selectById(c, record.taskId()).isPresent()) {
            throw new IllegalStateException("Task id collision: " + record.taskId());
        }
        String sql = "INSERT INTO tasks(" + COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, record.taskId());
            ps.setString(2, record.projectPath());
            ps.setString(3, record.agentKind());
            ps.setString(4, record.model());
            ps.setString(5, TaskStatus.RUNNING.name());
            ps.setString(6, record.contentFingerprint());
            ps.setLong(7, record.createdAtMs());
            ps.setNull(8, Types.INTEGER);
            ps.setString(9, Jsons.toCompactJson(record.filesModified()));
            ps.setString(10, null);
            ps.setString(11, null);
            ps.setString(12, null);
            if (record.executionPid() == null) {
                ps.setNull(13, Types.INTEGER);
            } else {
                ps.setLong(13, record.executionPid());
            }
            ps.executeUpdate();
        }
    }

    private boolean updateFailed(Connection c, String taskId, String error, long nowMs, long createdBeforeMs)
            throws SQLException {
        String sql = "UPDATE tasks SET status=?,finished_at_ms=?,error=?,summary=? "
                + "WHERE task_id=? AND status=? AND created_at_ms<?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.FAILED.name());
            ps.setLong(2, nowMs);
            ps.setString(3, error);
            ps.setString(4, "Failed: " + error);
            ps.setString(5, taskId);
            ps.setString(6, TaskStatus.RUNNING.name());
            ps.setLong(7, createdBeforeMs);
            return ps.executeUpdate() == 1;
        }
    }

    private TransitionOutcome missOutcome(Connection c, String taskId) throws SQLException {
        Optional<TaskRecord> current = selectById(c, taskId);
        if (current.isEmpty()) {
            return TransitionOutcome.NOT_FOUND;
        }
        return current.get().status().isTerminal() ? TransitionOutcome.ALREADY_TERMINAL : TransitionOutcome.NOT_ELIGIBLE;
    }

    private Optional<TaskRecord> selectById(Connection c, String taskId) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM tasks WHERE task_id=?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, taskId);
            return readFirst(ps);
        }
    }

    private Optional<TaskRecord> selectRunning(Connection c, String projectPath) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM tasks WHERE project_path=? AND status=? "
                + "ORDER BY created_at_ms DESC LIMIT 1";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, projectPath);
            ps.setString(2, TaskStatus.RUNNING.name());
            return readFirst(ps);
        }
    }

    private Optional<TaskRecord> selectRecentByFingerprint(Connection c, String fingerprint, long sinceMs,
                                                           String excludeTaskId) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM tasks WHERE content_fingerprint=? AND created_at_ms>=? "
                + "AND task_id<>? ORDER BY created_at_ms DESC LIMIT 1";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, fingerprint);
            ps.setLong(2, sinceMs);
            ps.setString(3, excludeTaskId == null ? "" : excludeTaskId);
            return readFirst(ps);
        }
    }

    private Optional<TaskRecord> readFirst(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            return Optional.of(map(rs));
        }
    }

    private List<TaskRecord> readAll(PreparedStatement ps) throws SQLException {
        List<TaskRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(map(rs));
            }
        }
        return out;
    }

    private TaskRecord map(ResultSet rs) throws SQLException {
        long finishedAt = rs.getLong("finished_at_ms");
        Long finishedAtMs = rs.wasNull() ? null : finishedAt;
        long pid = rs.getLong("execution_pid");
        Long executionPid = rs.wasNull() ? null : pid;
        return new TaskRecord(
                rs.getString("task_id"),
                rs.getString("project_path"),
                rs.getString("agent_kind"),
                rs.getString("model"),
                TaskStatus.fromString(rs.getString("status")),
                rs.getString("content_fingerprint"),
                rs.getLong("created_at_ms"),
                finishedAtMs,
                parseFiles(rs.getString("files_modified")),
                rs.getString("summary"),
                rs.getString("error"),
                rs.getString("cli_output"),
                executionPid
        );
    }

    private List<String> parseFiles(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        try {
            return Jsons.mapper().readValue(raw, STRING_LIST);
        } catch (IOException e) {
            throw new IllegalStateException("Corrupt files_modified column: " + raw, e);
        }
    }
}
