package io.steadyloop.storage;

import io.steadyloop.model.TaskCategory;
import io.steadyloop.model.TaskPriority;
import io.steadyloop.model.TaskRecord;
import io.steadyloop.model.TaskStatus;
import io.steadyloop.pool.PooledHandle;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public final class TaskStore {
    private static final int CLAIM_ATTEMPTS = 8;
    private static final String TASK_COLUMNS = """
            t.task_id,t.description,t.category,t.priority,t.status,t.payload,t.deadline_at_ms,t.attempts,
            t.last_error,t.progress,t.checkpoint,t.result_payload,t.lease_owner,t.created_at_ms,t.started_at_ms,
            t.completed_at_ms,t.updated_at_ms,
            (SELECT group_concat(d.depends_on_task_id, ',') FROM task_dependencies d WHERE d.task_id=t.task_id) AS deps_csv
            """;

    private final Database database;
    private final Clock clock;

    public TaskStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    public boolean submit(Submission s) {
        if (taskExists(s.taskId())) {
            return false;
        }
        long now = clock.millis();
        try (PooledHandle<Connection> h = database.lease()) {
            Connection c = h.get();
            c.setAutoCommit(false);
            try (PreparedStatement t = c.prepareStatement(
                    "INSERT INTO tasks(task_id,description,category,priority,status,payload,deadline_at_ms,attempts,progress,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,?,0,0,?,?)");
                 PreparedStatement d = c.prepareStatement(
                         "INSERT OR IGNORE INTO task_dependencies(task_id,depends_on_task_id) VALUES(?,?)")) {
                t.setString(1, s.taskId());
                t.setString(2, s.description());
                t.setString(3, s.category().name());
                t.setInt(4, s.priority().rank());
                t.setString(5, TaskStatus.PENDING.name());
                t.setString(6, s.payload());
                setNullableLong(t, 7, s.deadlineAtMs());
                t.setLong(8, now);
                t.setLong(9, now);
                t.executeUpdate();

                for (String dep : s.dependencies()) {
                    d.setString(1, s.taskId());
                    d.setString(2, dep);
                    d.addBatch();
                }
                if (!s.dependencies().isEmpty()) {
                    d.executeBatch();
                }
                c.commit();
                return true;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            if (taskExists(s.taskId())) {
                return false;
            }
            throw new RuntimeException("Failed to submit task: " + s.taskId(), e);
        }
    }

    /**
     * Atomically moves the next ready task to IN_PROGRESS under a fresh lease. A task is ready when
     * it is PENDING and every dependency is COMPLETED; tasks depending on a FAILED, CANCELLED or
     * BLOCKED task are moved to BLOCKED first. Order: priority rank, then earliest deadline (tasks
     * with a deadline ahead of those without), then creation time.
     */
    public Optional<ClaimedTask> claimNext(String workerId) {
        String select = """
                SELECT t.task_id FROM tasks t
                WHERE t.status='PENDING'
                  AND NOT EXISTS (
                      SELECT 1 FROM task_dependencies d
                      LEFT JOIN tasks dep ON dep.task_id=d.depends_on_task_id
                      WHERE d.task_id=t.task_id AND (dep.status IS NULL OR dep.status<>'COMPLETED')
                  )
                ORDER BY t.priority ASC,
                         CASE WHEN t.deadline_at_ms IS NULL THEN 1 ELSE 0 END ASC,
                         t.deadline_at_ms ASC,
                         t.created_at_ms ASC,
                         t.rowid ASC
                LIMIT 1
                """;
        String claim = "UPDATE tasks SET status=?,attempts=attempts+1,started_at_ms=?,lease_owner=?,lease_token=?,updated_at_ms=? WHERE task_id=? AND status=?";
        for (int attempt = 0; attempt < CLAIM_ATTEMPTS; attempt++) {
            long now = clock.millis();
            String leaseToken = "lease_" + UUID.randomUUID();
            try (PooledHandle<Connection> h = database.lease()) {
                Connection c = h.get();
                c.setAutoCommit(false);
                try (PreparedStatement psSelect = c.prepareStatement(select);
                     PreparedStatement psClaim = c.prepareStatement(claim)) {
                    blockUnsatisfiable(c, now);
                    String taskId;
                    try (ResultSet rs = psSelect.executeQuery()) {
                        if (!rs.next()) {
                            c.commit();
                            return Optional.empty();
                        }
                        taskId = rs.getString("task_id");
                    }
                    psClaim.setString(1, TaskStatus.IN_PROGRESS.name());
                    psClaim.setLong(2, now);
                    psClaim.setString(3, workerId);
                    psClaim.setString(4, leaseToken);
                    psClaim.setLong(5, now);
                    psClaim.setString(6, taskId);
                    psClaim.setString(7, TaskStatus.PENDING.name());
                    if (psClaim.executeUpdate() == 0) {
                        c.commit();
                        continue;
                    }
                    TaskRecord task = readTask(c, taskId)
                            .orElseThrow(() -> new IllegalStateException("Claimed task vanished: " + taskId));
                    c.commit();
                    return Optional.of(new ClaimedTask(task, leaseToken));
                } catch (Exception e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            } catch (Exception e) {
                throw new RuntimeException("Failed to claim next task", e);
            }
        }
        return Optional.empty();
    }

    public boolean updateProgress(String taskId, double progress, String checkpoint) {
        double clamped = Double.isNaN(progress) ? 0.0d : Math.max(0.0d, Math.min(1.0d, progress));
        return exec(
                "UPDATE tasks SET progress=?,checkpoint=COALESCE(?,checkpoint),updated_at_ms=? WHERE task_id=? AND status=?",
                ps -> {
                    ps.setDouble(1, clamped);
                    ps.setString(2, checkpoint);
                    ps.setLong(3, clock.millis());
                    ps.setString(4, taskId);
                    ps.setString(5, TaskStatus.IN_PROGRESS.name());
                }) > 0;
    }

    public boolean complete(ClaimedTask lease, String result) {
        long now = clock.millis();
        return exec(
                "UPDATE tasks SET status=?,result_payload=?,progress=1.0,completed_at_ms=?,lease_owner=NULL,lease_token=NULL,updated_at_ms=? WHERE task_id=? AND status=? AND lease_token=?",
                ps -> {
                    ps.setString(1, TaskStatus.COMPLETED.name());
                    ps.setString(2, result);
                    ps.setLong(3, now);
                    ps.setLong(4, now);
                    ps.setString(5, lease.taskId());
                    ps.setString(6, TaskStatus.IN_PROGRESS.name());
                    ps.setString(7, lease.leaseToken());
                }) > 0;
    }

    public boolean fail(ClaimedTask lease, String error) {
        long now = clock.millis();
        return exec(
                "UPDATE tasks SET status=?,last_error=?,completed_at_ms=?,lease_owner=NULL,lease_token=NULL,updated_at_ms=? WHERE task_id=? AND status=? AND lease_token=?",
                ps -> {
                    ps.setString(1, TaskStatus.FAILED.name());
                    ps.setString(2, error);
                    ps.setLong(3, now);
                    ps.setLong(4, now);
                    ps.setString(5, lease.taskId());
                    ps.setString(6, TaskStatus.IN_PROGRESS.name());
                    ps.setString(7, lease.leaseToken());
                }) > 0;
    }

    public boolean requeue(ClaimedTask lease, String error) {
        return exec(
                "UPDATE tasks SET status=?,last_error=?,lease_owner=NULL,lease_token=NULL,updated_at_ms=? WHERE task_id=? AND status=? AND lease_token=?",
                ps -> {
                    ps.setString(1, TaskStatus.PENDING.name());
                    ps.setString(2, error);
                    ps.setLong(3, clock.millis());
                    ps.setString(4, lease.taskId());
                    ps.setString(5, TaskStatus.IN_PROGRESS.name());
                    ps.setString(6, lease.leaseToken());
                }) > 0;
    }

    public CancelResult cancel(String taskId, String reason) {
        long now = clock.millis();
        try (PooledHandle<Connection> h = database.lease()) {
            Connection c = h.get();
            c.setAutoCommit(false);
            try (PreparedStatement psCheck = c.prepareStatement("SELECT status FROM tasks WHERE task_id=?");
                 PreparedStatement psUpdate = c.prepareStatement(
                         "UPDATE tasks SET status=?,last_error=?,completed_at_ms=?,updated_at_ms=? WHERE task_id=? AND status IN (?,?)")) {
                psCheck.setString(1, taskId);
                TaskStatus status;
                try (ResultSet rs = psCheck.executeQuery()) {
                    if (!rs.next()) {
                        c.rollback();
                        return new CancelResult(taskId, false, "not_found");
                    }
                    status = TaskStatus.valueOf(rs.getString("status"));
                }
                if (status.terminal()) {
                    c.rollback();
                    return new CancelResult(taskId, false, "terminal_state:" + status.name());
                }
                if (status == TaskStatus.IN_PROGRESS) {
                    c.rollback();
                    return new CancelResult(taskId, false, "not_cancellable:" + status.name());
                }
                psUpdate.setString(1, TaskStatus.CANCELLED.name());
                psUpdate.setString(2, reason == null || reason.isBlank() ? "cancelled by user" : reason);
                psUpdate.setLong(3, now);
                psUpdate.setLong(4, now);
                psUpdate.setString(5, taskId);
                psUpdate.setString(6, TaskStatus.PENDING.name());
                psUpdate.setString(7, TaskStatus.BLOCKED.name());
                int rows = psUpdate.executeUpdate();
                c.commit();
                return new CancelResult(taskId, rows > 0, rows > 0 ? "cancelled" : "state_changed");
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to cancel task: " + taskId, e);
        }
    }

    public List<String> resumeInterrupted() {
        long now = clock.millis();
        try (PooledHandle<Connection> h = database.lease()) {
            Connection c = h.get();
            c.setAutoCommit(false);
            try (PreparedStatement psSelect = c.prepareStatement(
                    "SELECT task_id FROM tasks WHERE status=? ORDER BY started_at_ms ASC, task_id ASC");
                 PreparedStatement psReset = c.prepareStatement(
                         "UPDATE tasks SET status=?,lease_owner=NULL,lease_token=NULL,updated_at_ms=? WHERE task_id=? AND status=?")) {
                psSelect.setString(1, TaskStatus.IN_PROGRESS.name());
                List<String> ids = new ArrayList<>();
                try (ResultSet rs = psSelect.executeQuery()) {
                    while (rs.next()) {
                        ids.add(rs.getString("task_id"));
                    }
                }
                for (String id : ids) {
                    psReset.setString(1, TaskStatus.PENDING.name());
                    psReset.setLong(2, now);
                    psReset.setString(3, id);
                    psReset.setString(4, TaskStatus.IN_PROGRESS.name());
                    psReset.addBatch();
                }
                if (!ids.isEmpty()) {
                    psReset.executeBatch();
                }
                c.commit();
                return List.copyOf(ids);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to resume interrupted tasks", e);
        }
    }

    public Optional<TaskRecord> getTask(String taskId) {
        try (PooledHandle<Connection> h = database.lease()) {
            return readTask(h.get(), taskId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read task", e);
        }
    }

    public List<TaskRecord> listTasks(TaskStatus status, int limit, int offset) {
        String base = "SELECT " + TASK_COLUMNS + " FROM tasks t";
        String sql = status == null
                ? base + " ORDER BY t.updated_at_ms DESC, t.rowid DESC LIMIT ? OFFSET ?"
                : base + " WHERE t.status=? ORDER BY t.updated_at_ms DESC, t.rowid DESC LIMIT ? OFFSET ?";
        List<TaskRecord> out = new ArrayList<>();
        try (PooledHandle<Connection> h = database.lease(); PreparedStatement ps = h.get().prepareStatement(sql)) {
            int i = 1;
            if (status != null) {
                ps.setString(i++, status.name());
            }
            ps.setInt(i++, Math.max(1, limit));
            ps.setInt(i, Math.max(0, offset));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapTask(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list tasks", e);
        }
    }

    public int queueDepth() {
        return countWhere("status='PENDING'", null);
    }

    public QueueStatus status() {
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        for (TaskStatus s : TaskStatus.values()) {
            byStatus.put(s.name(), 0);
        }
        int total = 0;
        try (PooledHandle<Connection> h = database.lease();
             PreparedStatement ps = h.get().prepareStatement("SELECT status, COUNT(1) AS c FROM tasks GROUP BY status");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                int count = rs.getInt("c");
                byStatus.put(rs.getString("status"), count);
                total += count;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to collect queue status", e);
        }
        int overdue = countWhere("status='PENDING' AND deadline_at_ms IS NOT NULL AND deadline_at_ms < ?", clock.millis());
        return new QueueStatus(byStatus, overdue, total);
    }

    public int purgeFinishedOlderThan(long cutoffMs) {
        return exec("""
                DELETE FROM tasks
                WHERE status IN ('COMPLETED','FAILED','CANCELLED')
                  AND COALESCE(completed_at_ms, updated_at_ms) < ?
                  AND task_id NOT IN (
                      SELECT d.depends_on_task_id FROM task_dependencies d
                      JOIN tasks w ON w.task_id=d.task_id
                      WHERE w.status IN ('PENDING','IN_PROGRESS','BLOCKED')
                  )
                """, ps -> ps.setLong(1, cutoffMs));
    }

    private void blockUnsatisfiable(Connection c, long now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE tasks SET status='BLOCKED', last_error='dependency can no longer complete', updated_at_ms=?
                WHERE status='PENDING' AND EXISTS (
                    SELECT 1 FROM task_dependencies d
                    JOIN tasks dep ON dep.task_id=d.depends_on_task_id
                    WHERE d.task_id=tasks.task_id AND dep.status IN ('FAILED','CANCELLED','BLOCKED')
                )
                """)) {
            ps.setLong(1, now);
            ps.executeUpdate();
        }
    }

    private boolean taskExists(String taskId) {
        try (PooledHandle<Connection> h = database.lease();
             PreparedStatement ps = h.get().prepareStatement("SELECT 1 FROM tasks WHERE task_id=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed task lookup", e);
        }
    }

    private int countWhere(String where, Long param) {
        try (PooledHandle<Connection> h = database.lease();
             PreparedStatement ps = h.get().prepareStatement("SELECT COUNT(1) FROM tasks WHERE " + where)) {
            if (param != null) {
                ps.setLong(1, param);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks", e);
        }
    }

    private Optional<TaskRecord> readTask(Connection c, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + TASK_COLUMNS + " FROM tasks t WHERE t.task_id=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapTask(rs)) : Optional.empty();
            }
        }
    }

    private TaskRecord mapTask(ResultSet rs) throws SQLException {
        return new TaskRecord(
                rs.getString("task_id"),
                rs.getString("description"),
                TaskCategory.fromString(rs.getString("category")),
                TaskPriority.fromRank(rs.getInt("priority")),
                TaskStatus.valueOf(rs.getString("status")),
                rs.getString("payload"),
                parseDependsOnCsv(rs.getString("deps_csv")),
                nullableLong(rs, "deadline_at_ms"),
                rs.getInt("attempts"),
                rs.getString("last_error"),
                rs.getDouble("progress"),
                rs.getString("checkpoint"),
                rs.getString("result_payload"),
                rs.getString("lease_owner"),
                rs.getLong("created_at_ms"),
                nullableLong(rs, "started_at_ms"),
                nullableLong(rs, "completed_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private int exec(String sql, Binder binder) {
        try (PooledHandle<Connection> h = database.lease(); PreparedStatement ps = h.get().prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("DB exec failed", e);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    private static List<String> parseDependsOnCsv(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String raw : csv.split(",")) {
            String id = raw.trim();
            if (!id.isEmpty()) {
                out.add(id);
            }
        }
        return List.copyOf(out);
    }

    private interface Binder { void bind(PreparedStatement ps) throws SQLException; }

    public record Submission(
            String taskId,
            String description,
            TaskCategory category,
            TaskPriority priority,
            String payload,
            List<String> dependencies,
            Long deadlineAtMs
    ) {
        public Submission {
            if (taskId == null || taskId.isBlank() || taskId.indexOf(',') >= 0) {
                throw new IllegalArgumentException("taskId must be non-blank and comma-free: " + taskId);
            }
            if (description == null) {
                throw new IllegalArgumentException("description must not be null: " + taskId);
            }
            if (category == null || priority == null) {
                throw new IllegalArgumentException("category and priority are required: " + taskId);
            }
            List<String> deps = dependencies == null ? List.of() : dependencies;
            for (String dep : deps) {
                if (dep == null || dep.isBlank() || dep.indexOf(',') >= 0) {
                    throw new IllegalArgumentException("invalid dependency id for " + taskId + ": " + dep);
                }
                if (dep.equals(taskId)) {
                    throw new IllegalArgumentException("task cannot depend on itself: " + taskId);
                }
            }
            dependencies = List.copyOf(new LinkedHashSet<>(deps));
        }
    }

    public record ClaimedTask(TaskRecord task, String leaseToken) {
        public String taskId() {
            return task.taskId();
        }
    }

    public record CancelResult(String taskId, boolean cancelled, String message) {}

    public record QueueStatus(Map<String, Integer> byStatus, int overdue, int total) {}
}
