package com.ryuqq.dmo.adapter.sqlite;

import com.ryuqq.dmo.core.error.DmoException;
import com.ryuqq.dmo.core.model.Activity;
import com.ryuqq.dmo.core.model.ActivityPatch;
import com.ryuqq.dmo.core.model.CompletionRecord;
import com.ryuqq.dmo.core.model.EntityType;
import com.ryuqq.dmo.core.model.NewActivity;
import com.ryuqq.dmo.core.model.NewRoutine;
import com.ryuqq.dmo.core.model.Routine;
import com.ryuqq.dmo.core.model.RoutinePatch;
import com.ryuqq.dmo.core.spi.StorageBackend;
import com.ryuqq.dmo.core.util.DateRanges;
import com.ryuqq.dmo.core.util.DateTimes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Embedded single-file implementation of {@link StorageBackend} on SQLite (sqlite-jdbc).
 *
 * <p><strong>Storage Layout:</strong></p>
 * <ul>
 *   <li>One database file, one JDBC connection, opened by {@link #init()}</li>
 *   <li>{@code PRAGMA foreign_keys} enabled so deletes cascade and orphan inserts fail</li>
 *   <li>Dates as {@code yyyy-MM-dd} text, timestamps as fixed-width ISO-8601 UTC text,
 *       booleans as 0/1</li>
 * </ul>
 *
 * <p><strong>Atomicity:</strong></p>
 * <ul>
 *   <li>Name uniqueness: {@code UNIQUE(name)}; violations become DUPLICATE_NAME</li>
 *   <li>Completion upsert: {@code INSERT ... ON CONFLICT (routine_id, date) DO UPDATE}</li>
 *   <li>Orphan writes: foreign-key violations become ROUTINE_NOT_FOUND</li>
 *   <li>Access to the single connection is serialised on an internal lock</li>
 * </ul>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public class SqliteStorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(SqliteStorageBackend.class);

    private static final String SELECT_ROUTINE = "SELECT * FROM routines WHERE id = ?";
    private static final String SELECT_ACTIVITY = "SELECT * FROM activities WHERE id = ?";
    private static final String SELECT_COMPLETION =
        "SELECT * FROM completions WHERE routine_id = ? AND date = ?";

    private final SqliteConfig config;
    private final Clock clock;
    private final Object lock = new Object();

    private Connection connection;

    /**
     * Creates a backend with the given configuration and the system UTC clock.
     *
     * @param config database settings
     */
    public SqliteStorageBackend(SqliteConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Creates a backend with the given configuration and clock.
     *
     * @param config database settings
     * @param clock timestamp source
     * @throws IllegalArgumentException if an argument is null
     */
    public SqliteStorageBackend(SqliteConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "sqlite";
    }

    /**
     * {@inheritDoc}
     *
     * <p>Creates the parent directory of the database file if needed, opens the connection
     * once and (re)applies the idempotent schema on every call.</p>
     */
    @Override
    public void init() {
        synchronized (lock) {
            try {
                if (connection == null) {
                    connection = open();
                }
                try (Statement statement = connection.createStatement()) {
                    for (String ddl : SqliteSchema.STATEMENTS) {
                        statement.execute(ddl);
                    }
                }
                log.info("SQLite storage ready at {}", config.isInMemory() ? ":memory:" : config.databasePath());
            } catch (SQLException | IOException e) {
                log.error("Failed to initialize SQLite storage at {}", config.databasePath(), e);
                closeQuietly();
                throw DmoException.storage("init", e.getMessage(), e);
            }
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (connection != null) {
                closeQuietly();
                log.info("SQLite storage closed");
            }
        }
    }

    // ============================================================
    // Routines
    // ============================================================

    @Override
    public Routine createRoutine(NewRoutine routine) {
        if (routine == null) {
            throw new IllegalArgumentException("routine cannot be null");
        }
        return execute("create_routine", conn -> {
            Instant now = DateTimes.now(clock);
            try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO routines (name, description, active, timezone, created_at, updated_at) "
                    + "VALUES (?, ?, 1, ?, ?, ?)")) {
                ps.setString(1, routine.name());
                ps.setString(2, routine.description());
                ps.setString(3, routine.timezone());
                ps.setString(4, DateTimes.format(now));
                ps.setString(5, DateTimes.format(now));
                ps.executeUpdate();
            } catch (SQLException e) {
                if (SqliteErrors.isUniqueViolation(e)) {
                    log.debug("Rejected duplicate routine name '{}'", routine.name());
                    throw DmoException.duplicateName(EntityType.ROUTINE, routine.name(), e);
                }
                throw e;
            }
            return new Routine(lastInsertId(conn), routine.name(), routine.description(),
                true, routine.timezone(), now, now);
        });
    }

    @Override
    public Routine getRoutine(long routineId) {
        return execute("get_routine", conn -> requireRoutine(conn, routineId));
    }

    @Override
    public List<Routine> listRoutines(boolean includeInactive) {
        return execute("list_routines", conn -> {
            String sql = includeInactive
                ? "SELECT * FROM routines ORDER BY name ASC"
                : "SELECT * FROM routines WHERE active = 1 ORDER BY name ASC";
            List<Routine> result = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(sql);
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(toRoutine(rs));
                }
            }
            return result;
        });
    }

    @Override
    public Routine updateRoutine(long routineId, RoutinePatch patch) {
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        return execute("update_routine", conn -> {
            if (patch.isEmpty()) {
                return requireRoutine(conn, routineId);
            }
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE routines SET name = COALESCE(?, name), description = COALESCE(?, description), "
                    + "timezone = COALESCE(?, timezone), active = COALESCE(?, active), "
                    + "updated_at = MAX(updated_at, ?) WHERE id = ?")) {
                ps.setString(1, patch.name());
                ps.setString(2, patch.description());
                ps.setString(3, patch.timezone());
                if (patch.active() == null) {
                    ps.setNull(4, Types.INTEGER);
                } else {
                    ps.setInt(4, patch.active() ? 1 : 0);
                }
                ps.setString(5, DateTimes.format(DateTimes.now(clock)));
                ps.setLong(6, routineId);
                updated = ps.executeUpdate();
            } catch (SQLException e) {
                if (SqliteErrors.isUniqueViolation(e)) {
                    log.debug("Rejected rename of routine {} to duplicate name '{}'", routineId, patch.name());
                    throw DmoException.duplicateName(EntityType.ROUTINE, patch.name(), e);
                }
                throw e;
            }
            if (updated == 0) {
                throw DmoException.routineNotFound(routineId);
            }
            return requireRoutine(conn, routineId);
        });
    }

    @Override
    public void deleteRoutine(long routineId) {
        execute("delete_routine", conn -> {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM routines WHERE id = ?")) {
                ps.setLong(1, routineId);
                if (ps.executeUpdate() == 0) {
                    throw DmoException.routineNotFound(routineId);
                }
            }
            return null;
        });
    }

    // ============================================================
    // Activities
    // ============================================================

    @Override
    public Activity createActivity(NewActivity activity) {
        if (activity == null) {
            throw new IllegalArgumentException("activity cannot be null");
        }
        return execute("create_activity", conn -> {
            Instant now = DateTimes.now(clock);
            try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO activities (routine_id, name, \"order\", created_at, updated_at) VALUES (?, ?, ?, ?, ?)")) {
                ps.setLong(1, activity.routineId());
                ps.setString(2, activity.name());
                ps.setInt(3, activity.order());
                ps.setString(4, DateTimes.format(now));
                ps.setString(5, DateTimes.format(now));
                ps.executeUpdate();
            } catch (SQLException e) {
                if (SqliteErrors.isForeignKeyViolation(e)) {
                    throw DmoException.routineNotFound(activity.routineId());
                }
                throw e;
            }
            return new Activity(lastInsertId(conn), activity.routineId(), activity.name(), activity.order(), now, now);
        });
    }

    @Override
    public Activity getActivity(long activityId) {
        return execute("get_activity", conn -> requireActivity(conn, activityId));
    }

    @Override
    public List<Activity> listActivities(long routineId) {
        return execute("list_activities", conn -> {
            requireRoutine(conn, routineId);
            List<Activity> result = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM activities WHERE routine_id = ? ORDER BY \"order\" ASC, created_at ASC, id ASC")) {
                ps.setLong(1, routineId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        result.add(toActivity(rs));
                    }
                }
            }
            return result;
        });
    }

    @Override
    public Activity updateActivity(long activityId, ActivityPatch patch) {
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        return execute("update_activity", conn -> {
            if (patch.isEmpty()) {
                return requireActivity(conn, activityId);
            }
            try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE activities SET name = COALESCE(?, name), \"order\" = COALESCE(?, \"order\"), "
                    + "updated_at = MAX(updated_at, ?) WHERE id = ?")) {
                ps.setString(1, patch.name());
                if (patch.order() == null) {
                    ps.setNull(2, Types.INTEGER);
                } else {
                    ps.setInt(2, patch.order());
                }
                ps.setString(3, DateTimes.format(DateTimes.now(clock)));
                ps.setLong(4, activityId);
                if (ps.executeUpdate() == 0) {
                    throw DmoException.activityNotFound(activityId);
                }
            }
            return requireActivity(conn, activityId);
        });
    }

    @Override
    public void deleteActivity(long activityId) {
        execute("delete_activity", conn -> {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM activities WHERE id = ?")) {
                ps.setLong(1, activityId);
                if (ps.executeUpdate() == 0) {
                    throw DmoException.activityNotFound(activityId);
                }
            }
            return null;
        });
    }

    // ============================================================
    // Completions
    // ============================================================

    @Override
    public CompletionRecord setCompletion(long routineId, LocalDate date, boolean completed, String note) {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        CompletionRecord.validateNote(note);
        return execute("set_completion", conn -> {
            String now = DateTimes.format(DateTimes.now(clock));
            try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO completions (routine_id, date, completed, note, created_at, updated_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?) "
                    + "ON CONFLICT (routine_id, date) DO UPDATE SET "
                    + "completed = excluded.completed, note = excluded.note, "
                    + "updated_at = MAX(completions.updated_at, excluded.updated_at)")) {
                ps.setLong(1, routineId);
                ps.setString(2, date.toString());
                ps.setInt(3, completed ? 1 : 0);
                ps.setString(4, note);
                ps.setString(5, now);
                ps.setString(6, now);
                ps.executeUpdate();
            } catch (SQLException e) {
                if (SqliteErrors.isForeignKeyViolation(e)) {
                    throw DmoException.routineNotFound(routineId);
                }
                throw e;
            }
            return findCompletion(conn, routineId, date)
                .orElseThrow(() -> DmoException.storage("set_completion", "Upserted row not readable", null));
        });
    }

    @Override
    public Optional<CompletionRecord> getCompletion(long routineId, LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        return execute("get_completion", conn -> {
            requireRoutine(conn, routineId);
            return findCompletion(conn, routineId, date);
        });
    }

    @Override
    public List<CompletionRecord> listCompletions(long routineId, LocalDate start, LocalDate end) {
        DateRanges.requireOrdered(start, end);
        return execute("list_completions", conn -> {
            requireRoutine(conn, routineId);
            List<CompletionRecord> result = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM completions WHERE routine_id = ? AND date >= ? AND date <= ? ORDER BY date ASC")) {
                ps.setLong(1, routineId);
                ps.setString(2, start.toString());
                ps.setString(3, end.toString());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        result.add(toCompletion(rs));
                    }
                }
            }
            return result;
        });
    }

    @Override
    public int countCompleted(long routineId, LocalDate start, LocalDate end) {
        DateRanges.requireOrdered(start, end);
        return execute("count_completed", conn -> {
            requireRoutine(conn, routineId);
            try (PreparedStatement ps = conn.prepareStatement(
                "SELECT COUNT(*) FROM completions WHERE routine_id = ? AND date >= ? AND date <= ? AND completed = 1")) {
                ps.setLong(1, routineId);
                ps.setString(2, start.toString());
                ps.setString(3, end.toString());
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    // ============================================================
    // Helpers
    // ============================================================

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    /**
     * Runs work on the connection under the lock, translating driver errors.
     * {@link DmoException}s raised by the work pass through unchanged.
     */
    private <T> T execute(String operation, SqlWork<T> work) {
        synchronized (lock) {
            if (connection == null) {
                throw DmoException.storage(operation, "Storage not initialized. Call init() first.", null);
            }
            try {
                return work.run(connection);
            } catch (SQLException e) {
                log.error("SQLite operation {} failed", operation, e);
                throw DmoException.storage(operation, e.getMessage(), e);
            }
        }
    }

    private Connection open() throws SQLException, IOException {
        if (!config.isInMemory()) {
            Path parent = config.databasePath().toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        }
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setBusyTimeout(config.busyTimeoutMs());
        return DriverManager.getConnection(config.jdbcUrl(), sqlite.toProperties());
    }

    private void closeQuietly() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error while closing SQLite connection", e);
        } finally {
            connection = null;
        }
    }

    private static long lastInsertId(Connection conn) throws SQLException {
        try (Statement statement = conn.createStatement();
             ResultSet rs = statement.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid() returned no row");
            }
            return rs.getLong(1);
        }
    }

    private static Routine requireRoutine(Connection conn, long routineId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_ROUTINE)) {
            ps.setLong(1, routineId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw DmoException.routineNotFound(routineId);
                }
                return toRoutine(rs);
            }
        }
    }

    private static Activity requireActivity(Connection conn, long activityId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_ACTIVITY)) {
            ps.setLong(1, activityId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw DmoException.activityNotFound(activityId);
                }
                return toActivity(rs);
            }
        }
    }

    private static Optional<CompletionRecord> findCompletion(Connection conn, long routineId, LocalDate date)
        throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_COMPLETION)) {
            ps.setLong(1, routineId);
            ps.setString(2, date.toString());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toCompletion(rs)) : Optional.empty();
            }
        }
    }

    private static Routine toRoutine(ResultSet rs) throws SQLException {
        return new Routine(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("description"),
            rs.getInt("active") != 0,
            rs.getString("timezone"),
            DateTimes.parse(rs.getString("created_at")),
            DateTimes.parse(rs.getString("updated_at"))
        );
    }

    private static Activity toActivity(ResultSet rs) throws SQLException {
        return new Activity(
            rs.getLong("id"),
            rs.getLong("routine_id"),
            rs.getString("name"),
            rs.getInt("order"),
            DateTimes.parse(rs.getString("created_at")),
            DateTimes.parse(rs.getString("updated_at"))
        );
    }

    private static CompletionRecord toCompletion(ResultSet rs) throws SQLException {
        return new CompletionRecord(
            rs.getLong("id"),
            rs.getLong("routine_id"),
            LocalDate.parse(rs.getString("date")),
            rs.getInt("completed") != 0,
            rs.getString("note"),
            DateTimes.parse(rs.getString("created_at")),
            DateTimes.parse(rs.getString("updated_at"))
        );
    }
}
