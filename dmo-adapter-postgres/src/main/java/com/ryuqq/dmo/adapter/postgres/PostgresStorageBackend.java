package com.ryuqq.dmo.adapter.postgres;

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
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Networked implementation of {@link StorageBackend} on PostgreSQL with a HikariCP pool.
 *
 * <p><strong>Pool:</strong></p>
 * <ul>
 *   <li>Opened by {@link #init()}, closed by {@link #close()}</li>
 *   <li>minimumIdle / maximumPoolSize / connectionTimeout from {@link PostgresConfig}</li>
 *   <li>Every operation borrows one connection and returns it before completing</li>
 *   <li>Acquisition timeout or an unreachable server: {@code STORAGE_UNAVAILABLE} (retryable)</li>
 * </ul>
 *
 * <p><strong>Atomicity:</strong></p>
 * <ul>
 *   <li>Single-statement writes run in autocommit and use {@code RETURNING}</li>
 *   <li>Completion upsert runs in one transaction: update the existing row, otherwise
 *       {@code INSERT ... ON CONFLICT (routine_id, date) DO UPDATE}</li>
 *   <li>SQLState 23505 becomes DUPLICATE_NAME, 23503 becomes ROUTINE_NOT_FOUND</li>
 * </ul>
 *
 * <p>Routine names are ordered with {@code COLLATE "C"} (code point order) so that listings
 * match the other backends regardless of the database locale.</p>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public class PostgresStorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(PostgresStorageBackend.class);

    private static final String POOL_NAME = "dmo-postgres";

    private final PostgresConfig config;
    private final Clock clock;

    private volatile HikariDataSource dataSource;

    /**
     * Creates a backend with the given configuration and the system UTC clock.
     *
     * @param config connection and pool settings
     */
    public PostgresStorageBackend(PostgresConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Creates a backend with the given configuration and clock.
     *
     * @param config connection and pool settings
     * @param clock timestamp source
     * @throws IllegalArgumentException if an argument is null
     */
    public PostgresStorageBackend(PostgresConfig config, Clock clock) {
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
        return "postgres";
    }

    /**
     * {@inheritDoc}
     *
     * <p>Opens the pool on first call and (re)applies the idempotent schema.</p>
     *
     * @throws DmoException STORAGE_UNAVAILABLE if the server cannot be reached
     */
    @Override
    public synchronized void init() {
        if (dataSource == null) {
            try {
                dataSource = new HikariDataSource(hikariConfig());
            } catch (HikariPool.PoolInitializationException e) {
                log.error("Failed to open PostgreSQL pool for {}", config.jdbcUrl(), e);
                throw DmoException.unavailable("init", e);
            }
            log.info("PostgreSQL pool opened: {}", config);
        }
        execute("init", conn -> {
            try (Statement statement = conn.createStatement()) {
                for (String ddl : PostgresSchema.STATEMENTS) {
                    statement.execute(ddl);
                }
            }
            return null;
        });
        log.info("PostgreSQL schema ready");
    }

    @Override
    public synchronized void close() {
        HikariDataSource current = dataSource;
        if (current != null) {
            dataSource = null;
            current.close();
            log.info("PostgreSQL pool closed");
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
            OffsetDateTime now = timestamp(DateTimes.now(clock));
            // nextval() runs only for produced rows, so a visible duplicate leaves the sequence alone
            try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO routines (name, description, active, timezone, created_at, updated_at) "
                    + "SELECT CAST(? AS TEXT), CAST(? AS TEXT), TRUE, CAST(? AS TEXT), "
                    + "CAST(? AS TIMESTAMPTZ), CAST(? AS TIMESTAMPTZ) "
                    + "WHERE NOT EXISTS (SELECT 1 FROM routines WHERE name = CAST(? AS TEXT)) "
                    + "RETURNING *")) {
                ps.setString(1, routine.name());
                ps.setString(2, routine.description());
                ps.setString(3, routine.timezone());
                ps.setObject(4, now);
                ps.setObject(5, now);
                ps.setString(6, routine.name());
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        log.debug("Rejected duplicate routine name '{}'", routine.name());
                        throw DmoException.duplicateName(EntityType.ROUTINE, routine.name());
                    }
                    return toRoutine(rs);
                }
            } catch (SQLException e) {
                if (PostgresErrors.isUniqueViolation(e)) {
                    log.debug("Rejected duplicate routine name '{}'", routine.name());
                    throw DmoException.duplicateName(EntityType.ROUTINE, routine.name(), e);
                }
                throw e;
            }
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
                ? "SELECT * FROM routines ORDER BY name COLLATE \"C\" ASC"
                : "SELECT * FROM routines WHERE active ORDER BY name COLLATE \"C\" ASC";
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
            try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE routines SET name = COALESCE(CAST(? AS TEXT), name), "
                    + "description = COALESCE(CAST(? AS TEXT), description), "
                    + "timezone = COALESCE(CAST(? AS TEXT), timezone), "
                    + "active = COALESCE(CAST(? AS BOOLEAN), active), "
                    + "updated_at = GREATEST(updated_at, ?) WHERE id = ? RETURNING *")) {
                ps.setString(1, patch.name());
                ps.setString(2, patch.description());
                ps.setString(3, patch.timezone());
                if (patch.active() == null) {
                    ps.setNull(4, Types.BOOLEAN);
                } else {
                    ps.setBoolean(4, patch.active());
                }
                ps.setObject(5, timestamp(DateTimes.now(clock)));
                ps.setLong(6, routineId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw DmoException.routineNotFound(routineId);
                    }
                    return toRoutine(rs);
                }
            } catch (SQLException e) {
                if (PostgresErrors.isUniqueViolation(e)) {
                    log.debug("Rejected rename of routine {} to duplicate name '{}'", routineId, patch.name());
                    throw DmoException.duplicateName(EntityType.ROUTINE, patch.name(), e);
                }
                throw e;
            }
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
            OffsetDateTime now = timestamp(DateTimes.now(clock));
            try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO activities (routine_id, name, \"order\", created_at, updated_at) "
                    + "SELECT CAST(? AS BIGINT), CAST(? AS TEXT), CAST(? AS INTEGER), "
                    + "CAST(? AS TIMESTAMPTZ), CAST(? AS TIMESTAMPTZ) "
                    + "WHERE EXISTS (SELECT 1 FROM routines WHERE id = ?) "
                    + "RETURNING *")) {
                ps.setLong(1, activity.routineId());
                ps.setString(2, activity.name());
                ps.setInt(3, activity.order());
                ps.setObject(4, now);
                ps.setObject(5, now);
                ps.setLong(6, activity.routineId());
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw DmoException.routineNotFound(activity.routineId());
                    }
                    return toActivity(rs);
                }
            } catch (SQLException e) {
                if (PostgresErrors.isForeignKeyViolation(e)) {
                    throw DmoException.routineNotFound(activity.routineId());
                }
                throw e;
            }
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
                "UPDATE activities SET name = COALESCE(CAST(? AS TEXT), name), "
                    + "\"order\" = COALESCE(CAST(? AS INTEGER), \"order\"), "
                    + "updated_at = GREATEST(updated_at, ?) WHERE id = ? RETURNING *")) {
                ps.setString(1, patch.name());
                if (patch.order() == null) {
                    ps.setNull(2, Types.INTEGER);
                } else {
                    ps.setInt(2, patch.order());
                }
                ps.setObject(3, timestamp(DateTimes.now(clock)));
                ps.setLong(4, activityId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw DmoException.activityNotFound(activityId);
                    }
                    return toActivity(rs);
                }
            }
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

    /**
     * {@inheritDoc}
     *
     * <p>The existing row is updated first so that rewrites do not draw from the id
     * sequence. A concurrent first write for the same key is absorbed by the
     * {@code ON CONFLICT} clause of the fallback insert, which produces no row (and
     * draws no id) when the routine is absent.</p>
     */
    @Override
    public CompletionRecord setCompletion(long routineId, LocalDate date, boolean completed, String note) {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        CompletionRecord.validateNote(note);
        return execute("set_completion", conn -> inTransaction(conn, () -> {
            OffsetDateTime now = timestamp(DateTimes.now(clock));
            try (PreparedStatement update = conn.prepareStatement(
                "UPDATE completions SET completed = ?, note = ?, updated_at = GREATEST(updated_at, ?) "
                    + "WHERE routine_id = ? AND date = ? RETURNING *")) {
                update.setBoolean(1, completed);
                update.setString(2, note);
                update.setObject(3, now);
                update.setLong(4, routineId);
                update.setObject(5, date);
                try (ResultSet rs = update.executeQuery()) {
                    if (rs.next()) {
                        return toCompletion(rs);
                    }
                }
            }
            try (PreparedStatement insert = conn.prepareStatement(
                "INSERT INTO completions (routine_id, date, completed, note, created_at, updated_at) "
                    + "SELECT CAST(? AS BIGINT), CAST(? AS DATE), CAST(? AS BOOLEAN), CAST(? AS TEXT), "
                    + "CAST(? AS TIMESTAMPTZ), CAST(? AS TIMESTAMPTZ) "
                    + "WHERE EXISTS (SELECT 1 FROM routines WHERE id = ?) "
                    + "ON CONFLICT (routine_id, date) DO UPDATE SET "
                    + "completed = EXCLUDED.completed, note = EXCLUDED.note, "
                    + "updated_at = GREATEST(completions.updated_at, EXCLUDED.updated_at) "
                    + "RETURNING *")) {
                insert.setLong(1, routineId);
                insert.setObject(2, date);
                insert.setBoolean(3, completed);
                insert.setString(4, note);
                insert.setObject(5, now);
                insert.setObject(6, now);
                insert.setLong(7, routineId);
                try (ResultSet rs = insert.executeQuery()) {
                    if (!rs.next()) {
                        throw DmoException.routineNotFound(routineId);
                    }
                    return toCompletion(rs);
                }
            } catch (SQLException e) {
                if (PostgresErrors.isForeignKeyViolation(e)) {
                    throw DmoException.routineNotFound(routineId);
                }
                throw e;
            }
        }));
    }

    @Override
    public Optional<CompletionRecord> getCompletion(long routineId, LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        return execute("get_completion", conn -> {
            requireRoutine(conn, routineId);
            try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM completions WHERE routine_id = ? AND date = ?")) {
                ps.setLong(1, routineId);
                ps.setObject(2, date);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(toCompletion(rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public List<CompletionRecord> listCompletions(long routineId, LocalDate start, LocalDate end) {
        DateRanges.requireOrdered(start, end);
        return execute("list_completions", conn -> {
            requireRoutine(conn, routineId);
            List<CompletionRecord> result = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM completions WHERE routine_id = ? AND date BETWEEN ? AND ? ORDER BY date ASC")) {
                ps.setLong(1, routineId);
                ps.setObject(2, start);
                ps.setObject(3, end);
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
                "SELECT COUNT(*) FROM completions WHERE routine_id = ? AND date BETWEEN ? AND ? AND completed")) {
                ps.setLong(1, routineId);
                ps.setObject(2, start);
                ps.setObject(3, end);
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

    @FunctionalInterface
    private interface SqlBlock<T> {
        T run() throws SQLException;
    }

    /**
     * Borrows a pooled connection for the work and translates driver errors.
     * {@link DmoException}s raised by the work pass through unchanged.
     */
    private <T> T execute(String operation, SqlWork<T> work) {
        HikariDataSource pool = dataSource;
        if (pool == null) {
            throw DmoException.storage(operation, "Connection pool not initialized. Call init() first.", null);
        }
        try (Connection conn = pool.getConnection()) {
            return work.run(conn);
        } catch (SQLException e) {
            if (PostgresErrors.isUnavailable(e)) {
                log.warn("PostgreSQL unavailable during {}: {}", operation, e.getMessage());
                throw DmoException.unavailable(operation, e);
            }
            log.error("PostgreSQL operation {} failed", operation, e);
            throw DmoException.storage(operation, e.getMessage(), e);
        }
    }

    // visible for tests
    DataSource dataSource() {
        return dataSource;
    }

    private static <T> T inTransaction(Connection conn, SqlBlock<T> block) throws SQLException {
        conn.setAutoCommit(false);
        try {
            T result = block.run();
            conn.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private HikariConfig hikariConfig() {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName(POOL_NAME);
        hikari.setJdbcUrl(config.jdbcUrl());
        if (config.username() != null) {
            hikari.setUsername(config.username());
        }
        if (config.password() != null) {
            hikari.setPassword(config.password());
        }
        hikari.setMinimumIdle(config.minIdle());
        hikari.setMaximumPoolSize(config.maxPoolSize());
        hikari.setConnectionTimeout(config.connectionTimeoutMs());
        return hikari;
    }

    private static Routine requireRoutine(Connection conn, long routineId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM routines WHERE id = ?")) {
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
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM activities WHERE id = ?")) {
            ps.setLong(1, activityId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw DmoException.activityNotFound(activityId);
                }
                return toActivity(rs);
            }
        }
    }

    private static OffsetDateTime timestamp(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, OffsetDateTime.class).toInstant();
    }

    private static Routine toRoutine(ResultSet rs) throws SQLException {
        return new Routine(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("description"),
            rs.getBoolean("active"),
            rs.getString("timezone"),
            instant(rs, "created_at"),
            instant(rs, "updated_at")
        );
    }

    private static Activity toActivity(ResultSet rs) throws SQLException {
        return new Activity(
            rs.getLong("id"),
            rs.getLong("routine_id"),
            rs.getString("name"),
            rs.getInt("order"),
            instant(rs, "created_at"),
            instant(rs, "updated_at")
        );
    }

    private static CompletionRecord toCompletion(ResultSet rs) throws SQLException {
        return new CompletionRecord(
            rs.getLong("id"),
            rs.getLong("routine_id"),
            rs.getObject("date", LocalDate.class),
            rs.getBoolean("completed"),
            rs.getString("note"),
            instant(rs, "created_at"),
            instant(rs, "updated_at")
        );
    }
}
