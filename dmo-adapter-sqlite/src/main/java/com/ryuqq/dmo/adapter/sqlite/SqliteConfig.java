package com.ryuqq.dmo.adapter.sqlite;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * SQLite backend configuration (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>databasePath: database file; {@code null} selects a private in-memory database
 *       (default {@code ~/.dmo/dmo.db})</li>
 *   <li>busyTimeoutMs: how long a statement waits on a locked file (default 5000ms)</li>
 * </ul>
 *
 * @author DMO Team
 * @since 1.0.0
 * @param databasePath database file, or null for an in-memory database
 * @param busyTimeoutMs lock wait in milliseconds (0 or more)
 */
public record SqliteConfig(Path databasePath, int busyTimeoutMs) {

    /**
     * Default database location.
     */
    public static final Path DEFAULT_PATH = Paths.get(System.getProperty("user.home"), ".dmo", "dmo.db");

    private static final int DEFAULT_BUSY_TIMEOUT_MS = 5000;

    /**
     * Default settings: {@code ~/.dmo/dmo.db}, busyTimeoutMs=5000.
     */
    public SqliteConfig() {
        this(DEFAULT_PATH, DEFAULT_BUSY_TIMEOUT_MS);
    }

    /**
     * Compact constructor (validation).
     *
     * @throws IllegalArgumentException if busyTimeoutMs is negative
     */
    public SqliteConfig {
        if (busyTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "busyTimeoutMs must not be negative (current: " + busyTimeoutMs + ")"
            );
        }
    }

    /**
     * Settings for a database file at the given path.
     *
     * @param databasePath database file
     * @return config
     */
    public static SqliteConfig file(Path databasePath) {
        if (databasePath == null) {
            throw new IllegalArgumentException("databasePath cannot be null");
        }
        return new SqliteConfig(databasePath, DEFAULT_BUSY_TIMEOUT_MS);
    }

    /**
     * Settings for a private in-memory database, discarded on {@code close()}.
     *
     * @return config
     */
    public static SqliteConfig inMemory() {
        return new SqliteConfig(null, DEFAULT_BUSY_TIMEOUT_MS);
    }

    public SqliteConfig withBusyTimeoutMs(int busyTimeoutMs) {
        return new SqliteConfig(databasePath, busyTimeoutMs);
    }

    public boolean isInMemory() {
        return databasePath == null;
    }

    /**
     * JDBC URL for the sqlite-jdbc driver.
     *
     * @return e.g. {@code jdbc:sqlite:/home/me/.dmo/dmo.db}
     */
    public String jdbcUrl() {
        return isInMemory() ? "jdbc:sqlite::memory:" : "jdbc:sqlite:" + databasePath.toAbsolutePath();
    }
}
