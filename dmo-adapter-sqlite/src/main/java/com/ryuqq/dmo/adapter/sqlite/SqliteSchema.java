package com.ryuqq.dmo.adapter.sqlite;

import java.util.List;

/**
 * DDL for the embedded engine. Every statement is idempotent.
 */
final class SqliteSchema {

    static final List<String> STATEMENTS = List.of(
        """
        CREATE TABLE IF NOT EXISTS routines (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            name TEXT NOT NULL UNIQUE,
            description TEXT,
            active INTEGER NOT NULL DEFAULT 1,
            timezone TEXT,
            created_at TEXT NOT NULL,
            updated_at TEXT NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS activities (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            routine_id INTEGER NOT NULL,
            name TEXT NOT NULL,
            "order" INTEGER NOT NULL DEFAULT 0,
            created_at TEXT NOT NULL,
            updated_at TEXT NOT NULL,
            FOREIGN KEY (routine_id) REFERENCES routines(id) ON DELETE CASCADE
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_activities_routine_id ON activities(routine_id)",
        "CREATE INDEX IF NOT EXISTS idx_activities_order ON activities(routine_id, \"order\")",
        """
        CREATE TABLE IF NOT EXISTS completions (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            routine_id INTEGER NOT NULL,
            date TEXT NOT NULL,
            completed INTEGER NOT NULL,
            note TEXT,
            created_at TEXT NOT NULL,
            updated_at TEXT NOT NULL,
            FOREIGN KEY (routine_id) REFERENCES routines(id) ON DELETE CASCADE,
            UNIQUE (routine_id, date)
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_completions_routine_date ON completions(routine_id, date)"
    );

    private SqliteSchema() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
