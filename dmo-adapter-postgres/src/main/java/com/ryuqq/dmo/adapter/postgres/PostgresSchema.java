package com.ryuqq.dmo.adapter.postgres;

import java.util.List;

/**
 * DDL for the networked engine. Every statement is idempotent.
 */
final class PostgresSchema {

    static final List<String> STATEMENTS = List.of(
        """
        CREATE TABLE IF NOT EXISTS routines (
            id BIGSERIAL PRIMARY KEY,
            name TEXT NOT NULL UNIQUE,
            description TEXT,
            active BOOLEAN NOT NULL DEFAULT TRUE,
            timezone TEXT,
            created_at TIMESTAMPTZ NOT NULL,
            updated_at TIMESTAMPTZ NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS activities (
            id BIGSERIAL PRIMARY KEY,
            routine_id BIGINT NOT NULL REFERENCES routines(id) ON DELETE CASCADE,
            name TEXT NOT NULL,
            "order" INTEGER NOT NULL DEFAULT 0,
            created_at TIMESTAMPTZ NOT NULL,
            updated_at TIMESTAMPTZ NOT NULL
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_activities_routine_id ON activities(routine_id)",
        "CREATE INDEX IF NOT EXISTS idx_activities_order ON activities(routine_id, \"order\")",
        """
        CREATE TABLE IF NOT EXISTS completions (
            id BIGSERIAL PRIMARY KEY,
            routine_id BIGINT NOT NULL REFERENCES routines(id) ON DELETE CASCADE,
            date DATE NOT NULL,
            completed BOOLEAN NOT NULL,
            note TEXT,
            created_at TIMESTAMPTZ NOT NULL,
            updated_at TIMESTAMPTZ NOT NULL,
            UNIQUE (routine_id, date)
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_completions_routine_date ON completions(routine_id, date)"
    );

    private PostgresSchema() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
