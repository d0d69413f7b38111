package com.ryuqq.dmo.adapter.sqlite;

import com.ryuqq.dmo.core.error.DmoException;
import com.ryuqq.dmo.core.error.ErrorCode;
import com.ryuqq.dmo.core.model.Activity;
import com.ryuqq.dmo.core.model.CompletionRecord;
import com.ryuqq.dmo.core.model.NewActivity;
import com.ryuqq.dmo.core.model.NewRoutine;
import com.ryuqq.dmo.core.model.Routine;
import com.ryuqq.dmo.testkit.contract.TestClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * SQLite 파일 저장소 고유 동작 테스트.
 */
class SqliteStorageBackendTest {

    @TempDir
    Path tempDir;

    @Test
    void init_MissingParentDirectory_CreatesIt() {
        // Given
        Path file = tempDir.resolve("nested").resolve("dir").resolve("dmo.db");
        SqliteStorageBackend backend = new SqliteStorageBackend(SqliteConfig.file(file));

        // When
        backend.init();
        backend.close();

        // Then
        assertTrue(Files.exists(file));
    }

    @Test
    void reopen_SameFile_KeepsDataAndTimestamps() {
        // Given
        Path file = tempDir.resolve("dmo.db");
        TestClock clock = new TestClock(Instant.parse("2026-02-01T09:00:00.123456Z"));
        Routine routine;
        Activity activity;
        CompletionRecord record;
        try (SqliteStorageBackend first = new SqliteStorageBackend(SqliteConfig.file(file), clock)) {
            first.init();
            routine = first.createRoutine(new NewRoutine("Morning Routine", "desc", "UTC"));
            activity = first.createActivity(new NewActivity(routine.id(), "Meditate", 3));
            record = first.setCompletion(routine.id(), LocalDate.of(2026, 2, 1), true, "note");
        }

        // When
        try (SqliteStorageBackend second = new SqliteStorageBackend(SqliteConfig.file(file), clock)) {
            second.init();

            // Then
            assertEquals(routine, second.getRoutine(routine.id()));
            assertEquals(activity, second.getActivity(activity.id()));
            assertEquals(record, second.getCompletion(routine.id(), LocalDate.of(2026, 2, 1)).orElseThrow());
            assertEquals(Instant.parse("2026-02-01T09:00:00.123456Z"), second.getRoutine(routine.id()).createdAt());
        }
    }

    @Test
    void timestamps_SubMicrosecondPrecision_IsTruncated() {
        // Given
        TestClock clock = new TestClock(Instant.parse("2026-02-01T09:00:00.123456789Z"));
        try (SqliteStorageBackend backend = new SqliteStorageBackend(SqliteConfig.inMemory(), clock)) {
            backend.init();

            // When
            Routine routine = backend.createRoutine(NewRoutine.of("Precise"));

            // Then
            assertEquals(Instant.parse("2026-02-01T09:00:00.123456Z"), routine.createdAt());
            assertEquals(routine, backend.getRoutine(routine.id()));
        }
    }

    @Test
    void inMemoryDatabase_IsDiscardedOnClose() {
        // Given
        SqliteStorageBackend backend = new SqliteStorageBackend(SqliteConfig.inMemory());
        backend.init();
        backend.createRoutine(NewRoutine.of("Temp"));

        // When
        backend.close();
        backend.init();

        // Then
        assertThat(backend.listRoutines(true)).isEmpty();
        backend.close();
    }

    @Test
    void init_UnwritableLocation_FailsWithStorageError() throws Exception {
        // Given
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        SqliteStorageBackend backend = new SqliteStorageBackend(SqliteConfig.file(blocker.resolve("dmo.db")));

        // When / Then
        assertThatThrownBy(backend::init)
            .isInstanceOfSatisfying(DmoException.class, e -> {
                assertThat(e.getCode()).isEqualTo(ErrorCode.STORAGE_FAILURE);
                assertThat(e.getOperation()).isEqualTo("init");
            });
    }

    @Test
    void constructor_NullArguments_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> new SqliteStorageBackend(null));
        assertThrows(IllegalArgumentException.class,
            () -> new SqliteStorageBackend(SqliteConfig.inMemory(), null));
    }

    @Test
    void name_IsSqlite() {
        assertEquals("sqlite", new SqliteStorageBackend(SqliteConfig.inMemory()).name());
    }
}
