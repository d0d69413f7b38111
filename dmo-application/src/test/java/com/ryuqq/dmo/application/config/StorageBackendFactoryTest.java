package com.ryuqq.dmo.application.config;

import com.ryuqq.dmo.adapter.inmemory.InMemoryStorageBackend;
import com.ryuqq.dmo.adapter.postgres.PostgresConfig;
import com.ryuqq.dmo.adapter.postgres.PostgresStorageBackend;
import com.ryuqq.dmo.adapter.sqlite.SqliteConfig;
import com.ryuqq.dmo.adapter.sqlite.SqliteStorageBackend;
import com.ryuqq.dmo.core.model.NewRoutine;
import com.ryuqq.dmo.core.spi.StorageBackend;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * StorageBackendFactory 테스트.
 */
class StorageBackendFactoryTest {

    @TempDir
    Path tempDir;

    @Test
    void create_Memory_ReturnsInMemoryBackend() {
        StorageBackend backend = StorageBackendFactory.create(StorageSettings.memory());

        assertThat(backend).isInstanceOf(InMemoryStorageBackend.class);
        assertThat(backend.name()).isEqualTo("memory");
    }

    @Test
    void create_Sqlite_ReturnsUsableFileBackend() {
        // Given
        StorageSettings settings = StorageSettings.sqlite(SqliteConfig.file(tempDir.resolve("dmo.db")));

        // When
        try (StorageBackend backend = StorageBackendFactory.create(settings)) {
            backend.init();
            backend.createRoutine(NewRoutine.of("Morning Routine"));

            // Then
            assertThat(backend).isInstanceOf(SqliteStorageBackend.class);
            assertThat(backend.listRoutines(true)).hasSize(1);
        }
    }

    @Test
    void create_Postgres_ReturnsPooledBackendWithoutConnecting() {
        StorageSettings settings = StorageSettings.postgres(
            PostgresConfig.of("jdbc:postgresql://localhost:5432/dmo", "dmo", "dmo"));

        StorageBackend backend = StorageBackendFactory.create(settings);

        assertThat(backend).isInstanceOf(PostgresStorageBackend.class);
        assertThat(backend.name()).isEqualTo("postgres");
    }

    @Test
    void create_NullSettings_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> StorageBackendFactory.create(null));
    }
}
