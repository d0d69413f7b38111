package com.ryuqq.dmo.application.config;

import com.ryuqq.dmo.adapter.sqlite.SqliteConfig;
import com.ryuqq.dmo.core.error.DmoException;
import com.ryuqq.dmo.core.error.ErrorCode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * StorageSettings 환경 변수 해석 테스트.
 */
class StorageSettingsTest {

    @Test
    void fromEnvironment_Empty_DefaultsToSqliteInHomeDirectory() {
        StorageSettings settings = StorageSettings.fromEnvironment(Map.of());

        assertEquals(StorageBackendKind.SQLITE, settings.kind());
        assertEquals(SqliteConfig.DEFAULT_PATH, settings.sqlite().databasePath());
        assertNull(settings.postgres());
    }

    @Test
    void fromEnvironment_SqliteWithPath_UsesPath() {
        StorageSettings settings = StorageSettings.fromEnvironment(Map.of(
            "STORAGE_BACKEND", "SQLite",
            "DMO_DB_PATH", "/var/lib/dmo/routines.db"
        ));

        assertEquals(StorageBackendKind.SQLITE, settings.kind());
        assertEquals(Path.of("/var/lib/dmo/routines.db"), settings.sqlite().databasePath());
    }

    @Test
    void fromEnvironment_Memory_SelectsMemory() {
        StorageSettings settings = StorageSettings.fromEnvironment(Map.of("STORAGE_BACKEND", " memory "));

        assertEquals(StorageBackendKind.MEMORY, settings.kind());
    }

    @Test
    void fromEnvironment_Postgres_ParsesDsnAndPoolBounds() {
        StorageSettings settings = StorageSettings.fromEnvironment(Map.of(
            "STORAGE_BACKEND", "postgres",
            "DATABASE_URL", "postgresql://dmo:pw@db:5432/dmo",
            "DMO_POOL_MIN", "2",
            "DMO_POOL_MAX", "8"
        ));

        assertEquals(StorageBackendKind.POSTGRES, settings.kind());
        assertEquals("jdbc:postgresql://db:5432/dmo", settings.postgres().jdbcUrl());
        assertEquals("dmo", settings.postgres().username());
        assertEquals(2, settings.postgres().minIdle());
        assertEquals(8, settings.postgres().maxPoolSize());
    }

    @Test
    void fromEnvironment_PostgresWithoutUrl_FailsWithInvalidInput() {
        assertThatThrownBy(() -> StorageSettings.fromEnvironment(Map.of("STORAGE_BACKEND", "postgres")))
            .isInstanceOfSatisfying(DmoException.class, e -> {
                assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_INPUT);
                assertThat(e.getMessage()).contains("DATABASE_URL");
            });
    }

    @Test
    void fromEnvironment_BadPoolSize_FailsWithInvalidInput() {
        assertThatThrownBy(() -> StorageSettings.fromEnvironment(Map.of(
            "STORAGE_BACKEND", "postgres",
            "DATABASE_URL", "postgresql://dmo:pw@db/dmo",
            "DMO_POOL_MAX", "many"
        )))
            .isInstanceOfSatisfying(DmoException.class, e -> {
                assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_INPUT);
                assertThat(e.getMessage()).contains("DMO_POOL_MAX");
            });
    }

    @Test
    void fromEnvironment_UnknownBackend_FailsWithInvalidInput() {
        assertThatThrownBy(() -> StorageSettings.fromEnvironment(Map.of("STORAGE_BACKEND", "mongo")))
            .isInstanceOfSatisfying(DmoException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_INPUT));
    }

    @Test
    void constructor_SqliteKindWithoutConfig_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new StorageSettings(StorageBackendKind.SQLITE, null, null));
    }
}
