package com.ryuqq.dmo.application.config;

import com.ryuqq.dmo.adapter.postgres.PostgresConfig;
import com.ryuqq.dmo.adapter.sqlite.SqliteConfig;
import com.ryuqq.dmo.core.error.DmoException;

import java.nio.file.Path;
import java.util.Map;

/**
 * 저장소 선택과 엔진별 설정 (immutable record).
 *
 * <p><strong>환경 변수:</strong></p>
 * <ul>
 *   <li>{@code STORAGE_BACKEND}: memory | sqlite (기본값) | postgres</li>
 *   <li>{@code DATABASE_URL}: PostgreSQL DSN (postgres일 때 필수)</li>
 *   <li>{@code DMO_DB_PATH}: SQLite 파일 경로 (기본값 {@code ~/.dmo/dmo.db})</li>
 *   <li>{@code DMO_POOL_MIN} / {@code DMO_POOL_MAX}: PostgreSQL 풀 크기 (기본값 5 / 20)</li>
 * </ul>
 *
 * @param kind 선택된 엔진
 * @param sqlite SQLite 설정 (kind가 SQLITE일 때 필수)
 * @param postgres PostgreSQL 설정 (kind가 POSTGRES일 때 필수)
 *
 * @author DMO Team
 * @since 1.0.0
 */
public record StorageSettings(StorageBackendKind kind, SqliteConfig sqlite, PostgresConfig postgres) {

    public static final String STORAGE_BACKEND = "STORAGE_BACKEND";
    public static final String DATABASE_URL = "DATABASE_URL";
    public static final String DB_PATH = "DMO_DB_PATH";
    public static final String POOL_MIN = "DMO_POOL_MIN";
    public static final String POOL_MAX = "DMO_POOL_MAX";

    public StorageSettings {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind == StorageBackendKind.SQLITE && sqlite == null) {
            throw new IllegalArgumentException("sqlite config is required for the sqlite backend");
        }
        if (kind == StorageBackendKind.POSTGRES && postgres == null) {
            throw new IllegalArgumentException("postgres config is required for the postgres backend");
        }
    }

    public static StorageSettings memory() {
        return new StorageSettings(StorageBackendKind.MEMORY, null, null);
    }

    public static StorageSettings sqlite(SqliteConfig config) {
        return new StorageSettings(StorageBackendKind.SQLITE, config, null);
    }

    public static StorageSettings postgres(PostgresConfig config) {
        return new StorageSettings(StorageBackendKind.POSTGRES, null, config);
    }

    /**
     * 프로세스 환경 변수에서 설정을 읽습니다.
     *
     * @return 설정
     */
    public static StorageSettings fromSystemEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * 주어진 환경 맵에서 설정을 읽습니다.
     *
     * @param env 환경 변수 맵
     * @return 설정
     * @throws DmoException INVALID_INPUT (알 수 없는 엔진, DATABASE_URL 누락/형식 오류, 잘못된 풀 크기)
     */
    public static StorageSettings fromEnvironment(Map<String, String> env) {
        if (env == null) {
            throw new IllegalArgumentException("env cannot be null");
        }
        String backend = env.get(STORAGE_BACKEND);
        StorageBackendKind kind = isBlank(backend) ? StorageBackendKind.SQLITE : StorageBackendKind.fromKey(backend);

        switch (kind) {
            case MEMORY:
                return memory();
            case POSTGRES:
                return postgres(postgresConfig(env));
            case SQLITE:
            default:
                String path = env.get(DB_PATH);
                return sqlite(isBlank(path) ? new SqliteConfig() : SqliteConfig.file(Path.of(path.strip())));
        }
    }

    private static PostgresConfig postgresConfig(Map<String, String> env) {
        String url = env.get(DATABASE_URL);
        if (isBlank(url)) {
            throw DmoException.invalidInput("DATABASE_URL environment variable required for Postgres backend");
        }
        try {
            PostgresConfig config = PostgresConfig.fromDsn(url);
            int min = intValue(env, POOL_MIN, config.minIdle());
            int max = intValue(env, POOL_MAX, config.maxPoolSize());
            return config.withPool(min, max);
        } catch (IllegalArgumentException e) {
            throw DmoException.invalidInput("Invalid Postgres settings: " + e.getMessage());
        }
    }

    private static int intValue(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (isBlank(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + value + ")", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
