package com.ryuqq.dmo.application.config;

import com.ryuqq.dmo.adapter.inmemory.InMemoryStorageBackend;
import com.ryuqq.dmo.adapter.postgres.PostgresStorageBackend;
import com.ryuqq.dmo.adapter.sqlite.SqliteStorageBackend;
import com.ryuqq.dmo.core.spi.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * 설정에 맞는 {@link StorageBackend} 생성.
 *
 * <p>생성만 하며 {@code init()}은 호출자가 합니다.</p>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public final class StorageBackendFactory {

    private static final Logger log = LoggerFactory.getLogger(StorageBackendFactory.class);

    private StorageBackendFactory() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static StorageBackend create(StorageSettings settings) {
        return create(settings, Clock.systemUTC());
    }

    /**
     * 주어진 시계를 쓰는 백엔드 생성.
     *
     * @param settings 저장소 설정
     * @param clock 타임스탬프 시계
     * @return 초기화 전 백엔드
     */
    public static StorageBackend create(StorageSettings settings, Clock clock) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        log.info("Selected storage backend: {}", settings.kind().key());
        switch (settings.kind()) {
            case MEMORY:
                return new InMemoryStorageBackend(clock);
            case POSTGRES:
                return new PostgresStorageBackend(settings.postgres(), clock);
            case SQLITE:
            default:
                return new SqliteStorageBackend(settings.sqlite(), clock);
        }
    }
}
