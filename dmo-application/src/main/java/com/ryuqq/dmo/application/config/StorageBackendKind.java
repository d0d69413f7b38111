package com.ryuqq.dmo.application.config;

import com.ryuqq.dmo.core.error.DmoException;

import java.util.Locale;

/**
 * 선택 가능한 저장소 엔진.
 *
 * @author DMO Team
 * @since 1.0.0
 */
public enum StorageBackendKind {

    /** 휘발성 메모리 (테스트 전용). */
    MEMORY("memory"),

    /** 단일 파일 SQLite (기본값). */
    SQLITE("sqlite"),

    /** 커넥션 풀을 쓰는 PostgreSQL. */
    POSTGRES("postgres");

    private final String key;

    StorageBackendKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * 설정 값으로 엔진 선택 (대소문자, 앞뒤 공백 무시).
     *
     * @param value STORAGE_BACKEND 값
     * @return 엔진 종류
     * @throws DmoException INVALID_INPUT (알 수 없는 값)
     */
    public static StorageBackendKind fromKey(String value) {
        if (value == null) {
            throw DmoException.invalidInput("Storage backend cannot be null");
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (StorageBackendKind kind : values()) {
            if (kind.key.equals(normalized)) {
                return kind;
            }
        }
        throw DmoException.invalidInput(
            "Unknown storage backend: '" + value + "' (expected memory, sqlite or postgres)");
    }
}
