package com.ryuqq.dmo.core.error;

/**
 * 구체적인 오류 코드.
 *
 * <p>각 코드는 {@link ErrorKind}와 재시도 가능 여부를 함께 가집니다.</p>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public enum ErrorCode {

    /**
     * 루틴 없음.
     */
    ROUTINE_NOT_FOUND("DMO-404", ErrorKind.NOT_FOUND, false),

    /**
     * 활동 없음.
     */
    ACTIVITY_NOT_FOUND("ACT-404", ErrorKind.NOT_FOUND, false),

    /**
     * 이름 중복.
     */
    DUPLICATE_NAME("DMO-409", ErrorKind.VALIDATION, false),

    /**
     * 형식이 잘못된 입력 (길이, 공백 이름, 음수 순서 등).
     */
    INVALID_INPUT("DMO-400", ErrorKind.VALIDATION, false),

    /**
     * start &gt; end.
     */
    INVALID_RANGE("RNG-400", ErrorKind.INVALID_RANGE, false),

    /**
     * 백엔드 실패 (SQL 오류, 미초기화 상태 등).
     */
    STORAGE_FAILURE("STO-500", ErrorKind.STORAGE, false),

    /**
     * 커넥션 풀 고갈 또는 서버 연결 불가. 재시도 가능.
     */
    STORAGE_UNAVAILABLE("STO-503", ErrorKind.STORAGE, true);

    private final String code;
    private final ErrorKind kind;
    private final boolean retryable;

    ErrorCode(String code, ErrorKind kind, boolean retryable) {
        this.code = code;
        this.kind = kind;
        this.retryable = retryable;
    }

    /**
     * 외부 노출용 코드 문자열 (예: DMO-404).
     *
     * @return 코드 문자열
     */
    public String code() {
        return code;
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
