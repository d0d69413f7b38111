package com.ryuqq.dmo.core.error;

import com.ryuqq.dmo.core.model.EntityType;

import java.time.LocalDate;

/**
 * DMO 코어의 단일 예외 타입.
 *
 * <p>클래스 계층 대신 {@link ErrorCode}(→ {@link ErrorKind}) 태그와 구조화된 페이로드로
 * 오류를 표현합니다. 백엔드는 드라이버 고유 예외(SQLException 등)를 경계에서 반드시
 * 이 타입으로 변환해야 합니다.</p>
 *
 * <p><strong>페이로드:</strong></p>
 * <ul>
 *   <li>NOT_FOUND: entityType, entityId</li>
 *   <li>DUPLICATE_NAME: entityType, name</li>
 *   <li>STORAGE_*: operation, cause</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try {
 *     service.getRoutine(id);
 * } catch (DmoException e) {
 *     switch (e.getKind()) {
 *         case NOT_FOUND -&gt; respond(404, e.getMessage());
 *         case VALIDATION, INVALID_RANGE -&gt; respond(400, e.getMessage());
 *         case STORAGE -&gt; respond(e.isRetryable() ? 503 : 500, e.getMessage());
 *     }
 * }
 * </pre>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public final class DmoException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode code;
    private final EntityType entityType;
    private final Long entityId;
    private final String name;
    private final String operation;

    private DmoException(ErrorCode code,
                         String message,
                         EntityType entityType,
                         Long entityId,
                         String name,
                         String operation,
                         Throwable cause) {
        super(message, cause);
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        this.code = code;
        this.entityType = entityType;
        this.entityId = entityId;
        this.name = name;
        this.operation = operation;
    }

    /**
     * 루틴 없음.
     *
     * @param routineId 찾지 못한 루틴 ID
     * @return DmoException (ROUTINE_NOT_FOUND)
     */
    public static DmoException routineNotFound(long routineId) {
        return new DmoException(ErrorCode.ROUTINE_NOT_FOUND,
            "DMO not found: " + routineId,
            EntityType.ROUTINE, routineId, null, null, null);
    }

    /**
     * 활동 없음.
     *
     * @param activityId 찾지 못한 활동 ID
     * @return DmoException (ACTIVITY_NOT_FOUND)
     */
    public static DmoException activityNotFound(long activityId) {
        return new DmoException(ErrorCode.ACTIVITY_NOT_FOUND,
            "Activity not found: " + activityId,
            EntityType.ACTIVITY, activityId, null, null, null);
    }

    /**
     * 이름 중복.
     *
     * @param entityType 엔티티 종류
     * @param name 충돌한 이름
     * @return DmoException (DUPLICATE_NAME)
     */
    public static DmoException duplicateName(EntityType entityType, String name) {
        return duplicateName(entityType, name, null);
    }

    /**
     * 이름 중복 (제약 조건 위반 원인 포함).
     *
     * @param entityType 엔티티 종류
     * @param name 충돌한 이름
     * @param cause 백엔드의 제약 조건 위반 예외
     * @return DmoException (DUPLICATE_NAME)
     */
    public static DmoException duplicateName(EntityType entityType, String name, Throwable cause) {
        return new DmoException(ErrorCode.DUPLICATE_NAME,
            "Duplicate " + entityType.displayName() + " name: '" + name + "'",
            entityType, null, name, null, cause);
    }

    /**
     * 형식이 잘못된 입력.
     *
     * @param message 상세 메시지
     * @return DmoException (INVALID_INPUT)
     */
    public static DmoException invalidInput(String message) {
        return new DmoException(ErrorCode.INVALID_INPUT, message, null, null, null, null, null);
    }

    /**
     * start &gt; end.
     *
     * @param start 시작일
     * @param end 종료일
     * @return DmoException (INVALID_RANGE)
     */
    public static DmoException invalidRange(LocalDate start, LocalDate end) {
        return new DmoException(ErrorCode.INVALID_RANGE,
            "start (" + start + ") must be <= end (" + end + ")",
            null, null, null, null, null);
    }

    /**
     * 백엔드 실패.
     *
     * @param operation 실패한 연산 이름 (예: create_routine)
     * @param detail 상세 메시지
     * @param cause 원인 (null 허용)
     * @return DmoException (STORAGE_FAILURE)
     */
    public static DmoException storage(String operation, String detail, Throwable cause) {
        return new DmoException(ErrorCode.STORAGE_FAILURE,
            "Storage operation failed: " + operation + (detail != null ? " (" + detail + ")" : ""),
            null, null, null, operation, cause);
    }

    /**
     * 일시적 백엔드 실패 (풀 고갈, 연결 불가). 재시도 가능.
     *
     * @param operation 실패한 연산 이름
     * @param cause 원인
     * @return DmoException (STORAGE_UNAVAILABLE)
     */
    public static DmoException unavailable(String operation, Throwable cause) {
        return new DmoException(ErrorCode.STORAGE_UNAVAILABLE,
            "Storage temporarily unavailable: " + operation,
            null, null, null, operation, cause);
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorKind getKind() {
        return code.kind();
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }

    /**
     * 관련 엔티티 종류 (NOT_FOUND, DUPLICATE_NAME 에서만 설정).
     *
     * @return 엔티티 종류, 없으면 null
     */
    public EntityType getEntityType() {
        return entityType;
    }

    /**
     * 찾지 못한 엔티티 ID (NOT_FOUND 에서만 설정).
     *
     * @return 엔티티 ID, 없으면 null
     */
    public Long getEntityId() {
        return entityId;
    }

    /**
     * 충돌한 이름 (DUPLICATE_NAME 에서만 설정).
     *
     * @return 이름, 없으면 null
     */
    public String getName() {
        return name;
    }

    /**
     * 실패한 연산 이름 (STORAGE 에서만 설정).
     *
     * @return 연산 이름, 없으면 null
     */
    public String getOperation() {
        return operation;
    }
}
