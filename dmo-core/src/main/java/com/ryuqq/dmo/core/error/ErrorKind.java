package com.ryuqq.dmo.core.error;

/**
 * 오류 분류.
 *
 * <p>모든 {@link ErrorCode}는 정확히 하나의 ErrorKind에 속합니다.
 * 호출자(API/CLI)는 이 값만으로 사용자 응답을 결정할 수 있습니다.</p>
 *
 * <ul>
 *   <li>NOT_FOUND: 루틴 또는 활동이 존재하지 않음</li>
 *   <li>VALIDATION: 잘못된 입력 (이름 중복 포함)</li>
 *   <li>INVALID_RANGE: 시작일이 종료일보다 늦음</li>
 *   <li>STORAGE: 호출자 입력과 무관한 백엔드 실패</li>
 * </ul>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public enum ErrorKind {

    NOT_FOUND,

    VALIDATION,

    INVALID_RANGE,

    STORAGE
}
