package com.ryuqq.dmo.core.model;

import java.time.Instant;

/**
 * 추적 대상 일일 루틴 (DMO).
 *
 * <p>저장소가 반환하는 읽기 모델입니다. 모든 필드가 채워진 상태로만 생성됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>id는 할당 후 변경 불가</li>
 *   <li>name은 전체 루틴에서 유일 (대소문자 구분, trim 후 정확히 일치)</li>
 *   <li>updatedAt &gt;= createdAt</li>
 * </ul>
 *
 * @param id 루틴 ID
 * @param name 이름 (1~255자)
 * @param description 설명 (null 허용)
 * @param active 활성 여부
 * @param timezone 시간대 라벨 (null 허용)
 * @param createdAt 생성 시각 (UTC)
 * @param updatedAt 수정 시각 (UTC)
 *
 * @author DMO Team
 * @since 1.0.0
 */
public record Routine(
    long id,
    String name,
    String description,
    boolean active,
    String timezone,
    Instant createdAt,
    Instant updatedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name 또는 타임스탬프가 null인 경우
     */
    public Routine {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("timestamps cannot be null");
        }
    }

    /**
     * 현재 생명주기 상태.
     *
     * @return ACTIVE 또는 INACTIVE
     */
    public RoutineState state() {
        return RoutineState.of(active);
    }
}
