package com.ryuqq.dmo.core.model;

import java.time.Instant;

/**
 * 루틴에 속한 체크리스트 단계.
 *
 * <p>정보 제공용이며 완료 상태에는 영향을 주지 않습니다.</p>
 *
 * @param id 활동 ID
 * @param routineId 소유 루틴 ID
 * @param name 이름 (1~500자)
 * @param order 정렬 순서 (0 이상, 중복 허용)
 * @param createdAt 생성 시각 (UTC)
 * @param updatedAt 수정 시각 (UTC)
 *
 * @author DMO Team
 * @since 1.0.0
 */
public record Activity(
    long id,
    long routineId,
    String name,
    int order,
    Instant createdAt,
    Instant updatedAt
) {

    public Activity {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("timestamps cannot be null");
        }
    }
}
