package com.ryuqq.dmo.core.model;

/**
 * 루틴의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <pre>
 *            deactivate
 *   ACTIVE ──────────────► INACTIVE
 *      ▲                      │
 *      └──────────────────────┘
 *              activate
 *
 * - 생성 시 초기 상태: ACTIVE
 * - 이미 목표 상태라면 전이는 no-op (멱등)
 * - delete는 어느 상태에서든 종료 (되돌릴 수 없음)
 * </pre>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public enum RoutineState {

    /**
     * 활성 (일일/월간 리포트에 포함).
     */
    ACTIVE,

    /**
     * 비활성 (기본 목록과 리포트에서 제외).
     */
    INACTIVE;

    /**
     * active 플래그로부터 상태 변환.
     *
     * @param active active 플래그
     * @return ACTIVE 또는 INACTIVE
     */
    public static RoutineState of(boolean active) {
        return active ? ACTIVE : INACTIVE;
    }

    /**
     * 상태에 대응하는 active 플래그.
     *
     * @return ACTIVE이면 true
     */
    public boolean isActive() {
        return this == ACTIVE;
    }
}
