package com.ryuqq.dmo.core.model;

import java.time.Instant;

/**
 * 루틴 부분 수정 입력 (merge-patch).
 *
 * <p>null 필드는 "제공되지 않음"을 뜻하며 기존 값을 유지합니다.
 * 따라서 description/timezone을 null로 되돌리는 것은 이 타입으로 표현할 수 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RoutinePatch patch = RoutinePatch.empty()
 *     .withName("Evening Routine")
 *     .withActive(false);
 * </pre>
 *
 * @param name 새 이름 (null이면 유지)
 * @param description 새 설명 (null이면 유지)
 * @param timezone 새 시간대 (null이면 유지)
 * @param active 새 활성 여부 (null이면 유지)
 *
 * @author DMO Team
 * @since 1.0.0
 */
public record RoutinePatch(String name, String description, String timezone, Boolean active) {

    private static final RoutinePatch EMPTY = new RoutinePatch(null, null, null, null);

    public RoutinePatch {
        if (name != null) {
            name = Texts.requireName("name", name, NewRoutine.MAX_NAME_LENGTH);
        }
        description = Texts.optional("description", description, NewRoutine.MAX_DESCRIPTION_LENGTH);
        timezone = Texts.optional("timezone", timezone, NewRoutine.MAX_TIMEZONE_LENGTH);
    }

    /**
     * 아무 필드도 바꾸지 않는 패치.
     *
     * @return 빈 패치
     */
    public static RoutinePatch empty() {
        return EMPTY;
    }

    public RoutinePatch withName(String name) {
        return new RoutinePatch(name, description, timezone, active);
    }

    public RoutinePatch withDescription(String description) {
        return new RoutinePatch(name, description, timezone, active);
    }

    public RoutinePatch withTimezone(String timezone) {
        return new RoutinePatch(name, description, timezone, active);
    }

    public RoutinePatch withActive(boolean active) {
        return new RoutinePatch(name, description, timezone, active);
    }

    /**
     * 변경할 필드가 하나도 없는지 확인.
     *
     * @return 모든 필드가 null이면 true
     */
    public boolean isEmpty() {
        return name == null && description == null && timezone == null && active == null;
    }

    /**
     * 기존 루틴에 패치를 적용한 결과.
     *
     * @param current 현재 루틴
     * @param updatedAt 새 수정 시각
     * @return 패치가 적용된 루틴
     */
    public Routine applyTo(Routine current, Instant updatedAt) {
        return new Routine(
            current.id(),
            name != null ? name : current.name(),
            description != null ? description : current.description(),
            active != null ? active : current.active(),
            timezone != null ? timezone : current.timezone(),
            current.createdAt(),
            updatedAt
        );
    }
}
