package com.ryuqq.dmo.core.model;

import java.time.Instant;

/**
 * 활동 부분 수정 입력 (merge-patch).
 *
 * @param name 새 이름 (null이면 유지)
 * @param order 새 순서 (null이면 유지)
 *
 * @author DMO Team
 * @since 1.0.0
 */
public record ActivityPatch(String name, Integer order) {

    public ActivityPatch {
        if (name != null) {
            name = Texts.requireName("name", name, NewActivity.MAX_NAME_LENGTH);
        }
        if (order != null) {
            Texts.requireOrder(order);
        }
    }

    public static ActivityPatch ofName(String name) {
        return new ActivityPatch(name, null);
    }

    public static ActivityPatch ofOrder(int order) {
        return new ActivityPatch(null, order);
    }

    public boolean isEmpty() {
        return name == null && order == null;
    }

    /**
     * 기존 활동에 패치 적용.
     *
     * @param current 현재 활동
     * @param updatedAt 새 수정 시각
     * @return 패치가 적용된 활동
     */
    public Activity applyTo(Activity current, Instant updatedAt) {
        return new Activity(
            current.id(),
            current.routineId(),
            name != null ? name : current.name(),
            order != null ? order : current.order(),
            current.createdAt(),
            updatedAt
        );
    }
}
