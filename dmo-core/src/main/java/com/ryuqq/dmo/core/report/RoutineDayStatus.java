package com.ryuqq.dmo.core.report;

import com.ryuqq.dmo.core.model.Routine;

import java.util.List;

/**
 * 일일 리포트의 루틴 한 건.
 *
 * @param routine 루틴
 * @param completed 해당 날짜 완료 여부
 * @param note 메모 (null 허용)
 * @param activities 활동 이름 목록 (order, 생성 순)
 *
 * @author DMO Team
 * @since 1.0.0
 */
public record RoutineDayStatus(Routine routine, boolean completed, String note, List<String> activities) {

    public RoutineDayStatus {
        if (routine == null) {
            throw new IllegalArgumentException("routine cannot be null");
        }
        activities = activities == null ? List.of() : List.copyOf(activities);
    }
}
