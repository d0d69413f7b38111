package com.ryuqq.dmo.core.report;

import java.time.LocalDate;
import java.util.List;

/**
 * 특정 날짜의 활성 루틴 전체 현황. 비활성 루틴은 포함되지 않습니다.
 *
 * @param date 리포트 날짜
 * @param routines 활성 루틴별 상태 (이름 오름차순)
 *
 * @author DMO Team
 * @since 1.0.0
 */
public record DailyReport(LocalDate date, List<RoutineDayStatus> routines) {

    public DailyReport {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        routines = routines == null ? List.of() : List.copyOf(routines);
    }
}
