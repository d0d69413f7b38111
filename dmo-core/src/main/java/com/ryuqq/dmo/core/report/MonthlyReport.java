package com.ryuqq.dmo.core.report;

import com.ryuqq.dmo.core.model.Routine;

import java.util.List;

/**
 * 루틴 하나의 월간 리포트.
 *
 * @param routine 루틴
 * @param year 연도
 * @param month 월 (1~12)
 * @param days 일별 상태 (달의 모든 날짜, 오름차순)
 * @param summary 집계
 *
 * @author DMO Team
 * @since 1.0.0
 */
public record MonthlyReport(Routine routine, int year, int month, List<DayCompletion> days, MonthSummary summary) {

    public MonthlyReport {
        if (routine == null || summary == null) {
            throw new IllegalArgumentException("routine and summary cannot be null");
        }
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be between 1 and 12 (current: " + month + ")");
        }
        days = days == null ? List.of() : List.copyOf(days);
    }
}
