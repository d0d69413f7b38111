package com.ryuqq.dmo.core.report;

import com.ryuqq.dmo.core.model.Routine;

import java.time.LocalDate;

/**
 * 임의 기간에 대한 루틴 성과 요약.
 *
 * @param routine 루틴
 * @param startDate 시작일 (포함)
 * @param endDate 종료일 (포함)
 * @param totalDays 전체 일수
 * @param completedDays 완료 일수
 * @param completionRate 완료율 (소수점 4자리)
 * @param currentStreak 현재 연속 일수 (종료일 기준)
 * @param longestStreak 최장 연속 일수
 *
 * @author DMO Team
 * @since 1.0.0
 */
public record RangeSummary(
    Routine routine,
    LocalDate startDate,
    LocalDate endDate,
    int totalDays,
    int completedDays,
    double completionRate,
    int currentStreak,
    int longestStreak
) {

    public RangeSummary {
        if (routine == null || startDate == null || endDate == null) {
            throw new IllegalArgumentException("routine and dates cannot be null");
        }
    }
}
