package com.ryuqq.dmo.core.report;

import java.time.LocalDate;
import java.util.List;

/**
 * 한 달 집계.
 *
 * @param totalDays 달의 전체 일수 (28~31)
 * @param completedDays 완료 일수
 * @param completionRate 완료율 (소수점 4자리)
 * @param currentStreak 현재 연속 일수 (말일 기준)
 * @param longestStreak 최장 연속 일수
 * @param missedDays 미완료 날짜 (오름차순)
 *
 * @author DMO Team
 * @since 1.0.0
 */
public record MonthSummary(
    int totalDays,
    int completedDays,
    double completionRate,
    int currentStreak,
    int longestStreak,
    List<LocalDate> missedDays
) {

    public MonthSummary {
        if (completionRate < 0.0 || completionRate > 1.0) {
            throw new IllegalArgumentException("completionRate must be between 0.0 and 1.0 (current: " + completionRate + ")");
        }
        missedDays = missedDays == null ? List.of() : List.copyOf(missedDays);
    }
}
