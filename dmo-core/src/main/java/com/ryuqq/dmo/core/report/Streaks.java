package com.ryuqq.dmo.core.report;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 연속 완료(streak) 계산 결과.
 *
 * <p><strong>정의:</strong></p>
 * <ul>
 *   <li>longest: 목록 위치 기준으로 연속된 완료 날짜의 최장 길이</li>
 *   <li>current: 마지막 날짜부터 거꾸로 세어 처음 미완료(또는 기록 없음)를 만날 때까지의 길이.
 *       마지막 날짜가 미완료면 0</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 0 &lt;= current &lt;= longest &lt;= 전체 날짜 수</p>
 *
 * @param current 현재 연속 일수
 * @param longest 최장 연속 일수
 *
 * @author DMO Team
 * @since 1.0.0
 */
public record Streaks(int current, int longest) {

    private static final Streaks NONE = new Streaks(0, 0);

    public Streaks {
        if (current < 0 || longest < 0) {
            throw new IllegalArgumentException(
                "streaks cannot be negative (current: " + current + ", longest: " + longest + ")");
        }
        if (current > longest) {
            throw new IllegalArgumentException(
                "current streak cannot exceed longest (current: " + current + ", longest: " + longest + ")");
        }
    }

    /**
     * 연속 기록이 없는 결과.
     *
     * @return (0, 0)
     */
    public static Streaks none() {
        return NONE;
    }

    /**
     * 정방향 1회 + 역방향 1회 순회로 streak 계산.
     *
     * <p>저장소 조회 없이 이미 읽어 온 완료 날짜 집합만 사용합니다.</p>
     *
     * @param completedDates 완료로 표시된 날짜 집합
     * @param allDates 범위 내 모든 날짜 (오름차순)
     * @return 계산된 streak
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static Streaks calculate(Set<LocalDate> completedDates, List<LocalDate> allDates) {
        if (completedDates == null || allDates == null) {
            throw new IllegalArgumentException("completedDates and allDates cannot be null");
        }
        if (allDates.isEmpty()) {
            return NONE;
        }

        int longest = 0;
        int run = 0;
        for (LocalDate date : allDates) {
            if (completedDates.contains(date)) {
                run++;
                longest = Math.max(longest, run);
            } else {
                run = 0;
            }
        }

        int current = 0;
        for (int i = allDates.size() - 1; i >= 0; i--) {
            if (!completedDates.contains(allDates.get(i))) {
                break;
            }
            current++;
        }

        return new Streaks(current, longest);
    }

    /**
     * 완료 날짜만 정렬해 훑는 streak 계산. 범위 길이와 무관하게 완료 날짜 수에 비례합니다.
     *
     * <p>{@link #calculate(Set, List)}에 범위의 모든 날짜를 넘긴 결과와 같습니다.</p>
     *
     * @param completedDates 완료로 표시된 날짜 (범위 밖 날짜는 무시)
     * @param start 시작일 (포함)
     * @param end 종료일 (포함)
     * @return 계산된 streak
     * @throws IllegalArgumentException 인자가 null이거나 start &gt; end인 경우
     */
    public static Streaks overRange(Collection<LocalDate> completedDates, LocalDate start, LocalDate end) {
        if (completedDates == null || start == null || end == null) {
            throw new IllegalArgumentException("completedDates, start and end cannot be null");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start cannot be after end (start: " + start + ", end: " + end + ")");
        }

        TreeSet<LocalDate> sorted = new TreeSet<>();
        for (LocalDate date : completedDates) {
            if (!date.isBefore(start) && !date.isAfter(end)) {
                sorted.add(date);
            }
        }

        int longest = 0;
        int run = 0;
        LocalDate previous = null;
        for (LocalDate date : sorted) {
            run = previous != null && previous.plusDays(1).equals(date) ? run + 1 : 1;
            longest = Math.max(longest, run);
            previous = date;
        }

        int current = previous != null && previous.equals(end) ? run : 0;
        return new Streaks(current, longest);
    }
}
