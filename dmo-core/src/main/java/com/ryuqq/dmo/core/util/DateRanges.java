package com.ryuqq.dmo.core.util;

import com.ryuqq.dmo.core.error.DmoException;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Calendar day sequences.
 *
 * @author DMO Team
 * @since 1.0.0
 */
public final class DateRanges {

    private DateRanges() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Rejects reversed ranges.
     *
     * @param start start date (inclusive)
     * @param end end date (inclusive)
     * @throws IllegalArgumentException if either date is null
     * @throws DmoException INVALID_RANGE if start is after end
     */
    public static void requireOrdered(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Dates cannot be null (start: " + start + ", end: " + end + ")");
        }
        if (start.isAfter(end)) {
            throw DmoException.invalidRange(start, end);
        }
    }

    /**
     * Every date from start to end, both inclusive, ascending.
     *
     * @param start start date
     * @param end end date
     * @return the day sequence (at least one element)
     * @throws DmoException INVALID_RANGE if start is after end
     */
    public static List<LocalDate> days(LocalDate start, LocalDate end) {
        requireOrdered(start, end);
        List<LocalDate> result = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            result.add(d);
        }
        return result;
    }

    /**
     * Resolves a calendar month, 28-31 days depending on the month and leap year.
     *
     * @param year year, e.g. 2026
     * @param month month 1-12
     * @return the year-month
     * @throws DmoException INVALID_INPUT if the month is outside 1..12
     */
    /**
     * 포함 범위의 일수. 날짜 목록을 만들지 않습니다.
     *
     * @throws DmoException start &gt; end (INVALID_RANGE), int로 셀 수 없는 범위 (INVALID_INPUT)
     */
    public static int dayCount(LocalDate start, LocalDate end) {
        requireOrdered(start, end);
        long count = ChronoUnit.DAYS.between(start, end) + 1;
        if (count > Integer.MAX_VALUE) {
            throw DmoException.invalidInput("date range spans too many days (current: " + count + ")");
        }
        return (int) count;
    }

    public static YearMonth month(int year, int month) {
        try {
            return YearMonth.of(year, month);
        } catch (DateTimeException e) {
            throw DmoException.invalidInput("month must be between 1 and 12 (current: " + month + ")");
        }
    }

    /**
     * Every date of the given month, ascending.
     *
     * @param month the year-month
     * @return the day sequence
     */
    public static List<LocalDate> days(YearMonth month) {
        return days(month.atDay(1), month.atEndOfMonth());
    }
}
