package com.ryuqq.dmo.core.util;

import com.ryuqq.dmo.core.error.DmoException;
import com.ryuqq.dmo.core.error.ErrorCode;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * DateRanges 테스트.
 */
class DateRangesTest {

    @Test
    void days_InclusiveRange_ReturnsEveryDate() {
        List<LocalDate> days = DateRanges.days(LocalDate.of(2026, 1, 30), LocalDate.of(2026, 2, 2));

        assertThat(days).containsExactly(
            LocalDate.of(2026, 1, 30), LocalDate.of(2026, 1, 31),
            LocalDate.of(2026, 2, 1), LocalDate.of(2026, 2, 2));
    }

    @Test
    void days_SameStartAndEnd_ReturnsSingleDate() {
        LocalDate day = LocalDate.of(2026, 2, 14);

        assertEquals(List.of(day), DateRanges.days(day, day));
    }

    @Test
    void requireOrdered_StartAfterEnd_ThrowsInvalidRange() {
        DmoException exception = assertThrows(DmoException.class,
            () -> DateRanges.requireOrdered(LocalDate.of(2026, 2, 2), LocalDate.of(2026, 2, 1)));
        assertEquals(ErrorCode.INVALID_RANGE, exception.getCode());
    }

    @Test
    void requireOrdered_NullDate_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> DateRanges.requireOrdered(null, LocalDate.now()));
    }

    @Test
    void dayCount_CountsInclusiveDaysWithoutListingThem() {
        assertEquals(1, DateRanges.dayCount(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 1)));
        assertEquals(366, DateRanges.dayCount(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31)));
        assertEquals(3_652_059, DateRanges.dayCount(LocalDate.of(1, 1, 1), LocalDate.of(9999, 12, 31)));
    }

    @Test
    void dayCount_BeyondIntRange_ThrowsInvalidInput() {
        DmoException exception = assertThrows(DmoException.class,
            () -> DateRanges.dayCount(LocalDate.MIN, LocalDate.MAX));
        assertEquals(ErrorCode.INVALID_INPUT, exception.getCode());
    }

    @Test
    void month_LengthFollowsCalendar() {
        assertEquals(28, DateRanges.days(DateRanges.month(2026, 2)).size());
        assertEquals(29, DateRanges.days(DateRanges.month(2024, 2)).size());
        assertEquals(31, DateRanges.days(DateRanges.month(2026, 12)).size());
        assertEquals(YearMonth.of(2026, 4), DateRanges.month(2026, 4));
    }

    @Test
    void month_OutOfRange_ThrowsInvalidInput() {
        DmoException exception = assertThrows(DmoException.class, () -> DateRanges.month(2026, 13));
        assertEquals(ErrorCode.INVALID_INPUT, exception.getCode());
        assertThrows(DmoException.class, () -> DateRanges.month(2026, 0));
    }
}
