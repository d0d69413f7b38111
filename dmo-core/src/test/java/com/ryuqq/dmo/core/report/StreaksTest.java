package com.ryuqq.dmo.core.report;

import com.ryuqq.dmo.core.util.DateRanges;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Streaks 계산 테스트.
 */
class StreaksTest {

    private static final LocalDate JAN_1 = LocalDate.of(2026, 1, 1);

    @Test
    void calculate_EmptyDates_ReturnsZeroes() {
        assertEquals(Streaks.none(), Streaks.calculate(Set.of(), List.of()));
    }

    @Test
    void calculate_JanuaryPattern_CurrentTwoLongestTwo() {
        // Given: T T F T T
        List<LocalDate> days = DateRanges.days(JAN_1, JAN_1.plusDays(4));
        Set<LocalDate> done = Set.of(JAN_1, JAN_1.plusDays(1), JAN_1.plusDays(3), JAN_1.plusDays(4));

        // When
        Streaks streaks = Streaks.calculate(done, days);

        // Then
        assertEquals(2, streaks.current());
        assertEquals(2, streaks.longest());
    }

    @Test
    void calculate_LastDayMissing_CurrentIsZero() {
        List<LocalDate> days = DateRanges.days(JAN_1, JAN_1.plusDays(3));
        Set<LocalDate> done = Set.of(JAN_1, JAN_1.plusDays(1), JAN_1.plusDays(2));

        Streaks streaks = Streaks.calculate(done, days);

        assertEquals(0, streaks.current());
        assertEquals(3, streaks.longest());
    }

    @Test
    void calculate_AllCompleted_CurrentEqualsLongestEqualsTotal() {
        List<LocalDate> days = DateRanges.days(JAN_1, JAN_1.plusDays(9));

        Streaks streaks = Streaks.calculate(new HashSet<>(days), days);

        assertEquals(new Streaks(10, 10), streaks);
    }

    @Test
    void calculate_CompletedDatesOutsideList_AreIgnored() {
        List<LocalDate> days = List.of(JAN_1);

        Streaks streaks = Streaks.calculate(Set.of(JAN_1.minusDays(1)), days);

        assertEquals(Streaks.none(), streaks);
    }

    @Test
    void calculate_RandomPatterns_RespectOrderingInvariant() {
        Random random = new Random(20260201L);
        List<LocalDate> days = DateRanges.days(JAN_1, JAN_1.plusDays(60));
        for (int round = 0; round < 200; round++) {
            Set<LocalDate> done = new HashSet<>();
            for (LocalDate day : days) {
                if (random.nextBoolean()) {
                    done.add(day);
                }
            }

            Streaks streaks = Streaks.calculate(done, days);

            assertTrue(streaks.current() <= streaks.longest());
            assertTrue(streaks.longest() <= days.size());
        }
    }

    @Test
    void overRange_RandomPatterns_MatchesDayByDayCalculation() {
        Random random = new Random(20260301L);
        LocalDate end = JAN_1.plusDays(45);
        List<LocalDate> days = DateRanges.days(JAN_1, end);
        for (int round = 0; round < 200; round++) {
            Set<LocalDate> done = new HashSet<>();
            for (LocalDate day = JAN_1.minusDays(3); !day.isAfter(end.plusDays(3)); day = day.plusDays(1)) {
                if (random.nextBoolean()) {
                    done.add(day);
                }
            }

            assertEquals(Streaks.calculate(done, days), Streaks.overRange(done, JAN_1, end));
        }
    }

    @Test
    void overRange_MillenniaWideRange_OnlyVisitsCompletedDates() {
        // Given
        LocalDate start = LocalDate.of(1, 1, 1);
        LocalDate end = LocalDate.of(9999, 12, 31);
        Set<LocalDate> done = Set.of(end.minusDays(1), end, LocalDate.of(2026, 1, 1));

        // When
        Streaks streaks = Streaks.overRange(done, start, end);

        // Then
        assertEquals(new Streaks(2, 2), streaks);
    }

    @Test
    void overRange_StartAfterEnd_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Streaks.overRange(Set.of(), JAN_1, JAN_1.minusDays(1)));
    }

    @Test
    void constructor_CurrentAboveLongest_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Streaks(3, 2));
        assertThrows(IllegalArgumentException.class, () -> new Streaks(-1, 2));
    }
}
