package com.ryuqq.dmo.core.report;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Completion rate arithmetic.
 *
 * @author DMO Team
 * @since 1.0.0
 */
public final class CompletionRates {

    /**
     * Decimal places kept in a completion rate.
     */
    public static final int SCALE = 4;

    private CompletionRates() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * {@code completed / total} rounded to four decimal places, or 0.0 when total is zero.
     *
     * <p>The binary {@code double} quotient is rounded half-even on its exact decimal
     * expansion, so 1/160 gives 0.0063 and 3/160 gives 0.0187.</p>
     *
     * @param completedDays completed day count
     * @param totalDays total day count
     * @return rate between 0.0 and 1.0
     * @throws IllegalArgumentException if a count is negative or completed exceeds total
     */
    public static double of(int completedDays, int totalDays) {
        if (completedDays < 0 || totalDays < 0) {
            throw new IllegalArgumentException(
                "counts cannot be negative (completed: " + completedDays + ", total: " + totalDays + ")");
        }
        if (completedDays > totalDays) {
            throw new IllegalArgumentException(
                "completed cannot exceed total (completed: " + completedDays + ", total: " + totalDays + ")");
        }
        if (totalDays == 0) {
            return 0.0;
        }
        double quotient = (double) completedDays / totalDays;
        return new BigDecimal(quotient)
            .setScale(SCALE, RoundingMode.HALF_EVEN)
            .doubleValue();
    }
}
