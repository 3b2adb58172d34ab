package com.trading.curve.api;

import java.time.LocalDate;

/**
 * Day-count convention: converts a calendar span into a year fraction.
 *
 * <p>
 * Implementations are stateless and shared between curves. An end date before
 * the start date yields a negative fraction.
 */
@FunctionalInterface
public interface DayCount {
    /**
     * @param start Start of the accrual period.
     * @param end   End of the accrual period.
     * @return The year fraction between the two dates.
     */
    double yearFraction(LocalDate start, LocalDate end);
}
