package com.trading.curve.daycount;

import com.trading.curve.api.DayCount;

import java.time.LocalDate;

/**
 * 30/360 US (bond basis).
 *
 * <p>
 * Formula: {@code (360*(y2-y1) + 30*(m2-m1) + (d2-d1)) / 360}, where a start
 * day of 31 becomes 30, and an end day of 31 becomes 30 when the adjusted start
 * day is 30.
 */
public final class Thirty360 implements DayCount {
    @Override
    public double yearFraction(LocalDate start, LocalDate end) {
        int d1 = start.getDayOfMonth();
        int d2 = end.getDayOfMonth();
        if (d1 == 31)
            d1 = 30;
        if (d2 == 31 && d1 == 30)
            d2 = 30;

        int days = 360 * (end.getYear() - start.getYear())
                + 30 * (end.getMonthValue() - start.getMonthValue())
                + (d2 - d1);
        return days / 360.0;
    }
}
