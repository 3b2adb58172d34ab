package com.trading.curve.daycount;

import com.trading.curve.api.DayCount;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Actual/365 Fixed.
 */
public final class Act365 implements DayCount {
    @Override
    public double yearFraction(LocalDate start, LocalDate end) {
        return ChronoUnit.DAYS.between(start, end) / 365.0;
    }
}
