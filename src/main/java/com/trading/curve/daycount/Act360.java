package com.trading.curve.daycount;

import com.trading.curve.api.DayCount;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Actual/360, the money-market convention for most IBOR and OIS indexes.
 */
public final class Act360 implements DayCount {
    @Override
    public double yearFraction(LocalDate start, LocalDate end) {
        return ChronoUnit.DAYS.between(start, end) / 360.0;
    }
}
