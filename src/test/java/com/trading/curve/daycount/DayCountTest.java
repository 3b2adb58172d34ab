package com.trading.curve.daycount;

import com.trading.curve.api.DayCount;
import com.trading.curve.exception.UnknownStrategyException;
import org.junit.Test;

import java.time.LocalDate;

import static org.junit.Assert.*;

public class DayCountTest {
    private static final double EPS = 1e-12;

    @Test
    public void testAct365() {
        DayCount dc = new Act365();
        assertEquals(366.0 / 365.0, dc.yearFraction(LocalDate.of(2024, 1, 1), LocalDate.of(2025, 1, 1)), EPS);
        assertEquals(1.0, dc.yearFraction(LocalDate.of(2023, 1, 1), LocalDate.of(2024, 1, 1)), EPS);
    }

    @Test
    public void testAct360() {
        DayCount dc = new Act360();
        assertEquals(0.25, dc.yearFraction(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 31)), EPS);
        assertEquals(365.0 / 360.0, dc.yearFraction(LocalDate.of(2023, 1, 1), LocalDate.of(2024, 1, 1)), EPS);
    }

    @Test
    public void testSameDateIsZero() {
        LocalDate d = LocalDate.of(2024, 6, 15);
        for (DayCountConvention c : DayCountConvention.values()) {
            assertEquals(c.code(), 0.0, c.create().yearFraction(d, d), EPS);
        }
    }

    @Test
    public void testReversedDatesAreNegative() {
        assertEquals(-0.25, new Act360().yearFraction(LocalDate.of(2024, 3, 31), LocalDate.of(2024, 1, 1)), EPS);
    }

    @Test
    public void testThirty360() {
        DayCount dc = new Thirty360();
        assertEquals(0.5, dc.yearFraction(LocalDate.of(2024, 2, 15), LocalDate.of(2024, 8, 15)), EPS);
        // 31st start becomes 30th, and 31st end follows it
        assertEquals(60.0 / 360.0, dc.yearFraction(LocalDate.of(2024, 1, 31), LocalDate.of(2024, 3, 31)), EPS);
        // 31st end stays when the start day is below 30
        assertEquals(76.0 / 360.0, dc.yearFraction(LocalDate.of(2024, 1, 15), LocalDate.of(2024, 3, 31)), EPS);
        // February has 30 days under this convention
        assertEquals(13.0 / 360.0, dc.yearFraction(LocalDate.of(2024, 2, 28), LocalDate.of(2024, 3, 11)), EPS);
    }

    @Test
    public void testFromString() {
        assertEquals(DayCountConvention.ACT_360, DayCountConvention.fromString("act/360"));
        assertEquals(DayCountConvention.THIRTY_360, DayCountConvention.fromString("30/360"));
        assertTrue(DayCountConvention.ACT_365.create() instanceof Act365);

        try {
            DayCountConvention.fromString("ACT/ACT");
            fail("Should reject an unknown convention");
        } catch (UnknownStrategyException e) {
            assertEquals("day count convention", e.family());
            assertTrue(e.available().contains("ACT/365"));
        }
    }
}
