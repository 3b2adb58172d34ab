package com.trading.curve.interp;

import com.trading.curve.api.Interpolant;
import com.trading.curve.api.Interpolator;
import com.trading.curve.exception.UnknownStrategyException;
import org.junit.Test;

import static org.junit.Assert.*;

public class LogLinearInterpolatorTest {
    private static final double EPS = 1e-12;

    private final Interpolator interp = new LogLinearInterpolator();

    @Test
    public void testGeometricMidpoint() {
        double[] t = { 1.0, 2.0 };
        double[] r = { 0.02, 0.04 };
        assertEquals(Math.sqrt(0.02 * 0.04), interp.interpolate(t, r, 1.5), EPS);
        assertEquals(0.04, interp.interpolate(t, r, 2.0), EPS);
    }

    @Test
    public void testExtrapolationIsFlat() {
        double[] t = { 1.0, 2.0, 5.0 };
        double[] r = { 0.02, 0.03, 0.035 };
        assertEquals(0.02, interp.extrapolate(t, r, 0.25), EPS);
        assertEquals(0.035, interp.extrapolate(t, r, 30.0), EPS);
    }

    @Test
    public void testNonPositiveRatesAreFloored() {
        double[] t = { 1.0, 2.0 };
        double[] r = { -0.01, 0.02 };
        assertEquals(LogLinearInterpolator.RATE_FLOOR, interp.interpolate(t, r, 1.0), 1e-20);
        double mid = interp.interpolate(t, r, 1.5);
        assertTrue(mid > 0 && mid < 0.02);
    }

    @Test
    public void testBindMatchesDirectCalls() {
        double[] t = { 0.5, 1.0, 3.0 };
        double[] r = { 0.01, 0.015, 0.03 };
        Interpolant bound = interp.bind(t, r);
        assertEquals(interp.interpolate(t, r, 2.0), bound.interpolate(2.0), EPS);
        assertEquals(interp.extrapolate(t, r, 4.0), bound.extrapolate(4.0), EPS);
    }

    @Test
    public void testRepeatedTenorUsesFirstCopy() {
        double[] t = { 1.0, 2.0, 2.0, 3.0 };
        double[] r = { 0.02, 0.03, 0.09, 0.05 };
        assertEquals(Math.sqrt(0.03 * 0.05), interp.interpolate(t, r, 2.5), EPS);
        assertEquals(0.03, interp.bind(t, r).interpolate(2.0), EPS);
    }

    @Test
    public void testFromString() {
        assertEquals(InterpolationMethod.LOG_LINEAR, InterpolationMethod.fromString("log_linear"));
        assertEquals(InterpolationMethod.CUBIC_SPLINE, InterpolationMethod.fromString("CUBIC_SPLINE"));
        assertTrue(InterpolationMethod.fromString("Linear").create() instanceof LinearInterpolator);

        try {
            InterpolationMethod.fromString("quadratic");
            fail("Should reject an unknown interpolation method");
        } catch (UnknownStrategyException e) {
            assertEquals("interpolator", e.family());
            assertTrue(e.available().contains("log_linear"));
        }
    }
}
