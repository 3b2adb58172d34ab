package com.trading.curve.engine;

import com.trading.curve.api.CurvePoints;
import com.trading.curve.compounding.ContinuousCompounding;
import com.trading.curve.exception.CurveValidationException;
import com.trading.curve.exception.UnknownStrategyException;
import com.trading.curve.instrument.Bond;
import com.trading.curve.instrument.Deposit;
import com.trading.curve.interp.CubicSplineInterpolator;
import com.trading.curve.interp.LinearInterpolator;
import com.trading.curve.interp.LogLinearInterpolator;
import com.trading.curve.io.CurveRepresentation;
import com.trading.curve.util.SolverStatsListener;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class CurveFactoryTest {
    private static final double EPS = 1e-12;

    private final CurveFactory factory = CurveFactory.defaults();

    @Test
    public void testSpotCurve() {
        YieldCurve curve = factory.createSpotCurve(new double[] { 1, 2, 3 }, new double[] { 0.02, 0.025, 0.03 },
                "linear", "ACT/365", "simple");
        assertEquals(0.0225, curve.spotRate(1.5), EPS);
        assertEquals(1.0 / 1.02, curve.discountFactor(1.0), EPS);
        assertEquals(YieldCurve.SPOT, curve.getCurveType());
    }

    @Test
    public void testSpotCurveDefaults() {
        YieldCurve curve = factory.createSpotCurve(new double[] { 1, 2 }, new double[] { 0.02, 0.03 });
        assertTrue(curve.getInterpolator() instanceof LinearInterpolator);
        YieldCurve logLinear = factory.createSpotCurve(new double[] { 1, 2 }, new double[] { 0.02, 0.03 },
                "LOG_LINEAR");
        assertTrue(logLinear.getInterpolator() instanceof LogLinearInterpolator);
    }

    @Test
    public void testUnknownInterpolationListsNames() {
        try {
            factory.createSpotCurve(new double[] { 1, 2 }, new double[] { 0.02, 0.03 }, "bogus", null, null);
            fail("Should reject an unknown interpolator");
        } catch (UnknownStrategyException e) {
            assertEquals("bogus", e.name());
            assertTrue(e.getMessage().contains("linear"));
            assertTrue(e.getMessage().contains("cubic_spline"));
            assertTrue(e.getMessage().contains("log_linear"));
        }
    }

    @Test
    public void testFromBonds() {
        List<Bond> bonds = List.of(
                Bond.zeroCoupon(0.5, 98.0),
                Bond.zeroCoupon(2.0, 90.0),
                Bond.of(5.0, 0.04, 97.0));
        YieldCurve curve = factory.createFromBonds(bonds);
        assertTrue(curve.getInterpolator() instanceof CubicSplineInterpolator);
        assertEquals((100.0 / 90.0 - 1.0) / 2.0, curve.spotRate(2.0), 1e-12);
        assertEquals(3, curve.size());
        assertEquals(5.0, curve.maxTenor(), 0.0);
    }

    @Test
    public void testFromBondsContinuous() {
        YieldCurve curve = factory.createFromBonds(List.of(new Bond(2.0, 0.0, 90.0, 2, 100.0)), "bond", "linear",
                "ACT/365", "continuous");
        assertTrue(curve.getCompounding() instanceof ContinuousCompounding);
        assertEquals(-Math.log(0.9) / 2.0, curve.spotRate(2.0), 1e-12);
        assertEquals(0.9, curve.discountFactor(2.0), 1e-12);
    }

    @Test
    public void testListenerSeesBootstrap() {
        var stats = new SolverStatsListener();
        var withStats = new CurveFactory(StrategyCatalog.defaults(), null, null, stats);
        withStats.createFromBonds(List.of(Bond.zeroCoupon(1.0, 96.0), Bond.of(3.0, 0.05, 101.0)));
        assertEquals(2, stats.pointsSolved());
        assertEquals(1, stats.closedFormSolves());
    }

    @Test
    public void testFromDeposits() {
        YieldCurve curve = factory.createFromDeposits(List.of(
                new Deposit(0.5, 0.052),
                new Deposit(0.25, 0.05)));
        assertArrayEquals(new double[] { 0.25, 0.5 }, curve.tenors(), 0.0);
        assertEquals(0.051, curve.spotRate(0.375), EPS);
    }

    @Test
    public void testBootstrapperInstrumentMismatch() {
        try {
            factory.createFromBonds(List.of(Bond.zeroCoupon(1.0, 96.0)), "deposit", null, null, null);
            fail("Should reject a deposit bootstrapper for bonds");
        } catch (CurveValidationException e) {
            assertTrue(e.getMessage().contains("Deposit"));
        }
    }

    @Test
    public void testNamesResolvedBeforeBootstrapping() {
        var stats = new SolverStatsListener();
        var withStats = new CurveFactory(StrategyCatalog.defaults(), null, null, stats);
        try {
            withStats.createFromBonds(List.of(Bond.of(3.0, 0.05, 101.0)), "bond", "linear", "ACT/ACT", null);
            fail("Should reject an unknown day count");
        } catch (UnknownStrategyException e) {
            assertEquals("day count convention", e.family());
        }
        assertEquals(0, stats.pointsSolved());
    }

    @Test
    public void testEmptyInstruments() {
        try {
            factory.createFromDeposits(List.of());
            fail("Should reject empty input");
        } catch (CurveValidationException e) {
            assertTrue(e.getMessage().contains("Deposit"));
        }
    }

    @Test
    public void testFromRepresentation() {
        YieldCurve original = factory.createSpotCurve(new double[] { 2, 1 }, new double[] { 0.03, 0.02 });
        CurveRepresentation rep = original.toRepresentation();
        YieldCurve rebuilt = factory.fromRepresentation(rep, "cubic_spline", "ACT/360", "continuous");
        assertArrayEquals(original.tenors(), rebuilt.tenors(), 0.0);
        assertArrayEquals(original.rates(), rebuilt.rates(), 0.0);
        assertEquals(YieldCurve.SPOT, rebuilt.getCurveType());
        assertTrue(rebuilt.getInterpolator() instanceof CubicSplineInterpolator);
    }

    @Test
    public void testBootstrapWithoutCurve() {
        CurvePoints points = factory.bootstrap("deposit", Deposit.class, List.of(new Deposit(1.0, 0.04)), null,
                null);
        assertEquals(0.04, points.rateAt(0), 0.0);
    }
}
