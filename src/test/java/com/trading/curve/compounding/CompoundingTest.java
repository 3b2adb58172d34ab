package com.trading.curve.compounding;

import com.trading.curve.api.Compounding;
import com.trading.curve.exception.CurveValidationException;
import com.trading.curve.exception.UnknownStrategyException;
import org.junit.Test;

import static org.junit.Assert.*;

public class CompoundingTest {
    private static final double EPS = 1e-12;

    @Test
    public void testSimpleDiscountFactor() {
        Compounding c = new SimpleCompounding();
        assertEquals(1.0 / 1.1, c.discountFactor(0.05, 2.0), EPS);
        assertEquals(1.0, c.discountFactor(0.05, 0.0), EPS);
    }

    @Test
    public void testSimpleForwardIdentity() {
        Compounding c = new SimpleCompounding();
        double df1 = c.discountFactor(0.02, 1.0);
        double df2 = c.discountFactor(0.03, 2.0);
        assertEquals((df1 / df2 - 1.0) / 1.0, c.forwardRate(0.02, 1.0, 0.03, 2.0), EPS);
        assertEquals(1.06 / 1.02 - 1.0, c.forwardRate(0.02, 1.0, 0.03, 2.0), EPS);
    }

    @Test
    public void testContinuous() {
        Compounding c = new ContinuousCompounding();
        assertEquals(Math.exp(-0.1), c.discountFactor(0.05, 2.0), EPS);
        assertEquals(0.04, c.forwardRate(0.02, 1.0, 0.03, 2.0), EPS);
    }

    @Test
    public void testZeroRateInvertsDiscountFactor() {
        for (CompoundingMethod m : CompoundingMethod.values()) {
            Compounding c = m.create();
            double df = c.discountFactor(0.037, 3.5);
            assertEquals(m.code(), 0.037, c.zeroRate(df, 3.5), 1e-12);
        }
    }

    @Test
    public void testEmptyForwardPeriodRejected() {
        for (CompoundingMethod m : CompoundingMethod.values()) {
            try {
                m.create().forwardRate(0.02, 1.0, 0.03, 1.0);
                fail("Should reject t1 == t2 for " + m.code());
            } catch (CurveValidationException e) {
                assertTrue(e.getMessage().contains("empty"));
            }
        }
    }

    @Test
    public void testFromString() {
        assertEquals(CompoundingMethod.CONTINUOUS, CompoundingMethod.fromString("Continuous"));
        try {
            CompoundingMethod.fromString("annual");
            fail("Should reject an unknown compounding method");
        } catch (UnknownStrategyException e) {
            assertEquals("annual", e.name());
        }
    }
}
