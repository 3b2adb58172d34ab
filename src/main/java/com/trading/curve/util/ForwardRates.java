package com.trading.curve.util;

import com.trading.curve.exception.CurveValidationException;

/**
 * Forward rates implied by two points of a term structure.
 */
public final class ForwardRates {
    private ForwardRates() {
        // Utility class
    }

    /** Simple forward rate: {@code (df1 / df2 - 1) / (t2 - t1)}. */
    public static double fromDiscountFactors(double df1, double df2, double t1, double t2) {
        requireOrdered(t1, t2);
        return (df1 / df2 - 1.0) / (t2 - t1);
    }

    /**
     * Forward rate from two spot rates, under continuous compounding
     * {@code (r2*t2 - r1*t1) / (t2 - t1)} or simple compounding otherwise.
     */
    public static double fromSpotRates(double r1, double r2, double t1, double t2, boolean continuous) {
        requireOrdered(t1, t2);
        if (continuous)
            return (r2 * t2 - r1 * t1) / (t2 - t1);
        double df1 = 1.0 / (1.0 + r1 * t1);
        double df2 = 1.0 / (1.0 + r2 * t2);
        return fromDiscountFactors(df1, df2, t1, t2);
    }

    private static void requireOrdered(double t1, double t2) {
        if (!(t2 > t1))
            throw new CurveValidationException("t2 must be greater than t1: t1=" + t1 + ", t2=" + t2);
    }
}
