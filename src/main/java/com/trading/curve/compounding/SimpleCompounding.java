package com.trading.curve.compounding;

import com.trading.curve.api.Compounding;
import com.trading.curve.exception.CurveValidationException;

/**
 * Simple (money-market) interest.
 *
 * <p>
 * Formulas:
 * <ul>
 * <li>{@code df(r, t) = 1 / (1 + r*t)}</li>
 * <li>{@code fwd = (df1 / df2 - 1) / (t2 - t1)}</li>
 * </ul>
 */
public final class SimpleCompounding implements Compounding {
    @Override
    public double discountFactor(double rate, double tenor) {
        return 1.0 / (1.0 + rate * tenor);
    }

    @Override
    public double forwardRate(double r1, double t1, double r2, double t2) {
        if (t2 == t1)
            throw new CurveValidationException("Forward period is empty: t1 == t2 == " + t1);
        double df1 = discountFactor(r1, t1);
        double df2 = discountFactor(r2, t2);
        return (df1 / df2 - 1.0) / (t2 - t1);
    }

    @Override
    public double zeroRate(double discountFactor, double tenor) {
        return (1.0 / discountFactor - 1.0) / tenor;
    }
}
