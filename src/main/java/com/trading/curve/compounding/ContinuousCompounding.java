package com.trading.curve.compounding;

import com.trading.curve.api.Compounding;
import com.trading.curve.exception.CurveValidationException;

/**
 * Continuous compounding.
 *
 * <p>
 * Formulas:
 * <ul>
 * <li>{@code df(r, t) = exp(-r*t)}</li>
 * <li>{@code fwd = (r2*t2 - r1*t1) / (t2 - t1)}</li>
 * </ul>
 */
public final class ContinuousCompounding implements Compounding {
    @Override
    public double discountFactor(double rate, double tenor) {
        return Math.exp(-rate * tenor);
    }

    @Override
    public double forwardRate(double r1, double t1, double r2, double t2) {
        if (t2 == t1)
            throw new CurveValidationException("Forward period is empty: t1 == t2 == " + t1);
        return (r2 * t2 - r1 * t1) / (t2 - t1);
    }

    @Override
    public double zeroRate(double discountFactor, double tenor) {
        return -Math.log(discountFactor) / tenor;
    }
}
