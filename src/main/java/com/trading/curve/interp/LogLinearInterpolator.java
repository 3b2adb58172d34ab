package com.trading.curve.interp;

import com.trading.curve.api.Interpolant;
import com.trading.curve.api.Interpolator;

/**
 * Linear interpolation of {@code ln(max(rate, 1e-8))}, exponentiated back.
 * Extrapolation is flat at the nearest endpoint rate.
 */
public final class LogLinearInterpolator implements Interpolator {
    static final double RATE_FLOOR = 1e-8;

    @Override
    public double interpolate(double[] tenors, double[] rates, double target) {
        Segments.requirePoints(tenors, rates);
        if (tenors.length < 2)
            return rates[0];
        return Math.exp(Segments.linear(tenors, logRates(rates), target));
    }

    @Override
    public double extrapolate(double[] tenors, double[] rates, double target) {
        Segments.requirePoints(tenors, rates);
        if (target < tenors[0])
            return rates[0];
        return rates[Segments.firstOccurrence(tenors, tenors.length - 1)];
    }

    @Override
    public Interpolant bind(double[] tenors, double[] rates) {
        Segments.requirePoints(tenors, rates);
        double[] logs = logRates(rates);
        return new Interpolant() {
            @Override
            public double interpolate(double target) {
                if (tenors.length < 2)
                    return rates[0];
                return Math.exp(Segments.linear(tenors, logs, target));
            }

            @Override
            public double extrapolate(double target) {
                return LogLinearInterpolator.this.extrapolate(tenors, rates, target);
            }
        };
    }

    private static double[] logRates(double[] rates) {
        double[] logs = new double[rates.length];
        for (int i = 0; i < rates.length; i++)
            logs[i] = Math.log(Math.max(rates[i], RATE_FLOOR));
        return logs;
    }
}
