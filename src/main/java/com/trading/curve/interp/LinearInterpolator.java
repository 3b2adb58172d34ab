package com.trading.curve.interp;

import com.trading.curve.api.Interpolator;

/**
 * Piecewise-linear interpolation.
 *
 * <p>
 * Inside the range: {@code y = y0 + (t - t0) * (y1 - y0) / (t1 - t0)}; a
 * target outside the range passed to {@link #interpolate} is held flat.
 * Extrapolation continues the slope of the nearest boundary segment.
 *
 * <p>
 * Where a tenor repeats, only its first copy is used: a lookup at that tenor
 * returns the first copy's rate, and the segments on either side of it run
 * from or to that rate. The later copies never affect a result.
 */
public final class LinearInterpolator implements Interpolator {

    @Override
    public double interpolate(double[] tenors, double[] rates, double target) {
        Segments.requirePoints(tenors, rates);
        return Segments.linear(tenors, rates, target);
    }

    @Override
    public double extrapolate(double[] tenors, double[] rates, double target) {
        Segments.requirePoints(tenors, rates);
        int n = tenors.length;
        if (n < 2)
            return rates[0];

        if (target < tenors[0]) {
            int next = Segments.upperBound(tenors, tenors[0]);
            if (next >= n)
                return rates[0];
            double slope = (rates[next] - rates[0]) / (tenors[next] - tenors[0]);
            return rates[0] + slope * (target - tenors[0]);
        }

        int last = Segments.firstOccurrence(tenors, n - 1);
        if (last == 0)
            return rates[last];
        int prev = Segments.firstOccurrence(tenors, last - 1);
        double slope = (rates[last] - rates[prev]) / (tenors[last] - tenors[prev]);
        return rates[last] + slope * (target - tenors[last]);
    }
}
