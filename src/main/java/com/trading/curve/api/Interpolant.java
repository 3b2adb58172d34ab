package com.trading.curve.api;

/**
 * An {@link Interpolator} bound to one fixed set of curve points.
 */
public interface Interpolant {
    /** Value at a target inside the data range. */
    double interpolate(double target);

    /** Value at a target outside the data range. */
    double extrapolate(double target);
}
