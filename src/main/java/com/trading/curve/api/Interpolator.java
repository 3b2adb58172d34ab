package com.trading.curve.api;

/**
 * Interpolation and extrapolation over (tenor, rate) points.
 *
 * <p>
 * Tenors are sorted ascending. With fewer than two points every target
 * resolves to the single known rate.
 */
public interface Interpolator {
    /**
     * Interpolates at a target inside {@code [tenors[0], tenors[n-1]]}.
     */
    double interpolate(double[] tenors, double[] rates, double target);

    /**
     * Extrapolates at a target outside {@code [tenors[0], tenors[n-1]]}.
     */
    double extrapolate(double[] tenors, double[] rates, double target);

    /**
     * Binds this interpolator to fixed data. The arrays are not copied; callers
     * must not mutate them afterwards. Implementations with expensive set-up
     * (e.g. spline coefficients) override this to do the work once.
     */
    default Interpolant bind(double[] tenors, double[] rates) {
        return new Interpolant() {
            @Override
            public double interpolate(double target) {
                return Interpolator.this.interpolate(tenors, rates, target);
            }

            @Override
            public double extrapolate(double target) {
                return Interpolator.this.extrapolate(tenors, rates, target);
            }
        };
    }
}
