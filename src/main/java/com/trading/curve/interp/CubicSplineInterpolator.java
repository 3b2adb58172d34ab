package com.trading.curve.interp;

import com.trading.curve.api.CurvePoints;
import com.trading.curve.api.Interpolant;
import com.trading.curve.api.Interpolator;
import com.trading.curve.util.CurveOperations;

/**
 * Natural cubic spline (zero second derivative at both ends).
 *
 * <p>
 * The spline passes through every point. Repeated tenors are collapsed to
 * their first occurrence before fitting. Outside the data range the curve
 * continues along a straight line with the spline's slope at the nearest
 * endpoint, so it does not diverge the way the boundary cubic would.
 */
public final class CubicSplineInterpolator implements Interpolator {

    @Override
    public double interpolate(double[] tenors, double[] rates, double target) {
        return bind(tenors, rates).interpolate(target);
    }

    @Override
    public double extrapolate(double[] tenors, double[] rates, double target) {
        return bind(tenors, rates).extrapolate(target);
    }

    @Override
    public Interpolant bind(double[] tenors, double[] rates) {
        Segments.requirePoints(tenors, rates);
        CurvePoints unique = CurveOperations.ensureSortedUnique(tenors, rates);
        return new Spline(unique.tenors(), unique.rates());
    }

    /**
     * Spline over fixed knots. Second derivatives are solved once with the
     * Thomas algorithm on the tridiagonal system.
     *
     * <p>
     * On {@code [x_i, x_i+1]} with {@code h = x_i+1 - x_i},
     * {@code A = (x_i+1 - t)/h}, {@code B = (t - x_i)/h}:
     * {@code S(t) = A*y_i + B*y_i+1 + ((A^3-A)*m_i + (B^3-B)*m_i+1) * h^2/6}.
     */
    static final class Spline implements Interpolant {
        private final double[] x;
        private final double[] y;
        private final double[] m;

        Spline(double[] x, double[] y) {
            this.x = x;
            this.y = y;
            this.m = secondDerivatives(x, y);
        }

        @Override
        public double interpolate(double target) {
            int n = x.length;
            if (n < 2)
                return y[0];
            if (target < x[0] || target > x[n - 1])
                return extrapolate(target);

            int hi = Math.min(Math.max(Segments.upperBound(x, target), 1), n - 1);
            int lo = hi - 1;
            double h = x[hi] - x[lo];
            double a = (x[hi] - target) / h;
            double b = (target - x[lo]) / h;
            return a * y[lo] + b * y[hi]
                    + ((a * a * a - a) * m[lo] + (b * b * b - b) * m[hi]) * h * h / 6.0;
        }

        @Override
        public double extrapolate(double target) {
            int n = x.length;
            if (n < 2)
                return y[0];
            if (target < x[0])
                return y[0] + leftSlope() * (target - x[0]);
            return y[n - 1] + rightSlope() * (target - x[n - 1]);
        }

        double leftSlope() {
            double h = x[1] - x[0];
            return (y[1] - y[0]) / h - h * (2.0 * m[0] + m[1]) / 6.0;
        }

        double rightSlope() {
            int n = x.length;
            double h = x[n - 1] - x[n - 2];
            return (y[n - 1] - y[n - 2]) / h + h * (m[n - 2] + 2.0 * m[n - 1]) / 6.0;
        }

        private static double[] secondDerivatives(double[] x, double[] y) {
            int n = x.length;
            double[] m = new double[n];
            if (n < 3)
                return m;

            // Interior unknowns m[1..n-2]; m[0] = m[n-1] = 0 (natural ends).
            int k = n - 2;
            double[] diag = new double[k];
            double[] upper = new double[k];
            double[] rhs = new double[k];
            for (int i = 1; i <= k; i++) {
                double h0 = x[i] - x[i - 1];
                double h1 = x[i + 1] - x[i];
                diag[i - 1] = 2.0 * (h0 + h1);
                upper[i - 1] = h1;
                rhs[i - 1] = 6.0 * ((y[i + 1] - y[i]) / h1 - (y[i] - y[i - 1]) / h0);
            }

            // Forward sweep; the sub-diagonal entry of row i is h_(i-1) = upper[i-1].
            for (int i = 1; i < k; i++) {
                double w = upper[i - 1] / diag[i - 1];
                diag[i] -= w * upper[i - 1];
                rhs[i] -= w * rhs[i - 1];
            }

            m[k] = rhs[k - 1] / diag[k - 1];
            for (int i = k - 2; i >= 0; i--) {
                m[i + 1] = (rhs[i] - upper[i] * m[i + 2]) / diag[i];
            }
            return m;
        }
    }
}
