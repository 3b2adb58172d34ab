package com.trading.curve.util;

import com.trading.curve.exception.ConvergenceException;

import java.util.function.DoubleUnaryOperator;

/**
 * Bracketed root finder (Brent's method).
 *
 * <p>
 * Combines bisection, secant and inverse quadratic interpolation steps. Every
 * step keeps the root bracketed, so the search always terminates: either the
 * bracket shrinks below {@code tolerance}, {@code |f(x)|} drops below
 * {@code functionTolerance}, or {@code maxIterations} is reached and a
 * {@link ConvergenceException} is thrown.
 */
public final class BrentSolver {
    private static final double EPS = Math.ulp(1.0);

    /** Root and the number of iterations spent finding it. */
    public record Result(double root, int iterations) {
    }

    private final int maxIterations;
    private final double tolerance;
    private final double functionTolerance;

    public BrentSolver(int maxIterations, double tolerance, double functionTolerance) {
        if (maxIterations <= 0)
            throw new IllegalArgumentException("maxIterations must be positive");
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.functionTolerance = functionTolerance;
    }

    public int maxIterations() {
        return maxIterations;
    }

    /**
     * Finds {@code x} in {@code [lower, upper]} with {@code f(x) = 0}.
     *
     * @throws ConvergenceException if {@code f} has the same sign at both ends,
     *                              evaluates to NaN, or the iteration cap is hit.
     */
    public Result solve(DoubleUnaryOperator f, double lower, double upper) {
        double a = lower, b = upper;
        double fa = f.applyAsDouble(a);
        double fb = f.applyAsDouble(b);
        if (Double.isNaN(fa) || Double.isNaN(fb))
            throw new ConvergenceException("Objective is NaN at bracket ends [" + lower + ", " + upper + "]");
        if (fa == 0.0)
            return new Result(a, 0);
        if (fb == 0.0)
            return new Result(b, 0);
        if ((fa > 0) == (fb > 0))
            throw new ConvergenceException(String.format(
                    "Root not bracketed in [%s, %s]: f(lower)=%.6g, f(upper)=%.6g", lower, upper, fa, fb));

        double c = b, fc = fb;
        double d = b - a, e = d;

        for (int iter = 1; iter <= maxIterations; iter++) {
            if ((fb > 0) == (fc > 0)) {
                // Root lies in [a, b]; restart the contrapoint at a.
                c = a;
                fc = fa;
                d = b - a;
                e = d;
            }
            if (Math.abs(fc) < Math.abs(fb)) {
                a = b;
                b = c;
                c = a;
                fa = fb;
                fb = fc;
                fc = fa;
            }

            double tol = 2.0 * EPS * Math.abs(b) + 0.5 * tolerance;
            double xm = 0.5 * (c - b);
            if (Math.abs(xm) <= tol || Math.abs(fb) <= functionTolerance)
                return new Result(b, iter);

            if (Math.abs(e) >= tol && Math.abs(fa) > Math.abs(fb)) {
                double s = fb / fa;
                double p, q;
                if (a == c) {
                    // Secant step
                    p = 2.0 * xm * s;
                    q = 1.0 - s;
                } else {
                    // Inverse quadratic interpolation
                    double qa = fa / fc;
                    double r = fb / fc;
                    p = s * (2.0 * xm * qa * (qa - r) - (b - a) * (r - 1.0));
                    q = (qa - 1.0) * (r - 1.0) * (s - 1.0);
                }
                if (p > 0)
                    q = -q;
                p = Math.abs(p);
                double min1 = 3.0 * xm * q - Math.abs(tol * q);
                double min2 = Math.abs(e * q);
                if (2.0 * p < Math.min(min1, min2)) {
                    e = d;
                    d = p / q;
                } else {
                    d = xm;
                    e = d;
                }
            } else {
                d = xm;
                e = d;
            }

            a = b;
            fa = fb;
            b += Math.abs(d) > tol ? d : Math.copySign(tol, xm);
            fb = f.applyAsDouble(b);
            if (Double.isNaN(fb))
                throw new ConvergenceException("Objective evaluated to NaN at " + b);
        }
        throw new ConvergenceException("Brent solver did not converge within " + maxIterations + " iterations");
    }
}
