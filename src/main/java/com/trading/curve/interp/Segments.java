package com.trading.curve.interp;

import com.trading.curve.exception.CurveValidationException;

/**
 * Search helpers over sorted tenor arrays. Tenors may repeat; the first
 * occurrence of a repeated tenor is the one that counts.
 */
final class Segments {
    private Segments() {
        // Utility class
    }

    static void requirePoints(double[] tenors, double[] rates) {
        if (tenors.length == 0 || tenors.length != rates.length)
            throw new CurveValidationException(
                    "Interpolation needs at least one point and aligned arrays, got "
                            + tenors.length + " tenors and " + rates.length + " rates");
    }

    /** Index of the first tenor strictly greater than {@code target}. */
    static int upperBound(double[] tenors, double target) {
        int lo = 0, hi = tenors.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (tenors[mid] <= target)
                lo = mid + 1;
            else
                hi = mid;
        }
        return lo;
    }

    /** First index holding the same tenor as {@code tenors[i]}. */
    static int firstOccurrence(double[] tenors, int i) {
        while (i > 0 && tenors[i - 1] == tenors[i])
            i--;
        return i;
    }

    /**
     * Linear interpolation on [x0, x1], flat outside the data range. A segment
     * that starts at a repeated tenor starts from its first copy.
     */
    static double linear(double[] x, double[] y, double target) {
        int n = x.length;
        if (n < 2 || target <= x[0])
            return y[0];
        if (target >= x[n - 1])
            return y[firstOccurrence(x, n - 1)];
        int hi = upperBound(x, target);
        int lo = firstOccurrence(x, hi - 1);
        double w = (target - x[lo]) / (x[hi] - x[lo]);
        return y[lo] + w * (y[hi] - y[lo]);
    }
}
