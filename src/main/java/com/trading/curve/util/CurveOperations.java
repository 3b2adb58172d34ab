package com.trading.curve.util;

import com.trading.curve.api.CurvePoints;
import com.trading.curve.exception.CurveValidationException;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Array helpers shared by the curve, the interpolators and the bootstrappers.
 */
public final class CurveOperations {
    private CurveOperations() {
        // Utility class
    }

    /**
     * Sorts both arrays by tenor. The sort is stable, so points with equal
     * tenors keep their input order. Duplicates are kept.
     */
    public static CurvePoints sortByTenor(double[] tenors, double[] rates) {
        requireAligned(tenors, rates);
        int[] order = stableOrder(tenors);
        double[] t = new double[order.length];
        double[] r = new double[order.length];
        for (int i = 0; i < order.length; i++) {
            t[i] = tenors[order[i]];
            r[i] = rates[order[i]];
        }
        return new CurvePoints(t, r);
    }

    /**
     * Sorts by tenor and drops repeated tenors, keeping the first occurrence of
     * each.
     */
    public static CurvePoints ensureSortedUnique(double[] tenors, double[] rates) {
        requireAligned(tenors, rates);
        int[] order = stableOrder(tenors);
        double[] t = new double[order.length];
        double[] r = new double[order.length];
        int n = 0;
        for (int idx : order) {
            if (n > 0 && t[n - 1] == tenors[idx])
                continue;
            t[n] = tenors[idx];
            r[n] = rates[idx];
            n++;
        }
        return new CurvePoints(Arrays.copyOf(t, n), Arrays.copyOf(r, n));
    }

    /** True when every tenor is strictly greater than the previous one. */
    public static boolean isStrictlyAscending(double[] tenors) {
        for (int i = 1; i < tenors.length; i++) {
            if (!(tenors[i] > tenors[i - 1]))
                return false;
        }
        return true;
    }

    private static int[] stableOrder(double[] tenors) {
        return IntStream.range(0, tenors.length)
                .boxed()
                .sorted(Comparator.comparingDouble(i -> tenors[i]))
                .mapToInt(Integer::intValue)
                .toArray();
    }

    private static void requireAligned(double[] tenors, double[] rates) {
        if (tenors.length != rates.length)
            throw new CurveValidationException(
                    "Tenors and rates must have the same length: " + tenors.length + " vs " + rates.length);
    }
}
