package com.trading.curve.api;

import com.trading.curve.exception.CurveValidationException;

import java.util.Arrays;

/**
 * Tenor/rate pairs produced by a {@link Bootstrapper}. Arrays are copied on the
 * way in and on the way out.
 */
public record CurvePoints(double[] tenors, double[] rates) {

    public CurvePoints {
        if (tenors == null || rates == null)
            throw new CurveValidationException("Tenors and rates must not be null");
        if (tenors.length != rates.length)
            throw new CurveValidationException(
                    "Tenors and rates must have the same length: " + tenors.length + " vs " + rates.length);
        tenors = tenors.clone();
        rates = rates.clone();
    }

    @Override
    public double[] tenors() {
        return tenors.clone();
    }

    @Override
    public double[] rates() {
        return rates.clone();
    }

    public int size() {
        return tenors.length;
    }

    public double tenorAt(int i) {
        return tenors[i];
    }

    public double rateAt(int i) {
        return rates[i];
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CurvePoints other
                && Arrays.equals(tenors, other.tenors)
                && Arrays.equals(rates, other.rates);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(tenors) + Arrays.hashCode(rates);
    }

    @Override
    public String toString() {
        return "CurvePoints{tenors=" + Arrays.toString(tenors) + ", rates=" + Arrays.toString(rates) + "}";
    }
}
