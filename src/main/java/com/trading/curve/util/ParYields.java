package com.trading.curve.util;

import com.trading.curve.exception.CurveValidationException;

import java.util.function.DoubleUnaryOperator;

/**
 * Par yield of a bullet bond priced off a discount function.
 *
 * <p>
 * Formula: {@code c = f * (1 - df(T)) / sum(df(t_i))} over the coupon dates
 * {@code t_i = i/f}, {@code i = 1..round(T*f)}. The result is the annual
 * coupon rate that prices the bond at par.
 */
public final class ParYields {
    private ParYields() {
        // Utility class
    }

    public static double parYield(DoubleUnaryOperator discountFactor, double maturity) {
        return parYield(discountFactor, maturity, 2);
    }

    public static double parYield(DoubleUnaryOperator discountFactor, double maturity, int frequency) {
        if (!(maturity > 0))
            throw new CurveValidationException("Maturity must be positive: " + maturity);
        if (frequency <= 0)
            throw new CurveValidationException("Frequency must be positive: " + frequency);
        long periods = Math.round(maturity * frequency);
        if (periods == 0)
            throw new CurveValidationException(
                    "Periods computed to zero for maturity " + maturity + " and frequency " + frequency);

        double annuity = 0.0;
        double last = 0.0;
        for (long i = 1; i <= periods; i++) {
            last = discountFactor.applyAsDouble((double) i / frequency);
            annuity += last;
        }
        return frequency * (1.0 - last) / annuity;
    }
}
