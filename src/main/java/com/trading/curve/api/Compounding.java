package com.trading.curve.api;

/**
 * Compounding convention relating a rate, a tenor and a discount factor.
 *
 * <p>
 * Implementations are stateless and shared between curves.
 */
public interface Compounding {
    /**
     * @param rate  Annualized spot rate.
     * @param tenor Time to payment in years.
     * @return The discount factor for a cash flow at {@code tenor}.
     */
    double discountFactor(double rate, double tenor);

    /**
     * Forward rate implied between two spot points. Requires {@code t2 != t1}.
     */
    double forwardRate(double r1, double t1, double r2, double t2);

    /**
     * Inverse of {@link #discountFactor(double, double)}: the spot rate that
     * produces {@code discountFactor} at {@code tenor}.
     */
    double zeroRate(double discountFactor, double tenor);
}
