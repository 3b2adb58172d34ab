package com.trading.curve.exception;

/**
 * Raised when the root finder cannot bracket or converge on a rate.
 */
public class ConvergenceException extends CurveException {
    private final double maturity;

    public ConvergenceException(String message) {
        this(message, Double.NaN, null);
    }

    public ConvergenceException(String message, double maturity, Throwable cause) {
        super(message, cause);
        this.maturity = maturity;
    }

    /** Maturity of the instrument being solved, or NaN when not tied to one. */
    public double maturity() {
        return maturity;
    }
}
