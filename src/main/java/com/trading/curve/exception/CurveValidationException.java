package com.trading.curve.exception;

/**
 * Raised for malformed inputs: empty instrument lists, non-positive tenors or
 * maturities, mismatched array lengths, inverted forward periods and
 * unreadable curve definitions.
 */
public class CurveValidationException extends CurveException {
    public CurveValidationException(String message) {
        super(message);
    }

    public CurveValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
