package com.trading.curve.exception;

/**
 * Root of the unchecked exceptions raised by the curve engine.
 */
public class CurveException extends RuntimeException {
    public CurveException(String message) {
        super(message);
    }

    public CurveException(String message, Throwable cause) {
        super(message, cause);
    }
}
