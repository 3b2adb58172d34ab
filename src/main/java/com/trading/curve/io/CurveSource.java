package com.trading.curve.io;

import com.trading.curve.exception.CurveValidationException;

/**
 * Market data a curve definition is built from.
 */
public enum CurveSource {
    SPOT,
    BONDS,
    DEPOSITS,
    INDEX;

    public static CurveSource fromString(String text) {
        if (text == null)
            throw new CurveValidationException("Missing 'source' in curve definition");
        for (CurveSource s : values()) {
            if (s.name().equalsIgnoreCase(text)) {
                return s;
            }
        }
        throw new CurveValidationException("Unknown curve source: " + text);
    }
}
