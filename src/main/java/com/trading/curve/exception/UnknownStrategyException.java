package com.trading.curve.exception;

import java.util.List;

/**
 * Raised when a strategy name or an index code is not registered. The message
 * lists every name that is.
 */
public class UnknownStrategyException extends CurveException {
    private final String family;
    private final String name;
    private final List<String> available;

    public UnknownStrategyException(String family, String name, List<String> available) {
        super("Unknown " + family + ": " + name + ". Available: " + available);
        this.family = family;
        this.name = name;
        this.available = List.copyOf(available);
    }

    /** The strategy family, e.g. {@code interpolator} or {@code index}. */
    public String family() {
        return family;
    }

    public String name() {
        return name;
    }

    public List<String> available() {
        return available;
    }
}
