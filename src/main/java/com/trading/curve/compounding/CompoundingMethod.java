package com.trading.curve.compounding;

import com.trading.curve.api.Compounding;
import com.trading.curve.exception.UnknownStrategyException;

import java.util.Arrays;
import java.util.function.Supplier;

/**
 * Built-in compounding conventions and their factories.
 */
public enum CompoundingMethod {
    SIMPLE("simple", SimpleCompounding::new),
    CONTINUOUS("continuous", ContinuousCompounding::new);

    private final String code;
    private final Supplier<Compounding> factory;

    CompoundingMethod(String code, Supplier<Compounding> factory) {
        this.code = code;
        this.factory = factory;
    }

    public String code() {
        return code;
    }

    public Supplier<Compounding> factory() {
        return factory;
    }

    public Compounding create() {
        return factory.get();
    }

    public static CompoundingMethod fromString(String text) {
        for (CompoundingMethod m : values()) {
            if (m.code.equalsIgnoreCase(text)) {
                return m;
            }
        }
        throw new UnknownStrategyException("compounding method", text,
                Arrays.stream(values()).map(CompoundingMethod::code).toList());
    }
}
