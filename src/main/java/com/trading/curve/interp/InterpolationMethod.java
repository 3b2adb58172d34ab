package com.trading.curve.interp;

import com.trading.curve.api.Interpolator;
import com.trading.curve.exception.UnknownStrategyException;

import java.util.Arrays;
import java.util.function.Supplier;

/**
 * Built-in interpolation methods and their factories.
 */
public enum InterpolationMethod {
    LINEAR("linear", LinearInterpolator::new),
    CUBIC_SPLINE("cubic_spline", CubicSplineInterpolator::new),
    LOG_LINEAR("log_linear", LogLinearInterpolator::new);

    private final String code;
    private final Supplier<Interpolator> factory;

    InterpolationMethod(String code, Supplier<Interpolator> factory) {
        this.code = code;
        this.factory = factory;
    }

    public String code() {
        return code;
    }

    public Supplier<Interpolator> factory() {
        return factory;
    }

    public Interpolator create() {
        return factory.get();
    }

    public static InterpolationMethod fromString(String text) {
        for (InterpolationMethod m : values()) {
            if (m.code.equalsIgnoreCase(text) || m.name().equalsIgnoreCase(text)) {
                return m;
            }
        }
        throw new UnknownStrategyException("interpolator", text,
                Arrays.stream(values()).map(InterpolationMethod::code).toList());
    }
}
