package com.trading.curve.daycount;

import com.trading.curve.api.DayCount;
import com.trading.curve.exception.UnknownStrategyException;

import java.util.Arrays;
import java.util.function.Supplier;

/**
 * Built-in day-count conventions and their factories.
 */
public enum DayCountConvention {
    ACT_365("ACT/365", Act365::new),
    ACT_360("ACT/360", Act360::new),
    THIRTY_360("30/360", Thirty360::new);

    private final String code;
    private final Supplier<DayCount> factory;

    DayCountConvention(String code, Supplier<DayCount> factory) {
        this.code = code;
        this.factory = factory;
    }

    /** Registry name, e.g. {@code ACT/365}. */
    public String code() {
        return code;
    }

    public Supplier<DayCount> factory() {
        return factory;
    }

    public DayCount create() {
        return factory.get();
    }

    public static DayCountConvention fromString(String text) {
        for (DayCountConvention c : values()) {
            if (c.code.equalsIgnoreCase(text) || c.name().equalsIgnoreCase(text)) {
                return c;
            }
        }
        throw new UnknownStrategyException("day count convention", text,
                Arrays.stream(values()).map(DayCountConvention::code).toList());
    }
}
