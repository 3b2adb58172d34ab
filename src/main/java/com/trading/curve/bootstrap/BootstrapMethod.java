package com.trading.curve.bootstrap;

import com.trading.curve.exception.UnknownStrategyException;

import java.util.Arrays;

/**
 * Built-in bootstrapping algorithms and their factories.
 */
public enum BootstrapMethod {
    BOND("bond", ctx -> new BondBootstrapper(ctx.compounding(), ctx.interpolator(), ctx.solver(), ctx.listener())),
    DEPOSIT("deposit", ctx -> new DepositBootstrapper()),
    INDEX("index", ctx -> new IndexBootstrapper(ctx.indexes(), ctx.primaryIndex()));

    private final String code;
    private final BootstrapperFactory factory;

    BootstrapMethod(String code, BootstrapperFactory factory) {
        this.code = code;
        this.factory = factory;
    }

    public String code() {
        return code;
    }

    public BootstrapperFactory factory() {
        return factory;
    }

    public static BootstrapMethod fromString(String text) {
        for (BootstrapMethod m : values()) {
            if (m.code.equalsIgnoreCase(text)) {
                return m;
            }
        }
        throw new UnknownStrategyException("bootstrapper", text,
                Arrays.stream(values()).map(BootstrapMethod::code).toList());
    }
}
