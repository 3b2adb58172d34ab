package com.trading.curve.bootstrap;

import com.trading.curve.api.Bootstrapper;

/**
 * Creates a bootstrapper configured for one curve build.
 */
@FunctionalInterface
public interface BootstrapperFactory {
    Bootstrapper<?> create(BootstrapContext context);
}
