package com.trading.curve.bootstrap;

import com.trading.curve.api.BootstrapListener;
import com.trading.curve.api.Compounding;
import com.trading.curve.api.Interpolator;
import com.trading.curve.compounding.SimpleCompounding;
import com.trading.curve.index.IndexRegistry;
import com.trading.curve.interp.LinearInterpolator;

/**
 * Everything a {@link BootstrapperFactory} may need to build a bootstrapper.
 * Null components fall back to built-in defaults.
 *
 * @param compounding  Convention used to discount cash flows.
 * @param interpolator Interpolation over already solved points.
 * @param indexes      Benchmark catalog for index observations.
 * @param solver       Root-finder configuration.
 * @param listener     Progress callbacks.
 * @param primaryIndex Index that wins ties at equal tenor, or null.
 */
public record BootstrapContext(
        Compounding compounding,
        Interpolator interpolator,
        IndexRegistry indexes,
        SolverSettings solver,
        BootstrapListener listener,
        String primaryIndex) {

    public BootstrapContext {
        if (compounding == null)
            compounding = new SimpleCompounding();
        if (interpolator == null)
            interpolator = new LinearInterpolator();
        if (indexes == null)
            indexes = IndexRegistry.defaults();
        if (listener == null)
            listener = BootstrapListener.NONE;
        if (solver == null)
            solver = SolverSettings.defaults();
    }
}
