package com.trading.curve;

import com.trading.curve.api.BootstrapListener;
import com.trading.curve.bootstrap.SolverSettings;
import com.trading.curve.engine.CurveFactory;
import com.trading.curve.engine.StrategyCatalog;
import com.trading.curve.index.IndexCurveFactory;
import com.trading.curve.index.IndexRegistry;
import com.trading.curve.io.JsonCurveCompiler;

/**
 * Yield curve engine: builds term structures of interest rates from market
 * data.
 *
 * <h2>Pieces</h2>
 * <ul>
 * <li><b>Strategies</b> (interpolation, day count, compounding,
 * bootstrapping) are looked up by name in an immutable
 * {@link StrategyCatalog}.</li>
 * <li><b>Indexes</b> (SOFR, EURIBOR, ...) live in an {@link IndexRegistry}
 * that supplies their conventions.</li>
 * <li><b>Factories</b> turn points, bonds, deposits or index fixings into a
 * {@link com.trading.curve.engine.YieldCurve}.</li>
 * </ul>
 *
 * <p>
 * An engine is assembled once and then shared freely; every part of it is
 * immutable.
 *
 * <pre>{@code
 * CurveEngine engine = CurveEngine.builder()
 *         .catalog(StrategyCatalog.builder()
 *                 .registerInterpolator("flat", FlatInterpolator::new)
 *                 .build())
 *         .build();
 * YieldCurve curve = engine.curves().createFromBonds(bonds);
 * }</pre>
 */
public final class CurveEngine {
    private final CurveFactory curves;
    private final IndexCurveFactory indexCurves;
    private final JsonCurveCompiler compiler;

    private CurveEngine(Builder b) {
        this.curves = new CurveFactory(b.catalog, b.indexes, b.solverSettings, b.listener);
        this.indexCurves = new IndexCurveFactory(curves);
        this.compiler = new JsonCurveCompiler(curves, indexCurves);
    }

    /** Engine over the built-in strategies, indexes and solver settings. */
    public static CurveEngine create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public CurveFactory curves() {
        return curves;
    }

    public IndexCurveFactory indexCurves() {
        return indexCurves;
    }

    public JsonCurveCompiler compiler() {
        return compiler;
    }

    public StrategyCatalog catalog() {
        return curves.catalog();
    }

    public IndexRegistry indexes() {
        return curves.indexes();
    }

    public static final class Builder {
        private StrategyCatalog catalog = StrategyCatalog.defaults();
        private IndexRegistry indexes;
        private SolverSettings solverSettings = SolverSettings.defaults();
        private BootstrapListener listener = BootstrapListener.NONE;

        private Builder() {
        }

        public Builder catalog(StrategyCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder indexes(IndexRegistry indexes) {
            this.indexes = indexes;
            return this;
        }

        public Builder solverSettings(SolverSettings solverSettings) {
            this.solverSettings = solverSettings;
            return this;
        }

        /** Receives bootstrap progress of every curve built by the engine. */
        public Builder listener(BootstrapListener listener) {
            this.listener = listener;
            return this;
        }

        public CurveEngine build() {
            return new CurveEngine(this);
        }
    }
}
