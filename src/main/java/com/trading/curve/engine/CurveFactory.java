package com.trading.curve.engine;

import com.trading.curve.api.BootstrapListener;
import com.trading.curve.api.Bootstrapper;
import com.trading.curve.api.Compounding;
import com.trading.curve.api.CurvePoints;
import com.trading.curve.api.DayCount;
import com.trading.curve.api.Interpolator;
import com.trading.curve.bootstrap.BootstrapContext;
import com.trading.curve.bootstrap.SolverSettings;
import com.trading.curve.exception.CurveValidationException;
import com.trading.curve.index.IndexRegistry;
import com.trading.curve.instrument.Bond;
import com.trading.curve.instrument.Deposit;
import com.trading.curve.interp.LinearInterpolator;
import com.trading.curve.io.CurveRepresentation;

import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Builds {@link YieldCurve}s from raw points or market instruments, resolving
 * every strategy by name through a {@link StrategyCatalog}.
 *
 * <p>
 * All names are resolved before any bootstrapping starts, so an unknown name
 * fails fast without solver work. Bootstrappers always run with linear
 * interpolation over the points solved so far; the requested interpolator is
 * attached to the finished curve only.
 */
@Log4j2
public class CurveFactory {
    public static final String DEFAULT_INTERPOLATION = "linear";
    public static final String DEFAULT_DAY_COUNT = "ACT/365";
    public static final String DEFAULT_COMPOUNDING = "simple";
    public static final String DEFAULT_BOND_BOOTSTRAPPER = "bond";
    public static final String DEFAULT_BOND_INTERPOLATION = "cubic_spline";
    public static final String DEFAULT_DEPOSIT_BOOTSTRAPPER = "deposit";

    private final StrategyCatalog catalog;
    private final IndexRegistry indexes;
    private final SolverSettings solverSettings;
    private final BootstrapListener listener;

    public CurveFactory(StrategyCatalog catalog, IndexRegistry indexes, SolverSettings solverSettings,
            BootstrapListener listener) {
        this.catalog = catalog == null ? StrategyCatalog.defaults() : catalog;
        this.indexes = indexes == null ? IndexRegistry.defaults() : indexes;
        this.solverSettings = solverSettings == null ? SolverSettings.defaults() : solverSettings;
        this.listener = listener == null ? BootstrapListener.NONE : listener;
    }

    public CurveFactory(StrategyCatalog catalog) {
        this(catalog, null, null, null);
    }

    /** Factory over the built-in strategies and indexes. */
    public static CurveFactory defaults() {
        return new CurveFactory(StrategyCatalog.defaults());
    }

    public StrategyCatalog catalog() {
        return catalog;
    }

    public IndexRegistry indexes() {
        return indexes;
    }

    public SolverSettings solverSettings() {
        return solverSettings;
    }

    // ── Spot curves ──────────────────────────────────────────────

    public YieldCurve createSpotCurve(double[] tenors, double[] rates) {
        return createSpotCurve(tenors, rates, DEFAULT_INTERPOLATION, DEFAULT_DAY_COUNT, DEFAULT_COMPOUNDING);
    }

    public YieldCurve createSpotCurve(double[] tenors, double[] rates, String interpolation) {
        return createSpotCurve(tenors, rates, interpolation, DEFAULT_DAY_COUNT, DEFAULT_COMPOUNDING);
    }

    /** Curve straight from observed spot rates. Null names take the defaults. */
    public YieldCurve createSpotCurve(double[] tenors, double[] rates, String interpolation, String dayCount,
            String compounding) {
        if (tenors == null || rates == null)
            throw new CurveValidationException("Tenors and rates must not be null");
        return createCurve(new CurvePoints(tenors, rates), interpolation, dayCount, compounding,
                YieldCurve.SPOT);
    }

    /** Curve over already computed points, with strategies chosen by name. */
    public YieldCurve createCurve(CurvePoints points, String interpolation, String dayCount, String compounding,
            String curveType) {
        Interpolator interp = catalog.interpolator(or(interpolation, DEFAULT_INTERPOLATION));
        DayCount dc = catalog.dayCount(or(dayCount, DEFAULT_DAY_COUNT));
        Compounding comp = catalog.compounding(or(compounding, DEFAULT_COMPOUNDING));
        return YieldCurve.builder()
                .tenors(points.tenors())
                .rates(points.rates())
                .interpolator(interp)
                .dayCount(dc)
                .compounding(comp)
                .curveType(curveType)
                .build();
    }

    /** Rebuilds a curve from its representation, re-selecting strategies. */
    public YieldCurve fromRepresentation(CurveRepresentation representation, String interpolation,
            String dayCount, String compounding) {
        if (representation == null || representation.getTenors() == null || representation.getRates() == null)
            throw new CurveValidationException("Curve representation must carry tenors and rates");
        return createCurve(new CurvePoints(representation.getTenors(), representation.getRates()),
                interpolation, dayCount, compounding, representation.getCurveType());
    }

    // ── Bootstrapped curves ──────────────────────────────────────

    public YieldCurve createFromBonds(List<Bond> bonds) {
        return createFromBonds(bonds, DEFAULT_BOND_BOOTSTRAPPER, DEFAULT_BOND_INTERPOLATION, DEFAULT_DAY_COUNT,
                DEFAULT_COMPOUNDING);
    }

    /**
     * Bootstraps a spot curve from bond prices.
     *
     * @throws com.trading.curve.exception.ConvergenceException if a bond
     *                                                          cannot be
     *                                                          solved.
     */
    public YieldCurve createFromBonds(List<Bond> bonds, String bootstrapper, String interpolation,
            String dayCount, String compounding) {
        return createBootstrapped(bonds, Bond.class, or(bootstrapper, DEFAULT_BOND_BOOTSTRAPPER),
                or(interpolation, DEFAULT_BOND_INTERPOLATION), dayCount, compounding, null, YieldCurve.SPOT);
    }

    public YieldCurve createFromDeposits(List<Deposit> deposits) {
        return createFromDeposits(deposits, DEFAULT_DEPOSIT_BOOTSTRAPPER, DEFAULT_INTERPOLATION, DEFAULT_DAY_COUNT,
                DEFAULT_COMPOUNDING);
    }

    public YieldCurve createFromDeposits(List<Deposit> deposits, String bootstrapper, String interpolation,
            String dayCount, String compounding) {
        return createBootstrapped(deposits, Deposit.class, or(bootstrapper, DEFAULT_DEPOSIT_BOOTSTRAPPER),
                or(interpolation, DEFAULT_INTERPOLATION), dayCount, compounding, null, YieldCurve.SPOT);
    }

    /**
     * Resolves all strategies, runs the named bootstrapper and wraps the
     * result in a curve of type {@code curveType}.
     */
    protected <T> YieldCurve createBootstrapped(List<? extends T> instruments, Class<T> instrumentType,
            String bootstrapper, String interpolation, String dayCount, String compounding, String primaryIndex,
            String curveType) {
        String compName = or(compounding, DEFAULT_COMPOUNDING);
        Interpolator interp = catalog.interpolator(or(interpolation, DEFAULT_INTERPOLATION));
        DayCount dc = catalog.dayCount(or(dayCount, DEFAULT_DAY_COUNT));
        Compounding comp = catalog.compounding(compName);

        CurvePoints points = bootstrap(bootstrapper, instrumentType, instruments, compName, primaryIndex);
        log.debug("Bootstrapped {} points with '{}'", points.size(), bootstrapper);
        return YieldCurve.builder()
                .tenors(points.tenors())
                .rates(points.rates())
                .interpolator(interp)
                .dayCount(dc)
                .compounding(comp)
                .curveType(curveType)
                .build();
    }

    /**
     * Runs the named bootstrapper without building a curve.
     *
     * @param primaryIndex tie-break index for index bootstrappers, or null.
     */
    public <T> CurvePoints bootstrap(String bootstrapper, Class<T> instrumentType, List<? extends T> instruments,
            String compounding, String primaryIndex) {
        if (instruments == null || instruments.isEmpty())
            throw new CurveValidationException("No " + instrumentType.getSimpleName()
                    + " data provided for bootstrapping");
        BootstrapContext context = new BootstrapContext(
                catalog.compounding(or(compounding, DEFAULT_COMPOUNDING)),
                new LinearInterpolator(),
                indexes,
                solverSettings,
                listener,
                primaryIndex);
        Bootstrapper<T> b = catalog.bootstrapper(bootstrapper, instrumentType, context);
        return b.bootstrap(instruments);
    }

    static String or(String name, String fallback) {
        return name == null ? fallback : name;
    }
}
