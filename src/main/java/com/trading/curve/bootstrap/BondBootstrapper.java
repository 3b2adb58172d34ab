package com.trading.curve.bootstrap;

import com.trading.curve.api.BootstrapListener;
import com.trading.curve.api.Bootstrapper;
import com.trading.curve.api.Compounding;
import com.trading.curve.api.CurvePoints;
import com.trading.curve.api.Interpolator;
import com.trading.curve.compounding.SimpleCompounding;
import com.trading.curve.exception.ConvergenceException;
import com.trading.curve.exception.CurveValidationException;
import com.trading.curve.instrument.Bond;
import com.trading.curve.interp.LinearInterpolator;
import com.trading.curve.util.BrentSolver;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

import lombok.extern.log4j.Log4j2;

/**
 * Bootstraps a spot curve from coupon bond prices.
 *
 * <p>
 * Bonds are processed in increasing maturity. For each bond, the spot rate at
 * its maturity is the root of
 *
 * <pre>
 *   sum_i CF_i * df(r(t_i), t_i) - price = 0
 * </pre>
 *
 * where coupons before maturity are discounted at rates interpolated from the
 * points already solved (held flat beyond them) and the final cash flow is
 * discounted at the unknown rate. Each solved point therefore depends on all
 * shorter ones.
 *
 * <p>
 * Zero-coupon bonds have one cash flow and are solved in closed form,
 * {@code r = compounding.zeroRate(price / face, maturity)}.
 *
 * <p>
 * Coupon bonds use {@link BrentSolver} on the configured bracket, then once
 * more on the widened bracket; a second failure raises
 * {@link ConvergenceException}. Both attempts are capped in iterations.
 */
@Log4j2
public final class BondBootstrapper implements Bootstrapper<Bond> {
    private static final double MATURITY_TOLERANCE = 1e-9;

    private final Compounding compounding;
    private final Interpolator interpolator;
    private final SolverSettings settings;
    private final BootstrapListener listener;
    private final BrentSolver solver;
    private final BrentSolver widenedSolver;

    /** Simple compounding, linear interpolation, default solver settings. */
    public BondBootstrapper() {
        this(new SimpleCompounding(), new LinearInterpolator(), SolverSettings.defaults(), BootstrapListener.NONE);
    }

    public BondBootstrapper(Compounding compounding, Interpolator interpolator, SolverSettings settings,
            BootstrapListener listener) {
        this.compounding = compounding;
        this.interpolator = interpolator;
        this.settings = settings == null ? SolverSettings.defaults() : settings;
        this.listener = listener == null ? BootstrapListener.NONE : listener;
        this.solver = new BrentSolver(this.settings.maxIterations(), this.settings.rateTolerance(),
                this.settings.priceTolerance());
        this.widenedSolver = new BrentSolver(this.settings.widenedMaxIterations(), this.settings.rateTolerance(),
                this.settings.priceTolerance());
    }

    @Override
    public Class<Bond> instrumentType() {
        return Bond.class;
    }

    @Override
    public CurvePoints bootstrap(List<? extends Bond> bonds) {
        if (bonds == null || bonds.isEmpty())
            throw new CurveValidationException("No bond data provided for bootstrapping");

        List<? extends Bond> sorted = bonds.stream()
                .sorted(Comparator.comparingDouble(Bond::maturity))
                .toList();

        int n = sorted.size();
        double[] tenors = new double[n];
        double[] rates = new double[n];

        for (int i = 0; i < n; i++) {
            Bond bond = sorted.get(i);
            validate(bond);

            double rate;
            int iterations;
            if (bond.isZeroCoupon()) {
                rate = compounding.zeroRate(bond.price() / bond.faceValue(), bond.maturity());
                iterations = 0;
            } else {
                // Solved points are tenors[0..i), rates[0..i)
                double[] knownTenors = Arrays.copyOf(tenors, i);
                double[] knownRates = Arrays.copyOf(rates, i);
                BrentSolver.Result result = solve(i, bond, knownTenors, knownRates);
                rate = result.root();
                iterations = result.iterations();
            }

            tenors[i] = bond.maturity();
            rates[i] = rate;
            listener.onPointSolved(i, bond.maturity(), rate, iterations);
            log.debug("Bootstrapped {}Y: rate={} ({} iterations)", bond.maturity(), rate, iterations);
        }
        return new CurvePoints(tenors, rates);
    }

    /**
     * Present value of {@code bond} when its final cash flow is discounted at
     * {@code rate} and earlier ones off the known points.
     */
    double presentValue(Bond bond, double rate, double[] knownTenors, double[] knownRates) {
        double maturity = bond.maturity();
        int frequency = bond.frequency();
        long periods = Math.max(1L, Math.round(maturity * frequency));
        double coupon = bond.faceValue() * bond.coupon() / frequency;

        double pv = 0.0;
        for (long k = 0; k < periods; k++) {
            // Payment dates are laid back from maturity in 1/frequency steps.
            double t = maturity - (double) (periods - 1 - k) / frequency;
            boolean last = k == periods - 1;
            double cf = last ? coupon + bond.faceValue() : coupon;

            double r = (!last && t < maturity - MATURITY_TOLERANCE && knownTenors.length > 0)
                    ? knownRate(knownTenors, knownRates, t)
                    : rate;
            pv += cf * compounding.discountFactor(r, t);
        }
        return pv;
    }

    private double knownRate(double[] knownTenors, double[] knownRates, double t) {
        int last = knownTenors.length - 1;
        if (t <= knownTenors[0])
            return knownRates[0];
        if (t >= knownTenors[last])
            return knownRates[last];
        return interpolator.interpolate(knownTenors, knownRates, t);
    }

    private BrentSolver.Result solve(int index, Bond bond, double[] knownTenors, double[] knownRates) {
        double maturity = bond.maturity();
        DoubleUnaryOperator objective = r -> presentValue(bond, r, knownTenors, knownRates)
                - bond.price();

        try {
            return solver.solve(objective,
                    admissibleLower(settings.lowerBound(), maturity), settings.upperBound());
        } catch (ConvergenceException first) {
            log.warn("No root for {}Y bond in [{}, {}] ({}); retrying in [{}, {}]",
                    maturity, settings.lowerBound(), settings.upperBound(), first.getMessage(),
                    settings.widenedLowerBound(), settings.widenedUpperBound());
            listener.onBracketWidened(index, maturity);
            try {
                return widenedSolver.solve(objective,
                        admissibleLower(settings.widenedLowerBound(), maturity), settings.widenedUpperBound());
            } catch (ConvergenceException second) {
                throw new ConvergenceException(String.format(
                        "Failed to bootstrap %sY bond (coupon=%s, price=%s) even in widened bracket [%s, %s]: %s",
                        maturity, bond.coupon(), bond.price(), settings.widenedLowerBound(),
                        settings.widenedUpperBound(), second.getMessage()), maturity, second);
            }
        }
    }

    /**
     * Raises a negative lower bound towards zero until the discount factor at
     * maturity is positive and finite. Under simple compounding
     * {@code 1 + r*T} turns negative for long maturities and would flip the
     * sign of the objective without crossing a root.
     */
    private double admissibleLower(double lower, double maturity) {
        double lo = lower;
        for (int i = 0; i < 64 && lo < 0; i++) {
            double df = compounding.discountFactor(lo, maturity);
            if (df > 0 && Double.isFinite(df))
                return lo;
            lo *= 0.5;
        }
        return lo;
    }

    private static void validate(Bond bond) {
        if (!(bond.maturity() > 0))
            throw new CurveValidationException("Bond maturity must be positive, got " + bond.maturity());
        if (!(bond.price() > 0))
            throw new CurveValidationException("Bond price must be positive, got " + bond.price());
        if (bond.frequency() <= 0)
            throw new CurveValidationException("Bond frequency must be positive, got " + bond.frequency());
        if (!(bond.faceValue() > 0))
            throw new CurveValidationException("Bond face value must be positive, got " + bond.faceValue());
        if (!Double.isFinite(bond.coupon()))
            throw new CurveValidationException("Bond coupon must be finite, got " + bond.coupon());
    }
}
