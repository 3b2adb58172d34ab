package com.trading.curve.engine;

import com.trading.curve.api.Compounding;
import com.trading.curve.api.CurvePoints;
import com.trading.curve.api.DayCount;
import com.trading.curve.api.Interpolant;
import com.trading.curve.api.Interpolator;
import com.trading.curve.compounding.SimpleCompounding;
import com.trading.curve.daycount.Act365;
import com.trading.curve.exception.CurveValidationException;
import com.trading.curve.interp.LinearInterpolator;
import com.trading.curve.io.CurveRepresentation;
import com.trading.curve.util.CurveOperations;
import com.trading.curve.util.ParYields;

import java.time.LocalDate;
import java.util.Arrays;

import lombok.Builder;
import lombok.Getter;

/**
 * A term structure of spot rates with bound interpolation, day-count and
 * compounding strategies.
 *
 * <p>
 * Immutable after construction. The tenor and rate arrays are copied in,
 * sorted by tenor (stable, duplicates kept) and never handed out without a
 * copy. Strategies are shared, stateless objects; the curve holds references
 * to them and does not subclass them. Instances can be queried from any number
 * of threads.
 *
 * <h3>Queries</h3>
 * <ul>
 * <li>{@link #spotRate(double)}: stored rate at a stored tenor, interpolated
 * inside the range, extrapolated outside.</li>
 * <li>{@link #discountFactor(double)}, {@link #forwardRate(double, double)},
 * {@link #zeroCouponPrice(double, double)}: derived through the bound
 * {@link Compounding}.</li>
 * </ul>
 */
public final class YieldCurve {
    public static final String SPOT = "spot";
    public static final String INDEX_BASED = "index_based";

    /** Relative tolerance for matching a query to a stored tenor. */
    static final double TENOR_TOLERANCE = 1e-9;

    private final double[] tenors;
    private final double[] rates;
    @Getter
    private final String curveType;
    @Getter
    private final Interpolator interpolator;
    @Getter
    private final DayCount dayCount;
    @Getter
    private final Compounding compounding;
    private final Interpolant interpolant;

    /**
     * Missing strategies default to linear interpolation, ACT/365 and simple
     * compounding; a missing type defaults to {@link #SPOT}.
     *
     * @throws CurveValidationException on null or mismatched arrays, an empty
     *                                  curve, non-positive tenors or non-finite
     *                                  values.
     */
    @Builder
    public YieldCurve(double[] tenors, double[] rates, Interpolator interpolator, DayCount dayCount,
            Compounding compounding, String curveType) {
        if (tenors == null || rates == null)
            throw new CurveValidationException("Tenors and rates must not be null");
        if (tenors.length != rates.length)
            throw new CurveValidationException(
                    "Tenors and rates must have the same length: " + tenors.length + " vs " + rates.length);
        if (tenors.length == 0)
            throw new CurveValidationException("A curve needs at least one point");
        for (int i = 0; i < tenors.length; i++) {
            if (!(tenors[i] > 0) || Double.isInfinite(tenors[i]))
                throw new CurveValidationException("Tenors must be positive and finite, got " + tenors[i]);
            if (!Double.isFinite(rates[i]))
                throw new CurveValidationException("Rate at tenor " + tenors[i] + " is not finite: " + rates[i]);
        }

        CurvePoints sorted = CurveOperations.sortByTenor(tenors, rates);
        this.tenors = sorted.tenors();
        this.rates = sorted.rates();
        this.interpolator = interpolator != null ? interpolator : new LinearInterpolator();
        this.dayCount = dayCount != null ? dayCount : new Act365();
        this.compounding = compounding != null ? compounding : new SimpleCompounding();
        this.curveType = curveType != null ? curveType : SPOT;
        this.interpolant = this.interpolator.bind(this.tenors, this.rates);
    }

    /**
     * Spot rate at {@code tenor} years.
     *
     * @throws CurveValidationException if {@code tenor <= 0}.
     */
    public double spotRate(double tenor) {
        if (!(tenor > 0))
            throw new CurveValidationException("Tenor must be positive, got " + tenor);

        int match = matchIndex(tenor);
        if (match >= 0)
            return rates[match];
        if (tenor < tenors[0] || tenor > tenors[tenors.length - 1])
            return interpolant.extrapolate(tenor);
        return interpolant.interpolate(tenor);
    }

    /** {@code compounding.discountFactor(spotRate(t), t)}. */
    public double discountFactor(double tenor) {
        return compounding.discountFactor(spotRate(tenor), tenor);
    }

    /**
     * Discount factor for a payment date, measuring time with the bound day
     * count. A payment on the valuation date discounts to 1.
     */
    public double discountFactor(LocalDate valuationDate, LocalDate paymentDate) {
        double t = dayCount.yearFraction(valuationDate, paymentDate);
        if (t == 0.0)
            return 1.0;
        return discountFactor(t);
    }

    /**
     * Forward rate between {@code t1} and {@code t2}.
     *
     * @throws CurveValidationException unless {@code t2 > t1}.
     */
    public double forwardRate(double t1, double t2) {
        if (!(t2 > t1))
            throw new CurveValidationException("t2 must be greater than t1: t1=" + t1 + ", t2=" + t2);
        double r1 = spotRate(t1);
        double r2 = spotRate(t2);
        return compounding.forwardRate(r1, t1, r2, t2);
    }

    /** Price of a zero-coupon bond with a face value of 100. */
    public double zeroCouponPrice(double tenor) {
        return zeroCouponPrice(tenor, 100.0);
    }

    public double zeroCouponPrice(double tenor, double faceValue) {
        return faceValue * discountFactor(tenor);
    }

    /** Annual coupon rate that prices a bullet bond at par off this curve. */
    public double parYield(double maturity, int frequency) {
        return ParYields.parYield(this::discountFactor, maturity, frequency);
    }

    /** Year fraction under the bound day count. */
    public double yearFraction(LocalDate start, LocalDate end) {
        return dayCount.yearFraction(start, end);
    }

    public CurveRepresentation toRepresentation() {
        return new CurveRepresentation(tenors.clone(), rates.clone(), curveType);
    }

    public double[] tenors() {
        return tenors.clone();
    }

    public double[] rates() {
        return rates.clone();
    }

    public int size() {
        return tenors.length;
    }

    public double minTenor() {
        return tenors[0];
    }

    public double maxTenor() {
        return tenors[tenors.length - 1];
    }

    /** First stored index within tolerance of {@code tenor}, or -1. */
    private int matchIndex(double tenor) {
        double tol = TENOR_TOLERANCE * Math.max(1.0, Math.abs(tenor));
        int lo = 0, hi = tenors.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (tenors[mid] < tenor - tol)
                lo = mid + 1;
            else
                hi = mid;
        }
        return (lo < tenors.length && tenors[lo] <= tenor + tol) ? lo : -1;
    }

    @Override
    public String toString() {
        return "YieldCurve{type=" + curveType
                + ", interpolator=" + interpolator.getClass().getSimpleName()
                + ", dayCount=" + dayCount.getClass().getSimpleName()
                + ", compounding=" + compounding.getClass().getSimpleName()
                + ", tenors=" + Arrays.toString(tenors)
                + ", rates=" + Arrays.toString(rates) + "}";
    }
}
