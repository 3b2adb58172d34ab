package com.trading.curve.index;

import com.trading.curve.bootstrap.IndexBootstrapper;
import com.trading.curve.engine.CurveFactory;
import com.trading.curve.engine.YieldCurve;
import com.trading.curve.exception.CurveValidationException;
import com.trading.curve.instrument.IndexObservation;
import com.trading.curve.instrument.RateQuote;

import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Builds curves from benchmark index fixings.
 *
 * <p>
 * Day count and compounding left null are taken from the index definition
 * (from the primary index for multi-index curves, falling back to ACT/360 and
 * simple compounding when there is none). Curves produced here carry the type
 * {@link YieldCurve#INDEX_BASED}.
 */
@Log4j2
public class IndexCurveFactory {
    public static final String DEFAULT_INTERPOLATION = "cubic_spline";
    public static final String DEFAULT_BOOTSTRAPPER = "index";
    public static final String FALLBACK_DAY_COUNT = "ACT/360";
    public static final String FALLBACK_COMPOUNDING = "simple";

    private final CurveFactory curves;

    public IndexCurveFactory(CurveFactory curves) {
        this.curves = curves;
    }

    public static IndexCurveFactory defaults() {
        return new IndexCurveFactory(CurveFactory.defaults());
    }

    public IndexRegistry indexes() {
        return curves.indexes();
    }

    public YieldCurve createFromIndex(String indexCode, List<RateQuote> quotes) {
        return createFromIndex(indexCode, quotes, DEFAULT_INTERPOLATION, null, null);
    }

    /**
     * Curve from the quotes of a single index.
     *
     * @throws com.trading.curve.exception.UnknownStrategyException if the
     *                                                              index is
     *                                                              not
     *                                                              registered.
     */
    public YieldCurve createFromIndex(String indexCode, List<RateQuote> quotes, String interpolation,
            String dayCount, String compounding) {
        InterestRateIndex index = indexes().require(indexCode);
        if (quotes == null || quotes.isEmpty())
            throw new CurveValidationException("No quotes provided for index " + index.code());

        List<IndexObservation> observations = quotes.stream().map(q -> q.forIndex(index.code())).toList();
        log.debug("Building {} curve from {} quotes", index, observations.size());
        return build(observations, index.code(), interpolation,
                dayCount != null ? dayCount : index.dayCount(),
                compounding != null ? compounding : index.compounding());
    }

    public YieldCurve createFromMultipleIndexes(Map<String, ? extends List<RateQuote>> quotesByIndex,
            String primaryIndex) {
        return createFromMultipleIndexes(quotesByIndex, primaryIndex, DEFAULT_INTERPOLATION, null, null);
    }

    /**
     * Curve from the quotes of several indexes. At equal tenors the primary
     * index's quote is the one a lookup returns.
     */
    public YieldCurve createFromMultipleIndexes(Map<String, ? extends List<RateQuote>> quotesByIndex,
            String primaryIndex, String interpolation, String dayCount, String compounding) {
        if (quotesByIndex == null || quotesByIndex.isEmpty())
            throw new CurveValidationException("No index data provided");

        InterestRateIndex primary = primaryIndex == null ? null : indexes().require(primaryIndex);
        String dc = dayCount != null ? dayCount : primary != null ? primary.dayCount() : FALLBACK_DAY_COUNT;
        String comp = compounding != null ? compounding
                : primary != null ? primary.compounding() : FALLBACK_COMPOUNDING;

        List<IndexObservation> observations = IndexBootstrapper.flatten(quotesByIndex);
        log.debug("Building multi-index curve from {} ({} quotes, primary={})", quotesByIndex.keySet(),
                observations.size(), primary == null ? "none" : primary.code());
        return build(observations, primary == null ? null : primary.code(), interpolation, dc, comp);
    }

    /** Code to full name of the registered indexes, optionally for one currency. */
    public Map<String, String> listAvailableIndexes(String currency) {
        return indexes().listAvailable(currency);
    }

    public Map<String, String> listAvailableIndexes() {
        return listAvailableIndexes(null);
    }

    private YieldCurve build(List<IndexObservation> observations, String primaryIndex, String interpolation,
            String dayCount, String compounding) {
        String interp = interpolation == null ? DEFAULT_INTERPOLATION : interpolation;
        // Resolve every name before touching the data.
        curves.catalog().interpolator(interp);
        curves.catalog().dayCount(dayCount);
        curves.catalog().compounding(compounding);
        return curves.createCurve(
                curves.bootstrap(DEFAULT_BOOTSTRAPPER, IndexObservation.class, observations, compounding,
                        primaryIndex),
                interp, dayCount, compounding, YieldCurve.INDEX_BASED);
    }
}
