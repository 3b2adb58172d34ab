package com.trading.curve.bootstrap;

import com.trading.curve.api.Bootstrapper;
import com.trading.curve.api.CurvePoints;
import com.trading.curve.exception.CurveValidationException;
import com.trading.curve.index.IndexRegistry;
import com.trading.curve.index.InterestRateIndex;
import com.trading.curve.instrument.IndexObservation;
import com.trading.curve.instrument.RateQuote;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Aggregates index fixings into curve points.
 *
 * <p>
 * Observed index rates are used as spot rates unchanged: this is an
 * aggregation step, not a stripping algorithm. Converting futures-, FRA- or
 * swap-implied rates into spot rates is not done here.
 *
 * <p>
 * Output is sorted by tenor. When a primary index is set, its observations
 * come first among equal tenors, so a curve lookup at that tenor resolves to
 * the primary index.
 */
public final class IndexBootstrapper implements Bootstrapper<IndexObservation> {
    private final IndexRegistry indexes;
    private final String primaryIndex;

    public IndexBootstrapper(IndexRegistry indexes) {
        this(indexes, null);
    }

    public IndexBootstrapper(IndexRegistry indexes, String primaryIndex) {
        this.indexes = indexes;
        this.primaryIndex = primaryIndex == null ? null : indexes.require(primaryIndex).code();
    }

    @Override
    public Class<IndexObservation> instrumentType() {
        return IndexObservation.class;
    }

    public String primaryIndex() {
        return primaryIndex;
    }

    @Override
    public CurvePoints bootstrap(List<? extends IndexObservation> observations) {
        if (observations == null || observations.isEmpty())
            throw new CurveValidationException("No index data provided for bootstrapping");

        List<IndexObservation> normalized = new ArrayList<>(observations.size());
        for (IndexObservation obs : observations) {
            String code = obs.index() == null ? "" : obs.index();
            InterestRateIndex index = indexes.require(code);
            if (!(obs.tenor() > 0))
                throw new CurveValidationException(
                        "Invalid tenor for index " + index.code() + ": " + obs.tenor());
            normalized.add(new IndexObservation(index.code(), obs.tenor(), obs.rate()));
        }

        normalized.sort(Comparator.comparingDouble(IndexObservation::tenor)
                .thenComparingInt(o -> o.index().equals(primaryIndex) ? 0 : 1));

        double[] tenors = new double[normalized.size()];
        double[] rates = new double[normalized.size()];
        for (int i = 0; i < normalized.size(); i++) {
            tenors[i] = normalized.get(i).tenor();
            rates[i] = normalized.get(i).rate();
        }
        return new CurvePoints(tenors, rates);
    }

    /**
     * Flattens quotes from several indexes, tagging each with its source code.
     * Iteration order of the map is preserved.
     */
    public static List<IndexObservation> flatten(Map<String, ? extends List<RateQuote>> quotesByIndex) {
        List<IndexObservation> all = new ArrayList<>();
        for (Map.Entry<String, ? extends List<RateQuote>> e : quotesByIndex.entrySet()) {
            for (RateQuote q : e.getValue())
                all.add(q.forIndex(e.getKey()));
        }
        return all;
    }
}
