package com.trading.curve.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.trading.curve.api.CurvePoints;
import com.trading.curve.engine.CurveFactory;
import com.trading.curve.engine.YieldCurve;
import com.trading.curve.exception.CurveValidationException;
import com.trading.curve.index.IndexCurveFactory;
import com.trading.curve.instrument.Bond;
import com.trading.curve.instrument.Deposit;
import com.trading.curve.instrument.RateQuote;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a JSON {@link CurveDefinition} into a {@link YieldCurve}.
 *
 * <pre>
 * {"curve": {"name": "UST", "source": "bonds", "interpolation": "cubic_spline",
 *            "bonds": [{"maturity": 2, "coupon": 0.04, "price": 99.5}]}}
 * </pre>
 *
 * Unset strategy names take the defaults of the factory method the source maps
 * to. An {@code index} source reads either {@code index} plus {@code points}, or
 * {@code quotes} keyed by index code with an optional {@code primary_index}.
 */
@Log4j2
public final class JsonCurveCompiler {
    private final CurveFactory curves;
    private final IndexCurveFactory indexCurves;

    public JsonCurveCompiler(CurveFactory curves, IndexCurveFactory indexCurves) {
        this.curves = curves;
        this.indexCurves = indexCurves;
    }

    public JsonCurveCompiler(CurveFactory curves) {
        this(curves, new IndexCurveFactory(curves));
    }

    /** A compiled curve together with the name it was defined under. */
    public record CompiledCurve(String name, YieldCurve curve) {
    }

    public CompiledCurve compileFile(Path path) throws IOException {
        return compile(Files.readString(path));
    }

    /**
     * @throws CurveValidationException on malformed JSON or a definition
     *                                  missing the data its source needs.
     */
    public CompiledCurve compile(String json) {
        CurveDefinition def;
        try {
            def = CurveJson.mapper().readValue(json, CurveDefinition.class);
        } catch (JsonProcessingException e) {
            throw new CurveValidationException("Malformed curve definition: " + e.getOriginalMessage(), e);
        }
        return compile(def);
    }

    public CompiledCurve compile(CurveDefinition def) {
        if (def == null || def.getCurve() == null)
            throw new CurveValidationException("Missing 'curve' key");
        CurveDefinition.CurveInfo info = def.getCurve();
        CurveSource source = CurveSource.fromString(info.getSource());

        YieldCurve curve = switch (source) {
            case SPOT -> {
                CurvePoints points = points(required(info.getPoints(), "points"));
                yield curves.createSpotCurve(points.tenors(), points.rates(), info.getInterpolation(),
                        info.getDayCount(), info.getCompounding());
            }
            case BONDS -> curves.createFromBonds(
                    required(info.getBonds(), "bonds").stream()
                            .map(b -> new Bond(b.getMaturity(), b.getCoupon(), b.getPrice(), b.getFrequency(),
                                    b.getFaceValue()))
                            .toList(),
                    info.getBootstrapper(), info.getInterpolation(), info.getDayCount(), info.getCompounding());
            case DEPOSITS -> curves.createFromDeposits(
                    required(info.getDeposits(), "deposits").stream()
                            .map(d -> new Deposit(d.getMaturity(), d.getRate()))
                            .toList(),
                    info.getBootstrapper(), info.getInterpolation(), info.getDayCount(), info.getCompounding());
            case INDEX -> compileIndex(info);
        };

        log.debug("Compiled curve '{}' from {} ({} points)", info.getName(), source, curve.size());
        return new CompiledCurve(info.getName(), curve);
    }

    private YieldCurve compileIndex(CurveDefinition.CurveInfo info) {
        String interpolation = info.getInterpolation() != null ? info.getInterpolation()
                : IndexCurveFactory.DEFAULT_INTERPOLATION;
        if (info.getQuotes() != null && !info.getQuotes().isEmpty()) {
            Map<String, List<RateQuote>> quotes = new LinkedHashMap<>();
            info.getQuotes().forEach((code, pts) -> quotes.put(code, quotes(pts)));
            return indexCurves.createFromMultipleIndexes(quotes, info.getPrimaryIndex(), interpolation,
                    info.getDayCount(), info.getCompounding());
        }
        if (info.getIndex() == null)
            throw new CurveValidationException("Index curve needs 'index' or 'quotes'");
        return indexCurves.createFromIndex(info.getIndex(), quotes(required(info.getPoints(), "points")),
                interpolation, info.getDayCount(), info.getCompounding());
    }

    private static <T> List<T> required(List<T> list, String key) {
        if (list == null || list.isEmpty())
            throw new CurveValidationException("Missing '" + key + "' in curve definition");
        return list;
    }

    private static CurvePoints points(List<CurveDefinition.PointDef> defs) {
        double[] tenors = new double[defs.size()];
        double[] rates = new double[defs.size()];
        for (int i = 0; i < defs.size(); i++) {
            tenors[i] = defs.get(i).getTenor();
            rates[i] = defs.get(i).getRate();
        }
        return new CurvePoints(tenors, rates);
    }

    private static List<RateQuote> quotes(List<CurveDefinition.PointDef> defs) {
        if (defs == null)
            return List.of();
        return defs.stream().map(p -> new RateQuote(p.getTenor(), p.getRate())).toList();
    }
}
