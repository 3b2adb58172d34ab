package com.trading.curve;

import com.trading.curve.engine.YieldCurve;
import com.trading.curve.instrument.Bond;
import com.trading.curve.instrument.Deposit;
import com.trading.curve.instrument.RateQuote;
import com.trading.curve.io.CurveJson;
import com.trading.curve.io.JsonCurveCompiler;
import com.trading.curve.util.SolverStatsListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CurveEngineDemo {
    private static final Logger log = LogManager.getLogger(CurveEngineDemo.class);

    public static void main(String[] args) throws IOException {
        log.info("════════════════════════════════════════════════");
        log.info("  Yield Curve Engine Demo");
        log.info("════════════════════════════════════════════════");

        var stats = new SolverStatsListener();
        var engine = CurveEngine.builder().listener(stats).build();

        // 1. Treasury curve from bond prices
        List<Bond> bonds = List.of(
                Bond.zeroCoupon(0.5, 97.8),
                Bond.of(1.0, 0.045, 99.9),
                Bond.of(2.0, 0.0425, 99.5),
                Bond.of(5.0, 0.04, 98.7),
                Bond.of(10.0, 0.0425, 99.2),
                Bond.of(30.0, 0.045, 98.1));
        YieldCurve treasury = engine.curves().createFromBonds(bonds);
        log.info("Treasury curve: {}", treasury);
        for (double t : new double[] { 0.5, 1, 2, 3, 5, 7, 10, 20, 30 }) {
            log.info(String.format("  %5.1fY  spot=%.5f  df=%.6f  par=%.5f", t, treasury.spotRate(t),
                    treasury.discountFactor(t), treasury.parYield(t, 2)));
        }
        log.info("Forward 2Y-5Y: {}", String.format("%.5f", treasury.forwardRate(2, 5)));
        stats.logSummary();

        // 2. Money-market curve from deposits
        YieldCurve deposits = engine.curves().createFromDeposits(List.of(
                new Deposit(1.0 / 12, 0.0530),
                new Deposit(0.25, 0.0532),
                new Deposit(0.5, 0.0528)));
        log.info("Deposit curve: {}", CurveJson.write(deposits));

        // 3. Blended overnight/term curve, SOFR wins ties
        Map<String, List<RateQuote>> quotes = new LinkedHashMap<>();
        quotes.put("SOFR", List.of(new RateQuote(1.0 / 365, 0.0531), new RateQuote(0.25, 0.0528)));
        quotes.put("USD-LIBOR-3M", List.of(new RateQuote(0.25, 0.0555), new RateQuote(0.5, 0.0560)));
        YieldCurve usd = engine.indexCurves().createFromMultipleIndexes(quotes, "SOFR");
        log.info("USD index curve 3M rate: {} (from SOFR)", usd.spotRate(0.25));
        log.info("USD indexes available: {}", engine.indexCurves().listAvailableIndexes("USD"));

        // 4. Declarative definition
        JsonCurveCompiler.CompiledCurve compiled = engine.compiler()
                .compileFile(Path.of("src/main/resources/eur_depo_curve.json"));
        log.info("Compiled '{}': {}", compiled.name(), compiled.curve());
    }
}
