package com.trading.curve;

import com.trading.curve.api.Interpolator;
import com.trading.curve.bootstrap.SolverSettings;
import com.trading.curve.engine.StrategyCatalog;
import com.trading.curve.engine.YieldCurve;
import com.trading.curve.index.FixingFrequency;
import com.trading.curve.index.IndexRegistry;
import com.trading.curve.index.IndexType;
import com.trading.curve.index.InterestRateIndex;
import com.trading.curve.instrument.Bond;
import com.trading.curve.instrument.RateQuote;
import com.trading.curve.util.SolverStatsListener;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class CurveEngineTest {

    @Test
    public void testDefaultEngine() {
        CurveEngine engine = CurveEngine.create();
        assertSame(StrategyCatalog.defaults(), engine.catalog());
        assertEquals(12, engine.indexes().size());

        YieldCurve curve = engine.curves().createSpotCurve(new double[] { 1, 2, 3 },
                new double[] { 0.02, 0.025, 0.03 });
        assertEquals(0.0225, curve.spotRate(1.5), 1e-12);
    }

    @Test
    public void testCustomisedEngine() {
        Interpolator nearest = new Interpolator() {
            @Override
            public double interpolate(double[] tenors, double[] rates, double target) {
                int best = 0;
                for (int i = 1; i < tenors.length; i++) {
                    if (Math.abs(tenors[i] - target) < Math.abs(tenors[best] - target))
                        best = i;
                }
                return rates[best];
            }

            @Override
            public double extrapolate(double[] tenors, double[] rates, double target) {
                return target < tenors[0] ? rates[0] : rates[rates.length - 1];
            }
        };
        IndexRegistry indexes = IndexRegistry.builder()
                .registerDefaults()
                .register(new InterestRateIndex("TONA", "Tokyo Overnight Average Rate", "JPY", IndexType.OIS,
                        "ACT/365", "simple", FixingFrequency.DAILY, "Japanese Yen overnight rate"))
                .build();
        var stats = new SolverStatsListener();

        CurveEngine engine = CurveEngine.builder()
                .catalog(StrategyCatalog.builder().registerInterpolator("nearest", () -> nearest).build())
                .indexes(indexes)
                .solverSettings(new SolverSettings(-0.01, 0.2, 50, -0.05, 1.0, 100, 1e-12, 1e-10))
                .listener(stats)
                .build();

        YieldCurve tona = engine.indexCurves().createFromIndex("TONA",
                List.of(new RateQuote(0.25, 0.001), new RateQuote(1.0, 0.002)), "nearest", null, null);
        assertEquals(0.001, tona.spotRate(0.5), 0.0);

        engine.curves().createFromBonds(List.of(Bond.of(2.0, 0.03, 99.0)));
        assertEquals(1, stats.pointsSolved());
        assertEquals(1, engine.indexCurves().listAvailableIndexes("JPY").size());
    }
}
