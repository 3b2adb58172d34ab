package com.trading.curve.index;

import com.trading.curve.compounding.ContinuousCompounding;
import com.trading.curve.compounding.SimpleCompounding;
import com.trading.curve.daycount.Act360;
import com.trading.curve.daycount.Act365;
import com.trading.curve.engine.YieldCurve;
import com.trading.curve.exception.CurveValidationException;
import com.trading.curve.exception.UnknownStrategyException;
import com.trading.curve.instrument.RateQuote;
import com.trading.curve.interp.CubicSplineInterpolator;
import com.trading.curve.interp.LinearInterpolator;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class IndexCurveFactoryTest {
    private final IndexCurveFactory factory = IndexCurveFactory.defaults();

    @Test
    public void testSingleSofrQuote() {
        YieldCurve curve = factory.createFromIndex("SOFR", List.of(new RateQuote(0.25, 0.05)));
        assertEquals(0.05, curve.spotRate(0.25), 0.0);
        assertEquals(YieldCurve.INDEX_BASED, curve.getCurveType());
        assertTrue(curve.getDayCount() instanceof Act360);
        assertTrue(curve.getCompounding() instanceof SimpleCompounding);
        assertTrue(curve.getInterpolator() instanceof CubicSplineInterpolator);
    }

    @Test
    public void testExplicitConventionsOverrideIndex() {
        YieldCurve curve = factory.createFromIndex("sofr",
                List.of(new RateQuote(0.25, 0.05), new RateQuote(1.0, 0.048)),
                "linear", "ACT/365", "continuous");
        assertTrue(curve.getDayCount() instanceof Act365);
        assertTrue(curve.getCompounding() instanceof ContinuousCompounding);
        assertTrue(curve.getInterpolator() instanceof LinearInterpolator);
    }

    @Test
    public void testSoniaUsesAct365() {
        YieldCurve curve = factory.createFromIndex("SONIA", List.of(new RateQuote(0.5, 0.047)));
        assertTrue(curve.getDayCount() instanceof Act365);
    }

    @Test
    public void testMultipleIndexesPrimaryWins() {
        Map<String, List<RateQuote>> quotes = new LinkedHashMap<>();
        quotes.put("USD-LIBOR-3M", List.of(new RateQuote(0.25, 0.0555), new RateQuote(0.5, 0.056)));
        quotes.put("SOFR", List.of(new RateQuote(0.25, 0.0528), new RateQuote(1.0, 0.051)));

        YieldCurve curve = factory.createFromMultipleIndexes(quotes, "SOFR");
        assertEquals(0.0528, curve.spotRate(0.25), 0.0);
        assertEquals(4, curve.size());
        assertEquals(YieldCurve.INDEX_BASED, curve.getCurveType());
        assertTrue(curve.getDayCount() instanceof Act360);
    }

    @Test
    public void testPrimaryQuoteHoldsJustPastSharedTenor() {
        Map<String, List<RateQuote>> quotes = new LinkedHashMap<>();
        quotes.put("USD-LIBOR-3M", List.of(new RateQuote(0.25, 0.0555), new RateQuote(0.5, 0.056)));
        quotes.put("SOFR", List.of(new RateQuote(0.25, 0.0528), new RateQuote(1.0, 0.051)));

        for (String interpolation : List.of("linear", "log_linear", "cubic_spline")) {
            YieldCurve curve = factory.createFromMultipleIndexes(quotes, "SOFR", interpolation, null, null);
            assertEquals(interpolation, 0.0528, curve.spotRate(0.25), 0.0);
            assertEquals(interpolation, 0.0528, curve.spotRate(0.25 + 1e-7), 1e-6);
        }

        // linear runs from the primary quote at 0.25 to the other index's 0.5 point
        YieldCurve linear = factory.createFromMultipleIndexes(quotes, "SOFR", "linear", null, null);
        assertEquals(0.0528 + 0.5 * (0.056 - 0.0528), linear.spotRate(0.375), 1e-12);
    }

    @Test
    public void testMultipleIndexesDefaultsWithoutPrimary() {
        Map<String, List<RateQuote>> quotes = new LinkedHashMap<>();
        quotes.put("SONIA", List.of(new RateQuote(0.5, 0.047)));
        quotes.put("GBP-LIBOR-3M", List.of(new RateQuote(0.25, 0.048)));
        YieldCurve curve = factory.createFromMultipleIndexes(quotes, null);
        // no primary: ACT/360 and simple regardless of the indexes' own conventions
        assertTrue(curve.getDayCount() instanceof Act360);
        assertTrue(curve.getCompounding() instanceof SimpleCompounding);
    }

    @Test
    public void testMultipleIndexesPrimaryConventions() {
        Map<String, List<RateQuote>> quotes = new LinkedHashMap<>();
        quotes.put("SONIA", List.of(new RateQuote(0.5, 0.047)));
        YieldCurve curve = factory.createFromMultipleIndexes(quotes, "sonia");
        assertTrue(curve.getDayCount() instanceof Act365);
    }

    @Test
    public void testErrors() {
        try {
            factory.createFromIndex("NOPE", List.of(new RateQuote(0.25, 0.05)));
            fail("Should reject an unknown index");
        } catch (UnknownStrategyException e) {
            assertEquals("NOPE", e.name());
        }
        try {
            factory.createFromIndex("SOFR", List.of());
            fail("Should reject empty quotes");
        } catch (CurveValidationException e) {
            // Expected
        }
        try {
            factory.createFromMultipleIndexes(Map.of(), null);
            fail("Should reject an empty quote map");
        } catch (CurveValidationException e) {
            assertTrue(e.getMessage().contains("No index data"));
        }
        try {
            factory.createFromIndex("SOFR", List.of(new RateQuote(0.25, 0.05)), "bogus", null, null);
            fail("Should reject an unknown interpolator");
        } catch (UnknownStrategyException e) {
            assertEquals("interpolator", e.family());
        }
    }

    @Test
    public void testListAvailableIndexes() {
        Map<String, String> eur = factory.listAvailableIndexes("EUR");
        assertEquals(5, eur.size());
        assertTrue(eur.containsKey("ESTR"));
        assertEquals(12, factory.listAvailableIndexes().size());
    }
}
