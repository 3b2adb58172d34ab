package com.trading.curve.engine;

import com.trading.curve.exception.UnknownStrategyException;
import org.junit.Test;

import java.util.List;
import java.util.function.Supplier;

import static org.junit.Assert.*;

public class StrategyRegistryTest {

    private static StrategyRegistry<Supplier<String>> registry() {
        return StrategyRegistry.<Supplier<String>>builder("widget")
                .register("Alpha", () -> "a")
                .register("beta", () -> "b")
                .build();
    }

    @Test
    public void testCaseInsensitiveLookup() {
        var reg = registry();
        assertEquals("a", reg.get("alpha").get());
        assertEquals("a", reg.get("ALPHA").get());
        assertTrue(reg.contains("Beta"));
        assertFalse(reg.contains(null));
        assertEquals(List.of("Alpha", "beta"), reg.names());
        assertEquals("widget", reg.family());
    }

    @Test
    public void testUnknownNameListsRegistered() {
        try {
            registry().get("gamma");
            fail("Should reject an unknown name");
        } catch (UnknownStrategyException e) {
            assertEquals("Unknown widget: gamma. Available: [Alpha, beta]", e.getMessage());
            assertEquals(List.of("Alpha", "beta"), e.available());
        }
    }

    @Test
    public void testReRegistrationReplaces() {
        var reg = registry().toBuilder().register("ALPHA", () -> "a2").build();
        assertEquals(2, reg.size());
        assertEquals("a2", reg.get("alpha").get());
        // the original is untouched
        assertEquals("a", registry().get("alpha").get());
    }

    @Test
    public void testBlankNameRejected() {
        try {
            StrategyRegistry.<Supplier<String>>builder("widget").register(" ", () -> "x");
            fail("Should reject a blank name");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("blank"));
        }
    }
}
