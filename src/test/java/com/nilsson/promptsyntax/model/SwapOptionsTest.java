package com.nilsson.promptsyntax.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SwapOptionsTest {

    @Test
    void testDefaults() {
        SwapOptions options = SwapOptions.defaults();
        assertEquals(0.0, options.sStart());
        assertEquals(SwapOptions.DEFAULT_S_END, options.sEnd());
        assertEquals(0.0, options.tStart());
        assertEquals(1.0, options.tEnd());
        assertEquals(4, options.asMap().size(), "Only the schedule keys are present by default");
    }

    @Test
    void testShapeFreedomConversion() {
        SwapOptions options = SwapOptions.of(Map.of(SwapOptions.SHAPE_FREEDOM, OptionValue.of(0.5)));
        assertEquals(0.2062994740159002, options.sEnd(), 1e-12);
        assertFalse(options.asMap().containsKey(SwapOptions.SHAPE_FREEDOM));

        SwapOptions none = SwapOptions.of(Map.of(SwapOptions.SHAPE_FREEDOM, OptionValue.of(0.0)));
        assertEquals(1.0, none.sEnd(), 1e-12);
    }

    @Test
    void testExplicitSEndWinsOverShapeFreedom() {
        Map<String, OptionValue> given = new LinkedHashMap<>();
        given.put(SwapOptions.S_END, OptionValue.of(0.3));
        given.put(SwapOptions.SHAPE_FREEDOM, OptionValue.of(0.5));
        assertEquals(0.3, SwapOptions.of(given).sEnd(), 1e-12);
    }

    @Test
    void testInvalidValues() {
        assertThrows(ParsingException.class,
                () -> SwapOptions.of(Map.of(SwapOptions.SHAPE_FREEDOM, OptionValue.of(1.5))));
        assertThrows(ParsingException.class,
                () -> SwapOptions.of(Map.of(SwapOptions.SHAPE_FREEDOM, OptionValue.of(-0.1))));
        assertThrows(ParsingException.class,
                () -> SwapOptions.of(Map.of(SwapOptions.T_END, OptionValue.of("late"))));
        assertThrows(ParsingException.class,
                () -> SwapOptions.of(Map.of(SwapOptions.WEIGHT, OptionValue.flag())));
    }

    @Test
    void testUnknownKeysAreKept() {
        SwapOptions options = SwapOptions.of(Map.of("mode", OptionValue.of("soft"), "strict", OptionValue.flag()));
        assertEquals(OptionValue.of("soft"), options.get("mode").orElseThrow());
        assertTrue(options.isFlagSet("strict"));
        assertFalse(options.isFlagSet("mode"), "A text value is not a flag");
        assertTrue(options.get("missing").isEmpty());
    }

    @Test
    void testEquality() {
        assertEquals(SwapOptions.defaults(), SwapOptions.of(Map.of()));
        assertEquals(SwapOptions.defaults(), SwapOptions.of(Map.of(SwapOptions.T_END, OptionValue.of(1.0))));
        assertNotEquals(SwapOptions.defaults(), SwapOptions.of(Map.of(SwapOptions.S_START, OptionValue.of(0.1))));
    }
}
