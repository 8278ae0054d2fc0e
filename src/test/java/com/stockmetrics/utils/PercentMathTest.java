package com.stockmetrics.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PercentMathTest {

    @Test
    void round_shouldUseHalfUpOnDecimalRepresentation() {
        assertEquals(1.01, PercentMath.round(1.005, 2));
        assertEquals(-1.01, PercentMath.round(-1.005, 2));
        assertEquals(2.5, PercentMath.round(2.45, 1));
        assertEquals(3.0, PercentMath.round(2.5, 0));
    }

    @Test
    void pctChange_shouldReturnNullWithoutUsableBase() {
        assertNull(PercentMath.pctChange(10.0, null, 2));
        assertNull(PercentMath.pctChange(10.0, 0.0, 2));
        assertNull(PercentMath.pctChange(10.0, -4.0, 2));
        assertNull(PercentMath.pctChange(Double.NaN, 5.0, 2));
    }

    @Test
    void pctChange_shouldRoundPercentChange() {
        assertEquals(10.0, PercentMath.pctChange(110.0, 100.0, 2));
        assertEquals(-33.33, PercentMath.pctChange(2.0, 3.0, 2));
        assertEquals(0.0, PercentMath.pctChange(50.0, 50.0, 2));
    }
}
