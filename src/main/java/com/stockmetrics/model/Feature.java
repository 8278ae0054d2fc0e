package com.stockmetrics.model;

import java.util.List;

/**
 * The enumerated numeric columns that enter the pooled correlation.
 * Anything not listed here (year, month, previous_adjusted) is never correlated.
 */
public enum Feature {
    CLOSE("close"),
    DAILY_RETURN("daily_return"),
    DAILY_RANGE("daily_range"),
    VOLUME("volume"),
    ROLLING_VOLUME("rolling_volume"),
    ROLLING_VOLATILITY("rolling_volatility");

    private static final List<Feature> ORDERED = List.of(values());

    private final String column;

    Feature(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    public static List<Feature> ordered() {
        return ORDERED;
    }
}
