package com.stockmetrics.model;

/**
 * Mean and max of the non-null rolling volatility values of one (symbol, year).
 * Both are null when the year has no fully covered window.
 */
public final class YearlyVolatilitySummary {
    public final String symbol;
    public final int year;
    public final Double avgVolatility;
    public final Double maxVolatility;

    public YearlyVolatilitySummary(String symbol, int year, Double avgVolatility, Double maxVolatility) {
        this.symbol = symbol;
        this.year = year;
        this.avgVolatility = avgVolatility;
        this.maxVolatility = maxVolatility;
    }
}
