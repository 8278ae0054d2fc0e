package com.stockmetrics.model;

import java.time.LocalDate;

/**
 * A validated price row enriched with its lagged adjusted price and daily return.
 * Both derived fields are null for the first accepted record of a symbol.
 */
public final class DerivedPricePoint {
    public final PricePoint price;
    public final Double previousAdjusted;
    public final Double dailyReturn;

    public DerivedPricePoint(PricePoint price, Double previousAdjusted, Double dailyReturn) {
        this.price = price;
        this.previousAdjusted = previousAdjusted;
        this.dailyReturn = dailyReturn;
    }

    public String symbol() {
        return price.symbol;
    }

    public LocalDate date() {
        return price.date;
    }

    public double dailyRange() {
        return price.high - price.low;
    }
}
