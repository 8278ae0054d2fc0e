package com.stockmetrics.model;

import java.time.LocalDate;

public final class RollingStat {
    public final String symbol;
    public final LocalDate date;
    public final Double rollingVolatility;
    public final Double rollingVolume;

    public RollingStat(String symbol, LocalDate date, Double rollingVolatility, Double rollingVolume) {
        this.symbol = symbol;
        this.date = date;
        this.rollingVolatility = rollingVolatility;
        this.rollingVolume = rollingVolume;
    }
}
