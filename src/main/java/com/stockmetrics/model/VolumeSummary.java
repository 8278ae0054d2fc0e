package com.stockmetrics.model;

public final class VolumeSummary {
    public final String symbol;
    public final int year;
    public final double avgVolume;
    public final double maxVolume;

    public VolumeSummary(String symbol, int year, double avgVolume, double maxVolume) {
        this.symbol = symbol;
        this.year = year;
        this.avgVolume = avgVolume;
        this.maxVolume = maxVolume;
    }
}
