package com.stockmetrics.model;

/**
 * 模块说明：YearlyBar（class）。
 * 主要职责：按 (symbol, year) 聚合的年度开收盘价，previousClose 为上一年度收盘价。
 * 使用建议：首个年度的 previousClose 与 yearlyReturn 均为 null。
 */
public final class YearlyBar {
    public final String symbol;
    public final int year;
    public final double yearlyOpen;
    public final double yearlyClose;
    public final Double previousClose;
    public final Double yearlyReturn;

    public YearlyBar(String symbol, int year, double yearlyOpen, double yearlyClose, Double previousClose, Double yearlyReturn) {
        this.symbol = symbol;
        this.year = year;
        this.yearlyOpen = yearlyOpen;
        this.yearlyClose = yearlyClose;
        this.previousClose = previousClose;
        this.yearlyReturn = yearlyReturn;
    }
}
