package com.stockmetrics.model;

/**
 * 模块说明：MonthlyBar（class）。
 * 主要职责：按 (symbol, year, month) 聚合的月度开收盘价与环比收益。
 * 使用建议：monthlyReturn 对每个 symbol 的首个月份为 null。
 */
public final class MonthlyBar {
    public final String symbol;
    public final int year;
    public final int month;
    public final double monthlyOpen;
    public final double monthlyClose;
    public final Double monthlyReturn;

    public MonthlyBar(String symbol, int year, int month, double monthlyOpen, double monthlyClose, Double monthlyReturn) {
        this.symbol = symbol;
        this.year = year;
        this.month = month;
        this.monthlyOpen = monthlyOpen;
        this.monthlyClose = monthlyClose;
        this.monthlyReturn = monthlyReturn;
    }
}
