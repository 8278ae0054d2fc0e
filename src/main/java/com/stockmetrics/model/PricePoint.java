package com.stockmetrics.model;

import java.time.LocalDate;

/**
 * 模块说明：PricePoint（class）。
 * 主要职责：承载一条 (symbol, date) 日线行情记录，是整个指标流水线的输入粒度。
 * 使用建议：缺失的数值字段以 NaN 表示，由 PanelValidator 判定是否剔除。
 */
public final class PricePoint {
    public final String symbol;
    public final LocalDate date;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final double adjusted;
    public final double volume;

    public PricePoint(
            String symbol,
            LocalDate date,
            double open,
            double high,
            double low,
            double close,
            double adjusted,
            double volume
    ) {
        this.symbol = symbol;
        this.date = date;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.adjusted = adjusted;
        this.volume = volume;
    }

    public int year() {
        return date.getYear();
    }

    @Override
    public String toString() {
        return symbol + "@" + date;
    }
}
