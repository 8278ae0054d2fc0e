package com.stockmetrics.model;

import java.util.List;

/**
 * 模块说明：MetricsReport（class）。
 * 主要职责：一次流水线运行产出的全部输出表，供外部报表/可视化使用。
 * 使用建议：symbolCorrelation 仅在开启 correlation.symbol_pairwise.enabled 时非 null。
 */
public final class MetricsReport {
    public final List<DerivedPricePoint> derivedPrices;
    public final List<MonthlyBar> monthlyBars;
    public final List<YearlyBar> yearlyBars;
    public final List<RollingStat> rollingStats;
    public final List<YearlyVolatilitySummary> volatilitySummaries;
    public final List<VolumeSummary> volumeSummaries;
    public final CorrelationMatrix featureCorrelation;
    public final CorrelationMatrix symbolCorrelation;
    public final List<RowIssue> rejectedRows;

    public MetricsReport(
            List<DerivedPricePoint> derivedPrices,
            List<MonthlyBar> monthlyBars,
            List<YearlyBar> yearlyBars,
            List<RollingStat> rollingStats,
            List<YearlyVolatilitySummary> volatilitySummaries,
            List<VolumeSummary> volumeSummaries,
            CorrelationMatrix featureCorrelation,
            CorrelationMatrix symbolCorrelation,
            List<RowIssue> rejectedRows
    ) {
        this.derivedPrices = derivedPrices == null ? List.of() : List.copyOf(derivedPrices);
        this.monthlyBars = monthlyBars == null ? List.of() : List.copyOf(monthlyBars);
        this.yearlyBars = yearlyBars == null ? List.of() : List.copyOf(yearlyBars);
        this.rollingStats = rollingStats == null ? List.of() : List.copyOf(rollingStats);
        this.volatilitySummaries = volatilitySummaries == null ? List.of() : List.copyOf(volatilitySummaries);
        this.volumeSummaries = volumeSummaries == null ? List.of() : List.copyOf(volumeSummaries);
        this.featureCorrelation = featureCorrelation;
        this.symbolCorrelation = symbolCorrelation;
        this.rejectedRows = rejectedRows == null ? List.of() : List.copyOf(rejectedRows);
    }
}
