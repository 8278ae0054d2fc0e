package com.stockmetrics.rolling;

import com.stockmetrics.model.DerivedPricePoint;
import com.stockmetrics.model.RollingStat;
import com.stockmetrics.model.YearlyVolatilitySummary;
import org.apache.commons.math3.stat.descriptive.UnivariateStatistic;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Max;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 模块说明：RollingWindowEngine（class）。
 * 主要职责：在单个 symbol 的日期序列上计算固定宽度的滚动波动率（样本标准差，N-1）与滚动平均成交量。
 * 使用建议：窗口未满或窗口内存在 null 时结果为 null，不做部分窗口近似。
 */
public final class RollingWindowEngine {
    public static final int DEFAULT_WINDOW = 30;

    private final int window;

    public RollingWindowEngine() {
        this(DEFAULT_WINDOW);
    }

    public RollingWindowEngine(int window) {
        if (window < 2) {
            throw new IllegalArgumentException("rolling window must be at least 2, got " + window);
        }
        this.window = window;
    }

    public int window() {
        return window;
    }

/**
 * 方法说明：rollingStats，负责产出逐日滚动统计。
 * 处理流程：波动率使用调用方指定的对齐方式；成交量始终使用尾随窗口。
 */
    public List<RollingStat> rollingStats(List<DerivedPricePoint> series, WindowAlignment volatilityAlignment) {
        if (series == null || series.isEmpty()) {
            return List.of();
        }
        Double[] volatility = volatility(series, volatilityAlignment);
        Double[] volume = volume(series);
        List<RollingStat> out = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            DerivedPricePoint row = series.get(i);
            out.add(new RollingStat(row.symbol(), row.date(), volatility[i], volume[i]));
        }
        return out;
    }

/**
 * 方法说明：rollingStatsWithinYears，负责按自然年分段计算滚动统计。
 * 处理流程：先按年份切分序列，每段独立计算，窗口不会跨越年份边界。
 * 维护提示：年度波动率汇总必须使用这里的结果；交易日不足一个窗口的年份全部为 null。
 */
    public List<RollingStat> rollingStatsWithinYears(List<DerivedPricePoint> series, WindowAlignment volatilityAlignment) {
        if (series == null || series.isEmpty()) {
            return List.of();
        }
        Map<Integer, List<DerivedPricePoint>> byYear = new TreeMap<>();
        for (DerivedPricePoint row : series) {
            byYear.computeIfAbsent(row.price.year(), ignored -> new ArrayList<>()).add(row);
        }
        List<RollingStat> out = new ArrayList<>(series.size());
        for (List<DerivedPricePoint> slice : byYear.values()) {
            out.addAll(rollingStats(slice, volatilityAlignment));
        }
        return out;
    }

    public Double[] volatility(List<DerivedPricePoint> series, WindowAlignment alignment) {
        double[] returns = new double[series.size()];
        for (int i = 0; i < series.size(); i++) {
            Double value = series.get(i).dailyReturn;
            returns[i] = value == null ? Double.NaN : value;
        }
        return apply(returns, alignment, new StandardDeviation(true));
    }

    public Double[] volume(List<DerivedPricePoint> series) {
        double[] volumes = new double[series.size()];
        for (int i = 0; i < series.size(); i++) {
            volumes[i] = series.get(i).price.volume;
        }
        return apply(volumes, WindowAlignment.TRAILING, new Mean());
    }

/**
 * 方法说明：yearlySummary，负责按年汇总滚动波动率。
 * 处理流程：只统计非 null 值；某年全部为 null 时均值与最大值都为 null。
 * 维护提示：每个出现过的年份都会输出一行，保证下游表格的 (symbol, year) 完整。
 */
    public List<YearlyVolatilitySummary> yearlySummary(List<RollingStat> stats) {
        if (stats == null || stats.isEmpty()) {
            return List.of();
        }
        Map<Integer, List<Double>> byYear = new TreeMap<>();
        String symbol = stats.get(0).symbol;
        for (RollingStat stat : stats) {
            List<Double> values = byYear.computeIfAbsent(stat.date.getYear(), ignored -> new ArrayList<>());
            if (stat.rollingVolatility != null) {
                values.add(stat.rollingVolatility);
            }
        }
        List<YearlyVolatilitySummary> out = new ArrayList<>(byYear.size());
        for (Map.Entry<Integer, List<Double>> entry : byYear.entrySet()) {
            List<Double> values = entry.getValue();
            if (values.isEmpty()) {
                out.add(new YearlyVolatilitySummary(symbol, entry.getKey(), null, null));
                continue;
            }
            double[] raw = values.stream().mapToDouble(Double::doubleValue).toArray();
            out.add(new YearlyVolatilitySummary(
                    symbol,
                    entry.getKey(),
                    new Mean().evaluate(raw),
                    new Max().evaluate(raw)
            ));
        }
        return out;
    }

    private Double[] apply(double[] values, WindowAlignment alignment, UnivariateStatistic statistic) {
        int n = values.length;
        Double[] out = new Double[n];
        int[] missingPrefix = new int[n + 1];
        for (int i = 0; i < n; i++) {
            missingPrefix[i + 1] = missingPrefix[i] + (Double.isFinite(values[i]) ? 0 : 1);
        }
        for (int t = 0; t < n; t++) {
            int first = alignment.firstIndex(t, window);
            int last = alignment.lastIndex(t, window);
            if (first < 0 || last >= n) {
                continue;
            }
            if (missingPrefix[last + 1] - missingPrefix[first] > 0) {
                continue;
            }
            out[t] = statistic.evaluate(values, first, window);
        }
        return out;
    }
}
