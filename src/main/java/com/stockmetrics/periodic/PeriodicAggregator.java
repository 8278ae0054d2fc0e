package com.stockmetrics.periodic;

import com.stockmetrics.model.DerivedPricePoint;
import com.stockmetrics.model.MonthlyBar;
import com.stockmetrics.model.PricePoint;
import com.stockmetrics.model.VolumeSummary;
import com.stockmetrics.model.YearlyBar;
import com.stockmetrics.utils.PercentMath;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 模块说明：PeriodicAggregator（class）。
 * 主要职责：把单个 symbol 的日线折叠为月度/年度开收盘，并按期链式计算环比收益。
 * 使用建议：期初/期末不完整的区间照常聚合，不额外标记。
 */
public final class PeriodicAggregator {
    private final int scale;

    public PeriodicAggregator() {
        this(2);
    }

    public PeriodicAggregator(int scale) {
        this.scale = Math.max(0, scale);
    }

/**
 * 方法说明：monthly，负责按 (year, month) 聚合。
 * 处理流程：先按日期排序，再取每月首条 open 与末条 close，收益相对上一个有数据的月份。
 */
    public List<MonthlyBar> monthly(List<DerivedPricePoint> series) {
        Map<YearMonth, List<PricePoint>> periods = new TreeMap<>();
        for (PricePoint point : sorted(series)) {
            periods.computeIfAbsent(YearMonth.from(point.date), ignored -> new ArrayList<>()).add(point);
        }
        List<MonthlyBar> out = new ArrayList<>(periods.size());
        Double previousClose = null;
        for (Map.Entry<YearMonth, List<PricePoint>> entry : periods.entrySet()) {
            List<PricePoint> rows = entry.getValue();
            PricePoint first = rows.get(0);
            PricePoint last = rows.get(rows.size() - 1);
            out.add(new MonthlyBar(
                    first.symbol,
                    entry.getKey().getYear(),
                    entry.getKey().getMonthValue(),
                    first.open,
                    last.close,
                    PercentMath.pctChange(last.close, previousClose, scale)
            ));
            previousClose = last.close;
        }
        return out;
    }

    public List<YearlyBar> yearly(List<DerivedPricePoint> series) {
        Map<Integer, List<PricePoint>> periods = groupByYear(series);
        List<YearlyBar> out = new ArrayList<>(periods.size());
        Double previousClose = null;
        for (Map.Entry<Integer, List<PricePoint>> entry : periods.entrySet()) {
            List<PricePoint> rows = entry.getValue();
            PricePoint first = rows.get(0);
            PricePoint last = rows.get(rows.size() - 1);
            out.add(new YearlyBar(
                    first.symbol,
                    entry.getKey(),
                    first.open,
                    last.close,
                    previousClose,
                    PercentMath.pctChange(last.close, previousClose, scale)
            ));
            previousClose = last.close;
        }
        return out;
    }

    /**
     * Mean and max of daily volume per year.
     */
    public List<VolumeSummary> volumeByYear(List<DerivedPricePoint> series) {
        Map<Integer, List<PricePoint>> periods = groupByYear(series);
        List<VolumeSummary> out = new ArrayList<>(periods.size());
        for (Map.Entry<Integer, List<PricePoint>> entry : periods.entrySet()) {
            List<PricePoint> rows = entry.getValue();
            double sum = 0.0;
            double max = Double.NEGATIVE_INFINITY;
            for (PricePoint row : rows) {
                sum += row.volume;
                max = Math.max(max, row.volume);
            }
            out.add(new VolumeSummary(rows.get(0).symbol, entry.getKey(), sum / rows.size(), max));
        }
        return out;
    }

    private Map<Integer, List<PricePoint>> groupByYear(List<DerivedPricePoint> series) {
        Map<Integer, List<PricePoint>> periods = new TreeMap<>();
        for (PricePoint point : sorted(series)) {
            periods.computeIfAbsent(point.year(), ignored -> new ArrayList<>()).add(point);
        }
        return periods;
    }

    private List<PricePoint> sorted(List<DerivedPricePoint> series) {
        if (series == null || series.isEmpty()) {
            return List.of();
        }
        List<PricePoint> points = new ArrayList<>(series.size());
        String symbol = series.get(0).symbol();
        for (DerivedPricePoint row : series) {
            if (!symbol.equals(row.symbol())) {
                throw new IllegalArgumentException("series mixes symbols " + symbol + " and " + row.symbol());
            }
            points.add(row.price);
        }
        points.sort(Comparator.comparing((PricePoint p) -> p.date));
        return points;
    }
}
