package com.stockmetrics.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 模块说明：FeatureRow（class）。
 * 主要职责：相关性计算前的一行 (symbol, date) 特征，值为 null 表示该特征缺失。
 */
public final class FeatureRow {
    public final String symbol;
    public final LocalDate date;
    private final Map<Feature, Double> values;

    public FeatureRow(String symbol, LocalDate date, Map<Feature, Double> values) {
        this.symbol = symbol;
        this.date = date;
        EnumMap<Feature, Double> copy = new EnumMap<>(Feature.class);
        if (values != null) {
            copy.putAll(values);
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public Double get(Feature feature) {
        return values.get(feature);
    }

    public boolean isComplete() {
        for (Feature feature : Feature.ordered()) {
            Double value = values.get(feature);
            if (value == null || !Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }
}
