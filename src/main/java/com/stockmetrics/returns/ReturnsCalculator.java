package com.stockmetrics.returns;

import com.stockmetrics.model.DerivedPricePoint;
import com.stockmetrics.model.PricePoint;
import com.stockmetrics.utils.PercentMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：ReturnsCalculator（class）。
 * 主要职责：在单个 symbol 的有序序列上计算日收益 round((adj[t]/adj[t-1] - 1) * 100, scale)。
 * 使用建议：调用方必须先按 symbol 分区并按日期升序排序，本类不会跨 symbol 取前值。
 */
public final class ReturnsCalculator {
    private static final Logger LOG = LogManager.getLogger(ReturnsCalculator.class);

    private final int scale;

    public ReturnsCalculator() {
        this(2);
    }

    public ReturnsCalculator(int scale) {
        this.scale = Math.max(0, scale);
    }

/**
 * 方法说明：compute，负责执行业务逻辑并产出结果。
 * 处理流程：逐行推进 previous；复权价缺失或非正的行直接跳过，不作为后续行的前值。
 * 维护提示：首个有效行的 previousAdjusted 与 dailyReturn 都为 null。
 */
    public List<DerivedPricePoint> compute(List<PricePoint> series) {
        if (series == null || series.isEmpty()) {
            return List.of();
        }
        List<DerivedPricePoint> out = new ArrayList<>(series.size());
        PricePoint previous = null;
        for (PricePoint point : series) {
            if (previous != null && !point.symbol.equals(previous.symbol)) {
                throw new IllegalArgumentException("series mixes symbols " + previous.symbol + " and " + point.symbol);
            }
            if (previous != null && !point.date.isAfter(previous.date)) {
                throw new IllegalArgumentException("series for " + point.symbol + " is not strictly ascending at " + point.date);
            }
            if (!Double.isFinite(point.adjusted) || point.adjusted <= 0.0) {
                LOG.warn("Skipping {} from lag chain: adjusted={}", point, point.adjusted);
                continue;
            }
            if (previous == null) {
                out.add(new DerivedPricePoint(point, null, null));
            } else {
                Double previousAdjusted = previous.adjusted;
                out.add(new DerivedPricePoint(point, previousAdjusted, PercentMath.pctChange(point.adjusted, previousAdjusted, scale)));
            }
            previous = point;
        }
        return out;
    }
}
