package com.stockmetrics.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 模块说明：PercentMath（class）。
 * 主要职责：统一百分比变化与小数位舍入规则，收益类指标都经过这里。
 */
public final class PercentMath {
    private PercentMath() {
    }

    // 规则：四舍五入（HALF_UP），基于十进制表示而非二进制尾数
    public static double round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(Math.max(0, scale), RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * {@code round((current / previous - 1) * 100, scale)}, or null when the base is not a positive number.
     */
    public static Double pctChange(double current, Double previous, int scale) {
        if (previous == null || !Double.isFinite(previous) || previous <= 0.0 || !Double.isFinite(current)) {
            return null;
        }
        return round((current / previous - 1.0) * 100.0, scale);
    }
}
