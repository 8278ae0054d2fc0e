package com.stockmetrics.rolling;

/**
 * Where a fixed-width window sits relative to the position its statistic is attributed to.
 */
public enum WindowAlignment {
    /**
     * Window {@code [t - w + 1, t]}: the statistic belongs to the last date it covers.
     */
    TRAILING,
    /**
     * Window {@code [t - (w - 1 - w/2), t + w/2]}. Positions whose window would cross either end
     * of the series have no value (edge-truncated).
     */
    CENTERED;

    public int firstIndex(int position, int width) {
        return lastIndex(position, width) - (width - 1);
    }

    public int lastIndex(int position, int width) {
        if (this == TRAILING) {
            return position;
        }
        return position + width / 2;
    }
}
