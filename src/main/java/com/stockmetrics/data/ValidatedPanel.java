package com.stockmetrics.data;

import com.stockmetrics.model.PricePoint;
import com.stockmetrics.model.RowIssue;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 模块说明：ValidatedPanel（class）。
 * 主要职责：校验后的面板，按 symbol 分区且每个分区按日期升序，只包含通过行级校验的记录。
 * 使用建议：分区顺序按 symbol 字典序，保证下游输出可重复。
 */
public final class ValidatedPanel {
    private final Map<String, List<PricePoint>> bySymbol;
    private final List<RowIssue> rejected;
    private final int inputRows;

    ValidatedPanel(Map<String, List<PricePoint>> bySymbol, List<RowIssue> rejected, int inputRows) {
        this.bySymbol = bySymbol;
        this.rejected = List.copyOf(rejected);
        this.inputRows = inputRows;
    }

    public Set<String> symbols() {
        return bySymbol.keySet();
    }

    public List<PricePoint> series(String symbol) {
        List<PricePoint> series = bySymbol.get(symbol);
        return series == null ? List.of() : series;
    }

    public Map<String, List<PricePoint>> partitions() {
        return bySymbol;
    }

    public List<RowIssue> rejected() {
        return rejected;
    }

    public int inputRows() {
        return inputRows;
    }

    public int acceptedRows() {
        int total = 0;
        for (List<PricePoint> series : bySymbol.values()) {
            total += series.size();
        }
        return total;
    }
}
