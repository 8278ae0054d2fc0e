package com.stockmetrics.data;

import com.stockmetrics.model.PricePoint;
import com.stockmetrics.model.RowIssue;

import java.util.List;

/**
 * Rows read from a panel file, plus the rows the loader could not turn into a {@link PricePoint}.
 */
public final class LoadedPanel {
    private final List<PricePoint> rows;
    private final List<RowIssue> rejected;

    public LoadedPanel(List<PricePoint> rows, List<RowIssue> rejected) {
        this.rows = rows == null ? List.of() : List.copyOf(rows);
        this.rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }

    public List<PricePoint> rows() {
        return rows;
    }

    public List<RowIssue> rejected() {
        return rejected;
    }

    public int totalRows() {
        return rows.size() + rejected.size();
    }
}
