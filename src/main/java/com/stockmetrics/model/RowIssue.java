package com.stockmetrics.model;

import java.time.LocalDate;

/**
 * A single rejected panel row and why it was rejected.
 */
public final class RowIssue {
    public final String symbol;
    public final LocalDate date;
    public final RowIssueReason reason;
    public final String detail;

    public RowIssue(String symbol, LocalDate date, RowIssueReason reason, String detail) {
        this.symbol = symbol;
        this.date = date;
        this.reason = reason;
        this.detail = detail == null ? "" : detail;
    }

    @Override
    public String toString() {
        return reason + " symbol=" + symbol + ", date=" + date + (detail.isEmpty() ? "" : ", " + detail);
    }
}
