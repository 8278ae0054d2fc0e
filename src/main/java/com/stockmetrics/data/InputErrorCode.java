package com.stockmetrics.data;

/**
 * Schema-level problems that abort a run before any metric is computed.
 */
public enum InputErrorCode {
    MISSING_COLUMN,
    MISSING_KEY,
    DUPLICATE_KEY,
    EMPTY_PANEL
}
