package com.stockmetrics.model;

/**
 * One entry of a correlation matrix in long form. {@code value} is null for degenerate pairs.
 */
public record CorrelationCell(String rowLabel, String colLabel, Double value) {
}
