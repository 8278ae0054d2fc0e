package com.stockmetrics.correlation;

import com.stockmetrics.model.CorrelationMatrix;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

import java.util.List;

/**
 * Pairwise Pearson coefficients over equally long, fully populated columns.
 * The diagonal is 1.0; a pair whose coefficient is undefined (fewer than two rows, or a
 * zero-variance column) gets a null cell.
 */
final class PearsonMatrixBuilder {
    private final PearsonsCorrelation pearson = new PearsonsCorrelation();

    CorrelationMatrix build(List<String> labels, double[][] columns) {
        int k = labels.size();
        if (columns.length != k) {
            throw new IllegalArgumentException("expected " + k + " columns, got " + columns.length);
        }
        int rows = k == 0 ? 0 : columns[0].length;
        Double[][] values = new Double[k][k];
        for (int i = 0; i < k; i++) {
            values[i][i] = 1.0;
            for (int j = i + 1; j < k; j++) {
                Double r = coefficient(columns[i], columns[j]);
                values[i][j] = r;
                values[j][i] = r;
            }
        }
        return new CorrelationMatrix(labels, values, rows);
    }

    private Double coefficient(double[] x, double[] y) {
        if (x.length < 2 || x.length != y.length) {
            return null;
        }
        double r = pearson.correlation(x, y);
        if (!Double.isFinite(r)) {
            return null;
        }
        return Math.max(-1.0, Math.min(1.0, r));
    }
}
