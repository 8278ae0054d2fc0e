package com.stockmetrics.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：CorrelationMatrix（class）。
 * 主要职责：以标签索引的对称相关系数矩阵，对角线恒为 1.0，退化的单元格为 null。
 * 使用建议：longForm() 给下游报表使用，行列标签均来自同一标签集合。
 */
public final class CorrelationMatrix {
    private final List<String> labels;
    private final Double[][] values;
    private final int observations;

    public CorrelationMatrix(List<String> labels, Double[][] values, int observations) {
        this.labels = List.copyOf(labels);
        int n = this.labels.size();
        if (values.length != n) {
            throw new IllegalArgumentException("matrix size " + values.length + " does not match labels " + n);
        }
        this.values = new Double[n][n];
        for (int i = 0; i < n; i++) {
            if (values[i].length != n) {
                throw new IllegalArgumentException("matrix row " + i + " is not square");
            }
            System.arraycopy(values[i], 0, this.values[i], 0, n);
        }
        this.observations = Math.max(0, observations);
    }

    public List<String> labels() {
        return labels;
    }

    public int size() {
        return labels.size();
    }

    /**
     * Number of complete rows the coefficients were computed from.
     */
    public int observations() {
        return observations;
    }

    public Double get(int row, int col) {
        return values[row][col];
    }

    public Double get(String rowLabel, String colLabel) {
        int row = labels.indexOf(rowLabel);
        int col = labels.indexOf(colLabel);
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("unknown label pair " + rowLabel + "/" + colLabel);
        }
        return values[row][col];
    }

    public List<CorrelationCell> longForm() {
        List<CorrelationCell> out = new ArrayList<>(labels.size() * labels.size());
        for (int i = 0; i < labels.size(); i++) {
            for (int j = 0; j < labels.size(); j++) {
                out.add(new CorrelationCell(labels.get(i), labels.get(j), values[i][j]));
            }
        }
        return out;
    }
}
