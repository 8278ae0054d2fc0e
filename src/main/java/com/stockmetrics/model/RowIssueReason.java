package com.stockmetrics.model;

/**
 * 模块说明：RowIssueReason（enum）。
 * 主要职责：行级数据问题的分类，命中的行会被剔除但不会中断其他行或其他 symbol 的计算。
 */
public enum RowIssueReason {
    INVALID_DATE,
    INVALID_PRICE,
    INVALID_VOLUME
}
