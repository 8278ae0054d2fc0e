package com.stockmetrics.correlation;

import com.stockmetrics.model.CorrelationMatrix;
import com.stockmetrics.model.DerivedPricePoint;
import com.stockmetrics.model.Feature;
import com.stockmetrics.model.FeatureRow;
import com.stockmetrics.model.RollingStat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：CorrelationEngine（class）。
 * 主要职责：把所有 symbol 的逐日特征汇总成一张池化特征表，做完整样本过滤后计算特征之间的 Pearson 相关矩阵。
 * 使用建议：这里衡量的是"特征与特征"的关系（如成交量与波动率），不是股票与股票之间的相关性；
 * 后者见 SymbolCorrelationEngine。
 */
public final class CorrelationEngine {
    private static final Logger LOG = LogManager.getLogger(CorrelationEngine.class);

    private final PearsonMatrixBuilder matrixBuilder = new PearsonMatrixBuilder();

/**
 * 方法说明：featureRows，负责构建单个 symbol 的特征行。
 * 处理流程：按日期把日线与尾随窗口的滚动统计拼接；滚动统计缺失的日期对应特征为 null。
 * 维护提示：传入的 rollingStats 必须是 TRAILING 对齐的结果。
 */
    public List<FeatureRow> featureRows(List<DerivedPricePoint> series, List<RollingStat> trailingStats) {
        if (series == null || series.isEmpty()) {
            return List.of();
        }
        Map<LocalDate, RollingStat> statsByDate = new HashMap<>();
        if (trailingStats != null) {
            for (RollingStat stat : trailingStats) {
                statsByDate.put(stat.date, stat);
            }
        }
        List<FeatureRow> out = new ArrayList<>(series.size());
        for (DerivedPricePoint row : series) {
            RollingStat stat = statsByDate.get(row.date());
            Map<Feature, Double> values = new EnumMap<>(Feature.class);
            values.put(Feature.CLOSE, row.price.close);
            values.put(Feature.DAILY_RETURN, row.dailyReturn);
            values.put(Feature.DAILY_RANGE, row.dailyRange());
            values.put(Feature.VOLUME, row.price.volume);
            values.put(Feature.ROLLING_VOLUME, stat == null ? null : stat.rollingVolume);
            values.put(Feature.ROLLING_VOLATILITY, stat == null ? null : stat.rollingVolatility);
            out.add(new FeatureRow(row.symbol(), row.date(), values));
        }
        return out;
    }

    public List<FeatureRow> completeCases(List<FeatureRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        List<FeatureRow> out = new ArrayList<>(rows.size());
        for (FeatureRow row : rows) {
            if (row != null && row.isComplete()) {
                out.add(row);
            }
        }
        return out;
    }

/**
 * 方法说明：correlate，负责计算池化特征相关矩阵。
 * 处理流程：先做完整样本过滤（任一特征为 null 的行整行剔除，不插补），再逐对计算 Pearson 系数。
 */
    public CorrelationMatrix correlate(List<FeatureRow> pooledRows) {
        List<FeatureRow> complete = completeCases(pooledRows);
        List<Feature> features = Feature.ordered();
        List<String> labels = new ArrayList<>(features.size());
        double[][] columns = new double[features.size()][complete.size()];
        for (int f = 0; f < features.size(); f++) {
            Feature feature = features.get(f);
            labels.add(feature.column());
            for (int r = 0; r < complete.size(); r++) {
                columns[f][r] = complete.get(r).get(feature);
            }
        }
        int input = pooledRows == null ? 0 : pooledRows.size();
        LOG.info("Feature correlation: pooled_rows={}, complete_rows={}, dropped={}",
                input, complete.size(), input - complete.size());
        return matrixBuilder.build(labels, columns);
    }
}
