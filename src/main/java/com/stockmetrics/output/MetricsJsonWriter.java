package com.stockmetrics.output;

import com.stockmetrics.core.RunTelemetry;
import com.stockmetrics.model.CorrelationCell;
import com.stockmetrics.model.CorrelationMatrix;
import com.stockmetrics.model.DerivedPricePoint;
import com.stockmetrics.model.MetricsReport;
import com.stockmetrics.model.MonthlyBar;
import com.stockmetrics.model.RollingStat;
import com.stockmetrics.model.RowIssue;
import com.stockmetrics.model.VolumeSummary;
import com.stockmetrics.model.YearlyBar;
import com.stockmetrics.model.YearlyVolatilitySummary;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * 模块说明：MetricsJsonWriter（class）。
 * 主要职责：把 MetricsReport 的每张输出表序列化为 JSON，供外部报表/图表工具消费。
 * 使用建议：null 指标统一写为 JSON null，而不是省略字段，保证每行字段集合一致。
 */
public final class MetricsJsonWriter {
    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final boolean pretty;

    public MetricsJsonWriter(boolean pretty) {
        this.pretty = pretty;
    }

    public Path write(Path outputDir, MetricsReport report, RunTelemetry telemetry, LocalDateTime now) throws IOException {
        Files.createDirectories(outputDir);
        Path out = outputDir.resolve("metrics_" + FILE_TS.format(now) + ".json");
        JSONObject root = toJson(report, telemetry);
        String text = pretty ? root.toString(2) : root.toString();
        Files.writeString(out, text, StandardCharsets.UTF_8);
        return out;
    }

    public JSONObject toJson(MetricsReport report, RunTelemetry telemetry) {
        JSONObject root = new JSONObject();
        root.put("daily_returns", dailyReturns(report));
        root.put("monthly_bars", monthlyBars(report));
        root.put("yearly_bars", yearlyBars(report));
        root.put("rolling_stats", rollingStats(report));
        root.put("yearly_volatility", volatility(report));
        root.put("yearly_volume", volume(report));
        root.put("feature_correlation", matrix(report.featureCorrelation));
        root.put("feature_correlation_long", longForm(report.featureCorrelation, "row_feature", "col_feature"));
        if (report.symbolCorrelation != null) {
            root.put("symbol_correlation", matrix(report.symbolCorrelation));
            root.put("symbol_correlation_long", longForm(report.symbolCorrelation, "row_symbol", "col_symbol"));
        }
        root.put("rejected_rows", rejected(report));
        if (telemetry != null) {
            root.put("run_summary", telemetry.getSummary());
        }
        return root;
    }

    private JSONArray dailyReturns(MetricsReport report) {
        JSONArray rows = new JSONArray();
        for (DerivedPricePoint row : report.derivedPrices) {
            JSONObject o = new JSONObject();
            o.put("symbol", row.symbol());
            o.put("date", row.date().toString());
            o.put("open", row.price.open);
            o.put("high", row.price.high);
            o.put("low", row.price.low);
            o.put("close", row.price.close);
            o.put("adjusted", row.price.adjusted);
            o.put("volume", row.price.volume);
            o.put("previous_adjusted", nullable(row.previousAdjusted));
            o.put("daily_return", nullable(row.dailyReturn));
            rows.put(o);
        }
        return rows;
    }

    private JSONArray monthlyBars(MetricsReport report) {
        JSONArray rows = new JSONArray();
        for (MonthlyBar bar : report.monthlyBars) {
            JSONObject o = new JSONObject();
            o.put("symbol", bar.symbol);
            o.put("year", bar.year);
            o.put("month", bar.month);
            o.put("monthly_open", bar.monthlyOpen);
            o.put("monthly_close", bar.monthlyClose);
            o.put("monthly_return", nullable(bar.monthlyReturn));
            rows.put(o);
        }
        return rows;
    }

    private JSONArray yearlyBars(MetricsReport report) {
        JSONArray rows = new JSONArray();
        for (YearlyBar bar : report.yearlyBars) {
            JSONObject o = new JSONObject();
            o.put("symbol", bar.symbol);
            o.put("year", bar.year);
            o.put("yearly_open", bar.yearlyOpen);
            o.put("yearly_close", bar.yearlyClose);
            o.put("previous_close", nullable(bar.previousClose));
            o.put("yearly_return", nullable(bar.yearlyReturn));
            rows.put(o);
        }
        return rows;
    }

    private JSONArray rollingStats(MetricsReport report) {
        JSONArray rows = new JSONArray();
        for (RollingStat stat : report.rollingStats) {
            JSONObject o = new JSONObject();
            o.put("symbol", stat.symbol);
            o.put("date", stat.date.toString());
            o.put("rolling_volatility", nullable(stat.rollingVolatility));
            o.put("rolling_volume", nullable(stat.rollingVolume));
            rows.put(o);
        }
        return rows;
    }

    private JSONArray volatility(MetricsReport report) {
        JSONArray rows = new JSONArray();
        for (YearlyVolatilitySummary summary : report.volatilitySummaries) {
            JSONObject o = new JSONObject();
            o.put("symbol", summary.symbol);
            o.put("year", summary.year);
            o.put("avg_volatility", nullable(summary.avgVolatility));
            o.put("max_volatility", nullable(summary.maxVolatility));
            rows.put(o);
        }
        return rows;
    }

    private JSONArray volume(MetricsReport report) {
        JSONArray rows = new JSONArray();
        for (VolumeSummary summary : report.volumeSummaries) {
            JSONObject o = new JSONObject();
            o.put("symbol", summary.symbol);
            o.put("year", summary.year);
            o.put("avg_volume", summary.avgVolume);
            o.put("max_volume", summary.maxVolume);
            rows.put(o);
        }
        return rows;
    }

    private JSONObject matrix(CorrelationMatrix matrix) {
        JSONObject o = new JSONObject();
        o.put("labels", new JSONArray(matrix.labels()));
        o.put("observations", matrix.observations());
        JSONArray values = new JSONArray();
        for (int i = 0; i < matrix.size(); i++) {
            JSONArray row = new JSONArray();
            for (int j = 0; j < matrix.size(); j++) {
                row.put(nullable(matrix.get(i, j)));
            }
            values.put(row);
        }
        o.put("values", values);
        return o;
    }

    private JSONArray longForm(CorrelationMatrix matrix, String rowKey, String colKey) {
        JSONArray rows = new JSONArray();
        for (CorrelationCell cell : matrix.longForm()) {
            JSONObject o = new JSONObject();
            o.put(rowKey, cell.rowLabel());
            o.put(colKey, cell.colLabel());
            o.put("value", nullable(cell.value()));
            rows.put(o);
        }
        return rows;
    }

    private JSONArray rejected(MetricsReport report) {
        JSONArray rows = new JSONArray();
        for (RowIssue issue : report.rejectedRows) {
            JSONObject o = new JSONObject();
            o.put("symbol", issue.symbol);
            o.put("date", issue.date == null ? JSONObject.NULL : issue.date.toString());
            o.put("reason", issue.reason.name());
            o.put("detail", issue.detail);
            rows.put(o);
        }
        return rows;
    }

    private static Object nullable(Double value) {
        if (value == null || !Double.isFinite(value)) {
            return JSONObject.NULL;
        }
        return value;
    }
}
