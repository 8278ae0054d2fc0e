package com.stockmetrics.runner;

import com.stockmetrics.config.Config;
import com.stockmetrics.core.RunTelemetry;
import com.stockmetrics.correlation.CorrelationEngine;
import com.stockmetrics.correlation.SymbolCorrelationEngine;
import com.stockmetrics.data.LoadedPanel;
import com.stockmetrics.data.PanelValidator;
import com.stockmetrics.data.ValidatedPanel;
import com.stockmetrics.model.CorrelationMatrix;
import com.stockmetrics.model.DerivedPricePoint;
import com.stockmetrics.model.FeatureRow;
import com.stockmetrics.model.MetricsReport;
import com.stockmetrics.model.MonthlyBar;
import com.stockmetrics.model.PricePoint;
import com.stockmetrics.model.RollingStat;
import com.stockmetrics.model.RowIssue;
import com.stockmetrics.model.VolumeSummary;
import com.stockmetrics.model.YearlyBar;
import com.stockmetrics.model.YearlyVolatilitySummary;
import com.stockmetrics.periodic.PeriodicAggregator;
import com.stockmetrics.returns.ReturnsCalculator;
import com.stockmetrics.rolling.RollingWindowEngine;
import com.stockmetrics.rolling.WindowAlignment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 模块说明：MetricsRunner（class）。
 * 主要职责：串联 校验 → 收益 → {周期聚合, 滚动窗口} → 相关性 的整条流水线，产出 MetricsReport。
 * 使用建议：逐 symbol 的步骤互相独立，可按 pipeline.threads 并行；相关性步骤在所有 symbol 完成后执行。
 */
public final class MetricsRunner {
    private static final Logger LOG = LogManager.getLogger(MetricsRunner.class);

    private final Config config;
    private final RunTelemetry telemetry;
    private final PanelValidator validator;
    private final ReturnsCalculator returnsCalculator;
    private final PeriodicAggregator periodicAggregator;
    private final RollingWindowEngine rollingEngine;
    private final CorrelationEngine correlationEngine;
    private final SymbolCorrelationEngine symbolCorrelationEngine;
    private final WindowAlignment summaryAlignment;

    public MetricsRunner(Config config) {
        this(config, null);
    }

    public MetricsRunner(Config config, RunTelemetry telemetry) {
        this.config = config;
        this.telemetry = telemetry == null ? new RunTelemetry("manual", null) : telemetry;
        int scale = Math.max(0, config.getInt("returns.scale", 2));
        this.validator = new PanelValidator();
        this.returnsCalculator = new ReturnsCalculator(scale);
        this.periodicAggregator = new PeriodicAggregator(scale);
        this.rollingEngine = new RollingWindowEngine(config.getInt("rolling.window", RollingWindowEngine.DEFAULT_WINDOW));
        this.correlationEngine = new CorrelationEngine();
        this.symbolCorrelationEngine = new SymbolCorrelationEngine();
        this.summaryAlignment = config.getEnum("rolling.summary_alignment", WindowAlignment.class, WindowAlignment.CENTERED);
    }

/**
 * 方法说明：run，负责执行整条指标流水线。
 * 处理流程：面板级校验失败直接抛出 InvalidInputException，不做任何计算；行级问题只剔除对应行。
 * 维护提示：输出中所有表按 symbol 字典序、再按日期/期间排序，与线程数无关。
 */
    public MetricsReport run(List<PricePoint> rows) {
        return run(rows, List.of());
    }

    public MetricsReport run(LoadedPanel loaded) {
        return run(loaded.rows(), loaded.rejected());
    }

    public MetricsReport run(List<PricePoint> rows, List<RowIssue> loadRejected) {
        telemetry.startStep(RunTelemetry.STEP_VALIDATE);
        ValidatedPanel panel = validator.validate(rows, loadRejected);
        telemetry.endStep(RunTelemetry.STEP_VALIDATE, panel.inputRows(), panel.acceptedRows(), panel.rejected().size());
        telemetry.setPanelStats(panel.symbols().size(), panel.inputRows(), panel.rejected().size());

        Map<String, SymbolMetrics> perSymbol = computePerSymbol(panel);

        List<DerivedPricePoint> derived = new ArrayList<>();
        List<MonthlyBar> monthly = new ArrayList<>();
        List<YearlyBar> yearly = new ArrayList<>();
        List<VolumeSummary> volume = new ArrayList<>();
        List<RollingStat> rolling = new ArrayList<>();
        List<YearlyVolatilitySummary> volatilitySummaries = new ArrayList<>();
        List<FeatureRow> pooled = new ArrayList<>();
        Map<String, List<DerivedPricePoint>> derivedBySymbol = new LinkedHashMap<>();
        for (SymbolMetrics metrics : perSymbol.values()) {
            derived.addAll(metrics.derived);
            monthly.addAll(metrics.monthly);
            yearly.addAll(metrics.yearly);
            volume.addAll(metrics.volume);
            rolling.addAll(metrics.correlationStats);
            volatilitySummaries.addAll(metrics.volatilitySummary);
            pooled.addAll(metrics.featureRows);
            derivedBySymbol.put(metrics.symbol, metrics.derived);
        }
        telemetry.endStep(RunTelemetry.STEP_RETURNS, panel.acceptedRows(), derived.size(), 0);
        telemetry.endStep(RunTelemetry.STEP_PERIODIC, derived.size(), monthly.size() + yearly.size(), 0);
        telemetry.endStep(RunTelemetry.STEP_ROLLING, derived.size(), rolling.size(), 0,
                "window=" + rollingEngine.window() + ", summary=" + summaryAlignment + ", correlation=" + WindowAlignment.TRAILING);

        telemetry.startStep(RunTelemetry.STEP_CORRELATION);
        CorrelationMatrix featureMatrix = correlationEngine.correlate(pooled);
        CorrelationMatrix symbolMatrix = null;
        if (config.getBoolean("correlation.symbol_pairwise.enabled", false)) {
            symbolMatrix = symbolCorrelationEngine.correlate(derivedBySymbol);
        }
        telemetry.endStep(RunTelemetry.STEP_CORRELATION, pooled.size(), featureMatrix.observations(), 0,
                symbolMatrix == null ? "symbol_pairwise=off" : "symbol_pairwise=on");

        LOG.info("Metrics computed: symbols={}, derived_rows={}, monthly_bars={}, yearly_bars={}, complete_feature_rows={}",
                perSymbol.size(), derived.size(), monthly.size(), yearly.size(), featureMatrix.observations());
        return new MetricsReport(
                derived,
                monthly,
                yearly,
                rolling,
                volatilitySummaries,
                volume,
                featureMatrix,
                symbolMatrix,
                panel.rejected()
        );
    }

    private Map<String, SymbolMetrics> computePerSymbol(ValidatedPanel panel) {
        int threads = Math.max(1, config.getInt("pipeline.threads", 1));
        telemetry.startStep(RunTelemetry.STEP_RETURNS);
        telemetry.startStep(RunTelemetry.STEP_PERIODIC);
        telemetry.startStep(RunTelemetry.STEP_ROLLING);

        Map<String, SymbolMetrics> out = new LinkedHashMap<>();
        if (threads == 1 || panel.symbols().size() <= 1) {
            for (Map.Entry<String, List<PricePoint>> entry : panel.partitions().entrySet()) {
                out.put(entry.getKey(), computeSymbol(entry.getKey(), entry.getValue()));
            }
            return out;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, panel.symbols().size()));
        Map<String, Future<SymbolMetrics>> futures = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, List<PricePoint>> entry : panel.partitions().entrySet()) {
                futures.put(entry.getKey(), pool.submit(new SymbolTask(entry.getKey(), entry.getValue())));
            }
            for (Map.Entry<String, Future<SymbolMetrics>> entry : futures.entrySet()) {
                try {
                    out.put(entry.getKey(), entry.getValue().get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    throw new IllegalStateException("metrics failed for symbol=" + entry.getKey() + ": " + cause.getMessage(), cause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("metrics run interrupted", e);
        } finally {
            pool.shutdownNow();
        }
        return out;
    }

    private SymbolMetrics computeSymbol(String symbol, List<PricePoint> series) {
        List<DerivedPricePoint> derived = returnsCalculator.compute(series);
        List<MonthlyBar> monthly = periodicAggregator.monthly(derived);
        List<YearlyBar> yearly = periodicAggregator.yearly(derived);
        List<VolumeSummary> volume = periodicAggregator.volumeByYear(derived);

        List<RollingStat> correlationStats = rollingEngine.rollingStats(derived, WindowAlignment.TRAILING);
        List<RollingStat> summaryStats = rollingEngine.rollingStatsWithinYears(derived, summaryAlignment);
        List<YearlyVolatilitySummary> volatilitySummary = rollingEngine.yearlySummary(summaryStats);
        List<FeatureRow> featureRows = correlationEngine.featureRows(derived, correlationStats);

        LOG.debug("Symbol {} done: rows={}, months={}, years={}", symbol, derived.size(), monthly.size(), yearly.size());
        return new SymbolMetrics(symbol, derived, monthly, yearly, volume, correlationStats, volatilitySummary, featureRows);
    }

    private final class SymbolTask implements Callable<SymbolMetrics> {
        private final String symbol;
        private final List<PricePoint> series;

        private SymbolTask(String symbol, List<PricePoint> series) {
            this.symbol = symbol;
            this.series = series;
        }

        @Override
        public SymbolMetrics call() {
            return computeSymbol(symbol, series);
        }
    }

    private static final class SymbolMetrics {
        final String symbol;
        final List<DerivedPricePoint> derived;
        final List<MonthlyBar> monthly;
        final List<YearlyBar> yearly;
        final List<VolumeSummary> volume;
        final List<RollingStat> correlationStats;
        final List<YearlyVolatilitySummary> volatilitySummary;
        final List<FeatureRow> featureRows;

        private SymbolMetrics(
                String symbol,
                List<DerivedPricePoint> derived,
                List<MonthlyBar> monthly,
                List<YearlyBar> yearly,
                List<VolumeSummary> volume,
                List<RollingStat> correlationStats,
                List<YearlyVolatilitySummary> volatilitySummary,
                List<FeatureRow> featureRows
        ) {
            this.symbol = symbol;
            this.derived = derived;
            this.monthly = monthly;
            this.yearly = yearly;
            this.volume = volume;
            this.correlationStats = correlationStats;
            this.volatilitySummary = volatilitySummary;
            this.featureRows = featureRows;
        }
    }
}
