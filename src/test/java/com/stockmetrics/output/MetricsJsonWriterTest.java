package com.stockmetrics.output;

import com.stockmetrics.PanelFixtures;
import com.stockmetrics.config.Config;
import com.stockmetrics.core.RunTelemetry;
import com.stockmetrics.model.MetricsReport;
import com.stockmetrics.model.PricePoint;
import com.stockmetrics.runner.MetricsRunner;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsJsonWriterTest {

    private static final LocalDate START = LocalDate.of(2022, 12, 28);

    @TempDir
    Path dir;

    @Test
    void write_shouldEmitTimestampedFileWithAllTables() throws Exception {
        List<PricePoint> rows = new ArrayList<>(PanelFixtures.series("AAA", START, 10.0, 11.0, 12.0, 12.0, 9.0, 10.0, 11.0));
        rows.add(PanelFixtures.point("AAA", START.plusDays(7), -2.0));
        RunTelemetry telemetry = new RunTelemetry("test", null);
        MetricsReport report = new MetricsRunner(Config.of(dir, Map.of()), telemetry).run(rows);

        Path out = new MetricsJsonWriter(true).write(dir.resolve("out"), report, telemetry,
                LocalDateTime.of(2024, 1, 2, 3, 4, 5));

        assertEquals("metrics_20240102_030405.json", out.getFileName().toString());
        JSONObject root = new JSONObject(Files.readString(out, StandardCharsets.UTF_8));

        JSONArray daily = root.getJSONArray("daily_returns");
        assertEquals(7, daily.length());
        assertTrue(daily.getJSONObject(0).isNull("daily_return"));
        assertTrue(daily.getJSONObject(0).isNull("previous_adjusted"));
        assertEquals(10.0, daily.getJSONObject(1).getDouble("daily_return"), 1e-9);

        JSONArray monthly = root.getJSONArray("monthly_bars");
        assertEquals(2, monthly.length());
        assertEquals(12, monthly.getJSONObject(0).getInt("month"));
        assertEquals(2, root.getJSONArray("yearly_bars").length());
        assertTrue(root.getJSONArray("yearly_bars").getJSONObject(0).isNull("yearly_return"));
        assertEquals(2, root.getJSONArray("yearly_volume").length());
        assertEquals(7, root.getJSONArray("rolling_stats").length());
        assertTrue(root.getJSONArray("rolling_stats").getJSONObject(6).isNull("rolling_volatility"));
        assertTrue(root.getJSONArray("yearly_volatility").getJSONObject(0).isNull("avg_volatility"));

        JSONObject matrix = root.getJSONObject("feature_correlation");
        assertEquals(6, matrix.getJSONArray("labels").length());
        assertEquals("close", matrix.getJSONArray("labels").getString(0));
        assertEquals(0, matrix.getInt("observations"));
        assertEquals(1.0, matrix.getJSONArray("values").getJSONArray(1).getDouble(1), 0.0);
        assertTrue(matrix.getJSONArray("values").getJSONArray(0).isNull(1));
        assertEquals(36, root.getJSONArray("feature_correlation_long").length());
        assertFalse(root.has("symbol_correlation"));

        JSONArray rejected = root.getJSONArray("rejected_rows");
        assertEquals(1, rejected.length());
        assertEquals("INVALID_PRICE", rejected.getJSONObject(0).getString("reason"));
        assertTrue(root.getString("run_summary").contains("trigger=test"));
    }

    @Test
    void toJson_shouldIncludeSymbolCorrelationWhenComputed() {
        List<PricePoint> rows = new ArrayList<>(PanelFixtures.series("AAA", START, 10.0, 11.0, 12.5, 12.0));
        rows.addAll(PanelFixtures.series("BBB", START, 20.0, 21.0, 25.0, 23.0));
        MetricsReport report = new MetricsRunner(
                Config.of(dir, Map.of("correlation.symbol_pairwise.enabled", "true"))).run(rows);

        JSONObject root = new MetricsJsonWriter(false).toJson(report, null);

        JSONObject symbols = root.getJSONObject("symbol_correlation");
        assertEquals(2, symbols.getJSONArray("labels").length());
        assertEquals(3, symbols.getInt("observations"));
        JSONArray longForm = root.getJSONArray("symbol_correlation_long");
        assertEquals(4, longForm.length());
        assertEquals("AAA", longForm.getJSONObject(1).getString("row_symbol"));
        assertEquals("BBB", longForm.getJSONObject(1).getString("col_symbol"));
        assertFalse(root.has("run_summary"));
    }
}
