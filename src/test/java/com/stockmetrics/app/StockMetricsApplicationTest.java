package com.stockmetrics.app;

import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StockMetricsApplicationTest {

    @TempDir
    Path workDir;

    private final StockMetricsApplication app = new StockMetricsApplication();

    @BeforeEach
    void disableStdoutRouting() throws Exception {
        Files.writeString(workDir.resolve("config.properties"), "log.route_stdout=false\n", StandardCharsets.UTF_8);
    }

    @Test
    void run_shouldWriteMetricsJsonForValidPanel() throws Exception {
        writePanel("panel.csv", false);

        int exit = app.run(new String[]{"--input", "panel.csv", "--output-dir", "out", "--window", "5",
                "--threads", "2", "--symbol-correlation"}, workDir);

        assertEquals(0, exit);
        List<Path> written = listJson(workDir.resolve("out"));
        assertEquals(1, written.size());
        JSONObject root = new JSONObject(Files.readString(written.get(0), StandardCharsets.UTF_8));
        assertEquals(80, root.getJSONArray("daily_returns").length());
        assertTrue(root.has("symbol_correlation"));
        assertTrue(root.getJSONObject("feature_correlation").getInt("observations") > 0);
        assertTrue(root.getString("run_summary").contains("trigger=cli"));
    }

    @Test
    void run_shouldReportUnparseableDateRowAndStillSucceed() throws Exception {
        writePanel("panel.csv", false);
        Files.writeString(workDir.resolve("panel.csv"), "BBB,2023-02-30,1,1,1,1,1,1\n",
                StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        int exit = app.run(new String[]{"--input", "panel.csv", "--output-dir", "out"}, workDir);

        assertEquals(0, exit);
        JSONObject root = new JSONObject(Files.readString(listJson(workDir.resolve("out")).get(0), StandardCharsets.UTF_8));
        assertEquals(80, root.getJSONArray("daily_returns").length());
        JSONObject rejected = root.getJSONArray("rejected_rows").getJSONObject(0);
        assertEquals("INVALID_DATE", rejected.getString("reason"));
        assertTrue(rejected.isNull("date"));
    }

    @Test
    void run_shouldReturnOneForInvalidPanel() throws Exception {
        writePanel("dup.csv", true);

        int exit = app.run(new String[]{"--input", "dup.csv", "--output-dir", "out"}, workDir);

        assertEquals(1, exit);
        assertFalse(Files.exists(workDir.resolve("out")));
    }

    @Test
    void run_shouldReturnTwoForMissingInputFile() {
        assertEquals(2, app.run(new String[]{"--input", "nope.csv"}, workDir));
    }

    @Test
    void run_shouldReturnTwoForUnknownOption() {
        assertEquals(2, app.run(new String[]{"--bogus"}, workDir));
    }

    @Test
    void run_shouldReturnZeroForHelp() {
        assertEquals(0, app.run(new String[]{"--help"}, workDir));
    }

    private void writePanel(String name, boolean duplicate) throws Exception {
        StringBuilder csv = new StringBuilder("symbol,date,open,high,low,close,adjusted,volume\n");
        LocalDate start = LocalDate.of(2023, 11, 1);
        for (String symbol : List.of("AAA", "BBB")) {
            double base = symbol.equals("AAA") ? 50.0 : 80.0;
            for (int i = 0; i < 40; i++) {
                double close = base + Math.sin(i * (symbol.equals("AAA") ? 0.6 : 0.9)) * 2.0 + i * 0.1;
                csv.append(String.format(Locale.US, "%s,%s,%.4f,%.4f,%.4f,%.4f,%.4f,%d%n",
                        symbol, start.plusDays(i), close - 0.3, close + 0.8 + (i % 3) * 0.2,
                        close - 0.9 - (i % 4) * 0.1, close, close, 10_000 + i * 37 + (i % 5) * 400));
            }
        }
        if (duplicate) {
            csv.append("AAA,").append(start).append(",1,1,1,1,1,1\n");
        }
        Files.writeString(workDir.resolve(name), csv.toString(), StandardCharsets.UTF_8);
    }

    private static List<Path> listJson(Path dir) throws Exception {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".json")).collect(Collectors.toList());
        }
    }
}
