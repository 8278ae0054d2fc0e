package com.stockmetrics.data;

import com.stockmetrics.model.PricePoint;
import com.stockmetrics.model.RowIssue;
import com.stockmetrics.model.RowIssueReason;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a long-format price panel CSV: one row per (symbol, date).
 * <p>
 * Required columns, case-insensitive and in any order:
 * {@code symbol,date,open,high,low,close,adjusted,volume}. The adjusted column may also be
 * named {@code adj_close} or {@code adjusted_close}. Empty or unparseable numeric cells are
 * loaded as {@code NaN} and left to {@link PanelValidator}. A row whose date cannot be parsed is
 * rejected on its own; a missing column still fails the whole load.
 */
public final class PriceCsvLoader {
    private static final Logger LOG = LogManager.getLogger(PriceCsvLoader.class);

    private static final List<String> REQUIRED = List.of(
            "symbol", "date", "open", "high", "low", "close", "adjusted", "volume"
    );
    private static final Map<String, String> ALIASES = Map.of(
            "adj_close", "adjusted",
            "adjusted_close", "adjusted",
            "ticker", "symbol"
    );

    public LoadedPanel load(Path csv) throws IOException {
        try (Reader reader = Files.newBufferedReader(csv, StandardCharsets.UTF_8)) {
            LoadedPanel panel = parse(reader);
            LOG.info("Loaded {} rows from {}, rejected={}", panel.rows().size(), csv.toAbsolutePath(), panel.rejected().size());
            return panel;
        }
    }

    public LoadedPanel parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
        String headerLine = reader.readLine();
        while (headerLine != null && headerLine.trim().isEmpty()) {
            headerLine = reader.readLine();
        }
        if (headerLine == null) {
            throw new InvalidInputException(InputErrorCode.EMPTY_PANEL, "csv has no header row");
        }
        if (headerLine.startsWith("\uFEFF")) {
            headerLine = headerLine.substring(1);
        }
        Map<String, Integer> columns = resolveColumns(headerLine);

        List<PricePoint> rows = new ArrayList<>();
        List<RowIssue> rejected = new ArrayList<>();
        String line;
        int lineNo = 1;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] cols = line.split(",", -1);
            String symbol = cell(cols, columns.get("symbol"));
            String rawDate = cell(cols, columns.get("date"));
            LocalDate date = null;
            if (!rawDate.isEmpty()) {
                try {
                    date = LocalDate.parse(rawDate);
                } catch (DateTimeParseException e) {
                    if (symbol.isEmpty()) {
                        throw new InvalidInputException(InputErrorCode.MISSING_KEY, "line " + lineNo + " has no symbol", e);
                    }
                    RowIssue issue = new RowIssue(symbol, null, RowIssueReason.INVALID_DATE,
                            "line " + lineNo + ": date='" + rawDate + "'");
                    LOG.warn("Rejected row: {}", issue);
                    rejected.add(issue);
                    continue;
                }
            }
            rows.add(new PricePoint(
                    symbol.isEmpty() ? null : symbol,
                    date,
                    number(cols, columns.get("open")),
                    number(cols, columns.get("high")),
                    number(cols, columns.get("low")),
                    number(cols, columns.get("close")),
                    number(cols, columns.get("adjusted")),
                    number(cols, columns.get("volume"))
            ));
        }
        return new LoadedPanel(rows, rejected);
    }

    private Map<String, Integer> resolveColumns(String headerLine) {
        String[] names = headerLine.split(",", -1);
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            String name = unquote(names[i]).toLowerCase(Locale.ROOT);
            String canonical = ALIASES.getOrDefault(name, name);
            columns.putIfAbsent(canonical, i);
        }
        List<String> missing = new ArrayList<>();
        for (String required : REQUIRED) {
            if (!columns.containsKey(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            throw new InvalidInputException(InputErrorCode.MISSING_COLUMN, "missing required column(s): " + missing);
        }
        return columns;
    }

    private String cell(String[] cols, int index) {
        if (index >= cols.length) {
            return "";
        }
        return unquote(cols[index]);
    }

    private double number(String[] cols, int index) {
        String v = cell(cols, index);
        if (v.isEmpty() || v.equalsIgnoreCase("null") || v.equalsIgnoreCase("na")) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static String unquote(String raw) {
        String v = raw == null ? "" : raw.trim();
        if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) {
            v = v.substring(1, v.length() - 1).trim();
        }
        return v;
    }
}
