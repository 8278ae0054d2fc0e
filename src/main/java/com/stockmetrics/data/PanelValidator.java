package com.stockmetrics.data;

import com.stockmetrics.model.PricePoint;
import com.stockmetrics.model.RowIssue;
import com.stockmetrics.model.RowIssueReason;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Fail-fast schema checks plus row-level rejection of malformed prices.
 * <p>
 * Missing keys and duplicate (symbol, date) pairs abort with {@link InvalidInputException}.
 * Rows already rejected by the loader (unparseable dates) are reported with the rest.
 * A row with a missing or non-positive price, or a missing or negative volume, is dropped
 * and reported; the remaining rows of that symbol and all other symbols are kept.
 */
public final class PanelValidator {
    private static final Logger LOG = LogManager.getLogger(PanelValidator.class);

    public ValidatedPanel validate(List<PricePoint> rows) {
        return validate(rows, List.of());
    }

    /**
     * Validates {@code rows}; {@code loadRejected} are rows the loader already dropped and are
     * carried into the rejected list and the input row count.
     */
    public ValidatedPanel validate(List<PricePoint> rows, List<RowIssue> loadRejected) {
        List<RowIssue> preRejected = loadRejected == null ? List.of() : loadRejected;
        if ((rows == null || rows.isEmpty()) && preRejected.isEmpty()) {
            throw new InvalidInputException(InputErrorCode.EMPTY_PANEL, "price panel has no rows");
        }
        if (rows == null) {
            rows = List.of();
        }

        Set<String> seenKeys = new HashSet<>(rows.size() * 2);
        for (int i = 0; i < rows.size(); i++) {
            PricePoint row = rows.get(i);
            if (row == null) {
                throw new InvalidInputException(InputErrorCode.MISSING_KEY, "row " + i + " is null");
            }
            if (row.symbol == null || row.symbol.trim().isEmpty()) {
                throw new InvalidInputException(InputErrorCode.MISSING_KEY, "row " + i + " has no symbol");
            }
            if (row.date == null) {
                throw new InvalidInputException(InputErrorCode.MISSING_KEY, "row " + i + " has no date, symbol=" + row.symbol);
            }
            if (!seenKeys.add(row.symbol + "|" + row.date)) {
                throw new InvalidInputException(
                        InputErrorCode.DUPLICATE_KEY,
                        "duplicate (symbol, date) key: " + row.symbol + ", " + row.date
                );
            }
        }

        Map<String, List<PricePoint>> grouped = new TreeMap<>();
        List<RowIssue> rejected = new ArrayList<>(preRejected);
        for (PricePoint row : rows) {
            RowIssue issue = inspect(row);
            if (issue != null) {
                rejected.add(issue);
                LOG.warn("Rejected row: {}", issue);
                continue;
            }
            grouped.computeIfAbsent(row.symbol, ignored -> new ArrayList<>()).add(row);
        }

        Map<String, List<PricePoint>> partitions = new LinkedHashMap<>();
        for (Map.Entry<String, List<PricePoint>> entry : grouped.entrySet()) {
            List<PricePoint> series = entry.getValue();
            series.sort(Comparator.comparing((PricePoint p) -> p.date));
            partitions.put(entry.getKey(), Collections.unmodifiableList(series));
        }
        rejected.sort(Comparator.comparing((RowIssue r) -> r.symbol)
                .thenComparing((RowIssue r) -> r.date, Comparator.nullsFirst(Comparator.<LocalDate>naturalOrder())));

        int inputRows = rows.size() + preRejected.size();
        LOG.info("Panel validated: rows={}, accepted={}, rejected={}, symbols={}",
                inputRows, inputRows - rejected.size(), rejected.size(), partitions.size());
        return new ValidatedPanel(Collections.unmodifiableMap(partitions), rejected, inputRows);
    }

    private RowIssue inspect(PricePoint row) {
        LocalDate date = row.date;
        if (!isPositive(row.adjusted)) {
            return new RowIssue(row.symbol, date, RowIssueReason.INVALID_PRICE, "adjusted=" + row.adjusted);
        }
        if (!isPositive(row.open) || !isPositive(row.high) || !isPositive(row.low) || !isPositive(row.close)) {
            return new RowIssue(
                    row.symbol,
                    date,
                    RowIssueReason.INVALID_PRICE,
                    "open=" + row.open + ", high=" + row.high + ", low=" + row.low + ", close=" + row.close
            );
        }
        if (!Double.isFinite(row.volume) || row.volume < 0) {
            return new RowIssue(row.symbol, date, RowIssueReason.INVALID_VOLUME, "volume=" + row.volume);
        }
        return null;
    }

    private static boolean isPositive(double value) {
        return Double.isFinite(value) && value > 0.0;
    }
}
