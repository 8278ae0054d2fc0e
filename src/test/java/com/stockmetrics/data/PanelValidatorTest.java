package com.stockmetrics.data;

import com.stockmetrics.model.PricePoint;
import com.stockmetrics.model.RowIssue;
import com.stockmetrics.model.RowIssueReason;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.stockmetrics.PanelFixtures.point;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PanelValidatorTest {

    private static final LocalDate D1 = LocalDate.of(2020, 1, 1);
    private static final LocalDate D2 = LocalDate.of(2020, 1, 2);
    private static final LocalDate D3 = LocalDate.of(2020, 1, 3);

    private final PanelValidator validator = new PanelValidator();

    @Test
    void validate_shouldPartitionBySymbolAndSortByDate() {
        List<PricePoint> rows = List.of(
                point("MSFT", D3, 12.0),
                point("AAPL", D2, 101.0),
                point("MSFT", D1, 10.0),
                point("AAPL", D1, 100.0),
                point("MSFT", D2, 11.0)
        );

        ValidatedPanel panel = validator.validate(rows);

        assertEquals(List.of("AAPL", "MSFT"), new ArrayList<>(panel.symbols()));
        assertEquals(List.of(D1, D2, D3), panel.series("MSFT").stream().map(p -> p.date).toList());
        assertEquals(5, panel.inputRows());
        assertEquals(5, panel.acceptedRows());
        assertTrue(panel.rejected().isEmpty());
        assertTrue(panel.series("GOOG").isEmpty());
    }

    @Test
    void validate_shouldRejectBadRowsWithoutDroppingTheSymbol() {
        List<PricePoint> rows = List.of(
                point("AAA", D1, 10.0),
                point("AAA", D2, 0.0),
                point("AAA", D3, 12.0),
                point("BBB", D1, 5.0, -1.0),
                new PricePoint("BBB", D2, Double.NaN, 6.0, 4.0, 5.0, 5.0, 100.0),
                point("BBB", D3, 5.5)
        );

        ValidatedPanel panel = validator.validate(rows);

        assertEquals(2, panel.series("AAA").size());
        assertEquals(1, panel.series("BBB").size());
        assertEquals(6, panel.inputRows());
        assertEquals(3, panel.acceptedRows());
        List<RowIssue> rejected = panel.rejected();
        assertEquals(3, rejected.size());
        assertEquals("AAA", rejected.get(0).symbol);
        assertEquals(RowIssueReason.INVALID_PRICE, rejected.get(0).reason);
        assertEquals(D1, rejected.get(1).date);
        assertEquals(RowIssueReason.INVALID_VOLUME, rejected.get(1).reason);
        assertEquals(RowIssueReason.INVALID_PRICE, rejected.get(2).reason);
    }

    @Test
    void validate_shouldCarryLoaderRejectsIntoTheReport() {
        RowIssue badDate = new RowIssue("AAA", null, RowIssueReason.INVALID_DATE, "line 4: date='2020-13-45'");
        List<PricePoint> rows = List.of(point("AAA", D1, 10.0), point("AAA", D2, -1.0), point("BBB", D1, 5.0));

        ValidatedPanel panel = validator.validate(rows, List.of(badDate));

        assertEquals(4, panel.inputRows());
        assertEquals(2, panel.acceptedRows());
        assertEquals(2, panel.rejected().size());
        assertEquals(RowIssueReason.INVALID_DATE, panel.rejected().get(0).reason);
        assertEquals(RowIssueReason.INVALID_PRICE, panel.rejected().get(1).reason);
    }

    @Test
    void validate_shouldAcceptPanelWhoseOnlyRowsWereRejectedByTheLoader() {
        RowIssue badDate = new RowIssue("AAA", null, RowIssueReason.INVALID_DATE, "line 2");

        ValidatedPanel panel = validator.validate(List.of(), List.of(badDate));

        assertTrue(panel.symbols().isEmpty());
        assertEquals(1, panel.rejected().size());
    }

    @Test
    void validate_shouldFailOnDuplicateKey() {
        List<PricePoint> rows = List.of(point("AAA", D1, 10.0), point("AAA", D1, 10.5));

        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> validator.validate(rows));

        assertEquals(InputErrorCode.DUPLICATE_KEY, ex.code());
    }

    @Test
    void validate_shouldFailOnMissingKeys() {
        InvalidInputException noSymbol = assertThrows(InvalidInputException.class,
                () -> validator.validate(List.of(point(" ", D1, 10.0))));
        InvalidInputException noDate = assertThrows(InvalidInputException.class,
                () -> validator.validate(List.of(point("AAA", null, 10.0))));

        assertEquals(InputErrorCode.MISSING_KEY, noSymbol.code());
        assertEquals(InputErrorCode.MISSING_KEY, noDate.code());
    }

    @Test
    void validate_shouldFailOnEmptyPanel() {
        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> validator.validate(List.of()));

        assertEquals(InputErrorCode.EMPTY_PANEL, ex.code());
        assertTrue(ex.getMessage().startsWith("EMPTY_PANEL"));
    }
}
