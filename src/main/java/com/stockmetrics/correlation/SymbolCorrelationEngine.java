package com.stockmetrics.correlation;

import com.stockmetrics.model.CorrelationMatrix;
import com.stockmetrics.model.DerivedPricePoint;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Symbol-versus-symbol correlation of daily returns.
 * <p>
 * Pivots {@code daily_return} into a dates × symbols table and keeps only the dates on which
 * every symbol has a return, then correlates the symbol columns. This answers "which stocks
 * move together", which the pooled feature matrix of {@link CorrelationEngine} does not.
 */
public final class SymbolCorrelationEngine {
    private static final Logger LOG = LogManager.getLogger(SymbolCorrelationEngine.class);

    private final PearsonMatrixBuilder matrixBuilder = new PearsonMatrixBuilder();

    public CorrelationMatrix correlate(Map<String, List<DerivedPricePoint>> seriesBySymbol) {
        List<String> symbols = new ArrayList<>(new TreeMap<>(seriesBySymbol).keySet());
        Map<LocalDate, Map<String, Double>> pivot = new TreeMap<>();
        for (String symbol : symbols) {
            for (DerivedPricePoint row : seriesBySymbol.get(symbol)) {
                if (row.dailyReturn == null) {
                    continue;
                }
                pivot.computeIfAbsent(row.date(), ignored -> new HashMap<>()).put(symbol, row.dailyReturn);
            }
        }

        List<Map<String, Double>> complete = new ArrayList<>();
        for (Map<String, Double> returns : pivot.values()) {
            if (returns.size() == symbols.size()) {
                complete.add(returns);
            }
        }

        double[][] columns = new double[symbols.size()][complete.size()];
        for (int s = 0; s < symbols.size(); s++) {
            for (int d = 0; d < complete.size(); d++) {
                columns[s][d] = complete.get(d).get(symbols.get(s));
            }
        }
        LOG.info("Symbol correlation: symbols={}, dates={}, complete_dates={}",
                symbols.size(), pivot.size(), complete.size());
        return matrixBuilder.build(symbols, columns);
    }
}
