package dk.trustworks.statements.statementservice.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rows in presentation order plus the total of every section present.
 * Assets minus liabilities minus equity is reported as the ledger states it and need not be zero.
 */
public record BalanceSheet(List<StatementRow> rows, Map<Section, BigDecimal> sectionTotals) {

    public BalanceSheet {
        rows = List.copyOf(rows);
        Map<Section, BigDecimal> totals = new EnumMap<>(Section.class);
        totals.putAll(sectionTotals);
        sectionTotals = Collections.unmodifiableMap(totals);
    }

    public BigDecimal total(Section section) {
        return sectionTotals.getOrDefault(section, BigDecimal.ZERO);
    }
}
