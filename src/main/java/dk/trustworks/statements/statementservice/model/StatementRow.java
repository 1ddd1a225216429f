package dk.trustworks.statements.statementservice.model;

import java.math.BigDecimal;

/**
 * One line of a rendered statement. {@code amount} is null for section headers and spacers only.
 */
public record StatementRow(String label, BigDecimal amount, RowKind kind) {

    public static StatementRow header(String label) {
        return new StatementRow(label, null, RowKind.SECTION_HEADER);
    }

    public static StatementRow detail(String label, BigDecimal amount) {
        return new StatementRow(label, amount, RowKind.DETAIL);
    }

    public static StatementRow subtotal(String label, BigDecimal amount) {
        return new StatementRow(label, amount, RowKind.SUBTOTAL);
    }

    public static StatementRow total(String label, BigDecimal amount) {
        return new StatementRow(label, amount, RowKind.TOTAL);
    }

    public static StatementRow spacer() {
        return new StatementRow("", null, RowKind.SPACER);
    }
}
