package dk.trustworks.statements.statementservice.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * An invoice or a bill as fetched from the ledger. Never modified after mapping.
 *
 * @param totalAmount null when the ledger omitted it; required for flat totals
 */
public record Document(DocumentKind kind,
                       String id,
                       String counterparty,
                       LocalDate txnDate,
                       BigDecimal totalAmount,
                       BigDecimal balance,
                       List<TransactionLine> lines) {

    public Document {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }
}
