package dk.trustworks.statements.statementservice.model;

import java.math.BigDecimal;

/**
 * @param amount signed line amount, null when the ledger omitted it
 * @param detail never null after construction
 */
public record TransactionLine(BigDecimal amount, LineDetail detail) {

    public TransactionLine {
        if (detail == null) detail = LineDetail.none();
    }

    public BigDecimal amountOrZero() {
        return amount != null ? amount : BigDecimal.ZERO;
    }
}
