package dk.trustworks.statements.statementservice.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DocumentSummary(DocumentKind kind,
                              String id,
                              String counterparty,
                              LocalDate txnDate,
                              BigDecimal totalAmount,
                              BigDecimal balance) {

    public static DocumentSummary of(Document document) {
        return new DocumentSummary(document.kind(), document.id(), document.counterparty(),
                document.txnDate(), document.totalAmount(), document.balance());
    }
}
