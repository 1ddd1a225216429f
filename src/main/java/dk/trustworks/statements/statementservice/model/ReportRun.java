package dk.trustworks.statements.statementservice.model;

import java.util.List;

/**
 * Everything one report run produced. Each statement succeeds or fails on its own.
 */
public record ReportRun(ReportPeriod period,
                        StatementOutcome<ProfitAndLoss> profitAndLoss,
                        StatementOutcome<BalanceSheet> balanceSheet,
                        StatementOutcome<CashFlowStatement> cashFlow,
                        List<DocumentSummary> invoices,
                        List<DocumentSummary> bills) {

    public ReportRun {
        invoices = List.copyOf(invoices);
        bills = List.copyOf(bills);
    }

    public List<StatementOutcome<?>> outcomes() {
        return List.of(profitAndLoss, balanceSheet, cashFlow);
    }

    public boolean hasFailures() {
        return outcomes().stream().anyMatch(o -> o.status() == StatementStatus.FAILED);
    }
}
