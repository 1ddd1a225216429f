package dk.trustworks.statements.statementservice.services;

import dk.trustworks.statements.statementservice.model.BalanceSheet;
import dk.trustworks.statements.statementservice.model.CashFlowStatement;
import dk.trustworks.statements.statementservice.model.ProfitAndLoss;
import dk.trustworks.statements.statementservice.model.ReportPeriod;

import java.time.LocalDate;

/**
 * Presents finished statements. Implementations own all formatting and the output sink;
 * row order and field names of the statements must be kept as produced.
 */
public interface StatementRenderer {

    void renderProfitAndLoss(ReportPeriod period, ProfitAndLoss profitAndLoss);

    void renderBalanceSheet(LocalDate asOf, BalanceSheet balanceSheet);

    void renderCashFlow(ReportPeriod period, CashFlowStatement cashFlow);
}
