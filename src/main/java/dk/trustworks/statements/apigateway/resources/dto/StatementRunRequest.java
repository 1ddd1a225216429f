package dk.trustworks.statements.apigateway.resources.dto;

import dk.trustworks.statements.statementservice.model.CashFlowInput;
import dk.trustworks.statements.statementservice.model.PeriodPreset;
import dk.trustworks.statements.statementservice.model.ProfitAndLoss;

/**
 * @param from yyyy-MM-dd, only used with {@link PeriodPreset#CUSTOM}
 * @param to yyyy-MM-dd, only used with {@link PeriodPreset#CUSTOM}
 * @param cashFlow activity movements; the cash flow statement is skipped when absent
 */
public record StatementRunRequest(PeriodPreset period,
                                  String from,
                                  String to,
                                  ProfitAndLoss.Shape shape,
                                  CashFlowInput cashFlow) {
}
