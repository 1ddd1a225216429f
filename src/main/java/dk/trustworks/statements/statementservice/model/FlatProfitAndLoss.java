package dk.trustworks.statements.statementservice.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * P&L from document totals only; no categorization was possible.
 */
public record FlatProfitAndLoss(BigDecimal totalRevenue,
                                BigDecimal totalExpenses,
                                BigDecimal netIncome) implements ProfitAndLoss {

    @Override
    @JsonProperty("shape")
    public Shape shape() {
        return Shape.FLAT;
    }
}
