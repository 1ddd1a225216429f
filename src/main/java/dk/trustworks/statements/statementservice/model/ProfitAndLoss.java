package dk.trustworks.statements.statementservice.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Profit and loss result. Callers check {@link #shape()} to tell a categorized breakdown from
 * plain document totals.
 */
public interface ProfitAndLoss {

    enum Shape {
        CATEGORIZED,
        FLAT
    }

    @JsonProperty("shape")
    Shape shape();

    BigDecimal totalRevenue();

    BigDecimal totalExpenses();

    BigDecimal netIncome();
}
