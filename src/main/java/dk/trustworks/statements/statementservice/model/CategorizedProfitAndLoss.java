package dk.trustworks.statements.statementservice.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * P&L built from line detail. Category maps keep first-seen order.
 * Gross profit and net income are always equal; there is no cost-of-goods split.
 */
public record CategorizedProfitAndLoss(Map<String, BigDecimal> revenueDetail,
                                       Map<String, BigDecimal> expenseDetail,
                                       BigDecimal totalRevenue,
                                       BigDecimal totalExpenses,
                                       BigDecimal grossProfit,
                                       BigDecimal netIncome) implements ProfitAndLoss {

    public CategorizedProfitAndLoss {
        revenueDetail = Collections.unmodifiableMap(new LinkedHashMap<>(revenueDetail));
        expenseDetail = Collections.unmodifiableMap(new LinkedHashMap<>(expenseDetail));
    }

    @Override
    @JsonProperty("shape")
    public Shape shape() {
        return Shape.CATEGORIZED;
    }
}
