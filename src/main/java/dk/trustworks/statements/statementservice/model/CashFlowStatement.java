package dk.trustworks.statements.statementservice.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Indirect method cash flow. The operating map starts with net income followed by the
 * adjustments. {@code netChangeInCash == netOperating + netInvesting + netFinancing}.
 */
public record CashFlowStatement(BigDecimal netIncome,
                                Map<String, BigDecimal> operatingActivities,
                                Map<String, BigDecimal> investingActivities,
                                Map<String, BigDecimal> financingActivities,
                                BigDecimal netOperating,
                                BigDecimal netInvesting,
                                BigDecimal netFinancing,
                                BigDecimal netChangeInCash,
                                BigDecimal beginningCash,
                                BigDecimal endingCash) {

    public CashFlowStatement {
        operatingActivities = Collections.unmodifiableMap(new LinkedHashMap<>(operatingActivities));
        investingActivities = Collections.unmodifiableMap(new LinkedHashMap<>(investingActivities));
        financingActivities = Collections.unmodifiableMap(new LinkedHashMap<>(financingActivities));
    }
}
