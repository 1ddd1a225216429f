package dk.trustworks.statements.statementservice.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Balance sheet movements already sorted into cash flow activities by the caller.
 * Which account belongs to which activity is not decided here.
 */
public record CashFlowInput(BigDecimal beginningCash,
                            Map<String, BigDecimal> operating,
                            Map<String, BigDecimal> investing,
                            Map<String, BigDecimal> financing) {

    public CashFlowInput {
        beginningCash = beginningCash != null ? beginningCash : BigDecimal.ZERO;
        operating = copy(operating);
        investing = copy(investing);
        financing = copy(financing);
    }

    public static CashFlowInput empty() {
        return new CashFlowInput(BigDecimal.ZERO, Map.of(), Map.of(), Map.of());
    }

    private static Map<String, BigDecimal> copy(Map<String, BigDecimal> source) {
        if (source == null) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
