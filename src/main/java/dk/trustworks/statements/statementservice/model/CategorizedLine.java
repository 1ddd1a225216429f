package dk.trustworks.statements.statementservice.model;

import java.math.BigDecimal;

/**
 * @param fallback true when no rule resolved a label and the kind's default was used
 */
public record CategorizedLine(String category, BigDecimal amount, boolean fallback) {
}
