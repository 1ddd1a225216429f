package dk.trustworks.statements.statementservice.model;

import java.math.BigDecimal;

/**
 * @param currentBalance null when the ledger omitted it; required on the balance sheet
 * @param accountType declared type tag, e.g. "Bank" or "AccountsPayable"
 */
public record LedgerAccount(String id, String name, BigDecimal currentBalance, String accountType) {

    public static final String UNKNOWN_NAME = "Unknown Account";

    public String displayName() {
        return name != null && !name.isBlank() ? name : UNKNOWN_NAME;
    }
}
