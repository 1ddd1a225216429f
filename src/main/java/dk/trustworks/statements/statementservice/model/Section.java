package dk.trustworks.statements.statementservice.model;

/**
 * Top-level balance sheet grouping, in presentation order.
 */
public enum Section {
    ASSET("Assets"),
    LIABILITY("Liabilities"),
    EQUITY("Equity"),
    UNCLASSIFIED("Unclassified");

    private final String displayName;

    Section(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
