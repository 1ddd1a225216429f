package dk.trustworks.statements.statementservice.model;

/**
 * Side of the P&L a transaction line belongs to, with the label used when no category can be resolved.
 */
public enum CategoryKind {
    REVENUE("Other Revenue"),
    EXPENSE("Other Expenses");

    private final String defaultLabel;

    CategoryKind(String defaultLabel) {
        this.defaultLabel = defaultLabel;
    }

    public String getDefaultLabel() {
        return defaultLabel;
    }
}
