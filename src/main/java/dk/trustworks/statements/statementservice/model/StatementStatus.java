package dk.trustworks.statements.statementservice.model;

public enum StatementStatus {
    SUCCEEDED,
    FAILED,
    SKIPPED
}
