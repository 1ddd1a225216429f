package dk.trustworks.statements.statementservice.model;

public enum PeriodPreset {
    MONTHLY,
    QUARTERLY,
    YEARLY,
    CUSTOM
}
