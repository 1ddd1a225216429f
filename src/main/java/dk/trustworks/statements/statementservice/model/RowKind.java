package dk.trustworks.statements.statementservice.model;

public enum RowKind {
    SECTION_HEADER,
    DETAIL,
    SUBTOTAL,
    TOTAL,
    SPACER
}
