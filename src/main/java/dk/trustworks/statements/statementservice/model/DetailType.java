package dk.trustworks.statements.statementservice.model;

public enum DetailType {
    SALES_ITEM,
    ACCOUNT_EXPENSE,
    ITEM_EXPENSE,
    NONE
}
