package dk.trustworks.statements.statementservice.model;

/**
 * Pointer to another ledger entity (item, account, customer, vendor) as embedded in a record.
 */
public record Reference(String id, String name) {

    public boolean hasName() {
        return name != null && !name.isBlank();
    }
}
