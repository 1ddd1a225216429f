package dk.trustworks.statements.statementservice.exceptions;

/**
 * A fetched record lacks a value the statement being built cannot do without.
 * Fails that statement only.
 */
public class MalformedRecordException extends RuntimeException {

    private final String recordId;
    private final String field;

    public MalformedRecordException(String recordType, String recordId, String field) {
        super(String.format("%s %s has no %s", recordType, recordId != null ? recordId : "<no id>", field));
        this.recordId = recordId;
        this.field = field;
    }

    public String getRecordId() {
        return recordId;
    }

    public String getField() {
        return field;
    }
}
