package dk.trustworks.statements.ledgerservice.exceptions;

/**
 * Base class for classified failures raised while reading from the ledger.
 * Subclasses decide whether a failed request may be repeated.
 */
public abstract class LedgerFetchException extends RuntimeException {

    private final int statusCode;

    protected LedgerFetchException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    protected LedgerFetchException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return true when repeating the same request may succeed
     */
    public abstract boolean isTransient();

    /**
     * @return the HTTP status behind the failure, or 0 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
