package dk.trustworks.statements.ledgerservice.exceptions;

/**
 * Server error, throttling or network failure. Safe to repeat after a backoff.
 */
public class TransientServiceException extends LedgerFetchException {

    public TransientServiceException(String message, int statusCode) {
        super(message, statusCode);
    }

    public TransientServiceException(String message, Throwable cause) {
        super(message, 0, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
