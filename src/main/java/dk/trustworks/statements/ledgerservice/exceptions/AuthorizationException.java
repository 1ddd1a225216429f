package dk.trustworks.statements.ledgerservice.exceptions;

/**
 * The ledger rejected the credential (expired, revoked or missing scope).
 * Never retried; the caller must refresh the credential and start over.
 */
public class AuthorizationException extends LedgerFetchException {

    public AuthorizationException(String message) {
        super(message, 401);
    }

    public AuthorizationException(String message, int statusCode) {
        super(message, statusCode);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
