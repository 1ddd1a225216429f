package dk.trustworks.statements.ledgerservice.exceptions;

/**
 * Permanent request failure, e.g. a query the ledger cannot parse or an unknown entity.
 */
public class LedgerRequestException extends LedgerFetchException {

    public LedgerRequestException(String message, int statusCode) {
        super(message, statusCode);
    }

    public LedgerRequestException(String message, Throwable cause) {
        super(message, 0, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
