package dk.trustworks.statements.ledgerservice.exceptions;

/**
 * A page request kept failing with transient errors until the retry budget ran out.
 * The cause is the last transient error.
 */
public class FetchExhaustedException extends LedgerFetchException {

    private final int attempts;

    public FetchExhaustedException(String entity, int attempts, LedgerFetchException lastError) {
        super(String.format("Giving up on %s after %d attempts: %s", entity, attempts, lastError.getMessage()),
                lastError.getStatusCode(), lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
