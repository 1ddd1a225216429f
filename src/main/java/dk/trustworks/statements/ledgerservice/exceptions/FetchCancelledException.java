package dk.trustworks.statements.ledgerservice.exceptions;

/**
 * The fetch was cancelled between requests. Pages read so far are discarded.
 */
public class FetchCancelledException extends RuntimeException {

    private final int pagesDiscarded;

    public FetchCancelledException(String entity, int pagesDiscarded) {
        super("Fetch of " + entity + " cancelled after " + pagesDiscarded + " page(s)");
        this.pagesDiscarded = pagesDiscarded;
    }

    public int getPagesDiscarded() {
        return pagesDiscarded;
    }
}
