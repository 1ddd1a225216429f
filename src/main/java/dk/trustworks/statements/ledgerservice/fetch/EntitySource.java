package dk.trustworks.statements.ledgerservice.fetch;

import java.util.List;

/**
 * One kind of ledger record that can be listed page by page.
 *
 * @param <T> record type returned by the source
 */
public interface EntitySource<T> {

    /**
     * Name of the entity, used in logs and metrics (e.g. "Invoice").
     */
    String entityName();

    /**
     * Lists one page of records.
     *
     * @param filter opaque filter expression, passed through verbatim; null for no filter
     * @param startPosition 1-based position of the first record of the page
     * @param pageSize maximum number of records to return
     * @return the records of the page in server order, never null
     * @throws dk.trustworks.statements.ledgerservice.exceptions.LedgerFetchException classified failure
     */
    List<T> list(String filter, int startPosition, int pageSize);
}
