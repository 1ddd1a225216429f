package dk.trustworks.statements.ledgerservice.auth;

/**
 * Supplies the bearer credential used for ledger requests.
 * The fetch layer only reads it; refreshing is left to whoever orchestrates a report run.
 */
public interface CredentialProvider {

    String currentCredential();

    /**
     * Obtains a new credential and makes it the current one.
     *
     * @return the new credential
     * @throws dk.trustworks.statements.ledgerservice.exceptions.AuthorizationException if no new credential can be obtained
     */
    String refresh();
}
