package dk.trustworks.statements.ledgerservice.remote;

import dk.trustworks.statements.ledgerservice.auth.CredentialProvider;
import jakarta.ws.rs.client.ClientRequestContext;
import jakarta.ws.rs.client.ClientRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.jbosslog.JBossLog;

/**
 * Puts the provider's current credential on every ledger request. The token is looked up per
 * request, so a refresh takes effect without rebuilding the client.
 */
@JBossLog
public class BearerTokenHeaderFilter implements ClientRequestFilter {

    private final CredentialProvider credentialProvider;

    public BearerTokenHeaderFilter(CredentialProvider credentialProvider) {
        this.credentialProvider = credentialProvider;
    }

    @Override
    public void filter(ClientRequestContext ctx) {
        var h = ctx.getHeaders();
        h.putSingle(HttpHeaders.AUTHORIZATION, "Bearer " + credentialProvider.currentCredential());
        h.putSingle(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON);

        log.debugf("Ledger request: %s %s [Auth: Bearer ***]", ctx.getMethod(), ctx.getUri());
    }
}
