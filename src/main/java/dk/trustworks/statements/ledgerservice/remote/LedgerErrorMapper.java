package dk.trustworks.statements.ledgerservice.remote;

import dk.trustworks.statements.ledgerservice.exceptions.AuthorizationException;
import dk.trustworks.statements.ledgerservice.exceptions.LedgerFetchException;
import dk.trustworks.statements.ledgerservice.exceptions.LedgerRequestException;
import dk.trustworks.statements.ledgerservice.exceptions.TransientServiceException;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;

/**
 * Turns ledger error responses into classified exceptions:
 * 401/403 are authorization failures, 408, 429 and 5xx are transient, any other 4xx is a
 * permanent request failure (typically a query the ledger could not parse).
 */
@JBossLog
public class LedgerErrorMapper implements ResponseExceptionMapper<LedgerFetchException> {

    @Override
    public boolean handles(int status, MultivaluedMap<String, Object> headers) {
        return status >= 400;
    }

    @Override
    public LedgerFetchException toThrowable(Response response) {
        int status = response.getStatus();
        String message = "HTTP " + status + " from ledger: " + readBody(response);
        return classify(status, message);
    }

    static LedgerFetchException classify(int status, String message) {
        if (status == 401 || status == 403) {
            return new AuthorizationException(message, status);
        }
        if (status == 408 || status == 429 || status >= 500) {
            return new TransientServiceException(message, status);
        }
        return new LedgerRequestException(message, status);
    }

    private String readBody(Response response) {
        try {
            if (!response.hasEntity()) return "<no response body>";
            String body = response.readEntity(String.class);
            return body != null ? body : "";
        } catch (RuntimeException e) {
            log.warnf(e, "Failed to read ledger error response body");
            return "<failed to read body: " + e.getMessage() + ">";
        }
    }
}
