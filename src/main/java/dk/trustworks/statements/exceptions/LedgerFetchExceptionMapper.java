package dk.trustworks.statements.exceptions;

import dk.trustworks.statements.ledgerservice.exceptions.AuthorizationException;
import dk.trustworks.statements.ledgerservice.exceptions.LedgerFetchException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.jbosslog.JBossLog;

/**
 * Ledger failures that aborted a report run: 401 for a rejected credential, 503 when the ledger
 * stayed unavailable through all retries, 502 for any other ledger refusal.
 */
@JBossLog
@Provider
public class LedgerFetchExceptionMapper implements ExceptionMapper<LedgerFetchException> {

    @Override
    public Response toResponse(LedgerFetchException exception) {
        Response.Status status;
        if (exception instanceof AuthorizationException) {
            status = Response.Status.UNAUTHORIZED;
        } else if (exception.isTransient()) {
            status = Response.Status.SERVICE_UNAVAILABLE;
        } else {
            status = Response.Status.BAD_GATEWAY;
        }
        log.warnf("Report run aborted (%s): %s", exception.getClass().getSimpleName(), exception.getMessage());
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(exception.getClass().getSimpleName(), exception.getMessage()))
                .build();
    }
}
