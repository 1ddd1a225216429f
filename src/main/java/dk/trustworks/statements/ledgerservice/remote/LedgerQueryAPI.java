package dk.trustworks.statements.ledgerservice.remote;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;

import static jakarta.ws.rs.core.MediaType.APPLICATION_JSON;

/**
 * Ledger query endpoint. The query is a statement of the form
 * {@code SELECT * FROM Invoice WHERE ... STARTPOSITION 1 MAXRESULTS 100}.
 */
@Path("/v3/company")
@RegisterProvider(LedgerErrorMapper.class)
@Produces(APPLICATION_JSON)
public interface LedgerQueryAPI {

    @GET
    @Path("/{realmId}/query")
    Response query(@PathParam("realmId") String realmId,
                   @QueryParam("query") String query,
                   @QueryParam("minorversion") String minorVersion);

}
