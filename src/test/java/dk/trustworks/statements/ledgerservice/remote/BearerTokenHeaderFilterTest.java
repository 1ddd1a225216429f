package dk.trustworks.statements.ledgerservice.remote;

import dk.trustworks.statements.ledgerservice.auth.CredentialProvider;
import jakarta.ws.rs.client.ClientRequestContext;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.MultivaluedMap;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BearerTokenHeaderFilterTest {

    @Test
    void currentCredentialIsReadOnEveryRequest() {
        CredentialProvider credentials = Mockito.mock(CredentialProvider.class);
        Mockito.when(credentials.currentCredential()).thenReturn("first", "second");
        ClientRequestContext ctx = Mockito.mock(ClientRequestContext.class);
        MultivaluedMap<String, Object> headers = new MultivaluedHashMap<>();
        Mockito.when(ctx.getHeaders()).thenReturn(headers);
        Mockito.when(ctx.getMethod()).thenReturn("GET");
        Mockito.when(ctx.getUri()).thenReturn(URI.create("https://ledger.test/v3/company/1/query"));

        BearerTokenHeaderFilter filter = new BearerTokenHeaderFilter(credentials);
        filter.filter(ctx);
        assertEquals("Bearer first", headers.getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals("application/json", headers.getFirst(HttpHeaders.ACCEPT));

        filter.filter(ctx);
        assertEquals("Bearer second", headers.getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals(1, headers.get(HttpHeaders.AUTHORIZATION).size());
    }
}
