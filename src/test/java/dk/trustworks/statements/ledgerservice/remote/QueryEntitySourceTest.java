package dk.trustworks.statements.ledgerservice.remote;

import com.fasterxml.jackson.databind.ObjectMapper;
import dk.trustworks.statements.ledgerservice.exceptions.AuthorizationException;
import dk.trustworks.statements.ledgerservice.exceptions.LedgerRequestException;
import dk.trustworks.statements.ledgerservice.exceptions.TransientServiceException;
import dk.trustworks.statements.ledgerservice.remote.dto.QueryResponse;
import dk.trustworks.statements.ledgerservice.remote.dto.TransactionRecord;
import dk.trustworks.statements.statementservice.model.Document;
import dk.trustworks.statements.statementservice.model.DocumentKind;
import dk.trustworks.statements.statementservice.model.LineDetail;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("QueryEntitySource")
class QueryEntitySourceTest {

    private static final String REALM = "9130350";
    private static final String INVOICE_PAGE = """
            {
              "QueryResponse": {
                "Invoice": [
                  {
                    "Id": "130",
                    "DocNumber": "1037",
                    "TxnDate": "2024-01-15",
                    "CustomerRef": {"value": "3", "name": "Cool Cars"},
                    "TotalAmt": 362.07,
                    "Balance": 362.07,
                    "Line": [
                      {"Id": "1", "Amount": 275.0, "DetailType": "SalesItemLineDetail",
                       "SalesItemLineDetail": {"ItemRef": {"value": "5", "name": "Rock Fountain"}}},
                      {"Id": "2", "Amount": 87.07, "DetailType": "SalesItemLineDetail",
                       "SalesItemLineDetail": {"ItemRef": {"value": "11", "name": "Pump"}}},
                      {"Amount": 362.07, "DetailType": "SubTotalLineDetail", "SubTotalLineDetail": {}}
                    ],
                    "SyncToken": "0"
                  }
                ],
                "startPosition": 1,
                "maxResults": 1
              },
              "time": "2024-02-01T10:00:00.000-08:00"
            }
            """;

    @Mock
    LedgerQueryAPI api;

    @Mock
    Response response;

    private QueryEntitySource<Document> invoices;

    @BeforeEach
    void setUp() {
        Function<QueryResponse, List<Document>> extractor = r -> r.getInvoices() == null ? null
                : r.getInvoices().stream().map((TransactionRecord t) -> LedgerRecordMapper.toDocument(t, DocumentKind.INVOICE)).toList();
        invoices = new QueryEntitySource<>("Invoice", api, REALM, "65", new ObjectMapper(), extractor);
    }

    @Nested
    @DisplayName("Query text")
    class QueryText {

        @Test
        void withoutFilter() {
            assertEquals("SELECT * FROM Account STARTPOSITION 1 MAXRESULTS 100",
                    QueryEntitySource.buildQuery("Account", null, 1, 100));
        }

        @Test
        void blankFilterIsOmitted() {
            assertEquals("SELECT * FROM Account STARTPOSITION 101 MAXRESULTS 100",
                    QueryEntitySource.buildQuery("Account", "  ", 101, 100));
        }

        @Test
        void filterInsertedVerbatim() {
            assertEquals("SELECT * FROM Bill WHERE TxnDate >= '2024-01-01' AND TxnDate <= '2024-01-31' STARTPOSITION 201 MAXRESULTS 100",
                    QueryEntitySource.buildQuery("Bill", "TxnDate >= '2024-01-01' AND TxnDate <= '2024-01-31'", 201, 100));
        }

        @Test
        @DisplayName("Request goes to the configured company with the minor version")
        void requestParameters() {
            when(api.query(anyString(), anyString(), anyString())).thenReturn(response);
            when(response.getStatus()).thenReturn(200);
            when(response.readEntity(String.class)).thenReturn("{\"QueryResponse\":{}}");

            invoices.list("TxnDate >= '2024-01-01'", 1, 100);

            verify(api).query(REALM, "SELECT * FROM Invoice WHERE TxnDate >= '2024-01-01' STARTPOSITION 1 MAXRESULTS 100", "65");
            verify(response).close();
        }
    }

    @Nested
    @DisplayName("Response handling")
    class ResponseHandling {

        @BeforeEach
        void stubQuery() {
            when(api.query(anyString(), anyString(), anyString())).thenReturn(response);
        }

        @Test
        @DisplayName("Invoice page is mapped to documents without subtotal lines")
        void mapsInvoices() {
            when(response.getStatus()).thenReturn(200);
            when(response.readEntity(String.class)).thenReturn(INVOICE_PAGE);

            List<Document> page = invoices.list(null, 1, 100);

            assertEquals(1, page.size());
            Document invoice = page.get(0);
            assertEquals("130", invoice.id());
            assertEquals("Cool Cars", invoice.counterparty());
            assertEquals(LocalDate.of(2024, 1, 15), invoice.txnDate());
            assertEquals(0, new BigDecimal("362.07").compareTo(invoice.totalAmount()));
            assertEquals(2, invoice.lines().size());
            LineDetail detail = invoice.lines().get(0).detail();
            assertInstanceOf(LineDetail.SalesItemDetail.class, detail);
            assertEquals("Rock Fountain", detail.reference().name());
        }

        @Test
        @DisplayName("Missing entity list → empty page")
        void missingListIsEmpty() {
            when(response.getStatus()).thenReturn(200);
            when(response.readEntity(String.class)).thenReturn("{\"QueryResponse\":{},\"time\":\"x\"}");

            assertTrue(invoices.list(null, 1, 100).isEmpty());
        }

        @Test
        @DisplayName("Empty body → empty page")
        void emptyBody() {
            when(response.getStatus()).thenReturn(200);
            when(response.readEntity(String.class)).thenReturn("");

            assertTrue(invoices.list(null, 1, 100).isEmpty());
        }

        @Test
        @DisplayName("Malformed JSON → permanent request failure")
        void malformedJson() {
            when(response.getStatus()).thenReturn(200);
            when(response.readEntity(String.class)).thenReturn("{\"QueryResponse\": [");

            LedgerRequestException e = assertThrows(LedgerRequestException.class, () -> invoices.list(null, 1, 100));
            assertFalse(e.isTransient());
        }

        @Test
        @DisplayName("Error status → classified by the error mapper")
        void errorStatus() {
            when(response.getStatus()).thenReturn(401);
            when(response.hasEntity()).thenReturn(false);

            assertThrows(AuthorizationException.class, () -> invoices.list(null, 1, 100));
        }
    }

    @Nested
    @DisplayName("Transport failures")
    class TransportFailures {

        @Test
        @DisplayName("Connection failure → transient")
        void connectionFailure() {
            when(api.query(anyString(), anyString(), anyString()))
                    .thenThrow(new ProcessingException("Connection refused"));

            TransientServiceException e = assertThrows(TransientServiceException.class, () -> invoices.list(null, 1, 100));
            assertEquals(0, e.getStatusCode());
        }

        @Test
        @DisplayName("Classified failure wrapped by the client is unwrapped")
        void wrappedClassifiedFailure() {
            AuthorizationException denied = new AuthorizationException("expired");
            when(api.query(anyString(), anyString(), anyString()))
                    .thenThrow(new ProcessingException("wrapped", denied));

            AuthorizationException thrown = assertThrows(AuthorizationException.class, () -> invoices.list(null, 1, 100));
            assertSame(denied, thrown);
        }
    }
}
