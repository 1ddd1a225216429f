package dk.trustworks.statements.statementservice.services;

import dk.trustworks.statements.ledgerservice.auth.CredentialProvider;
import dk.trustworks.statements.ledgerservice.exceptions.AuthorizationException;
import dk.trustworks.statements.ledgerservice.exceptions.LedgerRequestException;
import dk.trustworks.statements.ledgerservice.fetch.CancellationToken;
import dk.trustworks.statements.ledgerservice.fetch.EntitySource;
import dk.trustworks.statements.ledgerservice.fetch.PagedFetcher;
import dk.trustworks.statements.ledgerservice.fetch.RetryPolicy;
import dk.trustworks.statements.ledgerservice.remote.LedgerClientFactory;
import dk.trustworks.statements.statementservice.model.BalanceSheet;
import dk.trustworks.statements.statementservice.model.CashFlowInput;
import dk.trustworks.statements.statementservice.model.CashFlowStatement;
import dk.trustworks.statements.statementservice.model.Document;
import dk.trustworks.statements.statementservice.model.DocumentKind;
import dk.trustworks.statements.statementservice.model.LedgerAccount;
import dk.trustworks.statements.statementservice.model.ProfitAndLoss;
import dk.trustworks.statements.statementservice.model.ReportPeriod;
import dk.trustworks.statements.statementservice.model.ReportRun;
import dk.trustworks.statements.statementservice.model.StatementStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static dk.trustworks.statements.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReportRunService")
class ReportRunServiceTest {

    private static final ReportPeriod JANUARY = new ReportPeriod(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

    @Mock
    LedgerClientFactory ledgerClient;

    @Mock
    CredentialProvider credentialProvider;

    private ListSource<Document> invoices;
    private ListSource<Document> bills;
    private ListSource<LedgerAccount> accounts;
    private ReportRunService service;

    @BeforeEach
    void setUp() {
        invoices = new ListSource<>("Invoice", List.of(
                invoice(salesLine("5000", "Consulting")),
                invoice(salesLine("3000", "Design"))));
        bills = new ListSource<>("Bill", List.of(bill(
                accountExpenseLine("2000", "Rent"),
                itemExpenseLine("500", "Supplies"))));
        accounts = new ListSource<>("Account", List.of(
                account("Checking", "12000", "Bank"),
                account("Owner Equity", "12000", "Equity")));

        lenient().when(ledgerClient.invoices()).thenReturn(invoices);
        lenient().when(ledgerClient.bills()).thenReturn(bills);
        lenient().when(ledgerClient.accounts()).thenReturn(accounts);

        PagedFetcher fetcher = new PagedFetcher(new RetryPolicy(() -> 0.0), d -> { }, new SimpleMeterRegistry());
        StatementAggregator aggregator = new StatementAggregator(new LineCategorizer(), new AccountClassifier());
        service = new ReportRunService(fetcher, ledgerClient, aggregator, credentialProvider);
    }

    @Nested
    @DisplayName("Successful run")
    class Successful {

        @Test
        @DisplayName("All three statements are built from the fetched data")
        void allStatements() {
            CashFlowInput input = new CashFlowInput(amount("1000"), Map.of("Depreciation", amount("100")), null, null);

            ReportRun run = service.run(JANUARY, input);

            assertEquals(StatementStatus.SUCCEEDED, run.profitAndLoss().status());
            assertEquals(0, amount("5500").compareTo(run.profitAndLoss().statement().netIncome()));
            assertEquals(StatementStatus.SUCCEEDED, run.balanceSheet().status());
            BalanceSheet sheet = run.balanceSheet().statement();
            assertFalse(sheet.rows().isEmpty());
            CashFlowStatement cashFlow = run.cashFlow().statement();
            assertEquals(0, amount("5600").compareTo(cashFlow.netChangeInCash()));
            assertEquals(0, amount("6600").compareTo(cashFlow.endingCash()));
            assertEquals(2, run.invoices().size());
            assertEquals(1, run.bills().size());
            assertFalse(run.hasFailures());
        }

        @Test
        @DisplayName("Documents are filtered on the period; accounts are not")
        void filters() {
            service.run(JANUARY, null);

            String expected = "TxnDate >= '2024-01-01' AND TxnDate <= '2024-01-31'";
            assertEquals(List.of(expected), invoices.filters);
            assertEquals(List.of(expected), bills.filters);
            assertEquals(1, accounts.filters.size());
            assertNull(accounts.filters.get(0));
        }

        @Test
        @DisplayName("No cash flow input → cash flow skipped")
        void cashFlowSkippedWithoutInput() {
            ReportRun run = service.run(JANUARY, null);

            assertEquals(StatementStatus.SKIPPED, run.cashFlow().status());
            assertNull(run.cashFlow().statement());
            assertFalse(run.hasFailures());
        }

        @Test
        @DisplayName("Flat shape sums document totals")
        void flatShape() {
            ReportRun run = service.run(JANUARY, ProfitAndLoss.Shape.FLAT, null, CancellationToken.none());

            assertEquals(ProfitAndLoss.Shape.FLAT, run.profitAndLoss().statement().shape());
            assertEquals(0, amount("5500").compareTo(run.profitAndLoss().statement().netIncome()));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Account without balance fails only the balance sheet")
        void malformedAccountScopedToBalanceSheet() {
            accounts.records = List.of(new LedgerAccount("9", "Broken", null, "Bank"));

            ReportRun run = service.run(JANUARY, CashFlowInput.empty());

            assertEquals(StatementStatus.FAILED, run.balanceSheet().status());
            assertEquals("MalformedRecordException", run.balanceSheet().errorType());
            assertEquals(StatementStatus.SUCCEEDED, run.profitAndLoss().status());
            assertEquals(StatementStatus.SUCCEEDED, run.cashFlow().status());
            assertTrue(run.hasFailures());
        }

        @Test
        @DisplayName("Failed P&L → cash flow skipped for lack of net income")
        void cashFlowSkippedWhenProfitAndLossFails() {
            invoices.records = List.of(new Document(
                    DocumentKind.INVOICE, "1", "Customer",
                    LocalDate.of(2024, 1, 5), null, null, List.of()));

            ReportRun run = service.run(JANUARY, ProfitAndLoss.Shape.FLAT, CashFlowInput.empty(), CancellationToken.none());

            assertEquals(StatementStatus.FAILED, run.profitAndLoss().status());
            assertEquals(StatementStatus.SKIPPED, run.cashFlow().status());
            assertTrue(run.cashFlow().message().startsWith("Net income unavailable"));
            assertEquals(StatementStatus.SUCCEEDED, run.balanceSheet().status());
        }

        @Test
        @DisplayName("Authorization failure → credential refreshed once and fetch restarted")
        void refreshOnce() {
            bills.failOnce = new AuthorizationException("token expired");

            ReportRun run = service.run(JANUARY, null);

            verify(credentialProvider, times(1)).refresh();
            assertEquals(StatementStatus.SUCCEEDED, run.profitAndLoss().status());
            assertEquals(2, invoices.calls);
            assertEquals(2, bills.calls);
            assertEquals(1, accounts.calls);
        }

        @Test
        @DisplayName("Authorization failure after refresh → propagated")
        void secondAuthorizationFailurePropagates() {
            invoices.alwaysFail = new AuthorizationException("revoked");

            assertThrows(AuthorizationException.class, () -> service.run(JANUARY, null));
            verify(credentialProvider, times(1)).refresh();
        }

        @Test
        @DisplayName("Permanent fetch failure aborts the run without refreshing")
        void permanentFailure() {
            accounts.alwaysFail = new LedgerRequestException("HTTP 400 from ledger: bad query", 400);

            assertThrows(LedgerRequestException.class, () -> service.run(JANUARY, null));
            verify(credentialProvider, never()).refresh();
        }
    }

    @Test
    @DisplayName("Only built statements are rendered")
    void renderSkipsUnbuilt() {
        ReportRun run = service.run(JANUARY, null);
        StatementRenderer renderer = mock(StatementRenderer.class);

        service.render(run, renderer);

        verify(renderer).renderProfitAndLoss(JANUARY, run.profitAndLoss().statement());
        verify(renderer).renderBalanceSheet(JANUARY.end(), run.balanceSheet().statement());
        verify(renderer, never()).renderCashFlow(any(), any());
    }

    static class ListSource<T> implements EntitySource<T> {
        private final String entity;
        List<T> records;
        RuntimeException failOnce;
        RuntimeException alwaysFail;
        final List<String> filters = new ArrayList<>();
        int calls;

        ListSource(String entity, List<T> records) {
            this.entity = entity;
            this.records = records;
        }

        @Override
        public String entityName() {
            return entity;
        }

        @Override
        public List<T> list(String filter, int startPosition, int pageSize) {
            calls++;
            filters.add(filter);
            if (alwaysFail != null) throw alwaysFail;
            if (failOnce != null) {
                RuntimeException e = failOnce;
                failOnce = null;
                throw e;
            }
            return records;
        }
    }
}
