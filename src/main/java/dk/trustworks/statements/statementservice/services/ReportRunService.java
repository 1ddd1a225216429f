package dk.trustworks.statements.statementservice.services;

import dk.trustworks.statements.ledgerservice.auth.CredentialProvider;
import dk.trustworks.statements.ledgerservice.exceptions.AuthorizationException;
import dk.trustworks.statements.ledgerservice.fetch.CancellationToken;
import dk.trustworks.statements.ledgerservice.fetch.PagedFetcher;
import dk.trustworks.statements.ledgerservice.remote.LedgerClientFactory;
import dk.trustworks.statements.statementservice.model.BalanceSheet;
import dk.trustworks.statements.statementservice.model.CashFlowInput;
import dk.trustworks.statements.statementservice.model.CashFlowStatement;
import dk.trustworks.statements.statementservice.model.Document;
import dk.trustworks.statements.statementservice.model.DocumentSummary;
import dk.trustworks.statements.statementservice.model.LedgerAccount;
import dk.trustworks.statements.statementservice.model.ProfitAndLoss;
import dk.trustworks.statements.statementservice.model.ReportPeriod;
import dk.trustworks.statements.statementservice.model.ReportRun;
import dk.trustworks.statements.statementservice.model.StatementOutcome;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.util.List;
import java.util.function.Supplier;

/**
 * Runs a report: fetches invoices, bills and accounts, then builds each statement in its own
 * scope so one bad record fails only the statement that needed it.
 *
 * <p>Fetch failures abort the run. On an authorization failure the credential is refreshed once
 * and the fetch phase starts over.
 */
@JBossLog
@ApplicationScoped
public class ReportRunService {

    public static final String PROFIT_AND_LOSS = "Profit and Loss";
    public static final String BALANCE_SHEET = "Balance Sheet";
    public static final String CASH_FLOW = "Cash Flow";

    private final PagedFetcher fetcher;
    private final LedgerClientFactory ledgerClient;
    private final StatementAggregator aggregator;
    private final CredentialProvider credentialProvider;

    @Inject
    public ReportRunService(PagedFetcher fetcher, LedgerClientFactory ledgerClient,
                            StatementAggregator aggregator, CredentialProvider credentialProvider) {
        this.fetcher = fetcher;
        this.ledgerClient = ledgerClient;
        this.aggregator = aggregator;
        this.credentialProvider = credentialProvider;
    }

    public ReportRun run(ReportPeriod period, CashFlowInput cashFlowInput) {
        return run(period, ProfitAndLoss.Shape.CATEGORIZED, cashFlowInput, CancellationToken.none());
    }

    /**
     * @param cashFlowInput activity movements for the cash flow statement; null skips it
     */
    public ReportRun run(ReportPeriod period, ProfitAndLoss.Shape shape, CashFlowInput cashFlowInput, CancellationToken token) {
        log.infof("Starting report run for %s to %s", period.start(), period.end());
        LedgerData data = fetchWithRefresh(period, token);

        List<DocumentSummary> invoiceSummaries = aggregator.summarize(data.invoices());
        List<DocumentSummary> billSummaries = aggregator.summarize(data.bills());

        StatementOutcome<ProfitAndLoss> profitAndLoss = build(PROFIT_AND_LOSS,
                () -> buildProfitAndLoss(shape, data, invoiceSummaries, billSummaries));
        StatementOutcome<BalanceSheet> balanceSheet = build(BALANCE_SHEET, () -> aggregator.balanceSheet(data.accounts()));

        StatementOutcome<CashFlowStatement> cashFlow;
        if (cashFlowInput == null) {
            cashFlow = StatementOutcome.skipped(CASH_FLOW, "No cash flow input supplied");
        } else if (!profitAndLoss.isSucceeded()) {
            cashFlow = StatementOutcome.skipped(CASH_FLOW, "Net income unavailable: " + profitAndLoss.message());
        } else {
            cashFlow = build(CASH_FLOW, () -> aggregator.cashFlow(profitAndLoss.statement().netIncome(), cashFlowInput));
        }

        ReportRun run = new ReportRun(period, profitAndLoss, balanceSheet, cashFlow, invoiceSummaries, billSummaries);
        run.outcomes().forEach(o -> log.infof("%s: %s%s", o.name(), o.status(), o.errorType() != null ? " (" + o.errorType() + ")" : ""));
        return run;
    }

    /**
     * Hands every statement that was built to the renderer.
     */
    public void render(ReportRun run, StatementRenderer renderer) {
        if (run.profitAndLoss().isSucceeded()) renderer.renderProfitAndLoss(run.period(), run.profitAndLoss().statement());
        if (run.balanceSheet().isSucceeded()) renderer.renderBalanceSheet(run.period().end(), run.balanceSheet().statement());
        if (run.cashFlow().isSucceeded()) renderer.renderCashFlow(run.period(), run.cashFlow().statement());
    }

    private ProfitAndLoss buildProfitAndLoss(ProfitAndLoss.Shape shape, LedgerData data,
                                             List<DocumentSummary> invoiceSummaries, List<DocumentSummary> billSummaries) {
        if (shape == ProfitAndLoss.Shape.FLAT) {
            return aggregator.flatProfitAndLoss(invoiceSummaries, billSummaries);
        }
        return aggregator.profitAndLoss(data.invoices(), data.bills());
    }

    private LedgerData fetchWithRefresh(ReportPeriod period, CancellationToken token) {
        try {
            return fetchAll(period, token);
        } catch (AuthorizationException e) {
            log.warnf("Ledger rejected the access token (%s), refreshing and starting over", e.getMessage());
            credentialProvider.refresh();
            return fetchAll(period, token);
        }
    }

    private LedgerData fetchAll(ReportPeriod period, CancellationToken token) {
        String filter = period.toFilter();
        List<Document> invoices = fetcher.fetch(ledgerClient.invoices(), filter, token);
        List<Document> bills = fetcher.fetch(ledgerClient.bills(), filter, token);
        List<LedgerAccount> accounts = fetcher.fetch(ledgerClient.accounts(), null, token);
        return new LedgerData(invoices, bills, accounts);
    }

    private static <T> StatementOutcome<T> build(String name, Supplier<? extends T> builder) {
        try {
            return StatementOutcome.succeeded(name, builder.get());
        } catch (RuntimeException e) {
            log.errorf(e, "Failed to build %s", name);
            return StatementOutcome.failed(name, e);
        }
    }

    private record LedgerData(List<Document> invoices, List<Document> bills, List<LedgerAccount> accounts) {
    }
}
