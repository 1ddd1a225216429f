package dk.trustworks.statements.statementservice.services;

import dk.trustworks.statements.statementservice.exceptions.MalformedRecordException;
import dk.trustworks.statements.statementservice.model.AccountClassification;
import dk.trustworks.statements.statementservice.model.BalanceSheet;
import dk.trustworks.statements.statementservice.model.CashFlowInput;
import dk.trustworks.statements.statementservice.model.CashFlowStatement;
import dk.trustworks.statements.statementservice.model.CategorizedLine;
import dk.trustworks.statements.statementservice.model.CategorizedProfitAndLoss;
import dk.trustworks.statements.statementservice.model.CategoryKind;
import dk.trustworks.statements.statementservice.model.Document;
import dk.trustworks.statements.statementservice.model.DocumentKind;
import dk.trustworks.statements.statementservice.model.DocumentSummary;
import dk.trustworks.statements.statementservice.model.FlatProfitAndLoss;
import dk.trustworks.statements.statementservice.model.LedgerAccount;
import dk.trustworks.statements.statementservice.model.Section;
import dk.trustworks.statements.statementservice.model.StatementRow;
import dk.trustworks.statements.statementservice.model.TransactionLine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the profit and loss statement, the balance sheet and the cash flow statement from
 * fetched ledger data. No I/O; every call works on its own fresh state.
 */
@JBossLog
@ApplicationScoped
public class StatementAggregator {

    public static final String NET_INCOME_LABEL = "Net Income";
    static final String DETAIL_INDENT = "  ";

    private final LineCategorizer lineCategorizer;
    private final AccountClassifier accountClassifier;

    @Inject
    public StatementAggregator(LineCategorizer lineCategorizer, AccountClassifier accountClassifier) {
        this.lineCategorizer = lineCategorizer;
        this.accountClassifier = accountClassifier;
    }

    // =========== Profit & Loss ===========

    /**
     * Categorized P&L from invoice and bill lines. Gross profit and net income carry the same value.
     */
    public CategorizedProfitAndLoss profitAndLoss(List<Document> invoices, List<Document> bills) {
        Map<String, BigDecimal> revenue = new LinkedHashMap<>();
        Map<String, BigDecimal> expenses = new LinkedHashMap<>();
        int fallbacks = groupByCategory(invoices, DocumentKind.INVOICE, revenue)
                + groupByCategory(bills, DocumentKind.BILL, expenses);

        BigDecimal totalRevenue = sum(revenue.values());
        BigDecimal totalExpenses = sum(expenses.values());
        BigDecimal netIncome = totalRevenue.subtract(totalExpenses);

        log.infof("P&L: %d revenue and %d expense categories, %d line(s) fell back to a default category",
                revenue.size(), expenses.size(), fallbacks);
        return new CategorizedProfitAndLoss(revenue, expenses, totalRevenue, totalExpenses, netIncome, netIncome);
    }

    /**
     * P&L from document totals when no line detail is available.
     *
     * @throws MalformedRecordException if a document has no total amount
     */
    public FlatProfitAndLoss flatProfitAndLoss(List<DocumentSummary> invoices, List<DocumentSummary> bills) {
        BigDecimal totalRevenue = sumTotals(invoices);
        BigDecimal totalExpenses = sumTotals(bills);
        return new FlatProfitAndLoss(totalRevenue, totalExpenses, totalRevenue.subtract(totalExpenses));
    }

    public List<DocumentSummary> summarize(List<Document> documents) {
        return documents.stream().map(DocumentSummary::of).toList();
    }

    private int groupByCategory(List<Document> documents, DocumentKind expectedKind, Map<String, BigDecimal> target) {
        CategoryKind kind = expectedKind.getCategoryKind();
        int fallbacks = 0;
        for (Document document : documents) {
            if (document.kind() != expectedKind) {
                throw new IllegalArgumentException("Expected " + expectedKind + " but got " + document.kind() + " " + document.id());
            }
            for (TransactionLine line : document.lines()) {
                CategorizedLine categorized = lineCategorizer.categorize(line, kind);
                if (categorized.fallback()) {
                    fallbacks++;
                    log.debugf("%s %s: line without a named %s reference booked as '%s'",
                            expectedKind, document.id(), line.detail().type(), categorized.category());
                }
                target.merge(categorized.category(), categorized.amount(), BigDecimal::add);
            }
        }
        return fallbacks;
    }

    private static BigDecimal sumTotals(List<DocumentSummary> summaries) {
        BigDecimal total = BigDecimal.ZERO;
        for (DocumentSummary summary : summaries) {
            if (summary.totalAmount() == null) {
                throw new MalformedRecordException(summary.kind().name(), summary.id(), "total amount");
            }
            total = total.add(summary.totalAmount());
        }
        return total;
    }

    // =========== Balance Sheet ===========

    /**
     * Rows per section (assets, liabilities, equity, then unclassified) and per subgroup in
     * first-seen order: header, one indented detail row per account, subtotal, spacer.
     * A total row per section follows.
     *
     * @throws MalformedRecordException if an account has no current balance
     */
    public BalanceSheet balanceSheet(List<LedgerAccount> accounts) {
        Map<Section, Map<String, List<LedgerAccount>>> grouped = new EnumMap<>(Section.class);
        for (LedgerAccount account : accounts) {
            if (account.currentBalance() == null) {
                throw new MalformedRecordException("Account", account.id() != null ? account.id() : account.name(), "current balance");
            }
            AccountClassification classification = accountClassifier.classify(account.accountType());
            grouped.computeIfAbsent(classification.section(), s -> new LinkedHashMap<>())
                    .computeIfAbsent(classification.subgroup(), g -> new ArrayList<>())
                    .add(account);
        }

        List<StatementRow> rows = new ArrayList<>();
        Map<Section, BigDecimal> sectionTotals = new EnumMap<>(Section.class);
        for (Section section : Section.values()) {
            Map<String, List<LedgerAccount>> subgroups = grouped.getOrDefault(section, Map.of());
            BigDecimal sectionTotal = BigDecimal.ZERO;
            for (Map.Entry<String, List<LedgerAccount>> subgroup : subgroups.entrySet()) {
                rows.add(StatementRow.header(subgroup.getKey()));
                BigDecimal subtotal = BigDecimal.ZERO;
                for (LedgerAccount account : subgroup.getValue()) {
                    rows.add(StatementRow.detail(DETAIL_INDENT + account.displayName(), account.currentBalance()));
                    subtotal = subtotal.add(account.currentBalance());
                }
                rows.add(StatementRow.subtotal("Total " + subgroup.getKey(), subtotal));
                rows.add(StatementRow.spacer());
                sectionTotal = sectionTotal.add(subtotal);
            }
            if (section != Section.UNCLASSIFIED || !subgroups.isEmpty()) {
                sectionTotals.put(section, sectionTotal);
            }
        }
        sectionTotals.forEach((section, total) -> rows.add(StatementRow.total("Total " + section.getDisplayName(), total)));

        if (sectionTotals.containsKey(Section.UNCLASSIFIED)) {
            log.warnf("Balance sheet: %d account(s) with an unrecognized type reported as unclassified",
                    grouped.get(Section.UNCLASSIFIED).values().stream().mapToInt(List::size).sum());
        }
        return new BalanceSheet(rows, sectionTotals);
    }

    // =========== Cash Flow ===========

    /**
     * Indirect method: net income opens the operating activities, followed by the caller's
     * adjustments. The caller decides which movement belongs to which activity.
     */
    public CashFlowStatement cashFlow(BigDecimal netIncome, CashFlowInput input) {
        if (netIncome == null) throw new IllegalArgumentException("Net income is required for the cash flow statement");
        if (input.operating().containsKey(NET_INCOME_LABEL)) {
            throw new IllegalArgumentException("'" + NET_INCOME_LABEL + "' is added by the statement and cannot be an operating adjustment");
        }

        Map<String, BigDecimal> operating = new LinkedHashMap<>();
        operating.put(NET_INCOME_LABEL, netIncome);
        input.operating().forEach((label, amount) -> operating.put(label, orZero(amount)));

        Map<String, BigDecimal> investing = zeroFilled(input.investing());
        Map<String, BigDecimal> financing = zeroFilled(input.financing());

        BigDecimal netOperating = sum(operating.values());
        BigDecimal netInvesting = sum(investing.values());
        BigDecimal netFinancing = sum(financing.values());
        BigDecimal netChange = netOperating.add(netInvesting).add(netFinancing);

        return new CashFlowStatement(netIncome, operating, investing, financing,
                netOperating, netInvesting, netFinancing, netChange,
                input.beginningCash(), input.beginningCash().add(netChange));
    }

    private static Map<String, BigDecimal> zeroFilled(Map<String, BigDecimal> activities) {
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        activities.forEach((label, amount) -> result.put(label, orZero(amount)));
        return result;
    }

    private static BigDecimal sum(Collection<BigDecimal> amounts) {
        return amounts.stream().map(StatementAggregator::orZero).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal orZero(BigDecimal amount) {
        return amount != null ? amount : BigDecimal.ZERO;
    }
}
