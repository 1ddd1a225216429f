package dk.trustworks.statements.statementservice.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dk.trustworks.statements.statementservice.model.BalanceSheet;
import dk.trustworks.statements.statementservice.model.CashFlowStatement;
import dk.trustworks.statements.statementservice.model.ProfitAndLoss;
import dk.trustworks.statements.statementservice.model.ReportPeriod;
import lombok.extern.jbosslog.JBossLog;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.LocalDate;

/**
 * Writes each statement as one JSON document per line:
 * {@code {"statement": "...", "from": ..., "to": ..., "data": {...}}}.
 */
@JBossLog
public class JsonStatementRenderer implements StatementRenderer {

    private final Writer writer;
    private final ObjectMapper objectMapper;

    public JsonStatementRenderer(Writer writer, ObjectMapper objectMapper) {
        this.writer = writer;
        this.objectMapper = objectMapper;
    }

    @Override
    public void renderProfitAndLoss(ReportPeriod period, ProfitAndLoss profitAndLoss) {
        ObjectNode document = header("Profit and Loss", period.start(), period.end());
        document.put("shape", profitAndLoss.shape().name());
        document.set("data", objectMapper.valueToTree(profitAndLoss));
        write(document);
    }

    @Override
    public void renderBalanceSheet(LocalDate asOf, BalanceSheet balanceSheet) {
        ObjectNode document = header("Balance Sheet", null, asOf);
        document.set("data", objectMapper.valueToTree(balanceSheet));
        write(document);
    }

    @Override
    public void renderCashFlow(ReportPeriod period, CashFlowStatement cashFlow) {
        ObjectNode document = header("Cash Flow", period.start(), period.end());
        document.set("data", objectMapper.valueToTree(cashFlow));
        write(document);
    }

    private ObjectNode header(String statement, LocalDate from, LocalDate to) {
        ObjectNode document = objectMapper.createObjectNode();
        document.put("statement", statement);
        if (from != null) document.put("from", from.toString());
        document.put("to", to.toString());
        return document;
    }

    private void write(ObjectNode document) {
        try {
            writer.write(objectMapper.writeValueAsString(document));
            writer.write(System.lineSeparator());
            writer.flush();
            log.debugf("Rendered %s", document.get("statement").asText());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + document.get("statement").asText(), e);
        }
    }
}
