package dk.trustworks.statements.ledgerservice.remote;

import dk.trustworks.statements.ledgerservice.remote.dto.AccountRecord;
import dk.trustworks.statements.ledgerservice.remote.dto.LineDetailRecord;
import dk.trustworks.statements.ledgerservice.remote.dto.LineRecord;
import dk.trustworks.statements.ledgerservice.remote.dto.RefRecord;
import dk.trustworks.statements.ledgerservice.remote.dto.TransactionRecord;
import dk.trustworks.statements.statementservice.model.Document;
import dk.trustworks.statements.statementservice.model.DocumentKind;
import dk.trustworks.statements.statementservice.model.LedgerAccount;
import dk.trustworks.statements.statementservice.model.LineDetail;
import dk.trustworks.statements.statementservice.model.Reference;
import dk.trustworks.statements.statementservice.model.TransactionLine;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;

/**
 * Maps ledger wire records to the statement model. Missing optional values stay null;
 * whether a value is required is decided where it is used.
 */
@JBossLog
public final class LedgerRecordMapper {

    private LedgerRecordMapper() {
    }

    public static Document toDocument(TransactionRecord record, DocumentKind kind) {
        RefRecord counterparty = kind == DocumentKind.INVOICE ? record.getCustomerRef() : record.getVendorRef();
        List<LineRecord> lines = record.getLines() != null ? record.getLines() : List.of();
        return new Document(
                kind,
                record.getId(),
                counterparty != null ? counterparty.getName() : null,
                parseDate(record),
                record.getTotalAmt(),
                record.getBalance(),
                lines.stream()
                        .filter(Objects::nonNull)
                        // subtotal lines repeat the sum of the lines above them
                        .filter(line -> !LineRecord.SUBTOTAL_DETAIL_TYPE.equals(line.getDetailType()))
                        .map(LedgerRecordMapper::toLine)
                        .toList());
    }

    public static LedgerAccount toAccount(AccountRecord record) {
        return new LedgerAccount(record.getId(), record.getName(), record.getCurrentBalance(), record.getAccountType());
    }

    static TransactionLine toLine(LineRecord line) {
        return new TransactionLine(line.getAmount(), toDetail(line));
    }

    static LineDetail toDetail(LineRecord line) {
        if (line.getSalesItemLineDetail() != null) {
            return new LineDetail.SalesItemDetail(toReference(line.getSalesItemLineDetail().getItemRef()));
        }
        if (line.getAccountBasedExpenseLineDetail() != null) {
            return new LineDetail.AccountExpenseDetail(toReference(line.getAccountBasedExpenseLineDetail().getAccountRef()));
        }
        if (line.getItemBasedExpenseLineDetail() != null) {
            LineDetailRecord detail = line.getItemBasedExpenseLineDetail();
            return new LineDetail.ItemExpenseDetail(toReference(detail.getItemRef()));
        }
        return LineDetail.none();
    }

    private static Reference toReference(RefRecord ref) {
        return ref != null ? new Reference(ref.getValue(), ref.getName()) : null;
    }

    private static LocalDate parseDate(TransactionRecord record) {
        if (record.getTxnDate() == null) return null;
        try {
            return LocalDate.parse(record.getTxnDate());
        } catch (DateTimeParseException e) {
            log.warnf("Record %s has an unreadable TxnDate '%s', leaving it empty", record.getId(), record.getTxnDate());
            return null;
        }
    }
}
