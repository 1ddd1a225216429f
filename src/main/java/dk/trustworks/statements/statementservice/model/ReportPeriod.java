package dk.trustworks.statements.statementservice.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;

/**
 * Inclusive date range a report run covers.
 */
public record ReportPeriod(LocalDate start, LocalDate end) {

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_LOCAL_DATE;

    public ReportPeriod {
        if (start == null || end == null) throw new IllegalArgumentException("Report period needs a start and an end date");
        if (start.isAfter(end)) throw new IllegalArgumentException("Report period starts after it ends: " + start + " > " + end);
    }

    /**
     * The whole calendar month before {@code today}.
     */
    public static ReportPeriod previousMonth(LocalDate today) {
        LocalDate lastMonth = today.withDayOfMonth(1).minusMonths(1);
        return new ReportPeriod(lastMonth, lastMonth.with(TemporalAdjusters.lastDayOfMonth()));
    }

    /**
     * The whole calendar quarter before the one {@code today} falls in. January to March gives Q4 of last year.
     */
    public static ReportPeriod previousQuarter(LocalDate today) {
        int currentQuarterStartMonth = ((today.getMonthValue() - 1) / 3) * 3 + 1;
        LocalDate start = LocalDate.of(today.getYear(), currentQuarterStartMonth, 1).minusMonths(3);
        return new ReportPeriod(start, start.plusMonths(3).minusDays(1));
    }

    public static ReportPeriod yearToDate(LocalDate today) {
        return new ReportPeriod(today.withDayOfYear(1), today);
    }

    /**
     * @param from yyyy-MM-dd
     * @param to yyyy-MM-dd
     * @throws IllegalArgumentException on a malformed date or a reversed range
     */
    public static ReportPeriod custom(String from, String to) {
        return new ReportPeriod(parse(from), parse(to));
    }

    public static ReportPeriod of(PeriodPreset preset, LocalDate today, String from, String to) {
        return switch (preset) {
            case MONTHLY -> previousMonth(today);
            case QUARTERLY -> previousQuarter(today);
            case YEARLY -> yearToDate(today);
            case CUSTOM -> custom(from, to);
        };
    }

    /**
     * Ledger query condition on the transaction date, e.g.
     * {@code TxnDate >= '2024-01-01' AND TxnDate <= '2024-01-31'}.
     */
    public String toFilter() {
        return "TxnDate >= '" + start.format(ISO) + "' AND TxnDate <= '" + end.format(ISO) + "'";
    }

    private static LocalDate parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing date, expected yyyy-MM-dd");
        }
        try {
            return LocalDate.parse(value.trim(), ISO);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date '" + value + "', expected yyyy-MM-dd (e.g. 2024-01-15)", e);
        }
    }
}
