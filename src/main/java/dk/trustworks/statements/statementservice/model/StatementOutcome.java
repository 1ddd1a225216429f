package dk.trustworks.statements.statementservice.model;

/**
 * Result of building one statement within a report run.
 *
 * @param statement the statement, null unless {@code status} is SUCCEEDED
 * @param errorType simple class name of the failure, null unless FAILED
 */
public record StatementOutcome<T>(String name, StatementStatus status, T statement, String errorType, String message) {

    public static <T> StatementOutcome<T> succeeded(String name, T statement) {
        return new StatementOutcome<>(name, StatementStatus.SUCCEEDED, statement, null, null);
    }

    public static <T> StatementOutcome<T> failed(String name, RuntimeException error) {
        return new StatementOutcome<>(name, StatementStatus.FAILED, null, error.getClass().getSimpleName(), error.getMessage());
    }

    public static <T> StatementOutcome<T> skipped(String name, String reason) {
        return new StatementOutcome<>(name, StatementStatus.SKIPPED, null, null, reason);
    }

    public boolean isSucceeded() {
        return status == StatementStatus.SUCCEEDED;
    }
}
