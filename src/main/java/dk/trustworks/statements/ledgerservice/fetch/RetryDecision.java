package dk.trustworks.statements.ledgerservice.fetch;

import java.time.Duration;

public record RetryDecision(boolean retry, Duration delay) {

    private static final RetryDecision ABORT = new RetryDecision(false, Duration.ZERO);

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay);
    }

    public static RetryDecision abort() {
        return ABORT;
    }
}
