package dk.trustworks.statements.ledgerservice.fetch;

import dk.trustworks.statements.ledgerservice.exceptions.LedgerFetchException;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Decides whether a failed ledger request is repeated and how long to wait first.
 *
 * <p>Only transient {@link LedgerFetchException}s are retried, at most {@value #MAX_RETRIES} times,
 * with exponential backoff: {@code 1s * 2^attempt} plus up to one second of jitter.
 * Everything else aborts on the first failure.
 */
@ApplicationScoped
public class RetryPolicy {

    public static final int MAX_RETRIES = 4;
    public static final int MAX_ATTEMPTS = MAX_RETRIES + 1;
    static final Duration BASE_DELAY = Duration.ofSeconds(1);

    private final DoubleSupplier jitter;

    public RetryPolicy() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param jitter source of values in [0, 1), in units of the base delay
     */
    public RetryPolicy(DoubleSupplier jitter) {
        this.jitter = jitter;
    }

    /**
     * @param error the failure of one attempt
     * @param attempt zero-based index of the attempt that failed
     */
    public RetryDecision decide(RuntimeException error, int attempt) {
        if (!isTransient(error) || attempt >= MAX_RETRIES) {
            return RetryDecision.abort();
        }
        return RetryDecision.retryAfter(backoff(attempt));
    }

    public static boolean isTransient(RuntimeException error) {
        return error instanceof LedgerFetchException fetchError && fetchError.isTransient();
    }

    Duration backoff(int attempt) {
        long exponentialMillis = BASE_DELAY.toMillis() << attempt;
        long jitterMillis = (long) (jitter.getAsDouble() * BASE_DELAY.toMillis());
        return Duration.ofMillis(exponentialMillis + jitterMillis);
    }
}
