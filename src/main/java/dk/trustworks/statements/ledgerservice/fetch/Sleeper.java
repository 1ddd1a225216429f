package dk.trustworks.statements.ledgerservice.fetch;

import java.time.Duration;

/**
 * Blocks the calling thread between retries.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
