package dk.trustworks.statements.ledgerservice.fetch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag shared between a running fetch and whoever may stop it.
 * Checked between page requests and around retry sleeps, never in the middle of a request.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        if (this == NONE) throw new IllegalStateException("The shared no-op token cannot be cancelled");
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
