package dk.trustworks.statements.ledgerservice.fetch;

import dk.trustworks.statements.ledgerservice.exceptions.FetchCancelledException;
import dk.trustworks.statements.ledgerservice.exceptions.FetchExhaustedException;
import dk.trustworks.statements.ledgerservice.exceptions.LedgerFetchException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a complete result set from an {@link EntitySource} in pages of {@value #PAGE_SIZE}.
 *
 * <p>Each page request is retried according to the {@link RetryPolicy}. Paging stops at the
 * first page holding fewer than {@value #PAGE_SIZE} records, so an exact multiple of the page
 * size costs one extra (empty) request. Records are returned in the order the server sent them.
 */
@JBossLog
@ApplicationScoped
public class PagedFetcher {

    public static final int PAGE_SIZE = 100;
    public static final int FIRST_POSITION = 1;

    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final MeterRegistry registry;

    @Inject
    public PagedFetcher(RetryPolicy retryPolicy, Sleeper sleeper, MeterRegistry registry) {
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.registry = registry;
    }

    public <T> List<T> fetch(EntitySource<T> source, String filter) {
        return fetch(source, filter, CancellationToken.none());
    }

    public <T> List<T> fetch(EntitySource<T> source, String filter, CancellationToken token) {
        String entity = source.entityName();
        List<T> records = new ArrayList<>();
        int startPosition = FIRST_POSITION;
        int pages = 0;

        while (true) {
            checkCancelled(token, entity, pages);
            List<T> page = fetchPage(source, filter, startPosition, token, pages);
            pages++;
            registry.counter("ledger.fetch.pages", "entity", entity).increment();
            records.addAll(page);
            log.debugf("Fetched %s page %d: %d record(s) from position %d", entity, pages, page.size(), startPosition);

            if (page.size() < PAGE_SIZE) break;
            startPosition += PAGE_SIZE;
        }

        log.infof("Fetched %d %s record(s) in %d page(s)", records.size(), entity, pages);
        return records;
    }

    private <T> List<T> fetchPage(EntitySource<T> source, String filter, int startPosition, CancellationToken token, int pagesSoFar) {
        String entity = source.entityName();
        int attempt = 0;
        while (true) {
            try {
                List<T> page = source.list(filter, startPosition, PAGE_SIZE);
                return page != null ? page : List.of();
            } catch (RuntimeException e) {
                RetryDecision decision = retryPolicy.decide(e, attempt);
                if (!decision.retry()) {
                    if (RetryPolicy.isTransient(e)) {
                        log.errorf("%s page at position %d failed %d times, giving up: %s", entity, startPosition, attempt + 1, e.getMessage());
                        throw new FetchExhaustedException(entity, attempt + 1, (LedgerFetchException) e);
                    }
                    log.warnf("%s page at position %d failed permanently: %s", entity, startPosition, e.getMessage());
                    throw e;
                }
                registry.counter("ledger.fetch.retries", "entity", entity).increment();
                log.warnf("%s page at position %d failed (attempt %d/%d), retrying in %d ms: %s",
                        entity, startPosition, attempt + 1, RetryPolicy.MAX_ATTEMPTS, decision.delay().toMillis(), e.getMessage());
                checkCancelled(token, entity, pagesSoFar);
                pause(decision.delay(), entity, pagesSoFar);
                checkCancelled(token, entity, pagesSoFar);
                attempt++;
            }
        }
    }

    private void pause(Duration delay, String entity, int pagesSoFar) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new FetchCancelledException(entity, pagesSoFar);
        }
    }

    private static void checkCancelled(CancellationToken token, String entity, int pagesSoFar) {
        if (token.isCancelled()) {
            throw new FetchCancelledException(entity, pagesSoFar);
        }
    }
}
