package dk.trustworks.statements.ledgerservice.fetch;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

@ApplicationScoped
public class FetchConfiguration {

    @Produces
    @ApplicationScoped
    Sleeper sleeper() {
        return Sleeper.THREAD;
    }
}
