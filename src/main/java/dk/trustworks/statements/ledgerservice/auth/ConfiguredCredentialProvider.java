package dk.trustworks.statements.ledgerservice.auth;

import dk.trustworks.statements.ledgerservice.exceptions.AuthorizationException;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads the access token from configuration ({@value #ACCESS_TOKEN_KEY}).
 *
 * <p>Token acquisition happens outside this service; whatever rotates the token updates the
 * config source (environment, secret mount). {@link #refresh()} re-reads it and fails when the
 * value has not changed.
 */
@JBossLog
@ApplicationScoped
public class ConfiguredCredentialProvider implements CredentialProvider {

    static final String ACCESS_TOKEN_KEY = "ledger.auth.access-token";

    private final AtomicReference<String> current = new AtomicReference<>();

    @Override
    public String currentCredential() {
        String token = current.get();
        if (token == null) {
            token = readToken(ConfigProvider.getConfig());
            current.compareAndSet(null, token);
        }
        return current.get();
    }

    @Override
    public String refresh() {
        String previous = current.get();
        String token = readToken(ConfigProvider.getConfig());
        if (token.equals(previous)) {
            throw new AuthorizationException("No refreshed access token available in " + ACCESS_TOKEN_KEY);
        }
        current.set(token);
        log.info("Ledger access token refreshed from configuration");
        return token;
    }

    private static String readToken(Config config) {
        return config.getOptionalValue(ACCESS_TOKEN_KEY, String.class)
                .filter(s -> !s.isBlank())
                .orElseThrow(() -> new AuthorizationException("Missing configuration value " + ACCESS_TOKEN_KEY));
    }
}
