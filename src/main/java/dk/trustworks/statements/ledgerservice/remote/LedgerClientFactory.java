package dk.trustworks.statements.ledgerservice.remote;

import com.fasterxml.jackson.databind.ObjectMapper;
import dk.trustworks.statements.ledgerservice.auth.CredentialProvider;
import dk.trustworks.statements.ledgerservice.fetch.EntitySource;
import dk.trustworks.statements.ledgerservice.remote.dto.QueryResponse;
import dk.trustworks.statements.ledgerservice.remote.dto.TransactionRecord;
import dk.trustworks.statements.statementservice.model.Document;
import dk.trustworks.statements.statementservice.model.DocumentKind;
import dk.trustworks.statements.statementservice.model.LedgerAccount;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.RestClientBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Builds the ledger REST client and the entity sources for invoices, bills and accounts.
 */
@JBossLog
@ApplicationScoped
public class LedgerClientFactory {

    @ConfigProperty(name = "ledger.api.url")
    String apiUrl;

    @ConfigProperty(name = "ledger.realm-id")
    String realmId;

    @ConfigProperty(name = "ledger.minor-version", defaultValue = "65")
    String minorVersion;

    @ConfigProperty(name = "ledger.api.connect-timeout", defaultValue = "PT10S")
    Duration connectTimeout;

    @ConfigProperty(name = "ledger.api.read-timeout", defaultValue = "PT30S")
    Duration readTimeout;

    @Inject
    CredentialProvider credentialProvider;

    @Inject
    ObjectMapper objectMapper;

    private volatile LedgerQueryAPI api;

    public EntitySource<Document> invoices() {
        return new QueryEntitySource<>("Invoice", api(), realmId, minorVersion, objectMapper,
                documents(QueryResponse::getInvoices, DocumentKind.INVOICE));
    }

    public EntitySource<Document> bills() {
        return new QueryEntitySource<>("Bill", api(), realmId, minorVersion, objectMapper,
                documents(QueryResponse::getBills, DocumentKind.BILL));
    }

    public EntitySource<LedgerAccount> accounts() {
        return new QueryEntitySource<>("Account", api(), realmId, minorVersion, objectMapper,
                response -> response.getAccounts() == null ? List.of()
                        : response.getAccounts().stream().map(LedgerRecordMapper::toAccount).toList());
    }

    private static Function<QueryResponse, List<Document>> documents(Function<QueryResponse, List<TransactionRecord>> list, DocumentKind kind) {
        return response -> {
            List<TransactionRecord> records = list.apply(response);
            if (records == null) return List.of();
            return records.stream().map(r -> LedgerRecordMapper.toDocument(r, kind)).toList();
        };
    }

    LedgerQueryAPI api() {
        LedgerQueryAPI result = api;
        if (result == null) {
            synchronized (this) {
                if (api == null) {
                    log.infof("Creating ledger client for %s (company %s)", apiUrl, realmId);
                    api = RestClientBuilder.newBuilder()
                            .baseUri(URI.create(apiUrl))
                            .connectTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                            .readTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
                            .register(new BearerTokenHeaderFilter(credentialProvider))
                            .build(LedgerQueryAPI.class);
                }
                result = api;
            }
        }
        return result;
    }
}
