package dk.trustworks.statements.ledgerservice.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dk.trustworks.statements.ledgerservice.exceptions.LedgerFetchException;
import dk.trustworks.statements.ledgerservice.exceptions.LedgerRequestException;
import dk.trustworks.statements.ledgerservice.exceptions.TransientServiceException;
import dk.trustworks.statements.ledgerservice.fetch.EntitySource;
import dk.trustworks.statements.ledgerservice.remote.dto.QueryResponse;
import dk.trustworks.statements.ledgerservice.remote.dto.QueryResponseEnvelope;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;

import java.util.List;
import java.util.function.Function;

/**
 * {@link EntitySource} backed by the ledger query endpoint. One instance per entity.
 *
 * @param <T> model type the wire records are mapped to
 */
@JBossLog
public class QueryEntitySource<T> implements EntitySource<T> {

    private final String entity;
    private final LedgerQueryAPI api;
    private final String realmId;
    private final String minorVersion;
    private final ObjectMapper objectMapper;
    private final Function<QueryResponse, List<T>> extractor;

    public QueryEntitySource(String entity, LedgerQueryAPI api, String realmId, String minorVersion,
                             ObjectMapper objectMapper, Function<QueryResponse, List<T>> extractor) {
        this.entity = entity;
        this.api = api;
        this.realmId = realmId;
        this.minorVersion = minorVersion;
        this.objectMapper = objectMapper;
        this.extractor = extractor;
    }

    @Override
    public String entityName() {
        return entity;
    }

    @Override
    public List<T> list(String filter, int startPosition, int pageSize) {
        String query = buildQuery(entity, filter, startPosition, pageSize);
        log.debugf("Ledger query: %s", query);

        String body;
        try (Response response = api.query(realmId, query, minorVersion)) {
            if (response.getStatus() >= 400) {
                throw new LedgerErrorMapper().toThrowable(response);
            }
            body = response.readEntity(String.class);
        } catch (ProcessingException e) {
            if (e.getCause() instanceof LedgerFetchException classified) throw classified;
            throw new TransientServiceException("Ledger request for " + entity + " failed: " + e.getMessage(), e);
        }

        QueryResponse queryResponse = parse(body);
        if (queryResponse == null) return List.of();
        List<T> records = extractor.apply(queryResponse);
        return records != null ? records : List.of();
    }

    static String buildQuery(String entity, String filter, int startPosition, int pageSize) {
        StringBuilder query = new StringBuilder("SELECT * FROM ").append(entity);
        if (filter != null && !filter.isBlank()) {
            query.append(" WHERE ").append(filter);
        }
        return query.append(" STARTPOSITION ").append(startPosition)
                .append(" MAXRESULTS ").append(pageSize)
                .toString();
    }

    private QueryResponse parse(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return objectMapper.readValue(body, QueryResponseEnvelope.class).getQueryResponse();
        } catch (JsonProcessingException e) {
            throw new LedgerRequestException("Unreadable " + entity + " query response: " + e.getOriginalMessage(), e);
        }
    }
}
