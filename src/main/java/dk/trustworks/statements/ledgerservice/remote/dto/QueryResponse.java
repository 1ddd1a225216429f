package dk.trustworks.statements.ledgerservice.remote.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Inner {@code QueryResponse} object. Only the list matching the queried entity is present;
 * the ledger omits it altogether when the page is empty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@NoArgsConstructor
public class QueryResponse {

    @JsonProperty("Invoice")
    private List<TransactionRecord> invoices;
    @JsonProperty("Bill")
    private List<TransactionRecord> bills;
    @JsonProperty("Account")
    private List<AccountRecord> accounts;
    @JsonProperty("startPosition")
    private Integer startPosition;
    @JsonProperty("maxResults")
    private Integer maxResults;

}
