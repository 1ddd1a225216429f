package dk.trustworks.statements.ledgerservice.remote.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@NoArgsConstructor
public class QueryResponseEnvelope {

    @JsonProperty("QueryResponse")
    private QueryResponse queryResponse;
    @JsonProperty("time")
    private String time;

}
