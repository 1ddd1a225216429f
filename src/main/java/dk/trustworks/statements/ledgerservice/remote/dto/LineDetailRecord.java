package dk.trustworks.statements.ledgerservice.remote.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of any of the line detail payloads. Sales and item based details carry an
 * {@code ItemRef}, account based details an {@code AccountRef}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LineDetailRecord {

    @JsonProperty("ItemRef")
    private RefRecord itemRef;
    @JsonProperty("AccountRef")
    private RefRecord accountRef;

}
