package dk.trustworks.statements.ledgerservice.remote.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
        "Id",
        "Amount",
        "DetailType",
        "SalesItemLineDetail",
        "AccountBasedExpenseLineDetail",
        "ItemBasedExpenseLineDetail"
})
@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@NoArgsConstructor
public class LineRecord {

    public static final String SUBTOTAL_DETAIL_TYPE = "SubTotalLineDetail";

    @JsonProperty("Id")
    private String id;
    @JsonProperty("Amount")
    private BigDecimal amount;
    @JsonProperty("DetailType")
    private String detailType;
    @JsonProperty("SalesItemLineDetail")
    private LineDetailRecord salesItemLineDetail;
    @JsonProperty("AccountBasedExpenseLineDetail")
    private LineDetailRecord accountBasedExpenseLineDetail;
    @JsonProperty("ItemBasedExpenseLineDetail")
    private LineDetailRecord itemBasedExpenseLineDetail;

}
