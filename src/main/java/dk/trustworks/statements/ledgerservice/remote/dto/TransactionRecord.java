package dk.trustworks.statements.ledgerservice.remote.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Invoice or bill as returned by the query endpoint. Invoices carry a {@code CustomerRef},
 * bills a {@code VendorRef}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
        "Id",
        "DocNumber",
        "TxnDate",
        "CustomerRef",
        "VendorRef",
        "TotalAmt",
        "Balance",
        "Line"
})
@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@NoArgsConstructor
public class TransactionRecord {

    @JsonProperty("Id")
    private String id;
    @JsonProperty("DocNumber")
    private String docNumber;
    @JsonProperty("TxnDate")
    private String txnDate;
    @JsonProperty("CustomerRef")
    private RefRecord customerRef;
    @JsonProperty("VendorRef")
    private RefRecord vendorRef;
    @JsonProperty("TotalAmt")
    private BigDecimal totalAmt;
    @JsonProperty("Balance")
    private BigDecimal balance;
    @JsonProperty("Line")
    private List<LineRecord> lines = new ArrayList<>();

}
