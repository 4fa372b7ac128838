package com.flagship.cash_ledger.ingest.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpsInvoicePayload implements EventPayload {

    @JsonProperty("status")
    private String status;

    @JsonProperty("charge_reference")
    private String chargeReference;

    @JsonProperty("customer_name")
    private String customerName;

    @JsonProperty("due_date")
    private LocalDate dueDate;

    @JsonIgnore
    public boolean isPaid() {
        return status != null && "paid".equalsIgnoreCase(status.trim());
    }
}
