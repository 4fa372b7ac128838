package com.flagship.cash_ledger.ingest.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Payment recorded by an operational system (invoicing, field service).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpsPaymentPayload implements EventPayload {

    private static final Set<String> PAID_STATUSES = Set.of("paid", "succeeded", "completed");

    /** Null means the system only reports payments that went through. */
    @JsonProperty("status")
    private String status;

    /** Processor charge id the operational system recorded, if any. */
    @JsonProperty("charge_reference")
    private String chargeReference;

    @JsonProperty("customer_name")
    private String customerName;

    @JsonIgnore
    public boolean isPaid() {
        return status != null && PAID_STATUSES.contains(status.trim().toLowerCase());
    }
}
