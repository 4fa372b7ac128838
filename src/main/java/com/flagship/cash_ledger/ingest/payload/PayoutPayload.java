package com.flagship.cash_ledger.ingest.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Processor payout detail. The raw event amount is the net amount the bank
 * should see; the gross amount is what the composed charges add up to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayoutPayload implements EventPayload {

    /** Expected bank arrival. Falls back to the occurrence date when absent. */
    @JsonProperty("arrival_date")
    private LocalDate arrivalDate;

    @JsonProperty("gross_amount")
    private BigDecimal grossAmount;

    @JsonProperty("status")
    private String status;

    @JsonProperty("method")
    private String method;
}
