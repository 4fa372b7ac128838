package com.flagship.cash_ledger.ingest.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Processor line item. A PAYOUT sub-type is only a reference to a payout and
 * collapses onto the payout identity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceTransactionPayload implements EventPayload {

    @JsonProperty("sub_type")
    private BalanceTransactionType subType;

    /** Payout this line item was paid out in, when the processor reports it. */
    @JsonProperty("payout_id")
    private String payoutId;

    @JsonProperty("description")
    private String description;
}
