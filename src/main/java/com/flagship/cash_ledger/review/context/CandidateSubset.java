package com.flagship.cash_ledger.review.context;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * A set of line items whose signed amounts add up to the payout target.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CandidateSubset {

    @JsonProperty("identity_ids")
    private List<UUID> identityIds;

    @JsonProperty("total")
    private BigDecimal total;
}
