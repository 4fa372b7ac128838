package com.flagship.cash_ledger.review.context;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One candidate a matcher considered, with the measurements it decided on.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CandidateScore {

    @JsonProperty("identity_id")
    private UUID identityId;

    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("occurred_at")
    private Instant occurredAt;

    @JsonProperty("day_distance")
    private Long dayDistance;

    @JsonProperty("amount_delta")
    private BigDecimal amountDelta;

    @JsonProperty("similarity")
    private Double similarity;
}
