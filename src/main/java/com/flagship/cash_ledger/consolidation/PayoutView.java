package com.flagship.cash_ledger.consolidation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A processor payout with its settlement state.
 */
@Value
@Builder
public class PayoutView {

    @JsonProperty("identity_id")
    UUID identityId;

    @JsonProperty("source")
    String source;

    @JsonProperty("external_id")
    String externalId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("gross_amount")
    BigDecimal grossAmount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("expected_arrival")
    LocalDate expectedArrival;

    @JsonProperty("status")
    PayoutStatus status;

    @JsonProperty("settlement_identity_id")
    UUID settlementIdentityId;

    @JsonProperty("composed_of_count")
    int composedOfCount;

    @JsonProperty("open_exception_ids")
    List<UUID> openExceptionIds;
}
