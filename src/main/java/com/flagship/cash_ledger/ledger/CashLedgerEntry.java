package com.flagship.cash_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One recognized, non-duplicated cash movement, posted at the time the bank
 * recognized it. Immutable; a correction is a new compensating entry.
 */
@Value
@Builder
public class CashLedgerEntry {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("tenant_id")
    String tenantId;

    /** The settlement identity; at most one entry exists per identity. */
    @JsonProperty("identity_id")
    UUID identityId;

    @JsonProperty("posted_at")
    Instant postedAt;

    @JsonProperty("direction")
    Direction direction;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    /** Left for downstream classification; the consolidator never sets it. */
    @JsonProperty("classification_key")
    String classificationKey;

    @JsonProperty("confidence")
    double confidence;

    @JsonProperty("provenance")
    LedgerProvenance provenance;

    @JsonProperty("created_at")
    Instant createdAt;
}
