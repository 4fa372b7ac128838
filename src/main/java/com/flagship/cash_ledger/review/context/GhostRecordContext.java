package com.flagship.cash_ledger.review.context;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.flagship.cash_ledger.identity.CanonicalKind;
import com.flagship.cash_ledger.review.ExceptionKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * An operational record claims a payment that no processor or bank record corroborates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonTypeName("GHOST_RECORD")
public class GhostRecordContext implements ExceptionContext {

    @JsonProperty("matcher")
    private String matcher;

    @JsonProperty("subject_identity_id")
    private UUID subjectIdentityId;

    @JsonProperty("subject_kind")
    private CanonicalKind subjectKind;

    @JsonProperty("source")
    private String source;

    @JsonProperty("external_ids")
    private List<String> externalIds;

    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("currency")
    private String currency;

    @JsonProperty("occurred_at")
    private Instant occurredAt;

    @JsonProperty("age_days")
    private long ageDays;

    @JsonProperty("source_status")
    private String sourceStatus;

    @Override
    public ExceptionKind kind() {
        return ExceptionKind.GHOST_RECORD;
    }

    @Override
    public Set<UUID> referencedIdentityIds() {
        return Set.of(subjectIdentityId);
    }
}
