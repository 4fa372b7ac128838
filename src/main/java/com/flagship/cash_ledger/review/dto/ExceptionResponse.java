package com.flagship.cash_ledger.review.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_ledger.review.ExceptionKind;
import com.flagship.cash_ledger.review.ExceptionRecord;
import com.flagship.cash_ledger.review.ExceptionSeverity;
import com.flagship.cash_ledger.review.ExceptionStatus;
import com.flagship.cash_ledger.review.context.ExceptionContext;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Review queue entry as shown to reviewers.
 */
@Value
@Builder
public class ExceptionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("tenant_id")
    String tenantId;

    @JsonProperty("kind")
    ExceptionKind kind;

    @JsonProperty("status")
    ExceptionStatus status;

    @JsonProperty("severity")
    ExceptionSeverity severity;

    @JsonProperty("dedupe_key")
    String dedupeKey;

    @JsonProperty("context")
    ExceptionContext context;

    @JsonProperty("subject_identity_ids")
    Set<UUID> subjectIdentityIds;

    @JsonProperty("resolution_note")
    String resolutionNote;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("resolved_at")
    Instant resolvedAt;

    public static ExceptionResponse from(ExceptionRecord record) {
        return ExceptionResponse.builder()
            .id(record.getId())
            .tenantId(record.getTenantId())
            .kind(record.getKind())
            .status(record.getStatus())
            .severity(record.getSeverity())
            .dedupeKey(record.getDedupeKey())
            .context(record.getContext())
            .subjectIdentityIds(record.getSubjectIdentityIds())
            .resolutionNote(record.getResolutionNote())
            .createdAt(record.getCreatedAt())
            .updatedAt(record.getUpdatedAt())
            .resolvedAt(record.getResolvedAt())
            .build();
    }
}
