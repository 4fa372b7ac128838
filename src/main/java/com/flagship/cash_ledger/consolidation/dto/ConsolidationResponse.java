package com.flagship.cash_ledger.consolidation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_ledger.consolidation.ConsolidationResult;
import com.flagship.cash_ledger.ledger.CashLedgerEntry;
import com.flagship.cash_ledger.review.dto.ExceptionResponse;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ConsolidationResponse {

    @JsonProperty("tenant_id")
    String tenantId;

    @JsonProperty("since")
    Instant since;

    @JsonProperty("watermark")
    Instant watermark;

    @JsonProperty("complete")
    boolean complete;

    @JsonProperty("edges_created")
    int edgesCreated;

    @JsonProperty("ledger_entries")
    List<CashLedgerEntry> ledgerEntries;

    @JsonProperty("exceptions")
    List<ExceptionResponse> exceptions;

    @JsonProperty("deferred_identity_ids")
    List<UUID> deferredIdentityIds;

    @JsonProperty("failed_identity_ids")
    List<UUID> failedIdentityIds;

    @JsonProperty("failed_matchers")
    List<String> failedMatchers;

    public static ConsolidationResponse from(ConsolidationResult result) {
        return ConsolidationResponse.builder()
            .tenantId(result.getTenantId())
            .since(result.getSince())
            .watermark(result.getWatermark())
            .complete(result.isComplete())
            .edgesCreated(result.getEdgesCreated())
            .ledgerEntries(result.getLedgerEntries())
            .exceptions(result.getExceptions().stream().map(ExceptionResponse::from).toList())
            .deferredIdentityIds(result.getDeferredIdentityIds())
            .failedIdentityIds(result.getFailedIdentityIds())
            .failedMatchers(result.getFailedMatchers())
            .build();
    }
}
