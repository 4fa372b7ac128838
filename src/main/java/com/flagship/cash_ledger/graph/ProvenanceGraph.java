package com.flagship.cash_ledger.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_ledger.identity.CanonicalKind;
import com.flagship.cash_ledger.ingest.RawEventKind;
import com.flagship.cash_ledger.ledger.CashLedgerEntry;
import com.flagship.cash_ledger.review.dto.ExceptionResponse;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The neighbourhood of one identity: every identity reachable over edges in
 * either direction, with the raw events, ledger entries and exceptions that
 * explain them.
 */
@Value
@Builder
public class ProvenanceGraph {

    @JsonProperty("root_identity_id")
    UUID rootIdentityId;

    @JsonProperty("nodes")
    List<Node> nodes;

    @JsonProperty("edges")
    List<IdentityEdge> edges;

    @JsonProperty("ledger_entries")
    List<CashLedgerEntry> ledgerEntries;

    @JsonProperty("exceptions")
    List<ExceptionResponse> exceptions;

    /** The traversal stopped at the node limit. */
    @JsonProperty("truncated")
    boolean truncated;

    @Value
    @Builder
    public static class Node {

        @JsonProperty("identity_id")
        UUID identityId;

        @JsonProperty("canonical_kind")
        CanonicalKind canonicalKind;

        @JsonProperty("low_confidence")
        boolean lowConfidence;

        @JsonProperty("raw_events")
        List<RawEventRef> rawEvents;
    }

    @Value
    @Builder
    public static class RawEventRef {

        @JsonProperty("raw_event_id")
        UUID rawEventId;

        @JsonProperty("source")
        String source;

        @JsonProperty("kind")
        RawEventKind kind;

        @JsonProperty("external_id")
        String externalId;

        @JsonProperty("occurred_at")
        Instant occurredAt;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("currency")
        String currency;

        @JsonProperty("counterparty")
        String counterparty;
    }
}
