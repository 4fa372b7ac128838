package com.flagship.cash_ledger.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Weighted evidence that two identities are related. Append-only: a review
 * decision adds a new edge rather than changing an old one.
 */
@Value
@Builder
public class IdentityEdge {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("tenant_id")
    String tenantId;

    @JsonProperty("from_identity_id")
    UUID fromIdentityId;

    @JsonProperty("to_identity_id")
    UUID toIdentityId;

    @JsonProperty("kind")
    EdgeKind kind;

    @JsonProperty("weight")
    double weight;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("origin")
    EdgeOrigin origin;

    @JsonProperty("created_at")
    Instant createdAt;
}
