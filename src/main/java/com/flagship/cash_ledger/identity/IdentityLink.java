package com.flagship.cash_ledger.identity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class IdentityLink {
    UUID id;
    String tenantId;
    UUID identityId;
    UUID rawEventId;
    double confidence;
    String reason;
    Instant createdAt;
    /** True when this link's raw event created the identity. */
    boolean identityCreated;
}
