package com.flagship.cash_ledger.identity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Canonical node for one real-world financial event, possibly backed by
 * raw events from several sources. Unique per (tenantId, fingerprint).
 */
@Value
@Builder
public class Identity {
    UUID id;
    String tenantId;
    String fingerprint;
    CanonicalKind canonicalKind;
    boolean lowConfidence;
    Instant createdAt;
    /** Last time a link or edge changed this identity; drives re-consolidation. */
    Instant touchedAt;
}
