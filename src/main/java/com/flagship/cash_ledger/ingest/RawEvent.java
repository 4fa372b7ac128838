package com.flagship.cash_ledger.ingest;

import com.flagship.cash_ledger.ingest.payload.EventPayload;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one inbound observation.
 *
 * Unique per (tenantId, source, kind, externalId). Created once by ingestion,
 * never updated and never deleted. Amounts are signed, credits positive.
 */
@Value
@Builder(toBuilder = true)
public class RawEvent {
    UUID id;
    String tenantId;
    String source;
    RawEventKind kind;
    String externalId;
    Instant occurredAt;
    BigDecimal amount;
    String currency;
    String accountRef;
    String counterparty;
    String parentExternalId;
    EventPayload payload;
    Instant receivedAt;

    /**
     * Returns the payload as the given variant, or null if it is of another kind.
     */
    public <T extends EventPayload> T payloadAs(Class<T> type) {
        return type.isInstance(payload) ? type.cast(payload) : null;
    }
}
