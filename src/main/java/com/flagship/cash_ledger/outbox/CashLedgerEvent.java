package com.flagship.cash_ledger.outbox;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of every event published on the ledger events topic.
 */
public interface CashLedgerEvent {

    /**
     * Unique per event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    String getTenantId();

    Instant getOccurredAt();

    String getEventType();
}
