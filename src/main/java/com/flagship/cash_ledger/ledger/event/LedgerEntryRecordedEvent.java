package com.flagship.cash_ledger.ledger.event;

import com.flagship.cash_ledger.ledger.CashLedgerEntry;
import com.flagship.cash_ledger.ledger.Direction;
import com.flagship.cash_ledger.ledger.ProvenancePath;
import com.flagship.cash_ledger.outbox.CashLedgerEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when the consolidator writes a ledger entry.
 */
@Value
public class LedgerEntryRecordedEvent implements CashLedgerEvent {
    UUID eventId;
    String tenantId;
    UUID entryId;
    UUID identityId;
    Instant postedAt;
    Direction direction;
    BigDecimal amount;
    String currency;
    ProvenancePath path;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LedgerEntryRecorded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LedgerEntryRecordedEvent from(CashLedgerEntry entry) {
        return new LedgerEntryRecordedEvent(
            UUID.randomUUID(),
            entry.getTenantId(),
            entry.getId(),
            entry.getIdentityId(),
            entry.getPostedAt(),
            entry.getDirection(),
            entry.getAmount(),
            entry.getCurrency(),
            entry.getProvenance() != null ? entry.getProvenance().getPath() : null,
            entry.getCreatedAt()
        );
    }
}
