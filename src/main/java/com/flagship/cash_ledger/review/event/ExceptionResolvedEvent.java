package com.flagship.cash_ledger.review.event;

import com.flagship.cash_ledger.outbox.CashLedgerEvent;
import com.flagship.cash_ledger.review.ExceptionKind;
import com.flagship.cash_ledger.review.ExceptionRecord;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published when a reviewer resolves an exception. Lists the edges written.
 */
@Value
public class ExceptionResolvedEvent implements CashLedgerEvent {
    UUID eventId;
    String tenantId;
    UUID exceptionId;
    ExceptionKind kind;
    List<UUID> edgeIds;
    String note;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ExceptionResolved";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ExceptionResolvedEvent from(ExceptionRecord record, List<UUID> edgeIds) {
        return new ExceptionResolvedEvent(
            UUID.randomUUID(),
            record.getTenantId(),
            record.getId(),
            record.getKind(),
            edgeIds,
            record.getResolutionNote(),
            record.getResolvedAt()
        );
    }
}
