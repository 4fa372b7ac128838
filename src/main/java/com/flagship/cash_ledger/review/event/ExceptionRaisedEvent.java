package com.flagship.cash_ledger.review.event;

import com.flagship.cash_ledger.outbox.CashLedgerEvent;
import com.flagship.cash_ledger.review.ExceptionKind;
import com.flagship.cash_ledger.review.ExceptionRecord;
import com.flagship.cash_ledger.review.ExceptionSeverity;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published when a new exception enters the review queue.
 */
@Value
public class ExceptionRaisedEvent implements CashLedgerEvent {
    UUID eventId;
    String tenantId;
    UUID exceptionId;
    ExceptionKind kind;
    ExceptionSeverity severity;
    String matcher;
    List<UUID> subjectIdentityIds;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ExceptionRaised";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ExceptionRaisedEvent from(ExceptionRecord record) {
        return new ExceptionRaisedEvent(
            UUID.randomUUID(),
            record.getTenantId(),
            record.getId(),
            record.getKind(),
            record.getSeverity(),
            record.getContext().getMatcher(),
            List.copyOf(record.getSubjectIdentityIds()),
            record.getCreatedAt()
        );
    }
}
