package com.flagship.cash_ledger.review;

import com.flagship.cash_ledger.review.context.ExceptionContext;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * An open question for a human reviewer. Resolution flips the status and
 * records the note; the record itself is never deleted.
 */
@Value
@Builder
public class ExceptionRecord {
    UUID id;
    String tenantId;
    ExceptionKind kind;
    ExceptionStatus status;
    ExceptionSeverity severity;
    String dedupeKey;
    ExceptionContext context;
    Set<UUID> subjectIdentityIds;
    String resolutionNote;
    Instant createdAt;
    Instant updatedAt;
    Instant resolvedAt;

    public boolean isOpen() {
        return status == ExceptionStatus.OPEN;
    }
}
