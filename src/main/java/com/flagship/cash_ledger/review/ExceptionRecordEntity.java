package com.flagship.cash_ledger.review;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * JPA mapping of the exceptions table plus its subject identities.
 *
 * No setters: the only state transitions are {@link #refresh} for a repeated
 * raise, {@link #escalate} and {@link #resolve}. The context column holds the
 * versioned JSON document and is opaque at this level.
 */
@Entity
@Table(name = "exceptions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ExceptionRecordEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false, length = 64)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private ExceptionKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ExceptionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ExceptionSeverity severity;

    @Column(name = "dedupe_key", nullable = false, updatable = false, length = 512)
    private String dedupeKey;

    /** The dedupe key while OPEN, null once resolved; unique per tenant. */
    @Column(name = "open_dedupe_key", length = 512)
    private String openDedupeKey;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String context;

    @Column(name = "resolution_note", columnDefinition = "TEXT")
    private String resolutionNote;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "exception_subjects", joinColumns = @JoinColumn(name = "exception_id"))
    @Column(name = "identity_id", nullable = false)
    private Set<UUID> subjectIdentityIds = new HashSet<>();

    public static ExceptionRecordEntity open(String tenantId, ExceptionKind kind, String dedupeKey,
                                             String context, Set<UUID> subjects, Instant now) {
        ExceptionRecordEntity entity = new ExceptionRecordEntity();
        entity.id = UUID.randomUUID();
        entity.tenantId = tenantId;
        entity.kind = kind;
        entity.status = ExceptionStatus.OPEN;
        entity.severity = ExceptionSeverity.initialFor(kind);
        entity.dedupeKey = dedupeKey;
        entity.openDedupeKey = dedupeKey;
        entity.context = context;
        entity.subjectIdentityIds = new HashSet<>(subjects);
        entity.createdAt = now;
        entity.updatedAt = now;
        return entity;
    }

    /**
     * Replaces the context of an open exception raised again by a later pass.
     * Subjects only grow so earlier candidates stay deferred.
     */
    public void refresh(String context, Set<UUID> subjects, Instant now) {
        requireOpen();
        this.context = context;
        this.subjectIdentityIds.addAll(subjects);
        this.updatedAt = now;
    }

    public void escalate(Instant now) {
        requireOpen();
        this.severity = ExceptionSeverity.WARNING;
        this.updatedAt = now;
    }

    public void resolve(String note, Instant now) {
        requireOpen();
        this.status = ExceptionStatus.RESOLVED;
        this.openDedupeKey = null;
        this.resolutionNote = note;
        this.resolvedAt = now;
        this.updatedAt = now;
    }

    private void requireOpen() {
        if (status != ExceptionStatus.OPEN) {
            throw new IllegalStateException("Exception " + id + " is " + status + ", expected OPEN");
        }
    }
}
