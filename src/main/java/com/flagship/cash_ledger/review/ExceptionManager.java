package com.flagship.cash_ledger.review;

import com.flagship.cash_ledger.common.exception.ResourceNotFoundException;
import com.flagship.cash_ledger.common.json.JsonColumnCodec;
import com.flagship.cash_ledger.graph.GraphStore;
import com.flagship.cash_ledger.graph.IdentityEdge;
import com.flagship.cash_ledger.graph.EdgeOrigin;
import com.flagship.cash_ledger.identity.Identity;
import com.flagship.cash_ledger.identity.IdentityRepository;
import com.flagship.cash_ledger.matching.MatchingContext;
import com.flagship.cash_ledger.observability.CashLedgerMetrics;
import com.flagship.cash_ledger.outbox.OutboxService;
import com.flagship.cash_ledger.review.context.ExceptionContext;
import com.flagship.cash_ledger.review.event.ExceptionRaisedEvent;
import com.flagship.cash_ledger.review.event.ExceptionResolvedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Review queue lifecycle: raise, resolve, list.
 *
 * Exceptions never resolve themselves. A raise for a question that is already
 * open refreshes that record instead of adding a duplicate; the question's
 * identity is its kind, the raising matcher and the subject identity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExceptionManager {

    public static final String AGGREGATE_TYPE = "Exception";

    private final ExceptionRecordRepository repository;
    private final IdentityRepository identityRepository;
    private final GraphStore graphStore;
    private final OutboxService outboxService;
    private final JsonColumnCodec jsonColumnCodec;
    private final CashLedgerMetrics metrics;
    private final Clock clock;

    @Transactional
    public RaiseOutcome raise(ExceptionContext context, MatchingContext matching) {
        String tenantId = matching.getTenantId();
        Instant now = matching.getNow();
        String dedupeKey = context.dedupeKey();
        Set<UUID> subjects = context.referencedIdentityIds();
        String json = jsonColumnCodec.write(context);

        Optional<ExceptionRecordEntity> open = repository
            .findFirstByTenantIdAndDedupeKeyAndStatusOrderByCreatedAtDesc(tenantId, dedupeKey, ExceptionStatus.OPEN);
        if (open.isPresent()) {
            ExceptionRecordEntity entity = open.get();
            entity.refresh(json, subjects, now);
            if (shouldEscalate(entity, matching)) {
                entity.escalate(now);
                log.warn("Escalated timing drift {} to WARNING after {} days open",
                    entity.getId(), Duration.between(entity.getCreatedAt(), now).toDays());
            }
            ExceptionRecord updated = toDomain(repository.save(entity));
            metrics.recordExceptionRaised(context.kind().name(), false);
            log.debug("Refreshed open exception {} ({})", updated.getId(), dedupeKey);
            return new RaiseOutcome(updated, RaiseOutcome.Result.UPDATED);
        }

        for (ExceptionRecordEntity resolved : repository.findByTenantIdAndDedupeKeyAndStatus(
                tenantId, dedupeKey, ExceptionStatus.RESOLVED)) {
            ExceptionContext previous = jsonColumnCodec.read(resolved.getContext(), ExceptionContext.class);
            if (previous != null && previous.referencedIdentityIds().equals(subjects)) {
                log.debug("Suppressed raise of {}: resolved as {} with the same candidates", dedupeKey, resolved.getId());
                return new RaiseOutcome(toDomain(resolved), RaiseOutcome.Result.SUPPRESSED);
            }
        }

        ExceptionRecordEntity entity = ExceptionRecordEntity.open(
            tenantId, context.kind(), dedupeKey, json, subjects, now);
        ExceptionRecord created = toDomain(repository.save(entity));
        outboxService.saveEvent(AGGREGATE_TYPE, created.getId(),
            ExceptionRaisedEvent.EVENT_TYPE, ExceptionRaisedEvent.from(created));
        metrics.recordExceptionRaised(context.kind().name(), true);

        log.warn("Raised {} exception {}: matcher={}, subject={}",
            created.getKind(), created.getId(), context.getMatcher(), context.getSubjectIdentityId());
        return new RaiseOutcome(created, RaiseOutcome.Result.CREATED);
    }

    /**
     * Resolves an open exception by writing the reviewer's chosen edges.
     * An empty edge list dismisses the exception without adding evidence.
     *
     * @throws ResourceNotFoundException if the exception does not exist
     * @throws IllegalStateException if the exception is not open
     * @throws IllegalArgumentException if an edge does not fit the tenant or its kind
     */
    @Transactional
    public ExceptionRecord resolve(UUID exceptionId, List<EdgeProposal> edges, String note) {
        ExceptionRecordEntity entity = repository.findById(exceptionId)
            .orElseThrow(() -> new ResourceNotFoundException("Exception not found: " + exceptionId));
        if (entity.getStatus() != ExceptionStatus.OPEN) {
            throw new IllegalStateException("Exception " + exceptionId + " is already " + entity.getStatus());
        }

        String tenantId = entity.getTenantId();
        List<EdgeProposal> proposals = edges == null ? List.of() : edges;
        for (EdgeProposal proposal : proposals) {
            validate(tenantId, proposal);
        }

        String reason = "review of " + entity.getKind() + " " + exceptionId + (note == null || note.isBlank() ? "" : ": " + note);
        List<UUID> edgeIds = new ArrayList<>();
        Set<UUID> touched = new LinkedHashSet<>(entity.getSubjectIdentityIds());
        for (EdgeProposal proposal : proposals) {
            IdentityEdge edge = graphStore.addEdge(tenantId, proposal.getFromIdentityId(), proposal.getToIdentityId(),
                proposal.getKind(), 1.0, reason, EdgeOrigin.REVIEW);
            edgeIds.add(edge.getId());
        }

        Instant now = clock.instant();
        entity.resolve(note, now);
        identityRepository.touch(touched, now);
        ExceptionRecord resolved = toDomain(repository.save(entity));

        outboxService.saveEvent(AGGREGATE_TYPE, resolved.getId(),
            ExceptionResolvedEvent.EVENT_TYPE, ExceptionResolvedEvent.from(resolved, edgeIds));
        metrics.recordExceptionResolved(resolved.getKind().name());

        log.info("Resolved {} exception {} with {} edge(s)", resolved.getKind(), exceptionId, edgeIds.size());
        return resolved;
    }

    @Transactional(readOnly = true)
    public ExceptionRecord get(UUID exceptionId) {
        return repository.findById(exceptionId)
            .map(this::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("Exception not found: " + exceptionId));
    }

    @Transactional(readOnly = true)
    public List<ExceptionRecord> list(String tenantId, ExceptionKind kind, ExceptionStatus status) {
        ExceptionStatus effective = status != null ? status : ExceptionStatus.OPEN;
        List<ExceptionRecordEntity> entities = kind == null
            ? repository.findByTenantIdAndStatusOrderByCreatedAtAsc(tenantId, effective)
            : repository.findByTenantIdAndStatusAndKindOrderByCreatedAtAsc(tenantId, effective, kind);
        return entities.stream().map(this::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public Optional<ExceptionRecord> findOpen(String tenantId, String dedupeKey) {
        return repository.findFirstByTenantIdAndDedupeKeyAndStatusOrderByCreatedAtDesc(
                tenantId, dedupeKey, ExceptionStatus.OPEN)
            .map(this::toDomain);
    }

    /**
     * Identities referenced by open exceptions. The consolidator defers these.
     */
    @Transactional(readOnly = true)
    public Set<UUID> openSubjectIdentityIds(String tenantId) {
        return new HashSet<>(repository.findSubjectIdentityIds(tenantId, ExceptionStatus.OPEN));
    }

    @Transactional(readOnly = true)
    public List<ExceptionRecord> findBySubject(String tenantId, UUID identityId) {
        return repository.findBySubject(tenantId, identityId).stream().map(this::toDomain).toList();
    }

    private boolean shouldEscalate(ExceptionRecordEntity entity, MatchingContext matching) {
        if (entity.getKind() != ExceptionKind.TIMING_DRIFT || entity.getSeverity() == ExceptionSeverity.WARNING) {
            return false;
        }
        Duration open = Duration.between(entity.getCreatedAt(), matching.getNow());
        return open.compareTo(Duration.ofDays(matching.getConfig().getDriftEscalationDays())) >= 0;
    }

    private void validate(String tenantId, EdgeProposal proposal) {
        if (proposal.getFromIdentityId() == null || proposal.getToIdentityId() == null || proposal.getKind() == null) {
            throw new IllegalArgumentException("Edge requires from_identity_id, to_identity_id and kind");
        }
        Identity from = requireIdentity(tenantId, proposal.getFromIdentityId());
        Identity to = requireIdentity(tenantId, proposal.getToIdentityId());
        if (!proposal.getKind().connects(from.getCanonicalKind(), to.getCanonicalKind())) {
            throw new IllegalArgumentException(String.format("%s edge cannot connect %s to %s",
                proposal.getKind(), from.getCanonicalKind(), to.getCanonicalKind()));
        }
    }

    private Identity requireIdentity(String tenantId, UUID identityId) {
        return identityRepository.findById(tenantId, identityId)
            .orElseThrow(() -> new IllegalArgumentException(
                "Identity " + identityId + " does not belong to tenant " + tenantId));
    }

    private ExceptionRecord toDomain(ExceptionRecordEntity entity) {
        return ExceptionRecord.builder()
            .id(entity.getId())
            .tenantId(entity.getTenantId())
            .kind(entity.getKind())
            .status(entity.getStatus())
            .severity(entity.getSeverity())
            .dedupeKey(entity.getDedupeKey())
            .context(jsonColumnCodec.read(entity.getContext(), ExceptionContext.class))
            .subjectIdentityIds(Set.copyOf(entity.getSubjectIdentityIds()))
            .resolutionNote(entity.getResolutionNote())
            .createdAt(entity.getCreatedAt())
            .updatedAt(entity.getUpdatedAt())
            .resolvedAt(entity.getResolvedAt())
            .build();
    }
}
