package com.flagship.cash_ledger.consolidation;

import com.flagship.cash_ledger.graph.EdgeKind;
import com.flagship.cash_ledger.graph.EdgeOrigin;
import com.flagship.cash_ledger.graph.GraphStore;
import com.flagship.cash_ledger.graph.IdentityEdge;
import com.flagship.cash_ledger.identity.CanonicalKind;
import com.flagship.cash_ledger.identity.Identity;
import com.flagship.cash_ledger.identity.IdentityRepository;
import com.flagship.cash_ledger.identity.IdentitySnapshot;
import com.flagship.cash_ledger.identity.IdentitySnapshots;
import com.flagship.cash_ledger.ledger.CashLedgerEntry;
import com.flagship.cash_ledger.ledger.Direction;
import com.flagship.cash_ledger.ledger.LedgerProvenance;
import com.flagship.cash_ledger.ledger.LedgerService;
import com.flagship.cash_ledger.ledger.ProvenancePath;
import com.flagship.cash_ledger.observability.CashLedgerMetrics;
import com.flagship.cash_ledger.observability.CorrelationContext;
import com.flagship.cash_ledger.review.ExceptionManager;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * The ledger pass: turns settled identities into ledger entries.
 *
 * Only settlements produce entries. A settlement with an incoming SETTLES
 * edge is posted as the payout it settles; one without is posted as a direct
 * bank movement, unless an open exception still lists it as a candidate. The
 * amount and time are always the bank's. Each settlement is written in its
 * own transaction so one failure does not hold back the rest.
 */
@Component
@Slf4j
public class SettlementConsolidator {

    private final IdentityRepository identityRepository;
    private final IdentitySnapshots identitySnapshots;
    private final GraphStore graphStore;
    private final LedgerService ledgerService;
    private final ExceptionManager exceptionManager;
    private final CashLedgerMetrics metrics;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public SettlementConsolidator(IdentityRepository identityRepository,
                                  IdentitySnapshots identitySnapshots,
                                  GraphStore graphStore,
                                  LedgerService ledgerService,
                                  ExceptionManager exceptionManager,
                                  CashLedgerMetrics metrics,
                                  Clock clock,
                                  PlatformTransactionManager transactionManager) {
        this.identityRepository = identityRepository;
        this.identitySnapshots = identitySnapshots;
        this.graphStore = graphStore;
        this.ledgerService = ledgerService;
        this.exceptionManager = exceptionManager;
        this.metrics = metrics;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public LedgerPassResult run(String tenantId, Instant since) {
        Set<UUID> settlementIds = new TreeSet<>();
        identityRepository.findTouchedSince(tenantId, CanonicalKind.SETTLEMENT, since)
            .forEach(identity -> settlementIds.add(identity.getId()));
        for (Identity payout : identityRepository.findTouchedSince(tenantId, CanonicalKind.PAYOUT, since)) {
            graphStore.outgoing(tenantId, payout.getId(), EdgeKind.SETTLES)
                .forEach(edge -> settlementIds.add(edge.getToIdentityId()));
        }
        Set<UUID> deferrable = exceptionManager.openSubjectIdentityIds(tenantId);

        List<CashLedgerEntry> entries = new ArrayList<>();
        List<UUID> deferred = new ArrayList<>();
        List<UUID> failed = new ArrayList<>();
        for (UUID settlementId : settlementIds) {
            MDC.put(CorrelationContext.IDENTITY_ID_MDC_KEY, settlementId.toString());
            try {
                Outcome outcome = transactionTemplate.execute(status -> consolidate(tenantId, settlementId, deferrable));
                if (outcome == null) {
                    continue;
                }
                outcome.entry.ifPresent(entries::add);
                if (outcome.deferred) {
                    deferred.add(settlementId);
                }
            } catch (RuntimeException e) {
                failed.add(settlementId);
                metrics.recordLedgerFailure();
                log.error("Failed to consolidate settlement {}: {}", settlementId, e.getMessage(), e);
            } finally {
                MDC.remove(CorrelationContext.IDENTITY_ID_MDC_KEY);
            }
        }

        log.info("Ledger pass finished: tenantId={}, candidates={}, written={}, deferred={}, failed={}",
            tenantId, settlementIds.size(), entries.size(), deferred.size(), failed.size());
        return new LedgerPassResult(entries, deferred, failed);
    }

    private Outcome consolidate(String tenantId, UUID settlementId, Set<UUID> deferrable) {
        if (ledgerService.existsForIdentity(tenantId, settlementId)) {
            return Outcome.NONE;
        }
        Optional<IdentitySnapshot> loaded = identitySnapshots.load(tenantId, settlementId);
        if (loaded.isEmpty() || !loaded.get().hasNativeEvent()) {
            log.debug("Settlement {} has no bank record yet", settlementId);
            return Outcome.NONE;
        }
        IdentitySnapshot settlement = loaded.get();

        Optional<IdentityEdge> settles = preferredSettlesEdge(graphStore.incoming(tenantId, settlementId, EdgeKind.SETTLES));
        if (settles.isPresent()) {
            IdentityEdge edge = settles.get();
            List<LedgerProvenance.EdgeRef> composedOf = graphStore
                .incoming(tenantId, edge.getFromIdentityId(), EdgeKind.COMPOSED_OF).stream()
                .map(LedgerProvenance.EdgeRef::of)
                .toList();
            List<String> reasons = new ArrayList<>();
            reasons.add(edge.getReason());
            composedOf.forEach(ref -> reasons.add(ref.getReason()));
            LedgerProvenance provenance = LedgerProvenance.builder()
                .path(ProvenancePath.PAYOUT_SETTLEMENT)
                .settlementIdentityId(settlementId)
                .payoutIdentityId(edge.getFromIdentityId())
                .settlesEdge(LedgerProvenance.EdgeRef.of(edge))
                .composedOf(new ArrayList<>(composedOf))
                .rawEventIds(new ArrayList<>(settlement.rawEventIds()))
                .reasons(reasons)
                .build();
            return new Outcome(ledgerService.record(entry(tenantId, settlement, edge.getWeight(), provenance)), false);
        }

        if (deferrable.contains(settlementId)) {
            log.debug("Settlement {} deferred: candidate of an open exception", settlementId);
            return new Outcome(Optional.empty(), true);
        }

        LedgerProvenance provenance = LedgerProvenance.builder()
            .path(ProvenancePath.DIRECT_SETTLEMENT)
            .settlementIdentityId(settlementId)
            .rawEventIds(new ArrayList<>(settlement.rawEventIds()))
            .reasons(new ArrayList<>(List.of("bank record with no settling payout")))
            .build();
        double confidence = identityRepository.minLinkConfidence(settlementId);
        return new Outcome(ledgerService.record(entry(tenantId, settlement, confidence, provenance)), false);
    }

    private CashLedgerEntry entry(String tenantId, IdentitySnapshot settlement, double confidence,
                                 LedgerProvenance provenance) {
        return CashLedgerEntry.builder()
            .id(UUID.randomUUID())
            .tenantId(tenantId)
            .identityId(settlement.getId())
            .postedAt(settlement.occurredAt())
            .direction(Direction.of(settlement.amount()))
            .amount(settlement.amount())
            .currency(settlement.currency())
            .confidence(confidence)
            .provenance(provenance)
            .createdAt(clock.instant())
            .build();
    }

    /**
     * The edge a reviewer chose wins; otherwise the strongest, then the newest.
     */
    static Optional<IdentityEdge> preferredSettlesEdge(List<IdentityEdge> edges) {
        return edges.stream().max(Comparator
            .comparing((IdentityEdge edge) -> edge.getOrigin() == EdgeOrigin.REVIEW)
            .thenComparingDouble(IdentityEdge::getWeight)
            .thenComparing(IdentityEdge::getCreatedAt));
    }

    private static final class Outcome {
        static final Outcome NONE = new Outcome(Optional.empty(), false);

        final Optional<CashLedgerEntry> entry;
        final boolean deferred;

        Outcome(Optional<CashLedgerEntry> entry, boolean deferred) {
            this.entry = entry;
            this.deferred = deferred;
        }
    }
}
