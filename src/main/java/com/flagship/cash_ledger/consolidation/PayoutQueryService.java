package com.flagship.cash_ledger.consolidation;

import com.flagship.cash_ledger.graph.EdgeKind;
import com.flagship.cash_ledger.graph.GraphStore;
import com.flagship.cash_ledger.graph.IdentityEdge;
import com.flagship.cash_ledger.identity.CanonicalKind;
import com.flagship.cash_ledger.identity.IdentitySnapshot;
import com.flagship.cash_ledger.identity.IdentitySnapshots;
import com.flagship.cash_ledger.matching.PayoutFacts;
import com.flagship.cash_ledger.matching.PayoutSettlementMatcher;
import com.flagship.cash_ledger.review.ExceptionKind;
import com.flagship.cash_ledger.review.ExceptionManager;
import com.flagship.cash_ledger.review.ExceptionRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Payouts of a tenant with their derived settlement status.
 */
@Service
@RequiredArgsConstructor
public class PayoutQueryService {

    private final IdentitySnapshots identitySnapshots;
    private final GraphStore graphStore;
    private final ExceptionManager exceptionManager;

    /**
     * Payouts created between the two dates, both inclusive, in UTC. Either bound may be null.
     */
    @Transactional(readOnly = true)
    public List<PayoutView> findPayouts(String tenantId, LocalDate from, LocalDate to) {
        return identitySnapshots.loadAll(tenantId, CanonicalKind.PAYOUT).stream()
            .filter(IdentitySnapshot::hasNativeEvent)
            .filter(payout -> from == null || !payout.occurredOn().isBefore(from))
            .filter(payout -> to == null || !payout.occurredOn().isAfter(to))
            .sorted(Comparator.comparing(IdentitySnapshot::occurredAt).thenComparing(IdentitySnapshot::getId))
            .map(payout -> view(tenantId, payout))
            .toList();
    }

    private PayoutView view(String tenantId, IdentitySnapshot payout) {
        Optional<IdentityEdge> settles = SettlementConsolidator.preferredSettlesEdge(
            graphStore.outgoing(tenantId, payout.getId(), EdgeKind.SETTLES));
        List<ExceptionRecord> open = exceptionManager.findBySubject(tenantId, payout.getId()).stream()
            .filter(ExceptionRecord::isOpen)
            .toList();
        boolean questioned = open.stream()
            .anyMatch(e -> e.getKind() == ExceptionKind.AMBIGUOUS_MATCH
                && e.getContext() != null
                && PayoutSettlementMatcher.NAME.equals(e.getContext().getMatcher())
                && payout.getId().equals(e.getContext().getSubjectIdentityId()));

        PayoutStatus status = settles.isPresent()
            ? PayoutStatus.SETTLED
            : questioned ? PayoutStatus.AMBIGUOUS : PayoutStatus.IN_TRANSIT;

        return PayoutView.builder()
            .identityId(payout.getId())
            .source(payout.source())
            .externalId(payout.primaryEvent().getExternalId())
            .amount(PayoutFacts.netAmount(payout))
            .grossAmount(PayoutFacts.payload(payout).getGrossAmount())
            .currency(payout.currency())
            .createdAt(payout.occurredAt())
            .expectedArrival(PayoutFacts.expectedArrival(payout))
            .status(status)
            .settlementIdentityId(settles.map(IdentityEdge::getToIdentityId).orElse(null))
            .composedOfCount(graphStore.incoming(tenantId, payout.getId(), EdgeKind.COMPOSED_OF).size())
            .openExceptionIds(open.stream().map(ExceptionRecord::getId).toList())
            .build();
    }
}
