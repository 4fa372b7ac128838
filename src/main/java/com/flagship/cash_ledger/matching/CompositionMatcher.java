package com.flagship.cash_ledger.matching;

import com.flagship.cash_ledger.graph.EdgeKind;
import com.flagship.cash_ledger.graph.EdgeOrigin;
import com.flagship.cash_ledger.graph.GraphStore;
import com.flagship.cash_ledger.identity.CanonicalKind;
import com.flagship.cash_ledger.identity.IdentitySnapshot;
import com.flagship.cash_ledger.identity.IdentitySnapshots;
import com.flagship.cash_ledger.ingest.RawEvent;
import com.flagship.cash_ledger.ingest.RawEventKind;
import com.flagship.cash_ledger.ingest.payload.BalanceTransactionPayload;
import com.flagship.cash_ledger.review.ExceptionManager;
import com.flagship.cash_ledger.review.context.AmbiguousMatchContext;
import com.flagship.cash_ledger.review.context.CandidateScore;
import com.flagship.cash_ledger.review.context.CandidateSubset;
import com.flagship.cash_ledger.review.context.NoMatchContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Links charges, fees and refunds to the payout they were paid out in
 * (COMPOSED_OF edges).
 *
 * An explicit payout reference from the processor always wins. Payouts that
 * end up with no explicit children are reconciled by exact subset sum over
 * the unattached line items of the same provider and currency from the
 * lookback window before the payout. A unique subset links at 0.95; several
 * raise AMBIGUOUS_MATCH with the subsets; none raises NO_MATCH once the
 * payout has settled or is overdue, so late-arriving line items get a chance.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CompositionMatcher implements Matcher {

    public static final String NAME = "composition";

    static final double SUBSET_WEIGHT = 0.95;

    private static final List<CanonicalKind> LINE_ITEM_KINDS =
        List.of(CanonicalKind.CHARGE, CanonicalKind.FEE, CanonicalKind.REFUND);

    private final IdentitySnapshots identitySnapshots;
    private final GraphStore graphStore;
    private final ExceptionManager exceptionManager;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public MatcherReport run(MatchingContext context) {
        String tenantId = context.getTenantId();
        MatcherReport report = new MatcherReport(NAME);

        List<IdentitySnapshot> payouts = identitySnapshots.loadAll(tenantId, CanonicalKind.PAYOUT).stream()
            .filter(IdentitySnapshot::hasNativeEvent)
            .sorted(Comparator.comparing(IdentitySnapshot::occurredAt).thenComparing(IdentitySnapshot::getId))
            .toList();
        List<IdentitySnapshot> lineItems = new ArrayList<>();
        LINE_ITEM_KINDS.forEach(kind -> lineItems.addAll(identitySnapshots.loadAll(tenantId, kind)));

        Set<UUID> attached = graphStore.sourcesOf(tenantId, EdgeKind.COMPOSED_OF);
        Set<UUID> composedPayouts = graphStore.targetsOf(tenantId, EdgeKind.COMPOSED_OF);
        Set<UUID> settledPayouts = graphStore.sourcesOf(tenantId, EdgeKind.SETTLES);

        linkExplicit(payouts, lineItems, attached, composedPayouts, context, report);

        for (IdentitySnapshot payout : payouts) {
            if (!composedPayouts.contains(payout.getId())) {
                reconcileBySubsetSum(payout, lineItems, attached, composedPayouts, settledPayouts, context, report);
            }
        }
        return report;
    }

    private void linkExplicit(List<IdentitySnapshot> payouts, List<IdentitySnapshot> lineItems,
                              Set<UUID> attached, Set<UUID> composedPayouts,
                              MatchingContext context, MatcherReport report) {
        Map<String, IdentitySnapshot> payoutsByReference = new HashMap<>();
        for (IdentitySnapshot payout : payouts) {
            payout.getEvents().stream()
                .filter(e -> e.getKind() == RawEventKind.PAYOUT)
                .forEach(e -> payoutsByReference.put(referenceKey(e.getSource(), e.getExternalId()), payout));
        }

        for (IdentitySnapshot item : lineItems) {
            if (attached.contains(item.getId())) {
                continue;
            }
            String reference = explicitPayoutReference(item);
            if (reference == null) {
                continue;
            }
            IdentitySnapshot payout = payoutsByReference.get(referenceKey(item.source(), reference));
            if (payout == null) {
                log.debug("Line item {} references payout {} which has not been ingested yet", item.getId(), reference);
                continue;
            }
            report.edge(graphStore.addEdge(context.getTenantId(), item.getId(), payout.getId(), EdgeKind.COMPOSED_OF,
                1.0, "explicit payout reference " + reference, EdgeOrigin.MATCHER));
            attached.add(item.getId());
            composedPayouts.add(payout.getId());
        }
    }

    private void reconcileBySubsetSum(IdentitySnapshot payout, List<IdentitySnapshot> lineItems,
                                      Set<UUID> attached, Set<UUID> composedPayouts, Set<UUID> settledPayouts,
                                      MatchingContext context, MatcherReport report) {
        MatchingConfig config = context.getConfig();
        LocalDate payoutDay = payout.occurredOn();
        LocalDate earliest = payoutDay.minusDays(config.getCompositionLookbackDays());

        List<IdentitySnapshot> eligible = lineItems.stream()
            .filter(item -> !attached.contains(item.getId()))
            .filter(item -> explicitPayoutReference(item) == null)
            .filter(item -> item.source().equals(payout.source()))
            .filter(item -> item.currency().equals(payout.currency()))
            .filter(item -> !item.occurredOn().isBefore(earliest) && !item.occurredOn().isAfter(payoutDay))
            .sorted(Comparator.comparingLong((IdentitySnapshot item) -> ChronoUnit.DAYS.between(item.occurredOn(), payoutDay))
                .thenComparing(IdentitySnapshot::occurredAt)
                .thenComparing(IdentitySnapshot::getId))
            .toList();
        boolean truncated = eligible.size() > config.getCompositionMaxCandidates();
        List<IdentitySnapshot> candidates = truncated
            ? eligible.subList(0, config.getCompositionMaxCandidates())
            : eligible;

        BigDecimal target = PayoutFacts.compositionTarget(payout);
        int maxReported = config.getCompositionMaxReportedSubsets();
        List<List<Integer>> solutions = candidates.isEmpty()
            ? List.of()
            : SubsetSumSolver.solve(candidates.stream().map(IdentitySnapshot::amount).toList(), target,
                Math.max(2, maxReported + 1));

        if (solutions.size() == 1) {
            List<IdentitySnapshot> subset = solutions.get(0).stream().map(candidates::get).toList();
            for (IdentitySnapshot item : subset) {
                report.edge(graphStore.addEdge(context.getTenantId(), item.getId(), payout.getId(),
                    EdgeKind.COMPOSED_OF, SUBSET_WEIGHT,
                    String.format("unique subset of %d line item(s) summing to %s", subset.size(), target.toPlainString()),
                    EdgeOrigin.MATCHER));
                attached.add(item.getId());
            }
            composedPayouts.add(payout.getId());
            log.info("Payout {} composed of {} line item(s) by subset sum", payout.getId(), subset.size());
            return;
        }

        if (solutions.size() > 1) {
            List<CandidateSubset> subsets = solutions.stream()
                .limit(maxReported)
                .map(indices -> new CandidateSubset(
                    indices.stream().map(i -> candidates.get(i).getId()).toList(), target))
                .toList();
            AmbiguousMatchContext ambiguous = AmbiguousMatchContext.builder()
                .matcher(NAME)
                .subjectIdentityId(payout.getId())
                .subjectAmount(target)
                .summary(String.format("%s%d subsets of line items sum to payout target %s",
                    solutions.size() > maxReported ? "more than " : "", subsets.size(), target.toPlainString()))
                .subsets(new ArrayList<>(subsets))
                .subsetsTruncated(solutions.size() > maxReported)
                .build();
            report.exception(exceptionManager.raise(ambiguous, context));
            return;
        }

        LocalDate today = LocalDate.ofInstant(context.getNow(), ZoneOffset.UTC);
        boolean overdue = ChronoUnit.DAYS.between(PayoutFacts.expectedArrival(payout), today) > config.getInTransitAgingDays();
        if (!settledPayouts.contains(payout.getId()) && !overdue) {
            log.debug("No composition for payout {} yet; waiting for more line items", payout.getId());
            return;
        }

        NoMatchContext noMatch = NoMatchContext.builder()
            .matcher(NAME)
            .subjectIdentityId(payout.getId())
            .summary(String.format("no combination of %d unattached line item(s) sums to payout target %s",
                candidates.size(), target.toPlainString()))
            .expectedAmount(target)
            .considered(new ArrayList<>(candidates.stream()
                .map(item -> CandidateScore.builder()
                    .identityId(item.getId())
                    .amount(item.amount())
                    .occurredAt(item.occurredAt())
                    .dayDistance(ChronoUnit.DAYS.between(item.occurredOn(), payoutDay))
                    .build())
                .toList()))
            .candidatesTruncated(truncated)
            .build();
        report.exception(exceptionManager.raise(noMatch, context));
    }

    /**
     * Payout id the processor reported for a line item, if any.
     */
    static String explicitPayoutReference(IdentitySnapshot item) {
        RawEvent event = item.primaryEvent();
        BalanceTransactionPayload payload = event.payloadAs(BalanceTransactionPayload.class);
        if (payload != null && payload.getPayoutId() != null) {
            return payload.getPayoutId();
        }
        return event.getParentExternalId();
    }

    private static String referenceKey(String source, String externalId) {
        return source + '\u0000' + externalId;
    }
}
