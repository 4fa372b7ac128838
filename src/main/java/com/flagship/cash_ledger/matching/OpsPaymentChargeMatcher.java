package com.flagship.cash_ledger.matching;

import com.flagship.cash_ledger.graph.EdgeKind;
import com.flagship.cash_ledger.graph.EdgeOrigin;
import com.flagship.cash_ledger.graph.GraphStore;
import com.flagship.cash_ledger.identity.CanonicalKind;
import com.flagship.cash_ledger.identity.IdentitySnapshot;
import com.flagship.cash_ledger.identity.IdentitySnapshots;
import com.flagship.cash_ledger.ingest.RawEvent;
import com.flagship.cash_ledger.review.ExceptionManager;
import com.flagship.cash_ledger.review.context.AmbiguousMatchContext;
import com.flagship.cash_ledger.review.context.CandidateScore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Links operational payments and invoices marked paid to the processor charge
 * that collected them (APPLIES_TO edges).
 *
 * An explicit charge reference from the operational system links at 1.0.
 * Otherwise unclaimed charges of the same currency and absolute amount
 * within the hours window are scored by customer-name similarity against the
 * charge counterparty. A unique best score at or above the threshold links at
 * that score; anything else with candidates is an AMBIGUOUS_MATCH. Invoices
 * settled through a payment record are left to that payment.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpsPaymentChargeMatcher implements Matcher {

    public static final String NAME = "ops-payment-charge";

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

        Set<UUID> applied = graphStore.sourcesOf(tenantId, EdgeKind.APPLIES_TO);
        Set<UUID> claimedCharges = graphStore.targetsOf(tenantId, EdgeKind.APPLIES_TO);
        List<IdentitySnapshot> charges = identitySnapshots.loadAll(tenantId, CanonicalKind.CHARGE);
        Map<String, IdentitySnapshot> chargesByExternalId = new HashMap<>();
        charges.forEach(charge -> charge.externalIds().forEach(id -> chargesByExternalId.putIfAbsent(id, charge)));

        List<IdentitySnapshot> payments = identitySnapshots.loadAll(tenantId, CanonicalKind.PAYMENT);
        Set<String> invoicesPaidThroughPayments = new HashSet<>();
        payments.forEach(payment -> payment.getEvents().stream()
            .map(RawEvent::getParentExternalId)
            .filter(ref -> ref != null)
            .forEach(invoicesPaidThroughPayments::add));

        List<IdentitySnapshot> subjects = new ArrayList<>(payments);
        identitySnapshots.loadAll(tenantId, CanonicalKind.INVOICE).stream()
            .filter(invoice -> invoice.externalIds().stream().noneMatch(invoicesPaidThroughPayments::contains))
            .forEach(subjects::add);

        for (IdentitySnapshot subject : subjects) {
            if (applied.contains(subject.getId()) || !OperationalFacts.isPaid(subject)) {
                continue;
            }
            matchSubject(subject, charges, chargesByExternalId, claimedCharges, context, report);
        }
        return report;
    }

    private void matchSubject(IdentitySnapshot subject, List<IdentitySnapshot> charges,
                              Map<String, IdentitySnapshot> chargesByExternalId, Set<UUID> claimedCharges,
                              MatchingContext context, MatcherReport report) {
        String reference = OperationalFacts.chargeReference(subject);
        if (reference != null) {
            IdentitySnapshot charge = chargesByExternalId.get(reference);
            if (charge != null) {
                link(subject, charge, 1.0, "explicit charge reference " + reference, claimedCharges, context, report);
                return;
            }
            log.debug("{} {} references charge {} which has not been ingested yet",
                subject.getKind(), subject.getId(), reference);
        }

        MatchingConfig config = context.getConfig();
        Duration window = Duration.ofHours(config.getOpsMatchWindowHours());
        List<IdentitySnapshot> candidates = charges.stream()
            .filter(charge -> !claimedCharges.contains(charge.getId()))
            .filter(charge -> charge.currency().equals(subject.currency()))
            .filter(charge -> charge.amount().abs().compareTo(subject.amount().abs()) == 0)
            .filter(charge -> Duration.between(charge.occurredAt(), subject.occurredAt()).abs().compareTo(window) <= 0)
            .toList();
        if (candidates.isEmpty()) {
            return;
        }

        String customer = OperationalFacts.customerName(subject);
        Map<UUID, Double> similarity = new LinkedHashMap<>();
        candidates.forEach(charge -> similarity.put(charge.getId(), DescriptorSimilarity.score(customer, charge.counterparty())));
        double best = similarity.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        List<IdentitySnapshot> leaders = candidates.stream()
            .filter(charge -> similarity.get(charge.getId()) == best)
            .toList();

        if (leaders.size() == 1 && best > 0.0 && best >= config.getOpsSimilarityThreshold()) {
            IdentitySnapshot charge = leaders.get(0);
            link(subject, charge, best,
                String.format("amount %s within %dh, customer similarity %.2f", charge.amount().abs().toPlainString(),
                    config.getOpsMatchWindowHours(), best),
                claimedCharges, context, report);
            return;
        }

        AmbiguousMatchContext ambiguous = AmbiguousMatchContext.builder()
            .matcher(NAME)
            .subjectIdentityId(subject.getId())
            .subjectAmount(subject.amount())
            .summary(leaders.size() > 1
                ? String.format("%d charges tie at customer similarity %.2f", leaders.size(), best)
                : String.format("best customer similarity %.2f is below threshold %.2f", best, config.getOpsSimilarityThreshold()))
            .candidates(new ArrayList<>(candidates.stream()
                .sorted(Comparator.comparingDouble((IdentitySnapshot charge) -> -similarity.get(charge.getId()))
                    .thenComparing(IdentitySnapshot::occurredAt))
                .map(charge -> CandidateScore.builder()
                    .identityId(charge.getId())
                    .amount(charge.amount())
                    .occurredAt(charge.occurredAt())
                    .similarity(similarity.get(charge.getId()))
                    .build())
                .toList()))
            .build();
        report.exception(exceptionManager.raise(ambiguous, context));
    }

    private void link(IdentitySnapshot subject, IdentitySnapshot charge, double weight, String reason,
                      Set<UUID> claimedCharges, MatchingContext context, MatcherReport report) {
        report.edge(graphStore.addEdge(context.getTenantId(), subject.getId(), charge.getId(),
            EdgeKind.APPLIES_TO, weight, reason, EdgeOrigin.MATCHER));
        claimedCharges.add(charge.getId());
        log.info("{} {} applied to charge {} ({})", subject.getKind(), subject.getId(), charge.getId(), reason);
    }
}
