package com.flagship.cash_ledger.matching;

import com.flagship.cash_ledger.graph.EdgeKind;
import com.flagship.cash_ledger.graph.GraphStore;
import com.flagship.cash_ledger.identity.CanonicalKind;
import com.flagship.cash_ledger.identity.IdentitySnapshot;
import com.flagship.cash_ledger.identity.IdentitySnapshots;
import com.flagship.cash_ledger.ingest.RawEvent;
import com.flagship.cash_ledger.review.ExceptionManager;
import com.flagship.cash_ledger.review.context.GhostRecordContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Flags operational payments and invoices marked paid that no processor
 * record corroborates once they are older than the aging window.
 *
 * A record is corroborated by its own APPLIES_TO edge, or, for an invoice,
 * by a payment referencing it that has one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GhostRecordDetector implements Matcher {

    public static final String NAME = "ghost-detector";

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

        List<IdentitySnapshot> payments = identitySnapshots.loadAll(tenantId, CanonicalKind.PAYMENT);
        Set<String> invoicesCorroboratedByPayments = new HashSet<>();
        payments.stream()
            .filter(payment -> applied.contains(payment.getId()))
            .flatMap(payment -> payment.getEvents().stream())
            .map(RawEvent::getParentExternalId)
            .filter(ref -> ref != null)
            .forEach(invoicesCorroboratedByPayments::add);

        List<IdentitySnapshot> subjects = new ArrayList<>(payments);
        subjects.addAll(identitySnapshots.loadAll(tenantId, CanonicalKind.INVOICE));

        Duration aging = Duration.ofDays(context.getConfig().getGhostAgingDays());
        for (IdentitySnapshot subject : subjects) {
            if (applied.contains(subject.getId()) || !OperationalFacts.isPaid(subject)) {
                continue;
            }
            if (subject.getKind() == CanonicalKind.INVOICE
                && subject.externalIds().stream().anyMatch(invoicesCorroboratedByPayments::contains)) {
                continue;
            }
            Duration age = Duration.between(subject.occurredAt(), context.getNow());
            if (age.compareTo(aging) <= 0) {
                continue;
            }

            GhostRecordContext ghost = GhostRecordContext.builder()
                .matcher(NAME)
                .subjectIdentityId(subject.getId())
                .subjectKind(subject.getKind())
                .source(subject.source())
                .externalIds(new ArrayList<>(subject.externalIds()))
                .amount(subject.amount())
                .currency(subject.currency())
                .occurredAt(subject.occurredAt())
                .ageDays(age.toDays())
                .sourceStatus(OperationalFacts.status(subject))
                .build();
            report.exception(exceptionManager.raise(ghost, context));
            log.info("Ghost {} {} paid {} day(s) ago with no processor record", subject.getKind(), subject.getId(), age.toDays());
        }
        return report;
    }
}
