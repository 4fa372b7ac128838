package com.flagship.cash_ledger.matching;

import com.flagship.cash_ledger.graph.EdgeKind;
import com.flagship.cash_ledger.graph.EdgeOrigin;
import com.flagship.cash_ledger.graph.GraphStore;
import com.flagship.cash_ledger.identity.CanonicalKind;
import com.flagship.cash_ledger.identity.Fingerprint;
import com.flagship.cash_ledger.identity.IdentitySnapshot;
import com.flagship.cash_ledger.identity.IdentitySnapshots;
import com.flagship.cash_ledger.review.ExceptionManager;
import com.flagship.cash_ledger.review.context.AmbiguousMatchContext;
import com.flagship.cash_ledger.review.context.CandidateScore;
import com.flagship.cash_ledger.review.context.TimingDriftContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Links payouts to the bank record that settled them (SETTLES edges).
 *
 * A bank record is a candidate when it is not yet claimed by another payout,
 * has the payout's currency and sign, its amount is within the tolerance of
 * the payout net, and it was posted within the settlement window around the
 * expected arrival. One candidate links at full weight. Several are narrowed
 * by nearest date, then by descriptor similarity; a tie that survives both
 * becomes an AMBIGUOUS_MATCH. No candidate leaves the payout in transit,
 * unless an amount match exists further out (TIMING_DRIFT) or the payout is
 * overdue (TIMING_DRIFT, unsettled).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PayoutSettlementMatcher implements Matcher {

    public static final String NAME = "payout-settlement";

    static final double TIE_BREAK_WEIGHT = 0.9;

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

        Set<UUID> settledPayouts = graphStore.sourcesOf(tenantId, EdgeKind.SETTLES);
        Set<UUID> claimedSettlements = graphStore.targetsOf(tenantId, EdgeKind.SETTLES);
        List<IdentitySnapshot> settlements = identitySnapshots.loadAll(tenantId, CanonicalKind.SETTLEMENT);

        List<IdentitySnapshot> payouts = identitySnapshots.loadAll(tenantId, CanonicalKind.PAYOUT).stream()
            .filter(IdentitySnapshot::hasNativeEvent)
            .filter(p -> !settledPayouts.contains(p.getId()))
            .sorted(Comparator.comparing(PayoutFacts::expectedArrival).thenComparing(IdentitySnapshot::occurredAt))
            .toList();

        for (IdentitySnapshot payout : payouts) {
            matchPayout(payout, settlements, claimedSettlements, context, report);
        }
        return report;
    }

    private void matchPayout(IdentitySnapshot payout, List<IdentitySnapshot> settlements,
                             Set<UUID> claimedSettlements, MatchingContext context, MatcherReport report) {
        MatchingConfig config = context.getConfig();
        LocalDate expected = PayoutFacts.expectedArrival(payout);
        BigDecimal net = PayoutFacts.netAmount(payout);

        List<IdentitySnapshot> amountMatches = settlements.stream()
            .filter(s -> !claimedSettlements.contains(s.getId()))
            .filter(s -> s.currency().equals(payout.currency()))
            .filter(s -> s.amount().signum() == net.signum())
            .filter(s -> amountDelta(s, net).compareTo(config.getAmountTolerance()) <= 0)
            .toList();

        List<IdentitySnapshot> inWindow = amountMatches.stream()
            .filter(s -> dayDistance(s, expected) <= config.getSettlementWindowDays())
            .toList();

        if (inWindow.size() == 1) {
            IdentitySnapshot settlement = inWindow.get(0);
            link(payout, settlement, Math.min(1.0, settlementConfidence(settlement)),
                String.format("single candidate within %d day(s) of expected arrival %s, amount delta %s, %d day(s) off",
                    config.getSettlementWindowDays(), expected, amountDelta(settlement, net).toPlainString(),
                    dayDistance(settlement, expected)),
                claimedSettlements, context, report);
            return;
        }
        if (inWindow.size() > 1) {
            tieBreak(payout, inWindow, expected, net, claimedSettlements, context, report);
            return;
        }

        List<IdentitySnapshot> drifted = amountMatches.stream()
            .filter(s -> dayDistance(s, expected) <= config.getDriftWindowDays())
            .sorted(Comparator.comparingLong((IdentitySnapshot s) -> dayDistance(s, expected)))
            .toList();
        LocalDate today = LocalDate.ofInstant(context.getNow(), ZoneOffset.UTC);
        long daysPast = ChronoUnit.DAYS.between(expected, today);

        if (!drifted.isEmpty()) {
            TimingDriftContext drift = TimingDriftContext.builder()
                .matcher(NAME)
                .subjectIdentityId(payout.getId())
                .reason(TimingDriftContext.Reason.MATCH_OUTSIDE_WINDOW)
                .summary(String.format("payout %s matches %d bank record(s) only outside the %d-day settlement window",
                    payout.primaryEvent().getExternalId(), drifted.size(), config.getSettlementWindowDays()))
                .expectedAmount(net)
                .expectedArrival(expected)
                .daysPastExpected(Math.max(0, daysPast))
                .candidates(scores(payout, drifted, expected, net))
                .build();
            report.exception(exceptionManager.raise(drift, context));
        } else if (daysPast > config.getInTransitAgingDays()) {
            TimingDriftContext unsettled = TimingDriftContext.builder()
                .matcher(NAME)
                .subjectIdentityId(payout.getId())
                .reason(TimingDriftContext.Reason.UNSETTLED)
                .summary(String.format("payout %s still unsettled %d day(s) after expected arrival %s",
                    payout.primaryEvent().getExternalId(), daysPast, expected))
                .expectedAmount(net)
                .expectedArrival(expected)
                .daysPastExpected(daysPast)
                .build();
            report.exception(exceptionManager.raise(unsettled, context));
        } else {
            log.debug("Payout {} in transit, expected {}", payout.getId(), expected);
        }
    }

    private void tieBreak(IdentitySnapshot payout, List<IdentitySnapshot> candidates, LocalDate expected,
                          BigDecimal net, Set<UUID> claimedSettlements,
                          MatchingContext context, MatcherReport report) {
        long nearest = candidates.stream().mapToLong(s -> dayDistance(s, expected)).min().orElseThrow();
        List<IdentitySnapshot> closest = candidates.stream()
            .filter(s -> dayDistance(s, expected) == nearest)
            .toList();
        if (closest.size() == 1) {
            IdentitySnapshot settlement = closest.get(0);
            link(payout, settlement, Math.min(TIE_BREAK_WEIGHT, settlementConfidence(settlement)),
                String.format("nearest of %d candidates: %d day(s) from expected arrival %s",
                    candidates.size(), nearest, expected),
                claimedSettlements, context, report);
            return;
        }

        String descriptor = PayoutFacts.descriptor(payout);
        Map<UUID, Double> similarity = new HashMap<>();
        closest.forEach(s -> similarity.put(s.getId(), DescriptorSimilarity.score(descriptor, s.counterparty())));
        double best = similarity.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        List<IdentitySnapshot> mostSimilar = closest.stream()
            .filter(s -> similarity.get(s.getId()) == best)
            .toList();
        if (mostSimilar.size() == 1) {
            IdentitySnapshot settlement = mostSimilar.get(0);
            link(payout, settlement, Math.min(TIE_BREAK_WEIGHT, settlementConfidence(settlement)),
                String.format("%d candidates on the nearest day, descriptor similarity %.2f", closest.size(), best),
                claimedSettlements, context, report);
            return;
        }

        AmbiguousMatchContext ambiguous = AmbiguousMatchContext.builder()
            .matcher(NAME)
            .subjectIdentityId(payout.getId())
            .subjectAmount(net)
            .summary(String.format("payout %s has %d equally plausible settlements",
                payout.primaryEvent().getExternalId(), candidates.size()))
            .candidates(scores(payout, candidates, expected, net))
            .build();
        report.exception(exceptionManager.raise(ambiguous, context));
    }

    private void link(IdentitySnapshot payout, IdentitySnapshot settlement, double weight, String reason,
                      Set<UUID> claimedSettlements, MatchingContext context, MatcherReport report) {
        report.edge(graphStore.addEdge(context.getTenantId(), payout.getId(), settlement.getId(),
            EdgeKind.SETTLES, weight, reason, EdgeOrigin.MATCHER));
        claimedSettlements.add(settlement.getId());
        log.info("Payout {} settled by {} (weight={}): {}", payout.getId(), settlement.getId(), weight, reason);
    }

    private List<CandidateScore> scores(IdentitySnapshot payout, List<IdentitySnapshot> candidates,
                                        LocalDate expected, BigDecimal net) {
        String descriptor = PayoutFacts.descriptor(payout);
        return candidates.stream()
            .map(s -> CandidateScore.builder()
                .identityId(s.getId())
                .amount(s.amount())
                .occurredAt(s.occurredAt())
                .dayDistance(dayDistance(s, expected))
                .amountDelta(amountDelta(s, net))
                .similarity(DescriptorSimilarity.score(descriptor, s.counterparty()))
                .build())
            .toList();
    }

    private static double settlementConfidence(IdentitySnapshot settlement) {
        return settlement.getIdentity().isLowConfidence() ? Fingerprint.LOW_CONFIDENCE : Fingerprint.FULL_CONFIDENCE;
    }

    private static long dayDistance(IdentitySnapshot settlement, LocalDate expected) {
        return Math.abs(ChronoUnit.DAYS.between(expected, settlement.occurredOn()));
    }

    private static BigDecimal amountDelta(IdentitySnapshot settlement, BigDecimal net) {
        return settlement.amount().abs().subtract(net.abs()).abs();
    }
}
