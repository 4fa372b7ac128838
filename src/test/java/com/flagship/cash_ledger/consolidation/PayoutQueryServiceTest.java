package com.flagship.cash_ledger.consolidation;

import com.flagship.cash_ledger.identity.CanonicalKind;
import com.flagship.cash_ledger.identity.IdentitySnapshots;
import com.flagship.cash_ledger.ingest.IngestionService;
import com.flagship.cash_ledger.ingest.dto.RawEventCommand;
import com.flagship.cash_ledger.matching.MatcherReport;
import com.flagship.cash_ledger.matching.MatchingConfig;
import com.flagship.cash_ledger.matching.MatchingContext;
import com.flagship.cash_ledger.matching.PayoutSettlementMatcher;
import com.flagship.cash_ledger.review.ExceptionKind;
import com.flagship.cash_ledger.review.ExceptionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static com.flagship.cash_ledger.support.RawEventFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Payout status tests.
 *
 * These tests verify that:
 * - A payout with a SETTLES edge is SETTLED
 * - An overdue payout stays IN_TRANSIT with its timing drift listed
 * - Only an open AMBIGUOUS_MATCH over its settlements makes a payout AMBIGUOUS
 */
@SpringBootTest
@ActiveProfiles("test")
class PayoutQueryServiceTest {

    @Autowired
    private PayoutQueryService payoutQueryService;

    @Autowired
    private PayoutSettlementMatcher settlementMatcher;

    @Autowired
    private IngestionService ingestionService;

    @Autowired
    private IdentitySnapshots identitySnapshots;

    private String tenantId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("  → " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        tenantId = newTenant();
    }

    private void ingest(RawEventCommand... commands) {
        ingestionService.ingest(tenantId, List.of(commands));
    }

    private MatcherReport matchAt(Instant now) {
        return settlementMatcher.run(new MatchingContext(tenantId, MatchingConfig.defaults(), now));
    }

    private PayoutView onlyPayout() {
        List<PayoutView> payouts = payoutQueryService.findPayouts(tenantId, null, null);
        assertEquals(1, payouts.size());
        return payouts.get(0);
    }

    @Test
    @DisplayName("Matched payout is SETTLED")
    void settledPayout() {
        printTestHeader("Settled payout");

        ingest(payout("po_1", "480.25", "500.00", "2024-03-03", "2024-03-05"),
            bankDeposit("bank-1", "480.25", "2024-03-05", "STRIPE TRANSFER"));
        matchAt(at("2024-03-06"));

        PayoutView view = onlyPayout();
        printOutput("Payout", view);

        assertEquals(PayoutStatus.SETTLED, view.getStatus());
        assertEquals(identitySnapshots.loadAll(tenantId, CanonicalKind.SETTLEMENT).get(0).getId(),
            view.getSettlementIdentityId());
        printSuccess("Settled by " + view.getSettlementIdentityId());
    }

    @Test
    @DisplayName("Overdue payout with an open timing drift stays IN_TRANSIT")
    void overduePayoutIsInTransit() {
        printTestHeader("Overdue payout");

        // Given: no bank record long after the expected arrival
        ingest(payout("po_1", "300.00", null, "2024-03-03", "2024-03-05"));
        MatcherReport report = matchAt(at("2024-03-20"));
        assertEquals(1, report.getRaised().size());
        ExceptionRecord drift = report.getRaised().get(0);
        assertEquals(ExceptionKind.TIMING_DRIFT, drift.getKind());

        // When
        PayoutView view = onlyPayout();
        printOutput("Payout", view);

        // Then
        assertEquals(PayoutStatus.IN_TRANSIT, view.getStatus());
        assertNull(view.getSettlementIdentityId());
        assertEquals(List.of(drift.getId()), view.getOpenExceptionIds());
        printSuccess("Timing drift listed, status IN_TRANSIT");
    }

    @Test
    @DisplayName("Two indistinguishable deposits make the payout AMBIGUOUS")
    void ambiguousPayout() {
        printTestHeader("Ambiguous payout");

        ingest(payout("po_1", "300.00", null, "2024-03-03", "2024-03-05"),
            bankDeposit("bank-a", "300.00", "2024-03-05", "ALPHA CORP"),
            bankDeposit("bank-b", "300.00", "2024-03-05", "BETA CORP"));
        MatcherReport report = matchAt(at("2024-03-06"));
        assertEquals(ExceptionKind.AMBIGUOUS_MATCH, report.getRaised().get(0).getKind());

        PayoutView view = onlyPayout();

        assertEquals(PayoutStatus.AMBIGUOUS, view.getStatus());
        assertEquals(1, view.getOpenExceptionIds().size());
        printSuccess("Payout awaits review");
    }
}
