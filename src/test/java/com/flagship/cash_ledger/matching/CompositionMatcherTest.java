package com.flagship.cash_ledger.matching;

import com.flagship.cash_ledger.graph.EdgeKind;
import com.flagship.cash_ledger.graph.GraphStore;
import com.flagship.cash_ledger.graph.IdentityEdge;
import com.flagship.cash_ledger.identity.CanonicalKind;
import com.flagship.cash_ledger.identity.IdentitySnapshots;
import com.flagship.cash_ledger.ingest.IngestionService;
import com.flagship.cash_ledger.ingest.dto.RawEventCommand;
import com.flagship.cash_ledger.review.ExceptionKind;
import com.flagship.cash_ledger.review.ExceptionRecord;
import com.flagship.cash_ledger.review.context.AmbiguousMatchContext;
import com.flagship.cash_ledger.review.context.NoMatchContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.flagship.cash_ledger.support.RawEventFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Payout composition tests.
 *
 * These tests verify that:
 * - Line items carrying a payout reference are attached directly
 * - A unique subset of unattached line items summing to the gross is attached
 * - Several subsets raise AMBIGUOUS_MATCH listing them, one exception per payout
 * - NO_MATCH waits until the payout is settled or overdue
 */
@SpringBootTest
@ActiveProfiles("test")
class CompositionMatcherTest {

    @Autowired
    private CompositionMatcher matcher;

    @Autowired
    private IngestionService ingestionService;

    @Autowired
    private IdentitySnapshots identitySnapshots;

    @Autowired
    private GraphStore graphStore;

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

    private UUID identityOf(CanonicalKind kind, String externalId) {
        return identitySnapshots.loadAll(tenantId, kind).stream()
            .filter(s -> s.externalIds().contains(externalId))
            .findFirst()
            .orElseThrow()
            .getId();
    }

    private MatchingContext contextAt(Instant now) {
        return new MatchingContext(tenantId, MatchingConfig.defaults(), now);
    }

    private Set<UUID> composedOf(UUID payoutId) {
        return graphStore.incoming(tenantId, payoutId, EdgeKind.COMPOSED_OF).stream()
            .map(IdentityEdge::getFromIdentityId)
            .collect(Collectors.toSet());
    }

    @Test
    @DisplayName("Line items with an explicit payout reference are attached at full weight")
    void explicitReferences() {
        printTestHeader("Explicit composition");

        ingest(payout("po_1", "97.10", "100.00", "2024-03-05", "2024-03-07"),
            balanceTransaction("ch_1", "CHARGE", "100.00", "2024-03-02", "po_1", "Jane Doe"),
            balanceTransaction("fee_1", "FEE", "-2.90", "2024-03-02", "po_1", null));

        MatcherReport report = matcher.run(contextAt(at("2024-03-06")));
        printOutput("Report", report);

        UUID payoutId = identityOf(CanonicalKind.PAYOUT, "po_1");
        assertEquals(2, report.getEdges().size());
        assertTrue(report.getEdges().stream().allMatch(e -> e.getWeight() == 1.0));
        assertEquals(Set.of(identityOf(CanonicalKind.CHARGE, "ch_1"), identityOf(CanonicalKind.FEE, "fee_1")),
            composedOf(payoutId));
        printSuccess("Charge and fee attached to " + payoutId);
    }

    @Test
    @DisplayName("Unique subset summing to the gross is attached")
    void uniqueSubset() {
        printTestHeader("Subset-sum composition");

        // Given: 100.00 + 57.25 - 2.90 = 154.35, the 33.10 charge belongs elsewhere
        ingest(payout("po_1", "154.35", "154.35", "2024-03-05", "2024-03-07"),
            balanceTransaction("ch_1", "CHARGE", "100.00", "2024-03-02", null, "Jane Doe"),
            balanceTransaction("ch_2", "CHARGE", "57.25", "2024-03-03", null, "John Roe"),
            balanceTransaction("fee_1", "FEE", "-2.90", "2024-03-04", null, null),
            balanceTransaction("ch_3", "CHARGE", "33.10", "2024-03-04", null, "Ann Poe"));

        MatcherReport report = matcher.run(contextAt(at("2024-03-06")));

        UUID payoutId = identityOf(CanonicalKind.PAYOUT, "po_1");
        assertEquals(3, report.getEdges().size());
        assertTrue(report.getEdges().stream().allMatch(e -> e.getWeight() == CompositionMatcher.SUBSET_WEIGHT));
        Set<UUID> items = composedOf(payoutId);
        assertTrue(items.contains(identityOf(CanonicalKind.CHARGE, "ch_1")));
        assertTrue(items.contains(identityOf(CanonicalKind.FEE, "fee_1")));
        assertFalse(items.contains(identityOf(CanonicalKind.CHARGE, "ch_3")));

        MatcherReport rerun = matcher.run(contextAt(at("2024-03-06")));
        assertTrue(rerun.getEdges().isEmpty(), "Composed payout is not reconsidered");
        printSuccess("Three line items attached");
    }

    @Test
    @DisplayName("Several equal subsets raise AMBIGUOUS_MATCH")
    void ambiguousSubsets() {
        printTestHeader("Ambiguous composition");

        ingest(payout("po_1", "20.00", "20.00", "2024-03-05", "2024-03-07"),
            balanceTransaction("ch_1", "CHARGE", "10.00", "2024-03-03", null, null),
            balanceTransaction("ch_2", "CHARGE", "10.00", "2024-03-04", null, null),
            balanceTransaction("ch_3", "CHARGE", "20.00", "2024-03-04", null, null));

        MatcherReport report = matcher.run(contextAt(at("2024-03-06")));

        assertTrue(report.getEdges().isEmpty());
        assertEquals(1, report.getRaised().size());
        ExceptionRecord exception = report.getRaised().get(0);
        assertEquals(ExceptionKind.AMBIGUOUS_MATCH, exception.getKind());
        AmbiguousMatchContext context = assertInstanceOf(AmbiguousMatchContext.class, exception.getContext());
        assertEquals(2, context.getSubsets().size());
        assertFalse(context.isSubsetsTruncated());
        assertEquals(0, new BigDecimal("20.00").compareTo(context.getSubjectAmount()));
        printSuccess("Both subsets offered for review");
    }

    @Test
    @DisplayName("Gross of 973.00 is composed of exactly 500.00, 450.00 and 23.00")
    void composedGross() {
        printTestHeader("Composition of 973.00");

        // Given: the three line items plus two that fit no combination
        ingest(payout("po_1", "973.00", "973.00", "2024-03-05", "2024-03-07"),
            balanceTransaction("ch_500", "CHARGE", "500.00", "2024-03-02", null, "Jane Doe"),
            balanceTransaction("ch_450", "CHARGE", "450.00", "2024-03-03", null, "John Roe"),
            balanceTransaction("ch_23", "CHARGE", "23.00", "2024-03-03", null, "Ann Poe"),
            balanceTransaction("ch_120", "CHARGE", "120.00", "2024-03-04", null, "Bob Smith"),
            balanceTransaction("ch_37", "CHARGE", "37.50", "2024-03-04", null, "Eve Doe"));

        // When
        MatcherReport report = matcher.run(contextAt(at("2024-03-06")));
        printOutput("Report", report);

        // Then
        UUID payoutId = identityOf(CanonicalKind.PAYOUT, "po_1");
        assertTrue(report.getRaised().isEmpty());
        assertEquals(3, report.getEdges().size());
        assertTrue(report.getEdges().stream().allMatch(e -> e.getWeight() == CompositionMatcher.SUBSET_WEIGHT));
        assertEquals(Set.of(identityOf(CanonicalKind.CHARGE, "ch_500"), identityOf(CanonicalKind.CHARGE, "ch_450"),
            identityOf(CanonicalKind.CHARGE, "ch_23")), composedOf(payoutId));
        printSuccess("500.00 + 450.00 + 23.00 attached");
    }

    @Test
    @DisplayName("Adding a 473.00 item makes 973.00 ambiguous between two subsets")
    void composedGrossAmbiguous() {
        printTestHeader("Ambiguous composition of 973.00");

        // Given: 500 + 450 + 23 and 500 + 473 both reach the gross
        ingest(payout("po_1", "973.00", "973.00", "2024-03-05", "2024-03-07"),
            balanceTransaction("ch_500", "CHARGE", "500.00", "2024-03-02", null, "Jane Doe"),
            balanceTransaction("ch_450", "CHARGE", "450.00", "2024-03-03", null, "John Roe"),
            balanceTransaction("ch_23", "CHARGE", "23.00", "2024-03-03", null, "Ann Poe"),
            balanceTransaction("ch_473", "CHARGE", "473.00", "2024-03-04", null, "Bob Smith"));

        // When
        MatcherReport report = matcher.run(contextAt(at("2024-03-06")));

        // Then: nothing attached, one question listing both subsets
        UUID payoutId = identityOf(CanonicalKind.PAYOUT, "po_1");
        assertTrue(report.getEdges().isEmpty());
        assertTrue(composedOf(payoutId).isEmpty());
        assertEquals(1, report.getRaised().size());
        ExceptionRecord exception = report.getRaised().get(0);
        assertEquals(ExceptionKind.AMBIGUOUS_MATCH, exception.getKind());
        AmbiguousMatchContext context = assertInstanceOf(AmbiguousMatchContext.class, exception.getContext());
        assertEquals(2, context.getSubsets().size());
        assertEquals(0, new BigDecimal("973.00").compareTo(context.getSubjectAmount()));

        MatcherReport rerun = matcher.run(contextAt(at("2024-03-06")));
        assertTrue(rerun.getRaised().isEmpty(), "Same question is not raised twice");
        printSuccess("Both subsets offered for review");
    }

    @Test
    @DisplayName("NO_MATCH waits until the payout is overdue")
    void noMatchOnlyWhenOverdue() {
        printTestHeader("No composition");

        ingest(payout("po_1", "50.00", "50.00", "2024-03-05", "2024-03-07"),
            balanceTransaction("ch_1", "CHARGE", "30.00", "2024-03-04", null, null));

        MatcherReport early = matcher.run(contextAt(at("2024-03-08")));
        MatcherReport overdue = matcher.run(contextAt(at("2024-03-20")));

        assertTrue(early.getRaised().isEmpty());
        assertEquals(1, overdue.getRaised().size());
        NoMatchContext context = assertInstanceOf(NoMatchContext.class, overdue.getRaised().get(0).getContext());
        assertEquals(CompositionMatcher.NAME, context.getMatcher());
        assertEquals(1, context.getConsidered().size());
        printSuccess("NO_MATCH raised once overdue");
    }

    @Test
    @DisplayName("Line items from another source or outside the lookback are not candidates")
    void candidateFilter() {
        printTestHeader("Candidate filter");

        RawEventCommand otherSource = balanceTransaction("ch_sq", "CHARGE", "40.00", "2024-03-04", null, null);
        otherSource.setSource("square");
        ingest(payout("po_1", "40.00", "40.00", "2024-03-15", "2024-03-17"),
            otherSource,
            balanceTransaction("ch_old", "CHARGE", "40.00", "2024-03-01", null, null));

        MatcherReport report = matcher.run(contextAt(at("2024-03-16")));

        assertTrue(report.getEdges().isEmpty());
        printSuccess("Neither line item was eligible");
    }
}
