package com.flagship.cash_ledger.consolidation;

import com.flagship.cash_ledger.config.ConsolidationProperties;
import com.flagship.cash_ledger.graph.EdgeKind;
import com.flagship.cash_ledger.graph.EdgeOrigin;
import com.flagship.cash_ledger.graph.GraphStore;
import com.flagship.cash_ledger.identity.CanonicalKind;
import com.flagship.cash_ledger.identity.IdentitySnapshots;
import com.flagship.cash_ledger.ingest.IngestionService;
import com.flagship.cash_ledger.ingest.dto.RawEventCommand;
import com.flagship.cash_ledger.ledger.CashLedgerEntry;
import com.flagship.cash_ledger.ledger.Direction;
import com.flagship.cash_ledger.ledger.LedgerService;
import com.flagship.cash_ledger.ledger.ProvenancePath;
import com.flagship.cash_ledger.review.EdgeProposal;
import com.flagship.cash_ledger.review.ExceptionKind;
import com.flagship.cash_ledger.review.ExceptionManager;
import com.flagship.cash_ledger.review.ExceptionRecord;
import com.flagship.cash_ledger.review.ExceptionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.flagship.cash_ledger.support.RawEventFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end consolidation tests.
 *
 * These tests verify that:
 * - A settled payout produces exactly one ledger entry, posted at bank time
 * - Reruns are idempotent: no new entries, no new exceptions
 * - A bank record seen before its payout is recorded once and never again
 * - Candidates of an open exception are deferred until it is resolved
 * - Resolving or dismissing an exception releases the deferred settlements
 * - The watermark advances only after a complete run, trailing the run start
 * - An explicit later start never moves the watermark past unconsolidated records
 * - A bank record committed while a run is in flight is picked up by the next run
 * - The ledger nets to the bank-recognized movements, never processor gross
 * - A tenant leased by another instance is skipped until the lease is released or expires
 */
@SpringBootTest
@ActiveProfiles("test")
class ConsolidationServiceTest {

    @Autowired
    private ConsolidationService consolidationService;

    @Autowired
    private IngestionService ingestionService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private ExceptionManager exceptionManager;

    @Autowired
    private GraphStore graphStore;

    @Autowired
    private IdentitySnapshots identitySnapshots;

    @Autowired
    private WatermarkRepository watermarkRepository;

    @Autowired
    private ConsolidationProperties consolidationProperties;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private String tenantId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("  ← " + label + ": " + value);
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

    /** Payout with its charge attached by reference, so composition is settled. */
    private void ingestPayout(String payoutId, String amount) {
        ingest(payout(payoutId, amount, amount, daysAgo(3), daysAgo(1)),
            balanceTransaction("ch_" + payoutId, "CHARGE", amount, daysAgo(4), payoutId, "Jane Doe"));
    }

    @Test
    @DisplayName("Settled payout yields one entry posted at bank time with full provenance")
    void settledPayoutProducesOneEntry() {
        printTestHeader("Payout settlement entry");

        // Given: gross 500.00 less a 14.50 fee arrives as 485.50 at the bank
        ingest(payout("po_1", "485.50", "500.00", daysAgo(4), daysAgo(2)),
            balanceTransaction("ch_1", "CHARGE", "500.00", daysAgo(5), "po_1", "Jane Doe"),
            balanceTransaction("fee_1", "FEE", "-14.50", daysAgo(5), "po_1", null),
            bankDeposit("bank-1", "485.50", daysAgo(2), "STRIPE TRANSFER ACME"));
        printInput("Tenant", tenantId);

        // When
        ConsolidationResult result = consolidationService.consolidate(tenantId, null);
        printOutput("Entries", result.getLedgerEntries());

        // Then
        assertTrue(result.isComplete());
        assertTrue(result.getExceptions().isEmpty());
        assertEquals(1, result.getLedgerEntries().size());
        CashLedgerEntry entry = result.getLedgerEntries().get(0);
        assertEquals(identityOf(CanonicalKind.SETTLEMENT, "bank-1"), entry.getIdentityId());
        assertEquals(at(daysAgo(2)), entry.getPostedAt(), "Posted at bank time, not payout creation");
        assertEquals(0, new BigDecimal("485.50").compareTo(entry.getAmount()));
        assertEquals(Direction.INFLOW, entry.getDirection());
        assertEquals(1.0, entry.getConfidence());
        assertEquals(ProvenancePath.PAYOUT_SETTLEMENT, entry.getProvenance().getPath());
        assertEquals(identityOf(CanonicalKind.PAYOUT, "po_1"), entry.getProvenance().getPayoutIdentityId());
        assertEquals(2, entry.getProvenance().getComposedOf().size());
        assertEquals(1, ledgerService.countByTenant(tenantId), "Charges and fees never become entries");
        printSuccess("One PAYOUT_SETTLEMENT entry for the bank deposit");
    }

    @Test
    @DisplayName("Rerunning consolidation changes nothing")
    void rerunIsIdempotent() {
        printTestHeader("Idempotent consolidation");

        ingestPayout("po_1", "300.00");
        ingest(bankDeposit("bank-1", "300.00", daysAgo(1), "ACME"));
        consolidationService.consolidate(tenantId, null);

        ConsolidationResult rerun = consolidationService.consolidate(tenantId, null);
        printOutput("Rerun", rerun);

        assertEquals(0, rerun.getEdgesCreated());
        assertTrue(rerun.getLedgerEntries().isEmpty());
        assertTrue(rerun.getExceptions().isEmpty());
        assertEquals(1, ledgerService.countByTenant(tenantId));
        printSuccess("Full rerun from the beginning wrote nothing");
    }

    @Test
    @DisplayName("Bank record without a payout is recorded directly with its link confidence")
    void directSettlement() {
        printTestHeader("Direct settlement");

        ingest(bankDeposit("bank-in", "1200.00", daysAgo(1), "CLIENT WIRE ACME"),
            bankDeposit("bank-out", "-45.00", daysAgo(1), null));

        ConsolidationResult result = consolidationService.consolidate(tenantId, null);

        assertEquals(2, result.getLedgerEntries().size());
        CashLedgerEntry inflow = ledgerService.findByIdentity(tenantId, identityOf(CanonicalKind.SETTLEMENT, "bank-in")).orElseThrow();
        CashLedgerEntry outflow = ledgerService.findByIdentity(tenantId, identityOf(CanonicalKind.SETTLEMENT, "bank-out")).orElseThrow();
        assertEquals(ProvenancePath.DIRECT_SETTLEMENT, inflow.getProvenance().getPath());
        assertEquals(1.0, inflow.getConfidence());
        assertEquals(Direction.OUTFLOW, outflow.getDirection());
        assertEquals(0.5, outflow.getConfidence(), "Missing counterparty lowers confidence");
        printSuccess("Two direct entries");
    }

    @Test
    @DisplayName("Bank record recorded before its payout is never counted twice")
    void settlementBeforePayout() {
        printTestHeader("Settlement before payout");

        ingest(bankDeposit("bank-1", "300.00", daysAgo(1), "ACME"));
        ConsolidationResult first = consolidationService.consolidate(tenantId, null);
        assertEquals(1, first.getLedgerEntries().size());

        ingestPayout("po_1", "300.00");
        ConsolidationResult second = consolidationService.consolidateFromWatermark(tenantId);
        printOutput("Second run", second);

        UUID settlementId = identityOf(CanonicalKind.SETTLEMENT, "bank-1");
        assertTrue(graphStore.hasIncoming(tenantId, settlementId, EdgeKind.SETTLES), "Payout is still linked");
        assertTrue(second.getLedgerEntries().isEmpty());
        assertEquals(1, ledgerService.countByTenant(tenantId));
        assertEquals(ProvenancePath.DIRECT_SETTLEMENT,
            ledgerService.findByIdentity(tenantId, settlementId).orElseThrow().getProvenance().getPath());
        printSuccess("Entry stays DIRECT, no double count");
    }

    @Test
    @DisplayName("Ambiguous settlement is deferred until a reviewer resolves it")
    void deferralAndResolution() {
        printTestHeader("Deferral and resolution");

        // Given: two indistinguishable deposits for one payout
        ingestPayout("po_1", "300.00");
        ingest(bankDeposit("bank-a", "300.00", daysAgo(1), "ALPHA CORP"),
            bankDeposit("bank-b", "300.00", daysAgo(1), "BETA CORP"));
        UUID payoutId = identityOf(CanonicalKind.PAYOUT, "po_1");
        UUID bankA = identityOf(CanonicalKind.SETTLEMENT, "bank-a");
        UUID bankB = identityOf(CanonicalKind.SETTLEMENT, "bank-b");

        // When: the first run can only ask
        ConsolidationResult first = consolidationService.consolidate(tenantId, null);
        printOutput("First run", first);

        // Then
        assertTrue(first.getLedgerEntries().isEmpty());
        assertEquals(1, first.getExceptions().size());
        ExceptionRecord exception = first.getExceptions().get(0);
        assertEquals(ExceptionKind.AMBIGUOUS_MATCH, exception.getKind());
        assertTrue(first.getDeferredIdentityIds().containsAll(List.of(bankA, bankB)));

        // When: the reviewer picks bank-a
        exceptionManager.resolve(exception.getId(), List.of(new EdgeProposal(payoutId, bankA, EdgeKind.SETTLES)),
            "matched on remittance advice");
        ConsolidationResult second = consolidationService.consolidateFromWatermark(tenantId);
        printOutput("Second run", second);

        // Then
        assertEquals(2, second.getLedgerEntries().size());
        CashLedgerEntry chosen = ledgerService.findByIdentity(tenantId, bankA).orElseThrow();
        assertEquals(ProvenancePath.PAYOUT_SETTLEMENT, chosen.getProvenance().getPath());
        assertEquals(EdgeOrigin.REVIEW, chosen.getProvenance().getSettlesEdge().getOrigin());
        assertEquals(ProvenancePath.DIRECT_SETTLEMENT,
            ledgerService.findByIdentity(tenantId, bankB).orElseThrow().getProvenance().getPath());
        assertEquals(ExceptionStatus.RESOLVED, exceptionManager.get(exception.getId()).getStatus());
        printSuccess("bank-a settles the payout, bank-b is direct");
    }

    @Test
    @DisplayName("Dismissed exception releases its candidates and is not raised again")
    void dismissalReleasesCandidates() {
        printTestHeader("Dismissal");

        ingestPayout("po_1", "300.00");
        ingest(bankDeposit("bank-a", "300.00", daysAgo(1), "ALPHA CORP"),
            bankDeposit("bank-b", "300.00", daysAgo(1), "BETA CORP"));
        ExceptionRecord exception = consolidationService.consolidate(tenantId, null).getExceptions().get(0);

        exceptionManager.resolve(exception.getId(), List.of(), "neither deposit is this payout");
        ConsolidationResult second = consolidationService.consolidateFromWatermark(tenantId);

        assertEquals(2, second.getLedgerEntries().size());
        assertTrue(second.getLedgerEntries().stream()
            .allMatch(e -> e.getProvenance().getPath() == ProvenancePath.DIRECT_SETTLEMENT));
        assertTrue(exceptionManager.list(tenantId, ExceptionKind.AMBIGUOUS_MATCH, ExceptionStatus.OPEN).isEmpty(),
            "Same question with the same candidates stays suppressed");
        printSuccess("Both deposits recorded directly");
    }

    @Test
    @DisplayName("Watermark advances after a complete run")
    void watermarkAdvances() {
        printTestHeader("Watermark");

        ingest(bankDeposit("bank-1", "10.00", daysAgo(1), "ACME"));
        Instant before = Instant.now();

        ConsolidationResult first = consolidationService.consolidateFromWatermark(tenantId);
        Instant stored = watermarkRepository.find(tenantId).orElseThrow();
        ConsolidationResult second = consolidationService.consolidateFromWatermark(tenantId);

        Duration lag = consolidationProperties.getWatermarkLag();
        assertEquals(Instant.EPOCH, first.getSince());
        assertFalse(stored.isBefore(before.minus(lag).minusSeconds(1)));
        assertTrue(stored.isBefore(Instant.now().minus(lag).plusSeconds(1)), "Watermark trails the run start by the lag");
        assertEquals(stored, first.getWatermark());
        assertEquals(stored, second.getSince());
        assertTrue(second.getLedgerEntries().isEmpty());
        assertFalse(watermarkRepository.find(tenantId).orElseThrow().isBefore(stored));
        printSuccess("Second run started from " + stored);
    }

    @Test
    @DisplayName("Explicit later start on a fresh tenant leaves earlier records to the next run")
    void explicitSinceKeepsWatermark() {
        printTestHeader("Explicit since");

        // Given: a deposit recorded before the requested start
        ingest(bankDeposit("bank-1", "250.00", daysAgo(1), "ACME"));

        // When: an on-demand run starts after it
        ConsolidationResult onDemand = consolidationService.consolidate(tenantId, Instant.now().plusSeconds(1));
        printOutput("On demand", onDemand);

        // Then: nothing is posted and the watermark has not moved past the deposit
        assertTrue(onDemand.isComplete());
        assertTrue(onDemand.getLedgerEntries().isEmpty());
        assertEquals(Instant.EPOCH, onDemand.getWatermark());
        assertEquals(Instant.EPOCH, watermarkRepository.find(tenantId).orElse(Instant.EPOCH));

        // And: the next run from the watermark posts it
        ConsolidationResult scheduled = consolidationService.consolidateFromWatermark(tenantId);
        assertEquals(1, scheduled.getLedgerEntries().size());
        assertEquals(1, ledgerService.countByTenant(tenantId));
        printSuccess("Deposit posted by the run from the watermark");
    }

    @Test
    @DisplayName("Bank record committed while a run is in flight is consolidated by the next run")
    void ingestionCommittedDuringRun() throws Exception {
        printTestHeader("Ingestion during a run");

        TransactionTemplate ingestion = new TransactionTemplate(transactionManager);
        ExecutorService runner = Executors.newSingleThreadExecutor();
        try {
            // Given: a deposit stamped inside a transaction that is still open
            ConsolidationResult during = ingestion.execute(status -> {
                ingest(bankDeposit("bank-late", "80.00", daysAgo(1), "ACME"));
                // When: a run starts and finishes before the commit
                try {
                    return runner.submit(() -> consolidationService.consolidateFromWatermark(tenantId))
                        .get(30, TimeUnit.SECONDS);
                } catch (InterruptedException | ExecutionException | TimeoutException e) {
                    throw new IllegalStateException(e);
                }
            });
            printOutput("During", during);

            // Then: that run could not see it
            assertTrue(during.getLedgerEntries().isEmpty());
        } finally {
            runner.shutdownNow();
        }

        // And: the next run does, exactly once
        ConsolidationResult after = consolidationService.consolidateFromWatermark(tenantId);
        ConsolidationResult again = consolidationService.consolidateFromWatermark(tenantId);
        assertEquals(1, after.getLedgerEntries().size());
        assertEquals(identityOf(CanonicalKind.SETTLEMENT, "bank-late"), after.getLedgerEntries().get(0).getIdentityId());
        assertTrue(again.getLedgerEntries().isEmpty());
        assertEquals(1, ledgerService.countByTenant(tenantId));
        printSuccess("Late commit posted once");
    }

    @Test
    @DisplayName("Ledger total equals the bank-recognized net movement, never processor gross")
    void noDoubleCounting() {
        printTestHeader("No double counting");

        // Given: gross 300.00 less a 10.00 fee paid out as 290.00, a check, a rent payment
        // and an ops payment for one of the charges
        ingest(payout("po_1", "290.00", "300.00", daysAgo(3), daysAgo(1)),
            balanceTransaction("ch_1", "CHARGE", "200.00", daysAgo(4), "po_1", "Jane Doe"),
            balanceTransaction("ch_2", "CHARGE", "100.00", daysAgo(4), "po_1", "John Roe"),
            balanceTransaction("fee_1", "FEE", "-10.00", daysAgo(4), "po_1", null),
            opsPayment("pay_1", "200.00", at(daysAgo(4)), "paid", "ch_1", "Jane Doe", null),
            bankDeposit("bank-payout", "290.00", daysAgo(1), "STRIPE TRANSFER"),
            bankDeposit("bank-check", "75.00", daysAgo(2), "CHECK DEPOSIT SMITH"),
            bankDeposit("bank-rent", "-40.00", daysAgo(2), "RENT"));
        BigDecimal bankNet = new BigDecimal("325.00");
        Instant from = at(daysAgo(6));
        Instant to = Instant.now().plusSeconds(60);

        // When: consolidated twice
        consolidationService.consolidate(tenantId, null);
        consolidationService.consolidate(tenantId, null);

        // Then
        List<CashLedgerEntry> entries = ledgerService.findByTenantAndRange(tenantId, from, to);
        BigDecimal ledgerNet = entries.stream()
            .map(CashLedgerEntry::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        long outflows = entries.stream().filter(e -> e.getDirection() == Direction.OUTFLOW).count();
        printOutput("Ledger net", ledgerNet);
        assertEquals(3, entries.size());
        assertEquals(1, outflows);
        assertEquals(0, bankNet.compareTo(ledgerNet), "Ledger nets to the bank movements");
        assertNotEquals(0, new BigDecimal("335.00").compareTo(ledgerNet), "Processor gross is never recognized");
        printSuccess("Ledger net " + ledgerNet + " equals bank net");
    }

    @Test
    @DisplayName("Tenant leased by another instance is skipped until the lease is released")
    void leasedTenantIsSkipped() {
        printTestHeader("Tenant lease");

        ingest(bankDeposit("bank-1", "10.00", daysAgo(1), "ACME"));
        UUID otherInstance = UUID.randomUUID();
        Instant now = Instant.now();
        assertTrue(watermarkRepository.tryAcquireLease(tenantId, otherInstance, now, now.plusSeconds(600)));

        Optional<ConsolidationResult> skipped = consolidationService.tryConsolidateFromWatermark(tenantId);
        assertTrue(skipped.isEmpty());
        assertEquals(0, ledgerService.countByTenant(tenantId));

        watermarkRepository.releaseLease(tenantId, otherInstance);
        Optional<ConsolidationResult> ran = consolidationService.tryConsolidateFromWatermark(tenantId);
        assertTrue(ran.isPresent());
        assertEquals(1, ran.get().getLedgerEntries().size());
        assertTrue(watermarkRepository.tryAcquireLease(tenantId, otherInstance, Instant.now(), Instant.now().plusSeconds(1)),
            "Lease released after the run");
        printSuccess("Run waited for the other instance");
    }

    @Test
    @DisplayName("Expired lease of a crashed instance is taken over")
    void expiredLeaseIsTakenOver() {
        printTestHeader("Expired lease");

        ingest(bankDeposit("bank-1", "10.00", daysAgo(1), "ACME"));
        Instant now = Instant.now();
        assertTrue(watermarkRepository.tryAcquireLease(tenantId, UUID.randomUUID(), now.minusSeconds(900), now.minusSeconds(1)));

        ConsolidationResult result = consolidationService.consolidateFromWatermark(tenantId);

        assertEquals(1, result.getLedgerEntries().size());
        printSuccess("Stale lease did not block the tenant");
    }
}
