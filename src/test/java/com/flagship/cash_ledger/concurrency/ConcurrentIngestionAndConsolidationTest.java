package com.flagship.cash_ledger.concurrency;

import com.flagship.cash_ledger.consolidation.ConsolidationResult;
import com.flagship.cash_ledger.consolidation.ConsolidationService;
import com.flagship.cash_ledger.consolidation.LedgerPassResult;
import com.flagship.cash_ledger.consolidation.SettlementConsolidator;
import com.flagship.cash_ledger.identity.CanonicalKind;
import com.flagship.cash_ledger.identity.Identity;
import com.flagship.cash_ledger.identity.IdentityRepository;
import com.flagship.cash_ledger.ingest.IngestionResult;
import com.flagship.cash_ledger.ingest.IngestionService;
import com.flagship.cash_ledger.ingest.dto.RawEventCommand;
import com.flagship.cash_ledger.ledger.CashLedgerEntry;
import com.flagship.cash_ledger.ledger.LedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static com.flagship.cash_ledger.support.RawEventFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Races against a real PostgreSQL.
 *
 * These tests verify that:
 * - Redelivering the same batch from many threads stores each record once
 * - Two feeds reporting one deposit at the same time converge on one identity
 * - Ledger passes running side by side write one entry per settlement
 * - Consolidation runs for one tenant are serialized
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ConcurrentIngestionAndConsolidationTest {

    private static final int THREADS = 8;

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("cash_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @Autowired
    private IngestionService ingestionService;

    @Autowired
    private IdentityRepository identityRepository;

    @Autowired
    private SettlementConsolidator settlementConsolidator;

    @Autowired
    private ConsolidationService consolidationService;

    @Autowired
    private LedgerService ledgerService;

    private String tenantId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("CONCURRENCY SCENARIO: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ VERIFIED: " + message);
    }

    @BeforeEach
    void setUp() {
        tenantId = newTenant();
    }

    /**
     * Starts all tasks together and waits for them to finish.
     */
    private <T> List<T> race(List<Supplier<T>> tasks) throws InterruptedException {
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(tasks.size());
        List<T> results = Collections.synchronizedList(new ArrayList<>());
        List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        try {
            for (Supplier<T> task : tasks) {
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        results.add(task.get());
                    } catch (Throwable t) {
                        failures.add(t);
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }
            startLatch.countDown();
            assertTrue(doneLatch.await(60, TimeUnit.SECONDS), "Tasks did not finish in time");
        } finally {
            executor.shutdownNow();
        }
        assertTrue(failures.isEmpty(), () -> "Tasks failed: " + failures);
        return results;
    }

    @Test
    @DisplayName("Redelivered batch raced from many threads is stored once")
    void redeliveryRace() throws InterruptedException {
        printTestHeader("Redelivery race");

        List<RawEventCommand> batch = List.of(
            bankDeposit("bank-1", "100.00", daysAgo(2), "ACME"),
            bankDeposit("bank-2", "250.00", daysAgo(2), "GLOBEX"),
            payout("po_1", "100.00", "100.00", daysAgo(4), daysAgo(2)));
        List<Supplier<IngestionResult>> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            tasks.add(() -> ingestionService.ingest(tenantId, batch));
        }

        List<IngestionResult> results = race(tasks);

        assertEquals(3, results.stream().mapToInt(IngestionResult::getStored).sum());
        assertEquals(3 * (THREADS - 1), results.stream().mapToInt(IngestionResult::getDeduplicated).sum());
        assertEquals(2, identityRepository.findByKind(tenantId, CanonicalKind.SETTLEMENT).size());
        assertEquals(1, identityRepository.findByKind(tenantId, CanonicalKind.PAYOUT).size());
        printSuccess("Three records stored across " + THREADS + " deliveries");
    }

    @Test
    @DisplayName("Two feeds reporting the same deposits converge on one identity each")
    void crossFeedRace() throws InterruptedException {
        printTestHeader("Cross-feed race");

        int deposits = 20;
        List<Supplier<IngestionResult>> tasks = new ArrayList<>();
        for (int i = 0; i < deposits; i++) {
            String amount = (100 + i) + ".00";
            RawEventCommand direct = bankDeposit("A-" + i, amount, daysAgo(3), "ACME LLC");
            RawEventCommand aggregated = bankDeposit("txn-" + i, amount, daysAgo(3), "ACME LLC TRANSFER");
            aggregated.setSource("plaid");
            tasks.add(() -> ingestionService.ingest(tenantId, List.of(direct)));
            tasks.add(() -> ingestionService.ingest(tenantId, List.of(aggregated)));
        }

        race(tasks);

        List<Identity> settlements = identityRepository.findByKind(tenantId, CanonicalKind.SETTLEMENT);
        assertEquals(deposits, settlements.size());
        for (Identity settlement : settlements) {
            assertEquals(2, identityRepository.findLinks(settlement.getId()).size(),
                "Both feeds link to " + settlement.getId());
        }
        printSuccess(deposits + " identities, two links each");
    }

    @Test
    @DisplayName("Ledger passes racing on one tenant write one entry per settlement")
    void ledgerPassRace() throws InterruptedException {
        printTestHeader("Ledger pass race");

        int deposits = 15;
        List<RawEventCommand> batch = new ArrayList<>();
        for (int i = 0; i < deposits; i++) {
            batch.add(bankDeposit("bank-" + i, (10 + i) + ".00", daysAgo(2), "CUSTOMER " + i));
        }
        ingestionService.ingest(tenantId, batch);

        List<Supplier<LedgerPassResult>> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            tasks.add(() -> settlementConsolidator.run(tenantId, Instant.EPOCH));
        }
        List<LedgerPassResult> results = race(tasks);

        Set<UUID> written = ConcurrentHashMap.newKeySet();
        AtomicInteger total = new AtomicInteger();
        for (LedgerPassResult result : results) {
            assertTrue(result.getFailedIdentityIds().isEmpty());
            for (CashLedgerEntry entry : result.getEntries()) {
                total.incrementAndGet();
                written.add(entry.getIdentityId());
            }
        }
        assertEquals(deposits, total.get(), "Each settlement reported as written exactly once");
        assertEquals(deposits, written.size());
        assertEquals(deposits, ledgerService.findByTenantAndRange(tenantId, null, null).size());
        printSuccess(deposits + " entries from " + THREADS + " passes");
    }

    @Test
    @DisplayName("Concurrent consolidation requests for one tenant do not duplicate work")
    void consolidationRace() throws InterruptedException {
        printTestHeader("Consolidation race");

        ingestionService.ingest(tenantId, List.of(
            payout("po_1", "300.00", "300.00", daysAgo(4), daysAgo(2)),
            balanceTransaction("ch_1", "CHARGE", "300.00", daysAgo(5), "po_1", "Jane Doe"),
            bankDeposit("bank-a", "300.00", daysAgo(2), "STRIPE TRANSFER"),
            bankDeposit("bank-b", "42.00", daysAgo(2), "REFUND")));

        List<Supplier<ConsolidationResult>> tasks = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            tasks.add(() -> consolidationService.consolidate(tenantId, null));
        }
        List<ConsolidationResult> results = race(tasks);

        assertEquals(2, results.stream().mapToInt(r -> r.getLedgerEntries().size()).sum());
        assertEquals(1, results.stream().mapToInt(ConsolidationResult::getEdgesCreated).filter(n -> n > 0).count(),
            "Only the first run finds edges to create");
        assertEquals(2, ledgerService.findByTenantAndRange(tenantId, null, null).size());
        printSuccess("Two entries, edges created once");
    }
}
