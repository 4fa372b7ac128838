package com.flagship.cash_ledger.consolidation;

import com.flagship.cash_ledger.config.ConsolidationProperties;
import com.flagship.cash_ledger.config.MatchingProperties;
import com.flagship.cash_ledger.matching.MatcherReport;
import com.flagship.cash_ledger.matching.MatchingContext;
import com.flagship.cash_ledger.matching.MatchingRun;
import com.flagship.cash_ledger.matching.MatchingService;
import com.flagship.cash_ledger.observability.CashLedgerMetrics;
import com.flagship.cash_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs the matchers and then the ledger pass for one tenant.
 *
 * Runs for the same tenant are serialized through a lease on the tenant's
 * watermark row, so they stay serial across instances; different tenants
 * proceed in parallel. A run is safe to repeat: matchers only add missing
 * evidence and the ledger is keyed on identity. The watermark advances only
 * when every matcher and every settlement succeeded, and then only to the run
 * start minus {@code consolidation.watermark-lag}, so identities stamped just
 * before the run but committed after it are read again next time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsolidationService {

    private static final long LEASE_POLL_MILLIS = 100;

    private final MatchingService matchingService;
    private final SettlementConsolidator settlementConsolidator;
    private final WatermarkRepository watermarkRepository;
    private final MatchingProperties matchingProperties;
    private final ConsolidationProperties consolidationProperties;
    private final CashLedgerMetrics metrics;
    private final Clock clock;

    /**
     * Consolidates identities touched at or after {@code since}; null means everything.
     * A {@code since} past the stored watermark leaves the watermark where it is.
     *
     * @throws IllegalStateException if another run holds the tenant past the lease wait
     */
    public ConsolidationResult consolidate(String tenantId, Instant since) {
        Instant from = since == null ? Instant.EPOCH : since;
        return withLease(tenantId, awaitLease(tenantId), () -> run(tenantId, from));
    }

    /**
     * Consolidates from the stored watermark, or from the beginning on the first run.
     *
     * @throws IllegalStateException if another run holds the tenant past the lease wait
     */
    public ConsolidationResult consolidateFromWatermark(String tenantId) {
        return withLease(tenantId, awaitLease(tenantId), () -> run(tenantId, storedWatermark(tenantId)));
    }

    /**
     * Like {@link #consolidateFromWatermark} but returns empty at once when
     * another run holds the tenant.
     */
    public Optional<ConsolidationResult> tryConsolidateFromWatermark(String tenantId) {
        UUID owner = UUID.randomUUID();
        if (!acquire(tenantId, owner)) {
            log.debug("Tenant {} is being consolidated elsewhere; skipping", tenantId);
            return Optional.empty();
        }
        return Optional.of(withLease(tenantId, owner, () -> run(tenantId, storedWatermark(tenantId))));
    }

    private UUID awaitLease(String tenantId) {
        UUID owner = UUID.randomUUID();
        Instant deadline = clock.instant().plus(consolidationProperties.getLeaseWait());
        while (!acquire(tenantId, owner)) {
            if (clock.instant().isAfter(deadline)) {
                throw new IllegalStateException("Consolidation already running for tenant " + tenantId);
            }
            try {
                Thread.sleep(LEASE_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for tenant " + tenantId, e);
            }
        }
        return owner;
    }

    private boolean acquire(String tenantId, UUID owner) {
        Instant now = clock.instant();
        return watermarkRepository.tryAcquireLease(tenantId, owner, now,
            now.plus(consolidationProperties.getLeaseDuration()));
    }

    private ConsolidationResult withLease(String tenantId, UUID owner, Supplier<ConsolidationResult> work) {
        MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, tenantId);
        try {
            return metrics.timeConsolidation(work);
        } finally {
            watermarkRepository.releaseLease(tenantId, owner);
            MDC.remove(CorrelationContext.TENANT_ID_MDC_KEY);
        }
    }

    private Instant storedWatermark(String tenantId) {
        return watermarkRepository.find(tenantId).orElse(Instant.EPOCH);
    }

    private ConsolidationResult run(String tenantId, Instant since) {
        Instant runStartedAt = clock.instant();
        log.info("Consolidation started: tenantId={}, since={}", tenantId, since);

        MatchingRun matching = matchingService.runAll(new MatchingContext(tenantId, matchingProperties.toConfig(), runStartedAt));
        LedgerPassResult ledger = settlementConsolidator.run(tenantId, since);

        ConsolidationResult.ConsolidationResultBuilder result = ConsolidationResult.builder()
            .tenantId(tenantId)
            .since(since)
            .edgesCreated(matching.edgesCreated())
            .ledgerEntries(ledger.getEntries())
            .deferredIdentityIds(ledger.getDeferredIdentityIds())
            .failedIdentityIds(ledger.getFailedIdentityIds())
            .failedMatchers(matching.getFailedMatchers());
        for (MatcherReport report : matching.getReports()) {
            result.exceptions(report.getRaised());
        }

        boolean complete = !matching.hasFailures() && ledger.getFailedIdentityIds().isEmpty();
        Instant watermark = storedWatermark(tenantId);
        if (!complete) {
            log.warn("Consolidation incomplete for tenant {}: failedMatchers={}, failedIdentities={}; watermark stays at {}",
                tenantId, matching.getFailedMatchers(), ledger.getFailedIdentityIds().size(), watermark);
        } else if (since.isAfter(watermark)) {
            log.info("Run since {} is past the watermark {} of tenant {}; watermark unchanged", since, watermark, tenantId);
        } else {
            Instant next = runStartedAt.minus(consolidationProperties.getWatermarkLag());
            if (next.isAfter(watermark)) {
                watermarkRepository.advance(tenantId, next, clock.instant());
                watermark = next;
            }
        }

        ConsolidationResult outcome = result.watermark(watermark).build();
        log.info("Consolidation finished: tenantId={}, edges={}, entries={}, exceptions={}, deferred={}, watermark={}",
            tenantId, outcome.getEdgesCreated(), outcome.getLedgerEntries().size(), outcome.getExceptions().size(),
            outcome.getDeferredIdentityIds().size(), watermark);
        return outcome;
    }
}
