package com.flagship.cash_ledger.consolidation;

import com.flagship.cash_ledger.identity.IdentityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically consolidates every tenant from its watermark.
 */
@Component
@ConditionalOnProperty(name = "consolidation.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ConsolidationScheduler {

    private final ConsolidationService consolidationService;
    private final IdentityRepository identityRepository;

    @Scheduled(fixedDelayString = "${consolidation.scheduler.interval-ms:300000}")
    public void consolidateAllTenants() {
        for (String tenantId : identityRepository.findTenantIds()) {
            try {
                // Tenants held by another instance are picked up on the next tick.
                consolidationService.tryConsolidateFromWatermark(tenantId);
            } catch (RuntimeException e) {
                log.error("Scheduled consolidation failed for tenant {}: {}", tenantId, e.getMessage(), e);
            }
        }
    }
}
