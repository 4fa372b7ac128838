package com.flagship.cash_ledger.consolidation;

import com.flagship.cash_ledger.ledger.CashLedgerEntry;
import com.flagship.cash_ledger.review.ExceptionRecord;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one consolidation run for one tenant.
 */
@Value
@Builder
public class ConsolidationResult {
    String tenantId;
    Instant since;
    /** Where the next scheduled run will start; unchanged after a partial failure or a later explicit start. */
    Instant watermark;
    int edgesCreated;
    @Singular
    List<CashLedgerEntry> ledgerEntries;
    /** Exceptions first raised by this run. */
    @Singular
    List<ExceptionRecord> exceptions;
    @Singular
    List<UUID> deferredIdentityIds;
    @Singular
    List<UUID> failedIdentityIds;
    @Singular
    List<String> failedMatchers;

    public boolean isComplete() {
        return failedIdentityIds.isEmpty() && failedMatchers.isEmpty();
    }
}
