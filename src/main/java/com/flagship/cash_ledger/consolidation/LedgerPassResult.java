package com.flagship.cash_ledger.consolidation;

import com.flagship.cash_ledger.ledger.CashLedgerEntry;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * What one ledger pass wrote, held back and failed on.
 */
@Value
public class LedgerPassResult {
    List<CashLedgerEntry> entries;
    List<UUID> deferredIdentityIds;
    List<UUID> failedIdentityIds;
}
