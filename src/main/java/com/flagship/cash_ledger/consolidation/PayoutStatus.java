package com.flagship.cash_ledger.consolidation;

public enum PayoutStatus {
    /** A bank record settling the payout has been matched. */
    SETTLED,
    /** No bank record yet; an overdue payout stays here with its timing drift listed. */
    IN_TRANSIT,
    /** Unsettled, with an open AMBIGUOUS_MATCH over its candidate settlements. */
    AMBIGUOUS
}
