package com.flagship.cash_ledger.ledger;

/**
 * How the consolidator reached a ledger entry.
 */
public enum ProvenancePath {
    /** A processor payout matched to the bank record that settled it. */
    PAYOUT_SETTLEMENT,
    /** A bank record with no payout behind it, such as a wire or a check. */
    DIRECT_SETTLEMENT
}
