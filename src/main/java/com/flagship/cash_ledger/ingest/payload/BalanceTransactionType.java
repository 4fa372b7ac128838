package com.flagship.cash_ledger.ingest.payload;

public enum BalanceTransactionType {
    CHARGE,
    REFUND,
    FEE,
    PAYOUT
}
