package com.flagship.cash_ledger.identity;

/**
 * Kind of real-world financial event an identity stands for.
 */
public enum CanonicalKind {
    SETTLEMENT,
    PAYOUT,
    CHARGE,
    FEE,
    REFUND,
    INVOICE,
    PAYMENT;

    public boolean isLineItem() {
        return this == CHARGE || this == FEE || this == REFUND;
    }

    public boolean isOperational() {
        return this == INVOICE || this == PAYMENT;
    }
}
