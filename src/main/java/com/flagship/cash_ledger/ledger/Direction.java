package com.flagship.cash_ledger.ledger;

import java.math.BigDecimal;

/**
 * Whether cash entered or left the bank account.
 */
public enum Direction {
    INFLOW,
    OUTFLOW;

    public static Direction of(BigDecimal signedAmount) {
        return signedAmount.signum() < 0 ? OUTFLOW : INFLOW;
    }
}
