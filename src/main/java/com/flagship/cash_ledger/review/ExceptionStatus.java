package com.flagship.cash_ledger.review;

public enum ExceptionStatus {
    OPEN,
    RESOLVED
}
