package com.flagship.cash_ledger.review;

public enum ExceptionKind {
    AMBIGUOUS_MATCH,
    NO_MATCH,
    GHOST_RECORD,
    TIMING_DRIFT
}
