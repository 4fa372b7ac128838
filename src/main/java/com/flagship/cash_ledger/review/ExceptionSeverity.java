package com.flagship.cash_ledger.review;

/**
 * Timing drift starts as INFO and escalates to WARNING when left open too long.
 * Every other kind is WARNING from the start.
 */
public enum ExceptionSeverity {
    INFO,
    WARNING;

    public static ExceptionSeverity initialFor(ExceptionKind kind) {
        return kind == ExceptionKind.TIMING_DRIFT ? INFO : WARNING;
    }
}
