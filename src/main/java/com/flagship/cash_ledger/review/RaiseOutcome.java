package com.flagship.cash_ledger.review;

import lombok.Value;

/**
 * What {@link ExceptionManager#raise} did with a raise request.
 */
@Value
public class RaiseOutcome {

    public enum Result {
        /** A new open exception was written. */
        CREATED,
        /** An open exception with the same key had its context refreshed. */
        UPDATED,
        /** A reviewer already resolved the same question with the same candidates. */
        SUPPRESSED
    }

    ExceptionRecord exception;
    Result result;

    public boolean isCreated() {
        return result == Result.CREATED;
    }
}
