package com.flagship.cash_ledger.matching;

import lombok.Value;

import java.util.List;

/**
 * Outcome of running every matcher once for a tenant.
 */
@Value
public class MatchingRun {
    List<MatcherReport> reports;
    List<String> failedMatchers;

    public int edgesCreated() {
        return reports.stream().mapToInt(r -> r.getEdges().size()).sum();
    }

    public boolean hasFailures() {
        return !failedMatchers.isEmpty();
    }
}
