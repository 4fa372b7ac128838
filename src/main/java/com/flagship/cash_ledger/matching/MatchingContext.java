package com.flagship.cash_ledger.matching;

import lombok.Value;

import java.time.Instant;

/**
 * Everything one matcher pass needs besides the graph: the tenant, the
 * configuration snapshot of the run and the instant the run treats as now.
 */
@Value
public class MatchingContext {
    String tenantId;
    MatchingConfig config;
    Instant now;
}
