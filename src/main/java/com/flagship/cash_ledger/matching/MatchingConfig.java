package com.flagship.cash_ledger.matching;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Immutable matcher tuning for one consolidation run.
 *
 * Passed explicitly to every matcher so that a run is reproducible and
 * tenants can be tuned independently.
 */
@Value
@Builder(toBuilder = true)
public class MatchingConfig {

    /** Days either side of a payout's expected arrival in which a bank record may settle it. */
    @Builder.Default
    int settlementWindowDays = 2;

    /** Absolute difference allowed between payout net and bank amount. */
    @Builder.Default
    BigDecimal amountTolerance = new BigDecimal("1.00");

    /** Days past expected arrival after which an unsettled payout is reported. */
    @Builder.Default
    int inTransitAgingDays = 5;

    /** Outer window searched for amount matches that fall outside the settlement window. */
    @Builder.Default
    int driftWindowDays = 10;

    /** Age at which an open timing-drift exception is escalated from INFO to WARNING. */
    @Builder.Default
    int driftEscalationDays = 14;

    @Builder.Default
    int compositionLookbackDays = 7;

    @Builder.Default
    int compositionMaxCandidates = 20;

    @Builder.Default
    int compositionMaxReportedSubsets = 10;

    @Builder.Default
    int opsMatchWindowHours = 24;

    @Builder.Default
    double opsSimilarityThreshold = 0.5;

    @Builder.Default
    int ghostAgingDays = 7;

    public static MatchingConfig defaults() {
        return MatchingConfig.builder().build();
    }
}
