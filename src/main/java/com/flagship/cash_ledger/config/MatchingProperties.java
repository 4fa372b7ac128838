package com.flagship.cash_ledger.config;

import com.flagship.cash_ledger.matching.MatchingConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Service-wide matcher defaults bound from {@code cash-ledger.matching.*}.
 * Each consolidation run takes an immutable snapshot via {@link #toConfig()}.
 */
@ConfigurationProperties(prefix = "cash-ledger.matching")
@Getter
@Setter
public class MatchingProperties {

    private int settlementWindowDays = 2;
    private BigDecimal amountTolerance = new BigDecimal("1.00");
    private int inTransitAgingDays = 5;
    private int driftWindowDays = 10;
    private int driftEscalationDays = 14;
    private int compositionLookbackDays = 7;
    private int compositionMaxCandidates = 20;
    private int compositionMaxReportedSubsets = 10;
    private int opsMatchWindowHours = 24;
    private double opsSimilarityThreshold = 0.5;
    private int ghostAgingDays = 7;

    public MatchingConfig toConfig() {
        if (driftWindowDays < settlementWindowDays) {
            throw new IllegalStateException(String.format(
                "drift-window-days (%d) must not be smaller than settlement-window-days (%d)",
                driftWindowDays, settlementWindowDays));
        }
        return MatchingConfig.builder()
            .settlementWindowDays(settlementWindowDays)
            .amountTolerance(amountTolerance)
            .inTransitAgingDays(inTransitAgingDays)
            .driftWindowDays(driftWindowDays)
            .driftEscalationDays(driftEscalationDays)
            .compositionLookbackDays(compositionLookbackDays)
            .compositionMaxCandidates(compositionMaxCandidates)
            .compositionMaxReportedSubsets(compositionMaxReportedSubsets)
            .opsMatchWindowHours(opsMatchWindowHours)
            .opsSimilarityThreshold(opsSimilarityThreshold)
            .ghostAgingDays(ghostAgingDays)
            .build();
    }
}
