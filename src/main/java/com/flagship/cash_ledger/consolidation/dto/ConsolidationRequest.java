package com.flagship.cash_ledger.consolidation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Optional body of a consolidation trigger. Without {@code since} the run
 * starts from the tenant's watermark.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConsolidationRequest {

    @JsonProperty("since")
    private Instant since;
}
