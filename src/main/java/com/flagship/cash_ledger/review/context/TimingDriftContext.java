package com.flagship.cash_ledger.review.context;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.flagship.cash_ledger.review.ExceptionKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A payout either matches a bank record only outside the settlement window,
 * or has not settled long after its expected arrival.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonTypeName("TIMING_DRIFT")
public class TimingDriftContext implements ExceptionContext {

    public enum Reason {
        MATCH_OUTSIDE_WINDOW,
        UNSETTLED
    }

    @JsonProperty("matcher")
    private String matcher;

    @JsonProperty("subject_identity_id")
    private UUID subjectIdentityId;

    @JsonProperty("reason")
    private Reason reason;

    @JsonProperty("summary")
    private String summary;

    @JsonProperty("expected_amount")
    private BigDecimal expectedAmount;

    @JsonProperty("expected_arrival")
    private LocalDate expectedArrival;

    @JsonProperty("days_past_expected")
    private long daysPastExpected;

    @Builder.Default
    @JsonProperty("candidates")
    private List<CandidateScore> candidates = new ArrayList<>();

    @Override
    public ExceptionKind kind() {
        return ExceptionKind.TIMING_DRIFT;
    }

    @Override
    public Set<UUID> referencedIdentityIds() {
        Set<UUID> ids = new LinkedHashSet<>();
        ids.add(subjectIdentityId);
        candidates.forEach(c -> ids.add(c.getIdentityId()));
        return ids;
    }
}
