package com.flagship.cash_ledger.review.context;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.flagship.cash_ledger.review.ExceptionKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * An expected counterpart is missing: money is unaccounted for.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonTypeName("NO_MATCH")
public class NoMatchContext implements ExceptionContext {

    @JsonProperty("matcher")
    private String matcher;

    @JsonProperty("subject_identity_id")
    private UUID subjectIdentityId;

    @JsonProperty("summary")
    private String summary;

    @JsonProperty("expected_amount")
    private BigDecimal expectedAmount;

    /** Candidates that were searched without finding an exact combination. */
    @Builder.Default
    @JsonProperty("considered")
    private List<CandidateScore> considered = new ArrayList<>();

    @JsonProperty("candidates_truncated")
    private boolean candidatesTruncated;

    @Override
    public ExceptionKind kind() {
        return ExceptionKind.NO_MATCH;
    }

    @Override
    public Set<UUID> referencedIdentityIds() {
        Set<UUID> ids = new LinkedHashSet<>();
        ids.add(subjectIdentityId);
        considered.forEach(c -> ids.add(c.getIdentityId()));
        return ids;
    }
}
