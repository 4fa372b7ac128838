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
 * Several candidates are equally valid. Carries either scored candidates
 * (settlement and ops matching) or candidate subsets (composition).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonTypeName("AMBIGUOUS_MATCH")
public class AmbiguousMatchContext implements ExceptionContext {

    @JsonProperty("matcher")
    private String matcher;

    @JsonProperty("subject_identity_id")
    private UUID subjectIdentityId;

    @JsonProperty("subject_amount")
    private BigDecimal subjectAmount;

    @JsonProperty("summary")
    private String summary;

    @Builder.Default
    @JsonProperty("candidates")
    private List<CandidateScore> candidates = new ArrayList<>();

    @Builder.Default
    @JsonProperty("subsets")
    private List<CandidateSubset> subsets = new ArrayList<>();

    /** More subsets exist than were reported. */
    @JsonProperty("subsets_truncated")
    private boolean subsetsTruncated;

    @Override
    public ExceptionKind kind() {
        return ExceptionKind.AMBIGUOUS_MATCH;
    }

    @Override
    public Set<UUID> referencedIdentityIds() {
        Set<UUID> ids = new LinkedHashSet<>();
        ids.add(subjectIdentityId);
        candidates.forEach(c -> ids.add(c.getIdentityId()));
        subsets.forEach(s -> ids.addAll(s.getIdentityIds()));
        return ids;
    }
}
