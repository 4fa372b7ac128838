package com.flagship.cash_ledger.review.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_ledger.graph.EdgeKind;
import com.flagship.cash_ledger.review.EdgeProposal;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A reviewer's decision: the edges to add (possibly none) and a note.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolveExceptionRequest {

    @Valid
    @Builder.Default
    @JsonProperty("edges")
    private List<Edge> edges = new ArrayList<>();

    @Size(max = 2000, message = "Note must be at most 2000 characters")
    @JsonProperty("note")
    private String note;

    public List<EdgeProposal> toProposals() {
        if (edges == null) {
            return List.of();
        }
        return edges.stream()
            .map(edge -> new EdgeProposal(edge.getFromIdentityId(), edge.getToIdentityId(), edge.getKind()))
            .toList();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Edge {

        @NotNull(message = "from_identity_id is required")
        @JsonProperty("from_identity_id")
        private UUID fromIdentityId;

        @NotNull(message = "to_identity_id is required")
        @JsonProperty("to_identity_id")
        private UUID toIdentityId;

        @NotNull(message = "kind is required")
        @JsonProperty("kind")
        private EdgeKind kind;
    }
}
