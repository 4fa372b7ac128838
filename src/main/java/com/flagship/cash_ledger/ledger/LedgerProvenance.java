package com.flagship.cash_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_ledger.graph.EdgeKind;
import com.flagship.cash_ledger.graph.EdgeOrigin;
import com.flagship.cash_ledger.graph.IdentityEdge;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * The evidence behind one ledger entry: the settling edge, the composition
 * of the payout and the raw events of the settlement. The composition is
 * informational; the entry amount is always the bank amount.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerProvenance {

    @JsonProperty("path")
    private ProvenancePath path;

    @JsonProperty("settlement_identity_id")
    private UUID settlementIdentityId;

    @JsonProperty("payout_identity_id")
    private UUID payoutIdentityId;

    @JsonProperty("settles_edge")
    private EdgeRef settlesEdge;

    @Builder.Default
    @JsonProperty("composed_of")
    private List<EdgeRef> composedOf = new ArrayList<>();

    @Builder.Default
    @JsonProperty("raw_event_ids")
    private List<UUID> rawEventIds = new ArrayList<>();

    @Builder.Default
    @JsonProperty("reasons")
    private List<String> reasons = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EdgeRef {

        @JsonProperty("edge_id")
        private UUID edgeId;

        @JsonProperty("from_identity_id")
        private UUID fromIdentityId;

        @JsonProperty("to_identity_id")
        private UUID toIdentityId;

        @JsonProperty("kind")
        private EdgeKind kind;

        @JsonProperty("weight")
        private double weight;

        @JsonProperty("origin")
        private EdgeOrigin origin;

        @JsonProperty("reason")
        private String reason;

        public static EdgeRef of(IdentityEdge edge) {
            return new EdgeRef(edge.getId(), edge.getFromIdentityId(), edge.getToIdentityId(),
                edge.getKind(), edge.getWeight(), edge.getOrigin(), edge.getReason());
        }
    }
}
