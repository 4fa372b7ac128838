package com.flagship.cash_ledger.review;

import com.flagship.cash_ledger.graph.EdgeKind;
import lombok.Value;

import java.util.UUID;

/**
 * An edge a reviewer chose while resolving an exception.
 */
@Value
public class EdgeProposal {
    UUID fromIdentityId;
    UUID toIdentityId;
    EdgeKind kind;
}
