package com.flagship.cash_ledger.graph;

import com.flagship.cash_ledger.identity.CanonicalKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Directed relationship between two identities.
 */
public enum EdgeKind {
    /** payout -> settlement */
    SETTLES(EnumSet.of(CanonicalKind.PAYOUT), EnumSet.of(CanonicalKind.SETTLEMENT)),
    /** charge, fee or refund -> payout */
    COMPOSED_OF(EnumSet.of(CanonicalKind.CHARGE, CanonicalKind.FEE, CanonicalKind.REFUND), EnumSet.of(CanonicalKind.PAYOUT)),
    /** ops payment or invoice -> charge */
    APPLIES_TO(EnumSet.of(CanonicalKind.PAYMENT, CanonicalKind.INVOICE), EnumSet.of(CanonicalKind.CHARGE));

    private final Set<CanonicalKind> fromKinds;
    private final Set<CanonicalKind> toKinds;

    EdgeKind(Set<CanonicalKind> fromKinds, Set<CanonicalKind> toKinds) {
        this.fromKinds = fromKinds;
        this.toKinds = toKinds;
    }

    public boolean connects(CanonicalKind from, CanonicalKind to) {
        return fromKinds.contains(from) && toKinds.contains(to);
    }
}
