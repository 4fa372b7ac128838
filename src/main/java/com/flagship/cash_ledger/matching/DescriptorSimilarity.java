package com.flagship.cash_ledger.matching;

import com.flagship.cash_ledger.identity.CounterpartyNormalizer;

import java.util.HashSet;
import java.util.Set;

/**
 * Token-set (Jaccard) similarity of two free-text descriptors, in [0, 1].
 */
public final class DescriptorSimilarity {

    private DescriptorSimilarity() {
    }

    public static double score(String left, String right) {
        Set<String> a = new HashSet<>(CounterpartyNormalizer.tokens(left));
        Set<String> b = new HashSet<>(CounterpartyNormalizer.tokens(right));
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }
}
