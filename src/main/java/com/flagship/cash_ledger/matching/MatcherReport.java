package com.flagship.cash_ledger.matching;

import com.flagship.cash_ledger.graph.IdentityEdge;
import com.flagship.cash_ledger.review.ExceptionRecord;
import com.flagship.cash_ledger.review.RaiseOutcome;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * What one matcher pass produced.
 */
@Getter
public class MatcherReport {

    private final String matcher;
    private final List<IdentityEdge> edges = new ArrayList<>();
    private final List<ExceptionRecord> raised = new ArrayList<>();
    private int exceptionsUpdated;

    public MatcherReport(String matcher) {
        this.matcher = matcher;
    }

    public void edge(IdentityEdge edge) {
        edges.add(edge);
    }

    public void exception(RaiseOutcome outcome) {
        if (outcome.isCreated()) {
            raised.add(outcome.getException());
        } else if (outcome.getResult() == RaiseOutcome.Result.UPDATED) {
            exceptionsUpdated++;
        }
    }

    @Override
    public String toString() {
        return String.format("%s: edges=%d, raised=%d, updated=%d", matcher, edges.size(), raised.size(), exceptionsUpdated);
    }
}
