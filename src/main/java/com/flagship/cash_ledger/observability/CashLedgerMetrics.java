package com.flagship.cash_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for ingestion, resolution, matching and consolidation.
 *
 * Metrics exposed:
 * - cash_ledger.ingest.records: raw events by kind and outcome
 * - cash_ledger.identities.resolved: links by canonical kind, new vs. merged
 * - cash_ledger.edges.created: graph edges by kind and origin
 * - cash_ledger.exceptions.raised / resolved: review queue traffic by kind
 * - cash_ledger.ledger.entries: ledger entries by provenance path
 * - cash_ledger.consolidation.duration: one timer sample per tenant run
 */
@Component
public class CashLedgerMetrics {

    private final MeterRegistry registry;
    private final Timer consolidationTimer;

    public CashLedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.consolidationTimer = Timer.builder("cash_ledger.consolidation.duration")
                .description("Time taken by one consolidation run for one tenant")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Ingestion ====================

    public void recordIngestion(String kind, String outcome) {
        registry.counter("cash_ledger.ingest.records",
                "kind", sanitizeTag(kind),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordIdentityResolution(String canonicalKind, boolean created, boolean lowConfidence) {
        registry.counter("cash_ledger.identities.resolved",
                "canonical_kind", sanitizeTag(canonicalKind),
                "result", created ? "created" : "merged",
                "low_confidence", String.valueOf(lowConfidence)
        ).increment();
    }

    // ==================== Graph and review ====================

    public void recordEdgeCreated(String kind, String origin) {
        registry.counter("cash_ledger.edges.created",
                "kind", sanitizeTag(kind),
                "origin", sanitizeTag(origin)
        ).increment();
    }

    public void recordExceptionRaised(String kind, boolean created) {
        registry.counter("cash_ledger.exceptions.raised",
                "kind", sanitizeTag(kind),
                "result", created ? "created" : "updated"
        ).increment();
    }

    public void recordExceptionResolved(String kind) {
        registry.counter("cash_ledger.exceptions.resolved", "kind", sanitizeTag(kind)).increment();
    }

    public void recordMatcherFailure(String matcher) {
        registry.counter("cash_ledger.matcher.failures", "matcher", sanitizeTag(matcher)).increment();
    }

    // ==================== Ledger ====================

    public void recordLedgerEntry(String path) {
        registry.counter("cash_ledger.ledger.entries", "path", sanitizeTag(path)).increment();
    }

    public void recordLedgerFailure() {
        registry.counter("cash_ledger.ledger.failures").increment();
    }

    public <T> T timeConsolidation(Supplier<T> operation) {
        return consolidationTimer.record(operation);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
