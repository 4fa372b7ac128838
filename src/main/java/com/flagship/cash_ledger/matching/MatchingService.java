package com.flagship.cash_ledger.matching;

import com.flagship.cash_ledger.observability.CashLedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the matchers for one tenant in dependency order: settlement first so
 * composition can see which payouts settled, ghost detection last so it sees
 * every APPLIES_TO edge of the run.
 *
 * Each matcher commits on its own. A matcher that fails is rolled back,
 * logged and reported; the remaining matchers still run.
 */
@Service
@Slf4j
public class MatchingService {

    private final List<Matcher> matchers;
    private final CashLedgerMetrics metrics;
    private final TransactionTemplate transactionTemplate;

    public MatchingService(PayoutSettlementMatcher payoutSettlementMatcher,
                           CompositionMatcher compositionMatcher,
                           OpsPaymentChargeMatcher opsPaymentChargeMatcher,
                           GhostRecordDetector ghostRecordDetector,
                           CashLedgerMetrics metrics,
                           PlatformTransactionManager transactionManager) {
        this.matchers = List.of(payoutSettlementMatcher, compositionMatcher, opsPaymentChargeMatcher, ghostRecordDetector);
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public MatchingRun runAll(MatchingContext context) {
        List<MatcherReport> reports = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (Matcher matcher : matchers) {
            try {
                MatcherReport report = transactionTemplate.execute(status -> matcher.run(context));
                reports.add(report);
                log.debug("Matcher finished: tenantId={}, {}", context.getTenantId(), report);
            } catch (RuntimeException e) {
                failed.add(matcher.name());
                metrics.recordMatcherFailure(matcher.name());
                log.error("Matcher {} failed for tenant {}: {}", matcher.name(), context.getTenantId(), e.getMessage(), e);
            }
        }
        return new MatchingRun(reports, failed);
    }
}
