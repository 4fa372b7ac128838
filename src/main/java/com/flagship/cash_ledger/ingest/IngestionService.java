package com.flagship.cash_ledger.ingest;

import com.flagship.cash_ledger.identity.IdentityResolver;
import com.flagship.cash_ledger.ingest.dto.RawEventCommand;
import com.flagship.cash_ledger.observability.CashLedgerMetrics;
import com.flagship.cash_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Ingestion boundary: validates, stores and resolves a batch of raw events.
 *
 * Every record is its own unit of work. A record is either stored together
 * with its identity link, skipped as a natural-key duplicate, or rejected;
 * a bad record never affects the rest of the batch. Redelivery of a whole
 * batch is a no-op beyond the deduplicated count.
 */
@Service
@Slf4j
public class IngestionService {

    private final RawEventValidator validator;
    private final RawEventStore rawEventStore;
    private final IdentityResolver identityResolver;
    private final CashLedgerMetrics metrics;
    private final TransactionTemplate transactionTemplate;

    public IngestionService(RawEventValidator validator,
                            RawEventStore rawEventStore,
                            IdentityResolver identityResolver,
                            CashLedgerMetrics metrics,
                            PlatformTransactionManager transactionManager) {
        this.validator = validator;
        this.rawEventStore = rawEventStore;
        this.identityResolver = identityResolver;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public IngestionResult ingest(String tenantId, List<RawEventCommand> commands) {
        MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, tenantId);
        try {
            IngestionResult.IngestionResultBuilder result = IngestionResult.builder();
            int stored = 0;
            int deduplicated = 0;
            int rejected = 0;

            for (RawEventCommand command : commands) {
                try {
                    RawEvent event = validator.validate(tenantId, command);
                    Boolean inserted = transactionTemplate.execute(status -> storeAndResolve(event));
                    if (Boolean.TRUE.equals(inserted)) {
                        stored++;
                        metrics.recordIngestion(event.getKind().name(), "stored");
                    } else {
                        deduplicated++;
                        metrics.recordIngestion(event.getKind().name(), "deduplicated");
                        log.debug("Duplicate raw event ignored: source={}, kind={}, externalId={}",
                            event.getSource(), event.getKind(), event.getExternalId());
                    }
                } catch (InvalidRawEventException e) {
                    rejected++;
                    reject(result, command, e.getMessage());
                } catch (DataIntegrityViolationException e) {
                    rejected++;
                    reject(result, command, "violates a storage constraint: " + e.getMostSpecificCause().getMessage());
                }
            }

            IngestionResult outcome = result.stored(stored).deduplicated(deduplicated).rejected(rejected).build();
            log.info("Ingested batch: tenantId={}, stored={}, deduplicated={}, rejected={}",
                tenantId, stored, deduplicated, rejected);
            return outcome;
        } finally {
            MDC.remove(CorrelationContext.TENANT_ID_MDC_KEY);
        }
    }

    private void reject(IngestionResult.IngestionResultBuilder result, RawEventCommand command, String reason) {
        metrics.recordIngestion(command.getKind(), "rejected");
        result.rejection(new IngestionResult.Rejection(command.getExternalId(), reason));
        log.warn("Rejected raw event: externalId={}, reason={}", command.getExternalId(), reason);
    }

    private boolean storeAndResolve(RawEvent event) {
        if (!rawEventStore.insertIfAbsent(event)) {
            return false;
        }
        identityResolver.resolve(event);
        return true;
    }
}
