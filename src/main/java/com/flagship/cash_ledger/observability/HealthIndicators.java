package com.flagship.cash_ledger.observability;

import com.flagship.cash_ledger.outbox.OutboxEventRepository;
import com.flagship.cash_ledger.review.ExceptionRecordRepository;
import com.flagship.cash_ledger.review.ExceptionStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness checks for the cash ledger service.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many ledger events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private final OutboxEventRepository outboxRepository;
        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Reports the open review queue. A large queue means money the ledger is
     * holding back, not an outage, so it only ever warns.
     */
    @Component("reviewQueueHealth")
    public static class ReviewQueueHealthIndicator implements HealthIndicator {

        private final ExceptionRecordRepository exceptionRepository;
        private static final long OPEN_WARNING_THRESHOLD = 500;

        public ReviewQueueHealthIndicator(ExceptionRecordRepository exceptionRepository) {
            this.exceptionRepository = exceptionRepository;
        }

        @Override
        public Health health() {
            try {
                long open = exceptionRepository.countByStatus(ExceptionStatus.OPEN);
                Health.Builder builder = open < OPEN_WARNING_THRESHOLD ? Health.up() : Health.status("WARNING");
                return builder
                        .withDetail("openExceptions", open)
                        .withDetail("warningThreshold", OPEN_WARNING_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Health indicator for Kafka connectivity.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
