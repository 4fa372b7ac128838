package com.flagship.cash_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics owned by the service.
 *
 * - raw-events: normalized records published by the source connectors
 * - cash-ledger-events: ledger entries and review events relayed from the outbox
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.raw-events:raw-events}")
    private String rawEventsTopic;

    @Value("${kafka.topic.ledger-events:cash-ledger-events}")
    private String ledgerEventsTopic;

    /**
     * Partitioned by tenant key so one tenant's feed is consumed in order.
     */
    @Bean
    public NewTopic rawEventsTopic() {
        return TopicBuilder.name(rawEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
