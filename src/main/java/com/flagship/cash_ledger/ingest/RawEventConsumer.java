package com.flagship.cash_ledger.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.cash_ledger.ingest.dto.RawEventCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Kafka entry point for connectors. One normalized raw event per message,
 * keyed by tenant.
 *
 * Offsets are committed only after the record went through ingestion.
 * Redelivery is harmless because the natural key deduplicates the event.
 * Unreadable messages and rejected records are acknowledged and logged;
 * redelivering them would never succeed.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RawEventConsumer {

    private final IngestionService ingestionService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.raw-events:raw-events}",
        groupId = "${spring.kafka.consumer.group-id:cash-ledger-ingestion}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        RawEventCommand command;
        try {
            command = objectMapper.readValue(record.value(), RawEventCommand.class);
        } catch (JsonProcessingException e) {
            log.warn("Could not parse raw event at offset {}, acknowledging to skip: {}",
                    record.offset(), e.getOriginalMessage());
            ack.acknowledge();
            return;
        }

        String tenantId = command.getTenantId() != null ? command.getTenantId() : record.key();
        IngestionResult result = ingestionService.ingest(tenantId, List.of(command));
        ack.acknowledge();

        if (result.getRejected() > 0) {
            log.warn("Raw event from offset {} rejected: {}", record.offset(), result.getRejections());
        }
    }
}
