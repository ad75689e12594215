package com.give.payout.application.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.give.payout.application.service.CorrelationIdService;
import com.give.payout.application.service.DeadLetterQueueService;
import com.give.payout.application.service.VaultEventOutcome;
import com.give.payout.application.service.VaultEventService;
import com.give.payout.domain.event.VaultEvent;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Kafka consumer for vault events (share changes, deposits, harvests)
 */
@Component
@ConditionalOnProperty(name = "app.kafka.listener.enabled", havingValue = "true", matchIfMissing = true)
public class VaultEventListener {

    private static final Logger log = LoggerFactory.getLogger(VaultEventListener.class);

    private final VaultEventService vaultEventService;
    private final DeadLetterQueueService deadLetterQueueService;
    private final CorrelationIdService correlationIdService;
    private final ObjectMapper objectMapper;

    public VaultEventListener(VaultEventService vaultEventService,
                              DeadLetterQueueService deadLetterQueueService,
                              CorrelationIdService correlationIdService,
                              ObjectMapper objectMapper) {
        this.vaultEventService = vaultEventService;
        this.deadLetterQueueService = deadLetterQueueService;
        this.correlationIdService = correlationIdService;
        this.objectMapper = objectMapper;
    }

    @KafkaListener(topics = "${app.kafka.topics.vault-events:payout-vault-events}",
                   groupId = "${spring.kafka.consumer.group-id:payout-router}")
    public void onVaultEvent(ConsumerRecord<String, String> record) {
        String payload = record.value();
        VaultEvent event;
        try {
            event = objectMapper.readValue(payload, VaultEvent.class);
        } catch (JsonProcessingException e) {
            log.error("Unreadable vault event at {}-{}@{}", record.topic(), record.partition(), record.offset(), e);
            deadLetterQueueService.routeToDLQ(record.key(), payload, List.of(e.getOriginalMessage()), "DESERIALIZATION");
            return;
        }

        if (event.getEventId() != null) {
            correlationIdService.setCorrelationId(event.getEventId());
        } else {
            correlationIdService.generateCorrelationId();
        }
        try {
            log.info("Received vault event {} ({}) from partition {}", event.getEventId(), event.getType(), record.partition());
            VaultEventOutcome outcome = vaultEventService.handle(event);
            if (outcome.getStatus() == VaultEventOutcome.Status.REJECTED) {
                deadLetterQueueService.routeToDLQ(record.key(), payload, outcome.getErrors(), "REJECTED");
            }
        } finally {
            correlationIdService.clear();
        }
    }
}
