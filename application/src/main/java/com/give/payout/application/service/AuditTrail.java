package com.give.payout.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.give.payout.domain.event.AuditEvent;
import com.give.payout.domain.messaging.MessageProducer;
import com.give.payout.domain.store.AuditEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Records audit events.
 *
 * Events are stored through {@link AuditEventStore} inside the caller's
 * transaction and published to Kafka once that transaction commits, so a
 * rolled back operation never reaches downstream indexers. Without an active
 * transaction the event is published immediately.
 */
@Service
public class AuditTrail {

    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    private final AuditEventStore auditEventStore;
    private final MessageProducer messageProducer;
    private final CorrelationIdService correlationIdService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String auditTopic;

    public AuditTrail(AuditEventStore auditEventStore,
                      MessageProducer messageProducer,
                      CorrelationIdService correlationIdService,
                      ObjectMapper objectMapper,
                      Clock clock,
                      @Value("${app.kafka.topics.audit-events:payout-audit-events}") String auditTopic) {
        this.auditEventStore = auditEventStore;
        this.messageProducer = messageProducer;
        this.correlationIdService = correlationIdService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.auditTopic = auditTopic;
    }

    public AuditEvent record(AuditEvent event) {
        AuditEvent stamped = event.toBuilder()
                .eventId(UUID.randomUUID().toString())
                .occurredAt(clock.instant())
                .correlationId(correlationIdService.getCurrentCorrelationId())
                .build();

        auditEventStore.append(stamped);

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    publish(stamped);
                }
            });
        } else {
            publish(stamped);
        }
        return stamped;
    }

    public List<AuditEvent> recent(String asset, int limit) {
        return auditEventStore.findRecent(asset, limit);
    }

    private void publish(AuditEvent event) {
        Map<String, String> headers = new HashMap<>();
        headers.put("event-type", event.getType().name());
        if (event.getActor() != null) {
            headers.put("actor", event.getActor());
        }
        if (event.getCorrelationId() != null) {
            headers.put("correlation-id", event.getCorrelationId());
        }

        try {
            String json = objectMapper.writeValueAsString(event);
            messageProducer.send(auditTopic, event.partitionKey(), json, headers);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audit event {} of type {}", event.getEventId(), event.getType(), e);
        } catch (RuntimeException e) {
            // the stored row stays the source of truth; the publisher can be replayed from it
            log.error("Failed to publish audit event {} of type {} to {}", event.getEventId(), event.getType(), auditTopic, e);
        }
    }
}
