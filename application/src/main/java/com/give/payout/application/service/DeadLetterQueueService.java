package com.give.payout.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.give.payout.domain.messaging.MessageProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes vault events that cannot be processed to the dead letter topic
 */
@Service
public class DeadLetterQueueService {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueueService.class);

    private final MessageProducer messageProducer;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String dlqTopic;

    public DeadLetterQueueService(MessageProducer messageProducer,
                                  ObjectMapper objectMapper,
                                  Clock clock,
                                  @Value("${app.kafka.topics.vault-events-dlq:payout-vault-events-dlq}") String dlqTopic) {
        this.messageProducer = messageProducer;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.dlqTopic = dlqTopic;
    }

    /**
     * @param payload the original message body, kept verbatim
     */
    public void routeToDLQ(String key, String payload, List<String> errors, String errorType) {
        try {
            Map<String, Object> dlqMessage = new HashMap<>();
            dlqMessage.put("payload", payload);
            dlqMessage.put("errors", errors);
            dlqMessage.put("errorType", errorType);
            dlqMessage.put("timestamp", clock.instant().toString());
            dlqMessage.put("correlationId", MDC.get(CorrelationIdService.CORRELATION_ID_KEY));

            messageProducer.send(dlqTopic, key, objectMapper.writeValueAsString(dlqMessage));
            log.warn("Routed vault event {} to DLQ ({}): {}", key, errorType, errors);
        } catch (Exception e) {
            log.error("Failed to route vault event {} to DLQ", key, e);
        }
    }
}
