package com.give.payout.infrastructure.messaging.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.give.payout.domain.messaging.MessageProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Kafka implementation of MessageProducer. Non-string payloads are written as JSON.
 */
@Component("kafkaMessageProducer")
public class KafkaMessageProducer implements MessageProducer {

    private static final Logger log = LoggerFactory.getLogger(KafkaMessageProducer.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    public KafkaMessageProducer(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(String topic, String key, Object message) {
        send(topic, key, message, null);
    }

    @Override
    public void send(String topic, String key, Object message, Map<String, String> headers) {
        try {
            String payload = message instanceof String ? (String) message : objectMapper.writeValueAsString(message);
            ProducerRecord<String, String> record = key != null
                    ? new ProducerRecord<>(topic, key, payload)
                    : new ProducerRecord<>(topic, payload);

            if (headers != null) {
                headers.forEach((name, value) -> {
                    if (value != null) {
                        record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
                    }
                });
            }

            kafkaTemplate.send(record);
            log.debug("Sent message to topic: {}, key: {}", topic, key);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize message for topic: {}", topic, e);
            throw new IllegalArgumentException("Message for " + topic + " is not serializable", e);
        } catch (Exception e) {
            log.error("Failed to send message to topic: {}", topic, e);
            throw new RuntimeException("Failed to send message to Kafka", e);
        }
    }
}
