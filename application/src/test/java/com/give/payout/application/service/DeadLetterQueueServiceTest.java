package com.give.payout.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.give.payout.application.config.JacksonConfig;
import com.give.payout.domain.messaging.MessageProducer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeadLetterQueueServiceTest {

    @Mock
    private MessageProducer messageProducer;

    private final ObjectMapper objectMapper = JacksonConfig.create();

    @Test
    void testRoutesOriginalPayloadWithErrors() throws Exception {
        // Given
        DeadLetterQueueService dlq = new DeadLetterQueueService(messageProducer, objectMapper,
                Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC), "vault-dlq");

        // When
        dlq.routeToDLQ("USDC", "{broken", List.of("Unexpected end"), "DESERIALIZATION");

        // Then
        ArgumentCaptor<Object> message = ArgumentCaptor.forClass(Object.class);
        verify(messageProducer).send(eq("vault-dlq"), eq("USDC"), message.capture());
        JsonNode json = objectMapper.readTree((String) message.getValue());
        assertEquals("{broken", json.get("payload").asText());
        assertEquals("DESERIALIZATION", json.get("errorType").asText());
        assertEquals("Unexpected end", json.get("errors").get(0).asText());
        assertEquals("2026-03-01T12:00:00Z", json.get("timestamp").asText());
    }

    @Test
    void testProducerFailureIsLoggedNotThrown() {
        DeadLetterQueueService dlq = new DeadLetterQueueService(messageProducer, objectMapper, Clock.systemUTC(), "vault-dlq");
        doThrow(new IllegalStateException("broker down")).when(messageProducer).send(anyString(), anyString(), any());

        assertDoesNotThrow(() -> dlq.routeToDLQ("USDC", "{}", List.of("x"), "REJECTED"));
    }
}
