package com.give.payout.application.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.give.payout.application.config.JacksonConfig;
import com.give.payout.application.service.CorrelationIdService;
import com.give.payout.application.service.DeadLetterQueueService;
import com.give.payout.application.service.VaultEventOutcome;
import com.give.payout.application.service.VaultEventService;
import com.give.payout.domain.event.VaultEvent;
import com.give.payout.domain.event.VaultEventType;
import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VaultEventListenerTest {

    private static final String TOPIC = "payout-vault-events";

    @Mock
    private VaultEventService vaultEventService;

    @Mock
    private DeadLetterQueueService deadLetterQueueService;

    private final ObjectMapper objectMapper = JacksonConfig.create();
    private VaultEventListener listener;

    @BeforeEach
    void setUp() {
        listener = new VaultEventListener(vaultEventService, deadLetterQueueService, new CorrelationIdService(), objectMapper);
    }

    @Test
    void testEventDeserializedWithStringAmounts() {
        // Given
        String payload = "{\"eventId\":\"evt-1\",\"type\":\"HARVEST\",\"callerId\":\"vault-usdc\","
                + "\"asset\":\"USDC\",\"yieldAmount\":\"115792089237316195423570985008687907853269984665640564039457584007913129639935\"}";
        when(vaultEventService.handle(any())).thenReturn(VaultEventOutcome.processed());

        // When
        listener.onVaultEvent(new ConsumerRecord<>(TOPIC, 0, 0L, "USDC", payload));

        // Then
        ArgumentCaptor<VaultEvent> captor = ArgumentCaptor.forClass(VaultEvent.class);
        verify(vaultEventService).handle(captor.capture());
        assertEquals(VaultEventType.HARVEST, captor.getValue().getType());
        assertEquals(BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE), captor.getValue().getYieldAmount());
        verifyNoInteractions(deadLetterQueueService);
        assertNull(MDC.get(CorrelationIdService.CORRELATION_ID_KEY));
    }

    @Test
    void testUnreadablePayloadRoutedToDlq() {
        listener.onVaultEvent(new ConsumerRecord<>(TOPIC, 0, 0L, "USDC", "{not json"));

        verify(deadLetterQueueService).routeToDLQ(eq("USDC"), eq("{not json"), anyList(), eq("DESERIALIZATION"));
        verifyNoInteractions(vaultEventService);
    }

    @Test
    void testRejectedEventRoutedToDlq() {
        String payload = "{\"eventId\":\"evt-1\",\"type\":\"SHARE_CHANGE\",\"asset\":\"USDC\"}";
        when(vaultEventService.handle(any())).thenReturn(VaultEventOutcome.rejected(List.of("Caller ID is required")));

        listener.onVaultEvent(new ConsumerRecord<>(TOPIC, 0, 0L, "USDC", payload));

        verify(deadLetterQueueService).routeToDLQ("USDC", payload, List.of("Caller ID is required"), "REJECTED");
    }

    @Test
    void testRetryableFailurePropagatesForRedelivery() {
        String payload = "{\"eventId\":\"evt-1\",\"type\":\"HARVEST\",\"callerId\":\"vault\",\"asset\":\"USDC\",\"yieldAmount\":10}";
        when(vaultEventService.handle(any())).thenThrow(new PayoutException(PayoutErrorCode.LEDGER_BUSY, "busy"));

        PayoutException ex = assertThrows(PayoutException.class,
                () -> listener.onVaultEvent(new ConsumerRecord<>(TOPIC, 0, 0L, "USDC", payload)));

        assertEquals(PayoutErrorCode.LEDGER_BUSY, ex.getCode());
        verify(deadLetterQueueService, never()).routeToDLQ(anyString(), anyString(), anyList(), anyString());
        assertNull(MDC.get(CorrelationIdService.CORRELATION_ID_KEY));
    }
}
