package com.give.payout.application.service;

import com.give.payout.application.support.InMemoryProcessedEventStore;
import com.give.payout.application.support.PayoutTestFixture;
import com.give.payout.domain.event.VaultEvent;
import com.give.payout.domain.event.VaultEventType;
import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.give.payout.application.support.PayoutTestFixture.ASSET;
import static com.give.payout.application.support.PayoutTestFixture.CUSTODY;
import static com.give.payout.application.support.PayoutTestFixture.FEE_RECIPIENT;
import static com.give.payout.application.support.PayoutTestFixture.SECURITY_ADMIN;
import static com.give.payout.application.support.PayoutTestFixture.VAULT;
import static com.give.payout.application.support.PayoutTestFixture.units;
import static org.junit.jupiter.api.Assertions.*;

class VaultEventServiceTest {

    private PayoutTestFixture fixture;
    private InMemoryProcessedEventStore processedStore;
    private VaultEventService vaultEventService;

    @BeforeEach
    void setUp() {
        fixture = new PayoutTestFixture();
        processedStore = new InMemoryProcessedEventStore();
        vaultEventService = new VaultEventService(
                new VaultEventValidationService(),
                new IdempotencyService(processedStore),
                fixture.shareLedger,
                fixture.custodyService,
                fixture.distribution,
                fixture.metrics,
                fixture.guard);
    }

    @Test
    void testShareChangeApplied() {
        // When
        VaultEventOutcome outcome = vaultEventService.handle(shareChange("evt-1", "alice", 300));

        // Then
        assertEquals(VaultEventOutcome.Status.PROCESSED, outcome.getStatus());
        assertEquals(units(300), fixture.shareLedger.getShares("alice", ASSET));
        assertEquals("PROCESSED", processedStore.findStatus("evt-1"));
    }

    @Test
    void testDuplicateEventSkipped() {
        // Given
        vaultEventService.handle(shareChange("evt-1", "alice", 300));
        vaultEventService.handle(shareChange("evt-2", "alice", 100));

        // When: redelivery of the first event
        VaultEventOutcome outcome = vaultEventService.handle(shareChange("evt-1", "alice", 300));

        // Then
        assertEquals(VaultEventOutcome.Status.DUPLICATE, outcome.getStatus());
        assertEquals(units(100), fixture.shareLedger.getShares("alice", ASSET));
        assertEquals(1.0, fixture.meterRegistry.counter("payout.vault_events.duplicate").count());
    }

    @Test
    void testInvalidEventRejectedWithoutRecord() {
        VaultEvent event = shareChange("evt-1", null, 300);

        VaultEventOutcome outcome = vaultEventService.handle(event);

        assertEquals(VaultEventOutcome.Status.REJECTED, outcome.getStatus());
        assertFalse(outcome.getErrors().isEmpty());
        assertNull(processedStore.findStatus("evt-1"));
    }

    @Test
    void testDepositThenHarvestDistributes() {
        // Given
        vaultEventService.handle(shareChange("evt-1", "alice", 300));
        vaultEventService.handle(shareChange("evt-2", "bob", 700));

        // When
        vaultEventService.handle(amountEvent("evt-3", VaultEventType.DEPOSIT, 1000));
        VaultEventOutcome outcome = vaultEventService.handle(amountEvent("evt-4", VaultEventType.HARVEST, 1000));

        // Then
        assertEquals(VaultEventOutcome.Status.PROCESSED, outcome.getStatus());
        assertEquals(units(976), fixture.balanceOf(FEE_RECIPIENT));
        assertEquals(BigInteger.ZERO, fixture.balanceOf(CUSTODY));
    }

    @Test
    void testNonRetryableFailureRejected() {
        VaultEvent event = shareChange("evt-1", "alice", 300);
        event.setCallerId("stranger");

        VaultEventOutcome outcome = vaultEventService.handle(event);

        assertEquals(VaultEventOutcome.Status.REJECTED, outcome.getStatus());
        assertTrue(outcome.getErrors().get(0).startsWith("UNAUTHORIZED_CALLER"));
        assertEquals("FAILED", processedStore.findStatus("evt-1"));
        assertTrue(processedStore.errorOf("evt-1").startsWith("UNAUTHORIZED_CALLER"));
    }

    @Test
    void testRetryableFailureRethrownAndRetriedLater() {
        // Given: harvest arrives before its deposit
        vaultEventService.handle(shareChange("evt-1", "alice", 300));
        VaultEvent harvest = amountEvent("evt-2", VaultEventType.HARVEST, 1000);

        // When
        PayoutException ex = assertThrows(PayoutException.class, () -> vaultEventService.handle(harvest));

        // Then
        assertEquals(PayoutErrorCode.INSUFFICIENT_BALANCE, ex.getCode());
        assertEquals("FAILED", processedStore.findStatus("evt-2"));

        vaultEventService.handle(amountEvent("evt-3", VaultEventType.DEPOSIT, 1000));
        assertEquals(VaultEventOutcome.Status.PROCESSED, vaultEventService.handle(harvest).getStatus());
    }

    @Test
    void testHarvestNotRepeatedWhenProcessedMarkerWriteFails() {
        // Given
        vaultEventService.handle(shareChange("evt-1", "alice", 1000));
        vaultEventService.handle(amountEvent("evt-2", VaultEventType.DEPOSIT, 2000));
        processedStore.failNextProcessedWrites(1);
        VaultEvent harvest = amountEvent("evt-h", VaultEventType.HARVEST, 1000);

        // When: the marker write fails and the broker redelivers
        assertThrows(IllegalStateException.class, () -> vaultEventService.handle(harvest));
        VaultEventOutcome redelivered = vaultEventService.handle(harvest);

        // Then
        assertEquals(VaultEventOutcome.Status.PROCESSED, redelivered.getStatus());
        assertEquals(1, fixture.statsStore.totalDistributions());
        assertEquals(units(1000), fixture.balanceOf(CUSTODY));
        assertEquals("PROCESSED", processedStore.findStatus("evt-h"));
        assertFalse(fixture.guard.discardEnlisted());
    }

    @Test
    void testEventClaimedUnderGuardReportedAsDuplicate() {
        // Given: another delivery marks the event while this one is past the fast-path check
        VaultEvent event = shareChange("evt-1", "alice", 300);
        IdempotencyService racing = new IdempotencyService(processedStore) {
            private boolean firstLookup = true;

            @Override
            public boolean isProcessed(String eventId) {
                if (firstLookup) {
                    firstLookup = false;
                    markAsProcessed(event);
                    return false;
                }
                return super.isProcessed(eventId);
            }
        };
        VaultEventService service = new VaultEventService(new VaultEventValidationService(), racing,
                fixture.shareLedger, fixture.custodyService, fixture.distribution, fixture.metrics, fixture.guard);

        // When
        VaultEventOutcome outcome = service.handle(event);

        // Then
        assertEquals(VaultEventOutcome.Status.DUPLICATE, outcome.getStatus());
        assertEquals(BigInteger.ZERO, fixture.shareLedger.getShares("alice", ASSET));
        assertEquals(1.0, fixture.meterRegistry.counter("payout.vault_events.duplicate").count());
    }

    @Test
    void testPausedRouterSurfacesRetryableFailure() {
        fixture.accessControl.pause(SECURITY_ADMIN);

        PayoutException ex = assertThrows(PayoutException.class,
                () -> vaultEventService.handle(shareChange("evt-1", "alice", 300)));

        assertEquals(PayoutErrorCode.SYSTEM_PAUSED, ex.getCode());
    }

    private static VaultEvent shareChange(String eventId, String stakeholder, long amount) {
        return VaultEvent.builder()
                .eventId(eventId)
                .type(VaultEventType.SHARE_CHANGE)
                .callerId(VAULT)
                .asset(ASSET)
                .stakeholder(stakeholder)
                .newShareAmount(BigInteger.valueOf(amount))
                .build();
    }

    private static VaultEvent amountEvent(String eventId, VaultEventType type, long amount) {
        return VaultEvent.builder()
                .eventId(eventId)
                .type(type)
                .callerId(VAULT)
                .asset(ASSET)
                .yieldAmount(BigInteger.valueOf(amount))
                .build();
    }
}
