package com.give.payout.application.service;

import com.give.payout.application.support.InMemoryFeeConfigStore;
import com.give.payout.application.support.PayoutTestFixture;
import com.give.payout.domain.event.AuditEventType;
import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import com.give.payout.domain.model.FeeConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.give.payout.application.support.PayoutTestFixture.CALLER_ADMIN;
import static com.give.payout.application.support.PayoutTestFixture.CUSTODY;
import static com.give.payout.application.support.PayoutTestFixture.FEE_ADMIN;
import static com.give.payout.application.support.PayoutTestFixture.FEE_RECIPIENT;
import static com.give.payout.application.support.PayoutTestFixture.PROTOCOL_TREASURY;
import static org.junit.jupiter.api.Assertions.*;

class FeeConfigServiceTest {

    private PayoutTestFixture fixture;
    private FeeConfigService feeConfigService;

    @BeforeEach
    void setUp() {
        fixture = new PayoutTestFixture();
        feeConfigService = fixture.feeConfigService;
    }

    @Test
    void testInitializedFromProperties() {
        FeeConfig config = feeConfigService.getFeeConfig();

        assertEquals(FEE_RECIPIENT, config.getFeeRecipient());
        assertEquals(100, config.getFeeBps());
        assertEquals(1_000, config.getMaxFeeBps());
        assertEquals(PROTOCOL_TREASURY, config.getProtocolTreasury());
        assertEquals(250, config.getProtocolFeeBps());
    }

    @Test
    void testInitializeKeepsExistingConfiguration() {
        feeConfigService.updateFeeConfig(FEE_ADMIN, "new-sink", 500);

        FeeConfig config = feeConfigService.initializeIfAbsent();

        assertEquals("new-sink", config.getFeeRecipient());
        assertEquals(500, config.getFeeBps());
    }

    @Test
    void testUpdateWithinCeiling() {
        FeeConfig updated = feeConfigService.updateFeeConfig(FEE_ADMIN, "new-sink", 1_000);

        assertEquals(1_000, updated.getFeeBps());
        assertEquals("new-sink", feeConfigService.getFeeConfig().getFeeRecipient());
        assertEquals(1, fixture.auditStore.ofType(AuditEventType.FEE_CONFIG_CHANGED).size());
    }

    @Test
    void testUpdateAboveCeilingRejected() {
        PayoutException ex = assertThrows(PayoutException.class,
                () -> feeConfigService.updateFeeConfig(FEE_ADMIN, "new-sink", 1_001));

        assertEquals(PayoutErrorCode.CONFIG_OUT_OF_BOUNDS, ex.getCode());
        assertEquals(100, feeConfigService.getFeeConfig().getFeeBps());
    }

    @Test
    void testUpdateRequiresFeeAdminRole() {
        PayoutException ex = assertThrows(PayoutException.class,
                () -> feeConfigService.updateFeeConfig(CALLER_ADMIN, "new-sink", 50));

        assertEquals(PayoutErrorCode.MISSING_ROLE, ex.getCode());
    }

    @Test
    void testBlankRecipientRejected() {
        PayoutException ex = assertThrows(PayoutException.class,
                () -> feeConfigService.updateFeeConfig(FEE_ADMIN, " ", 50));

        assertEquals(PayoutErrorCode.ZERO_ADDRESS, ex.getCode());
    }

    @Test
    void testSetTreasuryChangesProtocolTreasuryOnly() {
        FeeConfig updated = feeConfigService.setTreasury(FEE_ADMIN, "new-protocol");

        assertEquals("new-protocol", updated.getProtocolTreasury());
        assertEquals(FEE_RECIPIENT, updated.getFeeRecipient());
        assertEquals(PROTOCOL_TREASURY,
                fixture.auditStore.ofType(AuditEventType.TREASURY_CHANGED).get(0).getOldValue());
    }

    @Test
    void testCustodyAccountRejectedAsPayoutDestination() {
        // When
        PayoutException recipientEx = assertThrows(PayoutException.class,
                () -> feeConfigService.updateFeeConfig(FEE_ADMIN, CUSTODY, 50));
        PayoutException treasuryEx = assertThrows(PayoutException.class,
                () -> feeConfigService.setTreasury(FEE_ADMIN, CUSTODY));

        // Then
        assertEquals(PayoutErrorCode.CONFIG_OUT_OF_BOUNDS, recipientEx.getCode());
        assertEquals(PayoutErrorCode.CONFIG_OUT_OF_BOUNDS, treasuryEx.getCode());
        FeeConfig config = feeConfigService.getFeeConfig();
        assertEquals(FEE_RECIPIENT, config.getFeeRecipient());
        assertEquals(100, config.getFeeBps());
        assertEquals(PROTOCOL_TREASURY, config.getProtocolTreasury());
        assertTrue(fixture.auditStore.ofType(AuditEventType.FEE_CONFIG_CHANGED).isEmpty());
        assertTrue(fixture.auditStore.ofType(AuditEventType.TREASURY_CHANGED).isEmpty());
    }

    @Test
    void testInitialTreasuryEqualToCustodyRejected() {
        fixture.properties.getProtocol().setTreasury(CUSTODY);
        FeeConfigService fresh = new FeeConfigService(new InMemoryFeeConfigStore(),
                fixture.accessControl, fixture.guard, fixture.auditTrail, fixture.properties);

        PayoutException ex = assertThrows(PayoutException.class, fresh::initializeIfAbsent);

        assertEquals(PayoutErrorCode.CONFIG_OUT_OF_BOUNDS, ex.getCode());
    }

    @Test
    void testUninitializedConfigurationFailsLoudly() {
        FeeConfigService uninitialized = new FeeConfigService(new InMemoryFeeConfigStore(),
                fixture.accessControl, fixture.guard, fixture.auditTrail, fixture.properties);

        assertThrows(IllegalStateException.class, uninitialized::getFeeConfig);
    }

    @Test
    void testInvalidInitialConfigurationRejected() {
        fixture.properties.getFee().setBps(2_000);
        FeeConfigService fresh = new FeeConfigService(new InMemoryFeeConfigStore(),
                fixture.accessControl, fixture.guard, fixture.auditTrail, fixture.properties);

        PayoutException ex = assertThrows(PayoutException.class, fresh::initializeIfAbsent);

        assertEquals(PayoutErrorCode.CONFIG_OUT_OF_BOUNDS, ex.getCode());
    }
}
