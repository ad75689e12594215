package com.give.payout.application.service;

import com.give.payout.application.support.PayoutTestFixture;
import com.give.payout.domain.event.AuditEvent;
import com.give.payout.domain.event.AuditEventType;
import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import com.give.payout.domain.model.RecipientKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.give.payout.application.support.PayoutTestFixture.ASSET;
import static com.give.payout.application.support.PayoutTestFixture.CUSTODY;
import static com.give.payout.application.support.PayoutTestFixture.FEE_ADMIN;
import static com.give.payout.application.support.PayoutTestFixture.SECURITY_ADMIN;
import static com.give.payout.application.support.PayoutTestFixture.VAULT;
import static com.give.payout.application.support.PayoutTestFixture.units;
import static org.junit.jupiter.api.Assertions.*;

class CustodyServiceTest {

    private PayoutTestFixture fixture;
    private CustodyService custodyService;

    @BeforeEach
    void setUp() {
        fixture = new PayoutTestFixture();
        custodyService = fixture.custodyService;
    }

    @Test
    void testDepositCreditsCustody() {
        BigInteger balance = custodyService.deposit(VAULT, ASSET, units(500));

        assertEquals(units(500), balance);
        assertEquals(units(500), custodyService.balanceOf(ASSET));
        assertEquals(1, fixture.auditStore.ofType(AuditEventType.CUSTODY_DEPOSIT).size());
    }

    @Test
    void testDepositRequiresAuthorizedCaller() {
        PayoutException ex = assertThrows(PayoutException.class,
                () -> custodyService.deposit("stranger", ASSET, units(500)));

        assertEquals(PayoutErrorCode.UNAUTHORIZED_CALLER, ex.getCode());
        assertEquals(BigInteger.ZERO, custodyService.balanceOf(ASSET));
    }

    @Test
    void testDepositRejectsZeroAmount() {
        PayoutException ex = assertThrows(PayoutException.class,
                () -> custodyService.deposit(VAULT, ASSET, BigInteger.ZERO));

        assertEquals(PayoutErrorCode.ZERO_AMOUNT, ex.getCode());
    }

    @Test
    void testEmergencyWithdrawMovesBalance() {
        // Given
        fixture.fundCustody(1000);

        // When
        BigInteger remaining = custodyService.emergencyWithdraw(SECURITY_ADMIN, ASSET, "cold-wallet", units(400));

        // Then
        assertEquals(units(600), remaining);
        assertEquals(units(400), fixture.balanceOf("cold-wallet"));
        assertEquals(units(600), fixture.balanceOf(CUSTODY));

        AuditEvent event = fixture.auditStore.ofType(AuditEventType.EMERGENCY_WITHDRAWAL).get(0);
        assertEquals(RecipientKind.EMERGENCY, event.getRecipientKind());
        assertEquals(SECURITY_ADMIN, event.getActor());
    }

    @Test
    void testEmergencyWithdrawAvailableWhilePaused() {
        fixture.fundCustody(1000);
        fixture.accessControl.pause(SECURITY_ADMIN);

        BigInteger remaining = custodyService.emergencyWithdraw(SECURITY_ADMIN, ASSET, "cold-wallet", units(1000));

        assertEquals(BigInteger.ZERO, remaining);
    }

    @Test
    void testEmergencyWithdrawRequiresRole() {
        fixture.fundCustody(1000);

        PayoutException ex = assertThrows(PayoutException.class,
                () -> custodyService.emergencyWithdraw(FEE_ADMIN, ASSET, "cold-wallet", units(400)));

        assertEquals(PayoutErrorCode.MISSING_ROLE, ex.getCode());
        assertEquals(units(1000), fixture.balanceOf(CUSTODY));
    }

    @Test
    void testEmergencyWithdrawBeyondBalanceRejected() {
        fixture.fundCustody(100);

        PayoutException ex = assertThrows(PayoutException.class,
                () -> custodyService.emergencyWithdraw(SECURITY_ADMIN, ASSET, "cold-wallet", units(101)));

        assertEquals(PayoutErrorCode.INSUFFICIENT_BALANCE, ex.getCode());
    }

    @Test
    void testDepositRejectedWhilePaused() {
        fixture.accessControl.pause(SECURITY_ADMIN);

        PayoutException ex = assertThrows(PayoutException.class,
                () -> custodyService.deposit(VAULT, ASSET, units(500)));

        assertEquals(PayoutErrorCode.SYSTEM_PAUSED, ex.getCode());
    }
}
