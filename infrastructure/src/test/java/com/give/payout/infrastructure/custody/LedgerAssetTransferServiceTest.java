package com.give.payout.infrastructure.custody;

import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import com.give.payout.domain.model.UInt256;
import com.give.payout.infrastructure.persistence.entity.CustodyBalanceEntity;
import com.give.payout.infrastructure.persistence.entity.CustodyBalanceId;
import com.give.payout.infrastructure.persistence.repository.CustodyBalanceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LedgerAssetTransferServiceTest {

    private static final String ASSET = "USDC";
    private static final CustodyBalanceId ROUTER = new CustodyBalanceId(ASSET, "payout-router");
    private static final CustodyBalanceId CHARITY = new CustodyBalanceId(ASSET, "charity-a");

    @Mock
    private CustodyBalanceRepository repository;

    private LedgerAssetTransferService service;

    @BeforeEach
    void setUp() {
        service = new LedgerAssetTransferService(repository,
                Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void testTransferMovesBalance() {
        // Given
        CustodyBalanceEntity router = account(ROUTER, 1000);
        CustodyBalanceEntity charity = account(CHARITY, 5);
        when(repository.findForUpdate(ROUTER)).thenReturn(Optional.of(router));
        when(repository.findForUpdate(CHARITY)).thenReturn(Optional.of(charity));

        // When
        service.transfer(ASSET, "payout-router", "charity-a", BigInteger.valueOf(300));

        // Then
        assertEquals(BigInteger.valueOf(700), router.getBalance());
        assertEquals(BigInteger.valueOf(305), charity.getBalance());
        verify(repository).save(router);
        verify(repository).save(charity);
    }

    @Test
    void testRowsLockedInHolderOrder() {
        when(repository.findForUpdate(ROUTER)).thenReturn(Optional.of(account(ROUTER, 1000)));
        when(repository.findForUpdate(CHARITY)).thenReturn(Optional.empty());

        service.transfer(ASSET, "payout-router", "charity-a", BigInteger.TEN);

        // "charity-a" sorts before "payout-router"
        InOrder order = inOrder(repository);
        order.verify(repository).findForUpdate(CHARITY);
        order.verify(repository).findForUpdate(ROUTER);
    }

    @Test
    void testMissingRecipientRowCreated() {
        when(repository.findForUpdate(ROUTER)).thenReturn(Optional.of(account(ROUTER, 50)));
        when(repository.findForUpdate(CHARITY)).thenReturn(Optional.empty());

        service.transfer(ASSET, "payout-router", "charity-a", BigInteger.valueOf(50));

        verify(repository).save(argThat(e -> e.getId().equals(CHARITY) && e.getBalance().equals(BigInteger.valueOf(50))));
        verify(repository).save(argThat(e -> e.getId().equals(ROUTER) && e.getBalance().signum() == 0));
    }

    @Test
    void testInsufficientBalanceRejected() {
        when(repository.findForUpdate(ROUTER)).thenReturn(Optional.of(account(ROUTER, 10)));
        when(repository.findForUpdate(CHARITY)).thenReturn(Optional.empty());

        PayoutException ex = assertThrows(PayoutException.class,
                () -> service.transfer(ASSET, "payout-router", "charity-a", BigInteger.valueOf(11)));

        assertEquals(PayoutErrorCode.INSUFFICIENT_BALANCE, ex.getCode());
        verify(repository, never()).save(any());
    }

    @Test
    void testInvalidTransfersFail() {
        assertEquals(PayoutErrorCode.TRANSFER_FAILED, assertThrows(PayoutException.class,
                () -> service.transfer(ASSET, "payout-router", "", BigInteger.ONE)).getCode());
        assertEquals(PayoutErrorCode.TRANSFER_FAILED, assertThrows(PayoutException.class,
                () -> service.transfer(ASSET, "payout-router", "payout-router", BigInteger.ONE)).getCode());
        assertEquals(PayoutErrorCode.TRANSFER_FAILED, assertThrows(PayoutException.class,
                () -> service.transfer(ASSET, "payout-router", "charity-a", BigInteger.ZERO)).getCode());
        verifyNoInteractions(repository);
    }

    @Test
    void testReceiverOverflowRejected() {
        when(repository.findForUpdate(ROUTER)).thenReturn(Optional.of(account(ROUTER, 10)));
        CustodyBalanceEntity full = CustodyBalanceEntity.builder().id(CHARITY).balance(UInt256.MAX_VALUE).build();
        when(repository.findForUpdate(CHARITY)).thenReturn(Optional.of(full));

        PayoutException ex = assertThrows(PayoutException.class,
                () -> service.transfer(ASSET, "payout-router", "charity-a", BigInteger.ONE));

        assertEquals(PayoutErrorCode.ARITHMETIC_OVERFLOW, ex.getCode());
    }

    @Test
    void testDepositAndBalance() {
        when(repository.findForUpdate(ROUTER)).thenReturn(Optional.empty());

        service.deposit(ASSET, "payout-router", BigInteger.valueOf(42));

        verify(repository).save(argThat(e -> e.getBalance().equals(BigInteger.valueOf(42))));

        when(repository.findById(CHARITY)).thenReturn(Optional.empty());
        assertEquals(BigInteger.ZERO, service.balanceOf(ASSET, "charity-a"));
    }

    private static CustodyBalanceEntity account(CustodyBalanceId id, long balance) {
        return CustodyBalanceEntity.builder()
                .id(id)
                .balance(BigInteger.valueOf(balance))
                .updatedAt(OffsetDateTime.parse("2026-01-01T00:00:00Z"))
                .build();
    }
}
