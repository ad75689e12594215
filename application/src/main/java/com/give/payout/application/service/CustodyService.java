package com.give.payout.application.service;

import com.give.payout.application.config.PayoutProperties;
import com.give.payout.application.guard.ExecutionGuard;
import com.give.payout.domain.auth.PayoutFunction;
import com.give.payout.domain.custody.AssetTransferService;
import com.give.payout.domain.event.AuditEvent;
import com.give.payout.domain.event.AuditEventType;
import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import com.give.payout.domain.model.RecipientKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Router custody: vault deposits and the emergency withdrawal escape hatch
 */
@Service
public class CustodyService {

    private static final Logger log = LoggerFactory.getLogger(CustodyService.class);

    private final AssetTransferService assetTransferService;
    private final AccessControlService accessControlService;
    private final ExecutionGuard executionGuard;
    private final AuditTrail auditTrail;
    private final String custodyAccount;

    public CustodyService(AssetTransferService assetTransferService,
                          AccessControlService accessControlService,
                          ExecutionGuard executionGuard,
                          AuditTrail auditTrail,
                          PayoutProperties properties) {
        this.assetTransferService = assetTransferService;
        this.accessControlService = accessControlService;
        this.executionGuard = executionGuard;
        this.auditTrail = auditTrail;
        this.custodyAccount = properties.getCustodyAccount();
    }

    public BigInteger balanceOf(String asset) {
        return assetTransferService.balanceOf(asset, custodyAccount);
    }

    /**
     * Credit custody with assets handed over by the vault
     */
    public BigInteger deposit(String caller, String asset, BigInteger amount) {
        return executionGuard.execute("deposit", () -> {
            accessControlService.requireAuthorizedCaller(caller);
            PayoutValidation.requireAddress(asset, "asset");
            PayoutValidation.requirePositiveAmount(amount, "amount");

            assetTransferService.deposit(asset, custodyAccount, amount);
            auditTrail.record(AuditEvent.builder()
                    .type(AuditEventType.CUSTODY_DEPOSIT)
                    .actor(caller)
                    .asset(asset)
                    .amount(amount)
                    .build());
            BigInteger balance = balanceOf(asset);
            log.info("Deposited {} {} into custody by {}, balance {}", amount, asset, caller, balance);
            return balance;
        });
    }

    /**
     * Move a stranded custody balance out. Available while the router is paused.
     */
    public BigInteger emergencyWithdraw(String caller, String asset, String recipient, BigInteger amount) {
        return executionGuard.executeAdministrative("emergencyWithdraw", () -> {
            accessControlService.requireEntitlement(caller, PayoutFunction.EMERGENCY_WITHDRAW);
            PayoutValidation.requireAddress(asset, "asset");
            PayoutValidation.requireAddress(recipient, "recipient");
            PayoutValidation.requirePositiveAmount(amount, "amount");

            BigInteger balance = balanceOf(asset);
            if (balance.compareTo(amount) < 0) {
                throw new PayoutException(PayoutErrorCode.INSUFFICIENT_BALANCE,
                        "Custody holds " + balance + " " + asset + ", cannot withdraw " + amount);
            }

            assetTransferService.transfer(asset, custodyAccount, recipient, amount);
            auditTrail.record(AuditEvent.builder()
                    .type(AuditEventType.EMERGENCY_WITHDRAWAL)
                    .actor(caller)
                    .asset(asset)
                    .recipient(recipient)
                    .recipientKind(RecipientKind.EMERGENCY)
                    .amount(amount)
                    .build());
            BigInteger remaining = balance.subtract(amount);
            log.warn("EMERGENCY WITHDRAWAL of {} {} to {} by {}, {} left in custody", amount, asset, recipient, caller, remaining);
            return remaining;
        });
    }
}
