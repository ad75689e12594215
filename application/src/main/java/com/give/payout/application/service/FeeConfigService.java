package com.give.payout.application.service;

import com.give.payout.application.config.PayoutProperties;
import com.give.payout.application.guard.ExecutionGuard;
import com.give.payout.domain.auth.PayoutFunction;
import com.give.payout.domain.event.AuditEvent;
import com.give.payout.domain.event.AuditEventType;
import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import com.give.payout.domain.model.FeeConfig;
import com.give.payout.domain.store.FeeConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fee recipient, fee rate and protocol treasury.
 *
 * The fee ceiling and protocol fee rate are taken from configuration when the
 * router starts for the first time and cannot be changed afterwards.
 */
@Service
public class FeeConfigService {

    private static final Logger log = LoggerFactory.getLogger(FeeConfigService.class);

    private final FeeConfigStore feeConfigStore;
    private final AccessControlService accessControlService;
    private final ExecutionGuard executionGuard;
    private final AuditTrail auditTrail;
    private final PayoutProperties properties;

    public FeeConfigService(FeeConfigStore feeConfigStore,
                            AccessControlService accessControlService,
                            ExecutionGuard executionGuard,
                            AuditTrail auditTrail,
                            PayoutProperties properties) {
        this.feeConfigStore = feeConfigStore;
        this.accessControlService = accessControlService;
        this.executionGuard = executionGuard;
        this.auditTrail = auditTrail;
        this.properties = properties;
    }

    public FeeConfig getFeeConfig() {
        return feeConfigStore.load()
                .orElseThrow(() -> new IllegalStateException("Fee configuration has not been initialized"));
    }

    /**
     * Persist the configured defaults unless a configuration already exists
     */
    public FeeConfig initializeIfAbsent() {
        return executionGuard.executeAdministrative("initializeFeeConfig", () -> {
            return feeConfigStore.load().orElseGet(() -> {
                FeeConfig initial = FeeConfig.builder()
                        .feeRecipient(properties.getFee().getRecipient())
                        .feeBps(properties.getFee().getBps())
                        .maxFeeBps(properties.getFee().getMaxBps())
                        .protocolTreasury(properties.getProtocol().getTreasury())
                        .protocolFeeBps(properties.getProtocol().getFeeBps())
                        .build();
                validateInitial(initial);
                feeConfigStore.save(initial);
                log.info("Initialized fee configuration: recipient={}, feeBps={}, maxFeeBps={}, treasury={}, protocolFeeBps={}",
                        initial.getFeeRecipient(), initial.getFeeBps(), initial.getMaxFeeBps(),
                        initial.getProtocolTreasury(), initial.getProtocolFeeBps());
                return initial;
            });
        });
    }

    public FeeConfig updateFeeConfig(String caller, String newRecipient, int newFeeBps) {
        return executionGuard.executeAdministrative("updateFeeConfig", () -> {
            accessControlService.requireEntitlement(caller, PayoutFunction.FEE_CONFIG_UPDATE);
            PayoutValidation.requireAddress(newRecipient, "feeRecipient");
            PayoutValidation.requireNotCustody(newRecipient, properties.getCustodyAccount(), "feeRecipient");

            FeeConfig current = getFeeConfig();
            if (newFeeBps < 0 || newFeeBps > current.getMaxFeeBps()) {
                throw new PayoutException(PayoutErrorCode.CONFIG_OUT_OF_BOUNDS,
                        "feeBps " + newFeeBps + " outside [0, " + current.getMaxFeeBps() + "]");
            }

            FeeConfig updated = current.toBuilder()
                    .feeRecipient(newRecipient)
                    .feeBps(newFeeBps)
                    .build();
            feeConfigStore.save(updated);
            auditTrail.record(AuditEvent.builder()
                    .type(AuditEventType.FEE_CONFIG_CHANGED)
                    .actor(caller)
                    .recipient(newRecipient)
                    .oldValue(current.getFeeRecipient() + "@" + current.getFeeBps())
                    .newValue(newRecipient + "@" + newFeeBps)
                    .build());
            log.info("Fee configuration updated by {}: {}@{} -> {}@{}", caller,
                    current.getFeeRecipient(), current.getFeeBps(), newRecipient, newFeeBps);
            return updated;
        });
    }

    public FeeConfig setTreasury(String caller, String newTreasury) {
        return executionGuard.executeAdministrative("setTreasury", () -> {
            accessControlService.requireEntitlement(caller, PayoutFunction.TREASURY_UPDATE);
            PayoutValidation.requireAddress(newTreasury, "treasury");
            PayoutValidation.requireNotCustody(newTreasury, properties.getCustodyAccount(), "treasury");

            FeeConfig current = getFeeConfig();
            FeeConfig updated = current.toBuilder().protocolTreasury(newTreasury).build();
            feeConfigStore.save(updated);
            auditTrail.record(AuditEvent.builder()
                    .type(AuditEventType.TREASURY_CHANGED)
                    .actor(caller)
                    .recipient(newTreasury)
                    .oldValue(current.getProtocolTreasury())
                    .newValue(newTreasury)
                    .build());
            log.info("Protocol treasury changed by {}: {} -> {}", caller, current.getProtocolTreasury(), newTreasury);
            return updated;
        });
    }

    private void validateInitial(FeeConfig config) {
        PayoutValidation.requireAddress(config.getFeeRecipient(), "app.payout.fee.recipient");
        PayoutValidation.requireAddress(config.getProtocolTreasury(), "app.payout.protocol.treasury");
        PayoutValidation.requireNotCustody(config.getFeeRecipient(), properties.getCustodyAccount(), "app.payout.fee.recipient");
        PayoutValidation.requireNotCustody(config.getProtocolTreasury(), properties.getCustodyAccount(), "app.payout.protocol.treasury");
        if (config.getMaxFeeBps() < 0 || config.getMaxFeeBps() > FeeCalculator.BPS_DENOMINATOR) {
            throw new PayoutException(PayoutErrorCode.CONFIG_OUT_OF_BOUNDS, "maxFeeBps " + config.getMaxFeeBps() + " outside [0, 10000]");
        }
        if (config.getFeeBps() < 0 || config.getFeeBps() > config.getMaxFeeBps()) {
            throw new PayoutException(PayoutErrorCode.CONFIG_OUT_OF_BOUNDS,
                    "feeBps " + config.getFeeBps() + " outside [0, " + config.getMaxFeeBps() + "]");
        }
        if (config.getProtocolFeeBps() < 0 || config.getProtocolFeeBps() > FeeCalculator.BPS_DENOMINATOR) {
            throw new PayoutException(PayoutErrorCode.CONFIG_OUT_OF_BOUNDS,
                    "protocolFeeBps " + config.getProtocolFeeBps() + " outside [0, 10000]");
        }
    }
}
