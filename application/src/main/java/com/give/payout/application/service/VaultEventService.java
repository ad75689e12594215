package com.give.payout.application.service;

import com.give.payout.application.guard.ExecutionGuard;
import com.give.payout.domain.event.VaultEvent;
import com.give.payout.domain.exception.PayoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Routes vault events to the share ledger, custody and distribution engine.
 *
 * Invalid events and non-retryable failures come back as REJECTED. Retryable
 * failures (paused, ledger busy, registry down, insufficient balance) are
 * rethrown so the message is redelivered. The PROCESSED marker is written in
 * the same guarded transaction as the routed operation, so a delivery either
 * applies the operation and its marker together or neither.
 */
@Service
public class VaultEventService {

    private static final Logger log = LoggerFactory.getLogger(VaultEventService.class);

    private final VaultEventValidationService validationService;
    private final IdempotencyService idempotencyService;
    private final ShareLedgerService shareLedgerService;
    private final CustodyService custodyService;
    private final DistributionService distributionService;
    private final MetricsService metricsService;
    private final ExecutionGuard executionGuard;

    public VaultEventService(VaultEventValidationService validationService,
                             IdempotencyService idempotencyService,
                             ShareLedgerService shareLedgerService,
                             CustodyService custodyService,
                             DistributionService distributionService,
                             MetricsService metricsService,
                             ExecutionGuard executionGuard) {
        this.validationService = validationService;
        this.idempotencyService = idempotencyService;
        this.shareLedgerService = shareLedgerService;
        this.custodyService = custodyService;
        this.distributionService = distributionService;
        this.metricsService = metricsService;
        this.executionGuard = executionGuard;
    }

    public VaultEventOutcome handle(VaultEvent event) {
        List<String> errors = validationService.validate(event);
        if (!errors.isEmpty()) {
            metricsService.recordVaultEventRejected("validation");
            return VaultEventOutcome.rejected(errors);
        }

        if (idempotencyService.isProcessed(event.getEventId())) {
            return duplicate(event);
        }

        boolean claimPending;
        try {
            executionGuard.enlist(() -> idempotencyService.claim(event));
            route(event);
        } catch (DuplicateVaultEventException e) {
            return duplicate(event);
        } catch (PayoutException e) {
            idempotencyService.markAsFailed(event, e.getCode() + ": " + e.getMessage());
            if (e.isRetryable()) {
                throw e;
            }
            metricsService.recordVaultEventRejected(e.getCode().name());
            return VaultEventOutcome.rejected(List.of(e.getCode() + ": " + e.getMessage()));
        } finally {
            claimPending = executionGuard.discardEnlisted();
        }

        if (claimPending) {
            idempotencyService.markAsProcessed(event);
        }
        return VaultEventOutcome.processed();
    }

    private VaultEventOutcome duplicate(VaultEvent event) {
        metricsService.recordDuplicateVaultEvent();
        log.info("Skipping duplicate vault event {}", event.getEventId());
        return VaultEventOutcome.duplicate();
    }

    private void route(VaultEvent event) {
        switch (event.getType()) {
            case SHARE_CHANGE:
                shareLedgerService.setShares(event.getCallerId(), event.getStakeholder(), event.getAsset(), event.getNewShareAmount());
                break;
            case DEPOSIT:
                custodyService.deposit(event.getCallerId(), event.getAsset(), event.getYieldAmount());
                break;
            case HARVEST:
                distributionService.distributeProportional(event.getCallerId(), event.getAsset(), event.getYieldAmount());
                break;
            default:
                throw new IllegalArgumentException("Unsupported vault event type " + event.getType());
        }
        log.info("Processed vault event {} ({}) for {}", event.getEventId(), event.getType(), event.getAsset());
    }
}
