package com.give.payout.application.service;

import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.model.DistributionMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

/**
 * Service for recording router metrics
 */
@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter shareUpdatesCounter;
    private final Counter preferenceUpdatesCounter;
    private final Counter treasuryFallbacksCounter;
    private final Counter vaultEventsDuplicateCounter;
    private final Counter receiptFailuresCounter;

    private final Timer distributionTimer;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.shareUpdatesCounter = Counter.builder("payout.shares.updated")
                .description("Share ledger writes that changed a balance")
                .register(meterRegistry);

        this.preferenceUpdatesCounter = Counter.builder("payout.preferences.updated")
                .description("Allocation preferences written")
                .register(meterRegistry);

        this.treasuryFallbacksCounter = Counter.builder("payout.allocations.treasury_fallback")
                .description("Stakeholder allocations routed fully to the treasury")
                .register(meterRegistry);

        this.vaultEventsDuplicateCounter = Counter.builder("payout.vault_events.duplicate")
                .description("Vault events skipped as already processed")
                .register(meterRegistry);

        this.receiptFailuresCounter = Counter.builder("payout.registry.receipts.failed")
                .description("Beneficiary registry receipts that could not be recorded after a distribution")
                .register(meterRegistry);

        this.distributionTimer = Timer.builder("payout.distribution.time")
                .description("Distribution pass duration")
                .register(meterRegistry);
    }

    public void recordShareUpdate() {
        shareUpdatesCounter.increment();
    }

    public void recordPreferenceUpdate() {
        preferenceUpdatesCounter.increment();
    }

    public void recordReceiptFailure() {
        receiptFailuresCounter.increment();
    }

    public void recordTreasuryFallback() {
        treasuryFallbacksCounter.increment();
    }

    public void recordDuplicateVaultEvent() {
        vaultEventsDuplicateCounter.increment();
    }

    public void recordDistribution(DistributionMode mode) {
        meterRegistry.counter("payout.distributions", "mode", mode.name()).increment();
    }

    public void recordRejection(String operation, PayoutErrorCode code) {
        meterRegistry.counter("payout.rejections", "operation", operation, "code", code.name()).increment();
    }

    public void recordVaultEventRejected(String reason) {
        meterRegistry.counter("payout.vault_events.rejected", "reason", reason).increment();
    }

    public Timer.Sample startDistribution() {
        return Timer.start(meterRegistry);
    }

    public void recordDistributionTime(Timer.Sample sample) {
        sample.stop(distributionTimer);
    }
}
