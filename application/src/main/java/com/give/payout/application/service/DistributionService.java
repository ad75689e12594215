package com.give.payout.application.service;

import com.give.payout.application.config.PayoutProperties;
import com.give.payout.application.guard.ExecutionGuard;
import com.give.payout.domain.custody.AssetTransferService;
import com.give.payout.domain.event.AuditEvent;
import com.give.payout.domain.event.AuditEventType;
import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import com.give.payout.domain.model.AllocationPreference;
import com.give.payout.domain.model.DistributionMode;
import com.give.payout.domain.model.DistributionPlan;
import com.give.payout.domain.model.DistributionResult;
import com.give.payout.domain.model.DistributionStats;
import com.give.payout.domain.model.DistributionStatsView;
import com.give.payout.domain.model.FeeConfig;
import com.give.payout.domain.model.FeeSplit;
import com.give.payout.domain.model.PlannedTransfer;
import com.give.payout.domain.model.RecipientKind;
import com.give.payout.domain.model.ShareBook;
import com.give.payout.domain.model.StakeholderAllocation;
import com.give.payout.domain.registry.BeneficiaryRegistry;
import com.give.payout.domain.store.DistributionStatsStore;
import com.give.payout.domain.store.PreferenceStore;
import com.give.payout.domain.store.ShareLedgerStore;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Distribution engine.
 *
 * Every pass is all-or-nothing. The plan is computed without side effects and
 * the custody balance is checked before the first transfer. Transfers then run
 * inside the guard's transaction; if one of them (or a registry receipt) fails,
 * the transfers already made are reversed before the failure is rethrown.
 * Counters and audit events are written only once every transfer succeeded.
 */
@Service
public class DistributionService {

    private static final Logger log = LoggerFactory.getLogger(DistributionService.class);

    private final DistributionPlanner planner;
    private final FeeCalculator feeCalculator;
    private final ShareLedgerStore shareLedgerStore;
    private final PreferenceStore preferenceStore;
    private final DistributionStatsStore statsStore;
    private final BeneficiaryRegistry beneficiaryRegistry;
    private final AssetTransferService assetTransferService;
    private final FeeConfigService feeConfigService;
    private final AccessControlService accessControlService;
    private final ExecutionGuard executionGuard;
    private final AuditTrail auditTrail;
    private final MetricsService metricsService;
    private final Clock clock;
    private final String custodyAccount;

    public DistributionService(DistributionPlanner planner,
                               FeeCalculator feeCalculator,
                               ShareLedgerStore shareLedgerStore,
                               PreferenceStore preferenceStore,
                               DistributionStatsStore statsStore,
                               BeneficiaryRegistry beneficiaryRegistry,
                               AssetTransferService assetTransferService,
                               FeeConfigService feeConfigService,
                               AccessControlService accessControlService,
                               ExecutionGuard executionGuard,
                               AuditTrail auditTrail,
                               MetricsService metricsService,
                               Clock clock,
                               PayoutProperties properties) {
        this.planner = planner;
        this.feeCalculator = feeCalculator;
        this.shareLedgerStore = shareLedgerStore;
        this.preferenceStore = preferenceStore;
        this.statsStore = statsStore;
        this.beneficiaryRegistry = beneficiaryRegistry;
        this.assetTransferService = assetTransferService;
        this.feeConfigService = feeConfigService;
        this.accessControlService = accessControlService;
        this.executionGuard = executionGuard;
        this.auditTrail = auditTrail;
        this.metricsService = metricsService;
        this.clock = clock;
        this.custodyAccount = properties.getCustodyAccount();
    }

    /**
     * Fee to the fee recipient, net to the registry's default beneficiary
     */
    public DistributionResult distributeSingle(String caller, String asset, BigInteger amount) {
        return guarded("distributeSingle", () -> {
            checkEntry(caller, asset, amount);
            FeeConfig feeConfig = feeConfigService.getFeeConfig();
            String beneficiary = resolveDefaultBeneficiary();
            requireBalance(asset, amount);

            return execute(caller, planner.planSingle(asset, amount, feeConfig, beneficiary));
        });
    }

    /**
     * Fee once, net in equal parts across the given beneficiaries
     */
    public DistributionResult distributeEqualSplit(String caller, String asset, BigInteger amount, List<String> beneficiaries) {
        return guarded("distributeEqualSplit", () -> {
            checkEntry(caller, asset, amount);
            if (beneficiaries == null || beneficiaries.isEmpty()) {
                throw new PayoutException(PayoutErrorCode.EMPTY_BENEFICIARY_LIST, "At least one beneficiary is required");
            }
            for (String beneficiary : beneficiaries) {
                PayoutValidation.requireAddress(beneficiary, "beneficiary");
            }
            for (String beneficiary : beneficiaries) {
                if (!beneficiaryRegistry.isApproved(beneficiary)) {
                    throw new PayoutException(PayoutErrorCode.UNAPPROVED_BENEFICIARY,
                            "Beneficiary " + beneficiary + " is not approved");
                }
            }
            FeeConfig feeConfig = feeConfigService.getFeeConfig();
            requireBalance(asset, amount);

            return execute(caller, planner.planEqualSplit(asset, amount, feeConfig, List.copyOf(beneficiaries)));
        });
    }

    /**
     * Split harvested yield across stakeholders by share. With no shares
     * outstanding this behaves exactly like {@link #distributeSingle}.
     */
    public DistributionResult distributeProportional(String caller, String asset, BigInteger totalYield) {
        return guarded("distributeProportional", () -> {
            checkEntry(caller, asset, totalYield);
            FeeConfig feeConfig = feeConfigService.getFeeConfig();
            ShareBook book = shareLedgerStore.load(asset);

            DistributionPlan plan;
            if (book.getTotalShares().signum() == 0) {
                log.info("No shares outstanding for {}, distributing {} to the default beneficiary", asset, totalYield);
                String beneficiary = resolveDefaultBeneficiary();
                plan = planner.planSingle(asset, totalYield, feeConfig, beneficiary);
            } else {
                plan = planner.planProportional(asset, totalYield, book, feeConfig, effectivePreferences());
            }
            requireBalance(asset, totalYield);

            return execute(caller, plan);
        });
    }

    /**
     * Net and fee for an amount at the current fee rate
     */
    public FeeSplit previewDistribution(BigInteger amount) {
        PayoutValidation.requirePositiveAmount(amount, "amount");
        return feeCalculator.splitFee(amount, feeConfigService.getFeeConfig().getFeeBps());
    }

    public DistributionStatsView getDistributionStats(String asset) {
        DistributionStats stats = statsStore.load(asset);
        return DistributionStatsView.builder()
                .asset(asset)
                .totalDonated(stats.getTotalDonated())
                .totalFeeCollected(stats.getTotalFeeCollected())
                .totalProtocolFees(stats.getTotalProtocolFees())
                .totalDistributions(statsStore.totalDistributions())
                .currentBeneficiary(currentBeneficiaryOrNull())
                .currentFeeBps(feeConfigService.getFeeConfig().getFeeBps())
                .build();
    }

    private DistributionResult guarded(String operation, Supplier<DistributionResult> pass) {
        Timer.Sample sample = metricsService.startDistribution();
        try {
            DistributionResult result = executionGuard.execute(operation, pass);
            metricsService.recordDistribution(result.getMode());
            return result;
        } catch (PayoutException e) {
            metricsService.recordRejection(operation, e.getCode());
            log.warn("{} rejected: {} {}", operation, e.getCode(), e.getMessage());
            throw e;
        } finally {
            metricsService.recordDistributionTime(sample);
        }
    }

    private void checkEntry(String caller, String asset, BigInteger amount) {
        accessControlService.requireAuthorizedCaller(caller);
        PayoutValidation.requireAddress(asset, "asset");
        PayoutValidation.requirePositiveAmount(amount, "amount");
    }

    private String resolveDefaultBeneficiary() {
        String beneficiary = beneficiaryRegistry.currentBeneficiary()
                .filter(b -> !b.isBlank())
                .orElseThrow(() -> new PayoutException(PayoutErrorCode.NO_BENEFICIARY_CONFIGURED,
                        "Registry has no default beneficiary"));
        if (!beneficiaryRegistry.isApproved(beneficiary)) {
            throw new PayoutException(PayoutErrorCode.UNAPPROVED_BENEFICIARY,
                    "Default beneficiary " + beneficiary + " is not approved");
        }
        return beneficiary;
    }

    private String currentBeneficiaryOrNull() {
        try {
            return beneficiaryRegistry.currentBeneficiary().orElse(null);
        } catch (PayoutException e) {
            log.warn("Could not read default beneficiary for stats: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Preferences that are set and name a beneficiary the registry still approves.
     * Approval is looked up once per beneficiary within a pass.
     */
    private Function<String, Optional<AllocationPreference>> effectivePreferences() {
        Map<String, Boolean> approvals = new HashMap<>();
        return stakeholder -> preferenceStore.find(stakeholder)
                .filter(AllocationPreference::isSet)
                .filter(p -> approvals.computeIfAbsent(p.getBeneficiary(), beneficiaryRegistry::isApproved));
    }

    private void requireBalance(String asset, BigInteger amount) {
        BigInteger balance = assetTransferService.balanceOf(asset, custodyAccount);
        if (balance.compareTo(amount) < 0) {
            throw new PayoutException(PayoutErrorCode.INSUFFICIENT_BALANCE,
                    "Custody holds " + balance + " " + asset + ", distribution needs " + amount);
        }
    }

    private DistributionResult execute(String caller, DistributionPlan plan) {
        String asset = plan.getAsset();
        List<PlannedTransfer> completed = new ArrayList<>();
        DistributionResult result;
        try {
            for (PlannedTransfer transfer : plan.getTransfers()) {
                assetTransferService.transfer(asset, custodyAccount, transfer.getRecipient(), transfer.getAmount());
                completed.add(transfer);
            }

            Instant now = clock.instant();
            DistributionStats stats = statsStore.load(asset);
            stats.record(plan.getDonated(), plan.getFeeCollected(), plan.getProtocolFees(), now);
            statsStore.save(stats);

            long before = statsStore.totalDistributions();
            long after = before + plan.getDistributionCount();
            statsStore.saveTotalDistributions(after);

            recordEvents(caller, plan, before);
            result = DistributionResult.of(plan, after, now);
        } catch (RuntimeException e) {
            log.error("Distribution of {} {} failed after {} of {} transfers, reversing",
                    plan.getGrossAmount(), asset, completed.size(), plan.getTransfers().size(), e);
            compensate(asset, completed, e);
            if (e instanceof PayoutException) {
                throw e;
            }
            throw new PayoutException(PayoutErrorCode.TRANSFER_FAILED, "Distribution failed: " + e.getMessage(), e);
        }

        afterCommit(() -> recordReceipts(plan));
        log.info("Distribution #{} {} of {} {}: donated={}, fees={}, protocol={}, dust={}, transfers={}",
                result.getDistributionNumber(), plan.getMode(), plan.getGrossAmount(), asset, plan.getDonated(),
                plan.getFeeCollected(), plan.getProtocolFees(), plan.getRetainedDust(), plan.getTransfers().size());
        return result;
    }

    /**
     * Registry receipts are external writes and cannot be rolled back, so they
     * are sent only once the pass has committed.
     */
    private void afterCommit(Runnable work) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    work.run();
                }
            });
        } else {
            work.run();
        }
    }

    private void recordReceipts(DistributionPlan plan) {
        for (PlannedTransfer transfer : plan.getTransfers()) {
            if (transfer.getKind() != RecipientKind.BENEFICIARY) {
                continue;
            }
            try {
                beneficiaryRegistry.recordReceipt(transfer.getRecipient(), transfer.getAmount());
            } catch (RuntimeException e) {
                // the transfer is committed; the receipt has to be replayed from the audit log
                metricsService.recordReceiptFailure();
                log.error("Registry receipt of {} {} for {} not recorded", transfer.getAmount(), plan.getAsset(),
                        transfer.getRecipient(), e);
            }
        }
    }

    private void compensate(String asset, List<PlannedTransfer> completed, RuntimeException cause) {
        for (int i = completed.size() - 1; i >= 0; i--) {
            PlannedTransfer transfer = completed.get(i);
            try {
                assetTransferService.transfer(asset, transfer.getRecipient(), custodyAccount, transfer.getAmount());
            } catch (RuntimeException reversal) {
                log.error("CRITICAL: could not reverse transfer of {} {} to {}", transfer.getAmount(), asset, transfer.getRecipient(), reversal);
                cause.addSuppressed(reversal);
            }
        }
    }

    private void recordEvents(String caller, DistributionPlan plan, long distributionsBefore) {
        long current = distributionsBefore + 1;
        for (StakeholderAllocation allocation : plan.getAllocations()) {
            if (allocation.isTreasuryFallback()) {
                metricsService.recordTreasuryFallback();
            }
            auditTrail.record(AuditEvent.builder()
                    .type(AuditEventType.STAKEHOLDER_ALLOCATION)
                    .actor(caller)
                    .asset(plan.getAsset())
                    .mode(plan.getMode())
                    .stakeholder(allocation.getStakeholder())
                    .recipient(allocation.getBeneficiary())
                    .amount(allocation.getUserYield())
                    .protocolAmount(allocation.getProtocolAmount())
                    .beneficiaryAmount(allocation.getBeneficiaryAmount())
                    .treasuryAmount(allocation.getTreasuryAmount())
                    .distributionNumber(current)
                    .build());
        }

        int beneficiaryIndex = 0;
        for (PlannedTransfer transfer : plan.getTransfers()) {
            long number = current;
            if (plan.getMode() == DistributionMode.EQUAL_SPLIT && transfer.getKind() == RecipientKind.BENEFICIARY) {
                number = distributionsBefore + (++beneficiaryIndex);
            }
            auditTrail.record(AuditEvent.builder()
                    .type(AuditEventType.DISTRIBUTION)
                    .actor(caller)
                    .asset(plan.getAsset())
                    .mode(plan.getMode())
                    .recipient(transfer.getRecipient())
                    .recipientKind(transfer.getKind())
                    .amount(transfer.getAmount())
                    .fee(plan.getFeeCollected())
                    .distributionNumber(number)
                    .build());
        }
    }
}
