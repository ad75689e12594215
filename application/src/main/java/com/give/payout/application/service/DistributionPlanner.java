package com.give.payout.application.service;

import com.give.payout.domain.model.AllocationPreference;
import com.give.payout.domain.model.DistributionMode;
import com.give.payout.domain.model.DistributionPlan;
import com.give.payout.domain.model.FeeConfig;
import com.give.payout.domain.model.FeeSplit;
import com.give.payout.domain.model.PlannedTransfer;
import com.give.payout.domain.model.RecipientKind;
import com.give.payout.domain.model.ShareBook;
import com.give.payout.domain.model.StakeholderAllocation;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Computes distribution plans. Performs no I/O and no transfers; the plan is
 * checked and executed by {@link DistributionService}.
 *
 * Transfers of zero are left out of every plan.
 */
@Component
public class DistributionPlanner {

    private final FeeCalculator feeCalculator;

    public DistributionPlanner(FeeCalculator feeCalculator) {
        this.feeCalculator = feeCalculator;
    }

    /**
     * Fee to the fee recipient, net to one beneficiary
     */
    public DistributionPlan planSingle(String asset, BigInteger amount, FeeConfig feeConfig, String beneficiary) {
        FeeSplit split = feeCalculator.splitFee(amount, feeConfig.getFeeBps());

        DistributionPlan.DistributionPlanBuilder plan = DistributionPlan.builder()
                .asset(asset)
                .mode(DistributionMode.SINGLE)
                .grossAmount(amount)
                .donated(split.getNet())
                .feeCollected(split.getFee())
                .protocolFees(BigInteger.ZERO)
                .retainedDust(BigInteger.ZERO)
                .distributionCount(1);

        addTransfer(plan, feeConfig.getFeeRecipient(), split.getFee(), RecipientKind.FEE_RECIPIENT);
        addTransfer(plan, beneficiary, split.getNet(), RecipientKind.BENEFICIARY);
        return plan.build();
    }

    /**
     * Fee once, then net in equal parts with the remainder on the first beneficiary.
     * Counts one distribution per beneficiary entry.
     */
    public DistributionPlan planEqualSplit(String asset, BigInteger amount, FeeConfig feeConfig, List<String> beneficiaries) {
        FeeSplit split = feeCalculator.splitFee(amount, feeConfig.getFeeBps());
        List<BigInteger> parts = feeCalculator.splitEvenly(split.getNet(), beneficiaries.size());

        DistributionPlan.DistributionPlanBuilder plan = DistributionPlan.builder()
                .asset(asset)
                .mode(DistributionMode.EQUAL_SPLIT)
                .grossAmount(amount)
                .donated(split.getNet())
                .feeCollected(split.getFee())
                .protocolFees(BigInteger.ZERO)
                .retainedDust(BigInteger.ZERO)
                .distributionCount(beneficiaries.size());

        addTransfer(plan, feeConfig.getFeeRecipient(), split.getFee(), RecipientKind.FEE_RECIPIENT);
        for (int i = 0; i < beneficiaries.size(); i++) {
            addTransfer(plan, beneficiaries.get(i), parts.get(i), RecipientKind.BENEFICIARY);
        }
        return plan.build();
    }

    /**
     * Pro-rata split of {@code totalYield} across the active stakeholders of a book
     * with nonzero total shares.
     *
     * @param effectivePreference the preference to honour for a stakeholder, empty
     *                            when its net yield should go to the treasury
     */
    public DistributionPlan planProportional(String asset,
                                             BigInteger totalYield,
                                             ShareBook book,
                                             FeeConfig feeConfig,
                                             Function<String, Optional<AllocationPreference>> effectivePreference) {
        BigInteger totalShares = book.getTotalShares();
        if (totalShares.signum() == 0) {
            throw new IllegalArgumentException("Proportional plan needs nonzero total shares for " + asset);
        }

        DistributionPlan.DistributionPlanBuilder plan = DistributionPlan.builder()
                .asset(asset)
                .mode(DistributionMode.PROPORTIONAL)
                .grossAmount(totalYield)
                .distributionCount(1);

        BigInteger allocated = BigInteger.ZERO;
        BigInteger protocolTotal = BigInteger.ZERO;
        BigInteger treasuryTotal = BigInteger.ZERO;
        Map<String, BigInteger> beneficiaryTotals = new LinkedHashMap<>();

        for (String stakeholder : book.getActiveStakeholders()) {
            BigInteger shares = book.sharesOf(stakeholder);
            BigInteger userYield = feeCalculator.proRata(totalYield, shares, totalShares);
            if (userYield.signum() == 0) {
                continue;
            }

            BigInteger protocolAmount = feeCalculator.applyBps(userYield, feeConfig.getProtocolFeeBps());
            BigInteger netYield = userYield.subtract(protocolAmount);

            Optional<AllocationPreference> preference = effectivePreference.apply(stakeholder);
            BigInteger beneficiaryAmount = preference
                    .map(p -> feeCalculator.applyPercent(netYield, p.getSplitPercent()))
                    .orElse(BigInteger.ZERO);
            BigInteger treasuryAmount = netYield.subtract(beneficiaryAmount);
            String beneficiary = preference.map(AllocationPreference::getBeneficiary).orElse(null);

            plan.allocation(StakeholderAllocation.builder()
                    .stakeholder(stakeholder)
                    .shares(shares)
                    .userYield(userYield)
                    .protocolAmount(protocolAmount)
                    .netYield(netYield)
                    .beneficiary(beneficiary)
                    .beneficiaryAmount(beneficiaryAmount)
                    .treasuryAmount(treasuryAmount)
                    .treasuryFallback(preference.isEmpty())
                    .build());

            allocated = allocated.add(userYield);
            protocolTotal = protocolTotal.add(protocolAmount);
            treasuryTotal = treasuryTotal.add(treasuryAmount);
            if (beneficiary != null && beneficiaryAmount.signum() > 0) {
                beneficiaryTotals.merge(beneficiary, beneficiaryAmount, BigInteger::add);
            }
        }

        addTransfer(plan, feeConfig.getProtocolTreasury(), protocolTotal, RecipientKind.PROTOCOL_TREASURY);
        beneficiaryTotals.forEach((beneficiary, amount) -> addTransfer(plan, beneficiary, amount, RecipientKind.BENEFICIARY));
        addTransfer(plan, feeConfig.getFeeRecipient(), treasuryTotal, RecipientKind.FEE_RECIPIENT);

        BigInteger donated = beneficiaryTotals.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
        return plan
                .donated(donated)
                .feeCollected(treasuryTotal)
                .protocolFees(protocolTotal)
                .retainedDust(totalYield.subtract(allocated))
                .build();
    }

    private static void addTransfer(DistributionPlan.DistributionPlanBuilder plan, String recipient, BigInteger amount, RecipientKind kind) {
        if (amount.signum() > 0) {
            plan.transfer(new PlannedTransfer(recipient, amount, kind));
        }
    }
}
