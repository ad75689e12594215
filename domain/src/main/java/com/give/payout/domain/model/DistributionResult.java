package com.give.payout.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Completed distribution pass as returned to the caller
 */
@Value
@Builder
public class DistributionResult {
    String asset;
    DistributionMode mode;
    BigInteger grossAmount;
    BigInteger donated;
    BigInteger feeCollected;
    BigInteger protocolFees;
    BigInteger retainedDust;
    long distributionNumber;
    List<PlannedTransfer> transfers;
    List<StakeholderAllocation> allocations;
    Instant completedAt;

    public static DistributionResult of(DistributionPlan plan, long distributionNumber, Instant completedAt) {
        return DistributionResult.builder()
                .asset(plan.getAsset())
                .mode(plan.getMode())
                .grossAmount(plan.getGrossAmount())
                .donated(plan.getDonated())
                .feeCollected(plan.getFeeCollected())
                .protocolFees(plan.getProtocolFees())
                .retainedDust(plan.getRetainedDust())
                .distributionNumber(distributionNumber)
                .transfers(plan.getTransfers())
                .allocations(plan.getAllocations())
                .completedAt(completedAt)
                .build();
    }
}
