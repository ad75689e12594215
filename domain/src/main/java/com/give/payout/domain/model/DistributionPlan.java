package com.give.payout.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * Fully computed distribution pass, prior to any transfer.
 * {@code sum(transfers) + retainedDust == grossAmount}.
 */
@Value
@Builder
public class DistributionPlan {
    String asset;
    DistributionMode mode;
    BigInteger grossAmount;
    @Singular
    List<PlannedTransfer> transfers;
    @Singular
    List<StakeholderAllocation> allocations;
    BigInteger donated;
    BigInteger feeCollected;
    BigInteger protocolFees;
    BigInteger retainedDust;
    int distributionCount;     // increments applied to the global distribution counter

    public BigInteger totalTransferred() {
        return transfers.stream()
                .map(PlannedTransfer::getAmount)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }
}
