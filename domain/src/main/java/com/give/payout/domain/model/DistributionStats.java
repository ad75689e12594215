package com.give.payout.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Cumulative per-asset distribution counters. Never decremented.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistributionStats {
    private String asset;
    @Builder.Default
    private BigInteger totalDonated = BigInteger.ZERO;
    @Builder.Default
    private BigInteger totalFeeCollected = BigInteger.ZERO;
    @Builder.Default
    private BigInteger totalProtocolFees = BigInteger.ZERO;
    private Instant lastDistributionAt;

    public static DistributionStats empty(String asset) {
        return DistributionStats.builder().asset(asset).build();
    }

    public void record(BigInteger donated, BigInteger feeCollected, BigInteger protocolFees, Instant at) {
        this.totalDonated = UInt256.checked(totalDonated.add(donated), "totalDonated");
        this.totalFeeCollected = UInt256.checked(totalFeeCollected.add(feeCollected), "totalFeeCollected");
        this.totalProtocolFees = UInt256.checked(totalProtocolFees.add(protocolFees), "totalProtocolFees");
        this.lastDistributionAt = at;
    }
}
