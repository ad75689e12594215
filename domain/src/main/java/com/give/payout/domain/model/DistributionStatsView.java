package com.give.payout.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Read model combining cumulative counters with the current routing setup
 */
@Value
@Builder
public class DistributionStatsView {
    String asset;
    BigInteger totalDonated;
    BigInteger totalFeeCollected;
    BigInteger totalProtocolFees;
    long totalDistributions;
    String currentBeneficiary;
    int currentFeeBps;
}
