package com.give.payout.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * One stakeholder's slice of a proportional distribution pass
 */
@Value
@Builder
public class StakeholderAllocation {
    String stakeholder;
    BigInteger shares;
    BigInteger userYield;
    BigInteger protocolAmount;
    BigInteger netYield;
    String beneficiary;            // null when the net yield fell back to the treasury
    BigInteger beneficiaryAmount;
    BigInteger treasuryAmount;
    boolean treasuryFallback;
}
