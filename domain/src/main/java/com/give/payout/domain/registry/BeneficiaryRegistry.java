package com.give.payout.domain.registry;

import java.math.BigInteger;
import java.util.Optional;

/**
 * External registry that approves beneficiaries and keeps cumulative receipts.
 * Implementations raise REGISTRY_UNAVAILABLE rather than answering "not approved"
 * when the registry cannot be reached.
 */
public interface BeneficiaryRegistry {

    boolean isApproved(String beneficiary);

    /**
     * Default beneficiary used by single-recipient distributions
     */
    Optional<String> currentBeneficiary();

    /**
     * Called after every successful transfer to a beneficiary
     */
    void recordReceipt(String beneficiary, BigInteger amount);
}
