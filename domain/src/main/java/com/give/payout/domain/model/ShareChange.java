package com.give.payout.domain.model;

import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of a single share write
 */
@Value
public class ShareChange {
    String asset;
    String stakeholder;
    BigInteger oldAmount;
    BigInteger newAmount;
    BigInteger totalShares;
    MembershipChange membership;

    public boolean isNoOp() {
        return oldAmount.equals(newAmount);
    }
}
