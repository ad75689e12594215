package com.give.payout.domain.auth;

/**
 * Distinct administrative roles, so a single compromised key
 * cannot reconfigure fees, callers and custody at once
 */
public enum PayoutRole {
    FEE_ADMIN,
    CALLER_ADMIN,
    EMERGENCY_ADMIN
}
