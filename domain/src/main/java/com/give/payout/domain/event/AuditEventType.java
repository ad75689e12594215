package com.give.payout.domain.event;

/**
 * One type per state transition of the router
 */
public enum AuditEventType {
    PREFERENCE_CHANGED,
    ACCEPTED_SPLITS_CHANGED,
    SHARES_UPDATED,
    FEE_CONFIG_CHANGED,
    TREASURY_CHANGED,
    AUTHORIZED_CALLER_CHANGED,
    PAUSE_CHANGED,
    STAKEHOLDER_ALLOCATION,
    DISTRIBUTION,
    CUSTODY_DEPOSIT,
    EMERGENCY_WITHDRAWAL
}
